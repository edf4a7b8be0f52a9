/**
 * Result values and the error taxonomy shared by every conversion component.
 * <p><strong>Role:</strong> Domain layer; no dependencies on adapters.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 * <p><strong>Security:</strong> Exception messages carry charset names only, never converted text.</p>
 */
package ca.gc.cra.sconv.domain.conversion;
