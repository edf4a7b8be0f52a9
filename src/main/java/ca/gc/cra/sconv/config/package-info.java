/**
 * Configuration records, loaders and the composition root for sconv.
 * <p><strong>Role:</strong> Bootstrap layer selecting the charset backend, decomposition backend and
 * metrics adapter.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Charset names are validated with {@code ca.gc.cra.sconv.validation}
 * before they reach a backend.</p>
 */
package ca.gc.cra.sconv.config;
