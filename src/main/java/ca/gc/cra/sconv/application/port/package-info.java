/**
 * Ports through which the conversion engine reaches platform services.
 * <p><strong>Role:</strong> Application boundary; adapters live under
 * {@code ca.gc.cra.sconv.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Backends may be shared; handles they open are single-owner.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.sconv.application.port.MetricsPort} defines the
 * {@code sconv.*} namespace.</p>
 */
package ca.gc.cra.sconv.application.port;
