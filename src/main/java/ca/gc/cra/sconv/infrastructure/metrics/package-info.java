/**
 * Metrics adapters that bridge the sconv {@code MetricsPort} to OpenTelemetry or to nothing.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Performance:</strong> Instruments are created once per key and cached.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code sconv.profile.*}, {@code sconv.convert.*} and
 * {@code sconv.mstring.*} namespaces.</p>
 * <p><strong>Security:</strong> Never exports converted text; only counts and byte lengths.</p>
 */
package ca.gc.cra.sconv.infrastructure.metrics;
