/**
 * Conversion profiles: pipeline selection, the stages they run, and the per-archive registry.
 * <p>A profile is built once per charset pair; its one or two stages are fixed at construction and
 * run on every {@code convert} call. Profiles and the registry are stateful and not thread-safe;
 * use one registry per archive handle.</p>
 * <p>Counters are reported through {@link ca.gc.cra.sconv.application.port.MetricsPort} under
 * {@code sconv.profile.*} and {@code sconv.convert.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.application.conversion;
