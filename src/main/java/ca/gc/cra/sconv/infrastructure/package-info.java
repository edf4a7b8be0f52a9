/**
 * Adapters binding the application ports to the JVM and third-party libraries.
 * <p>Purpose: Charsets via {@code java.nio}, decomposition via ICU4J, metrics via OpenTelemetry.</p>
 * <p>Role: Outermost layer; wired by {@code ca.gc.cra.sconv.config.CompositionRoot}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.infrastructure;
