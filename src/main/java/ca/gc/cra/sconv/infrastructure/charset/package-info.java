/**
 * Charset adapters backed by {@link java.nio.charset}.
 * <p>Purpose: Implement the charset backend, native wide codec and system charset ports.</p>
 * <p>Role: Infrastructure; selected by {@code ca.gc.cra.sconv.config.CompositionRoot}.</p>
 * <p>Concurrency: Backends are stateless; handles are single-threaded.</p>
 * <p>Performance: Handles pivot through a fixed 1 KiB char buffer.</p>
 * <p>Observability: Unknown names are logged at DEBUG.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.infrastructure.charset;
