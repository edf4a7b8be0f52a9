/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Charset names and file names come from untrusted archives; helpers bound
 * their length and render raw bytes as hex.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.logging;
