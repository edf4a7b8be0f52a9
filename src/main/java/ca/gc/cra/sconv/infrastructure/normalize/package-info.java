/**
 * ICU4J implementation of canonical decomposition.
 * <p>Purpose: Supply NFD for conversions configured to decompose.</p>
 * <p>Concurrency: Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.infrastructure.normalize;
