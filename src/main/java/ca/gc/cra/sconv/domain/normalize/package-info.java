/**
 * Unicode canonical composition and the decomposition driver.
 * <p><strong>Role:</strong> Domain engine; the composition table and combining classes are derived
 * from ICU4J character data at class initialization.</p>
 * <p><strong>Concurrency:</strong> Static tables are immutable; composer instances are
 * single-threaded.</p>
 * <p><strong>Performance:</strong> Combining-mark runs are bounded, so adversarial input cannot
 * trigger unbounded lookahead.</p>
 */
package ca.gc.cra.sconv.domain.normalize;
