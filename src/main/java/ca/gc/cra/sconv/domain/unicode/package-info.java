/**
 * UTF-8, CESU-8, and UTF-16 code point codecs.
 * <p><strong>Role:</strong> Domain primitives shared by normalization and transcoding stages.</p>
 * <p><strong>Concurrency:</strong> Stateless and thread-safe.</p>
 * <p><strong>Security:</strong> Decoders are total over arbitrary bytes; malformed input never
 * throws and never reads past the supplied limit.</p>
 */
package ca.gc.cra.sconv.domain.unicode;
