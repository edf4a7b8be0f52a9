/**
 * Growable zero-terminated text buffers for byte and wide text.
 * <p><strong>Role:</strong> Domain storage used by every conversion stage.</p>
 * <p><strong>Concurrency:</strong> Buffers are single-owner and unsynchronized.</p>
 * <p><strong>Performance:</strong> Doubling growth below 8 KiB, 25% steps above; capacity is reused
 * across {@code clear()}.</p>
 * <p><strong>Security:</strong> Growth requests are range checked; overflow fails instead of wrapping.</p>
 */
package ca.gc.cra.sconv.domain.buffer;
