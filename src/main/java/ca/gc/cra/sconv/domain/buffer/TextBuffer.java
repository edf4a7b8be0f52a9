package ca.gc.cra.sconv.domain.buffer;

import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;

/**
 * <strong>What:</strong> Growable, zero-terminated text storage.
 * <p><strong>Why:</strong> Conversion stages write directly into backing arrays; a shared contract
 * keeps growth, termination, and failure handling identical for byte and wide text.</p>
 * <p><strong>Role:</strong> Domain value container owned exclusively by one string or profile.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep a zero unit at index {@code length()} whenever capacity is non-zero.</li>
 *   <li>Never shrink capacity except through {@link #free()} or a failed growth.</li>
 *   <li>Report exhaustion instead of wrapping around.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine each buffer to one owner.</p>
 * <p><strong>Performance:</strong> Amortized O(1) appends per unit using {@link BufferGrowth}.</p>
 *
 * @since 0.1.0
 * @see ByteTextBuffer
 * @see WideTextBuffer
 */
public interface TextBuffer {

  /** Number of units stored, excluding the terminator. */
  int length();

  /** Number of units allocated, including room for the terminator. */
  int capacity();

  /** Maximum capacity this buffer may grow to. */
  int maxCapacity();

  /** Returns {@code true} when no units are stored. */
  default boolean isEmpty() {
    return length() == 0;
  }

  /**
   * Grows the buffer so at least {@code minCapacity} units are allocated.
   *
   * <p>When growth fails the buffer is reset to an empty, unallocated state and {@code false} is
   * returned. A negative request is an overflowed size and always fails.</p>
   *
   * @param minCapacity requested capacity in units
   * @return {@code true} when the capacity is now at least {@code minCapacity}
   */
  boolean ensure(int minCapacity);

  /**
   * Same as {@link #ensure(int)} but reports failure as an exception.
   *
   * @param minCapacity requested capacity in units
   * @throws BufferExhaustedException when the buffer could not grow
   */
  default void reserve(int minCapacity) throws BufferExhaustedException {
    if (!ensure(minCapacity)) {
      throw new BufferExhaustedException(minCapacity);
    }
  }

  /** Sets the length to zero while keeping the allocation. */
  void clear();

  /** Drops the allocation; capacity becomes zero. */
  void free();
}
