package ca.gc.cra.sconv.domain.buffer;

/**
 * Capacity policy shared by the text buffers.
 *
 * <p>Small buffers start at {@value #MIN_CAPACITY} units and double until {@value #LINEAR_THRESHOLD};
 * larger buffers grow by a quarter so long strings do not waste half their allocation. The
 * computed capacity is never smaller than the request.</p>
 *
 * @since 0.1.0
 */
public final class BufferGrowth {
  /** Smallest non-zero capacity a buffer ever allocates. */
  public static final int MIN_CAPACITY = 32;
  /** Capacity at which growth switches from doubling to 25% steps. */
  public static final int LINEAR_THRESHOLD = 8192;
  /** Largest array the JVM reliably allocates. */
  public static final int MAX_ARRAY_CAPACITY = Integer.MAX_VALUE - 8;

  private BufferGrowth() {
    // Utility
  }

  /**
   * Computes the next capacity for a buffer.
   *
   * @param currentCapacity capacity currently allocated (0 for an unallocated buffer)
   * @param requested minimum capacity the caller needs
   * @param maxCapacity hard upper bound for this buffer
   * @return the new capacity, or {@code -1} when the request cannot be satisfied within
   *     {@code maxCapacity}
   */
  public static int nextCapacity(int currentCapacity, long requested, int maxCapacity) {
    if (requested < 0 || requested > maxCapacity) {
      return -1;
    }
    long next = currentCapacity;
    if (next < MIN_CAPACITY) {
      next = MIN_CAPACITY;
    } else if (next < LINEAR_THRESHOLD) {
      next += next;
    } else {
      next += next / 4;
    }
    if (next < requested) {
      next = requested;
    }
    if (next > maxCapacity) {
      // growth step overshot the bound but the request itself fits
      next = maxCapacity;
    }
    return (int) next;
  }

  /**
   * Capacity needed to hold {@code extra} more units after {@code length}.
   *
   * @return the sum, or {@code -1} when it does not fit in an {@code int}; a negative request
   *     fails in {@link TextBuffer#ensure(int)}
   */
  public static int request(int length, long extra) {
    long total = length + extra;
    return total > Integer.MAX_VALUE ? -1 : (int) total;
  }
}
