package ca.gc.cra.sconv.domain.conversion;

/**
 * Signals that a text buffer could not grow to the requested capacity.
 *
 * <p>This is the out-of-memory channel of the conversion engine and is kept distinct from
 * {@link UnsupportedConversionException} so callers can tell resource exhaustion from a rejected
 * charset pair. The buffer that failed has already been reset to an empty state.</p>
 *
 * @since 0.1.0
 */
public final class BufferExhaustedException extends ConversionException {
  private static final long serialVersionUID = 1L;

  private final long requestedCapacity;

  /**
   * Creates an exception for a failed growth request.
   *
   * @param requestedCapacity capacity, in units, that could not be satisfied
   */
  public BufferExhaustedException(long requestedCapacity) {
    super("Unable to grow text buffer to " + requestedCapacity + " units");
    this.requestedCapacity = requestedCapacity;
  }

  public long requestedCapacity() {
    return requestedCapacity;
  }
}
