package ca.gc.cra.sconv.domain.buffer;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Objects;

/**
 * Growable byte string holding UTF-8, system-charset, or UTF-16 encoded text.
 *
 * <p>The backing array is exposed through {@link #array()} so codecs can encode in place; callers
 * that write past {@link #length()} must {@link #ensure(int) ensure} capacity first and then call
 * {@link #setLength(int)} or {@link #terminate(int)} to publish the new length.</p>
 *
 * @since 0.1.0
 */
public final class ByteTextBuffer implements TextBuffer {
  private static final byte[] EMPTY = new byte[0];

  private final int maxCapacity;
  private byte[] data = EMPTY;
  private int length;

  /** Creates an unallocated buffer bounded by the JVM array limit. */
  public ByteTextBuffer() {
    this(BufferGrowth.MAX_ARRAY_CAPACITY);
  }

  /**
   * Creates an unallocated buffer with an explicit growth bound.
   *
   * @param maxCapacity largest capacity, in bytes, this buffer may reach
   * @throws IllegalArgumentException when {@code maxCapacity} is not positive
   */
  public ByteTextBuffer(int maxCapacity) {
    if (maxCapacity <= 0) {
      throw new IllegalArgumentException("maxCapacity must be positive");
    }
    this.maxCapacity = Math.min(maxCapacity, BufferGrowth.MAX_ARRAY_CAPACITY);
  }

  /**
   * Creates a buffer holding a copy of {@code bytes}.
   *
   * @param bytes initial content; must not be {@code null}
   * @return new buffer
   */
  public static ByteTextBuffer copyOf(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    ByteTextBuffer buffer = new ByteTextBuffer();
    if (!buffer.append(bytes, 0, bytes.length)) {
      throw new IllegalStateException("unable to allocate " + bytes.length + " bytes");
    }
    return buffer;
  }

  @Override
  public int length() {
    return length;
  }

  @Override
  public int capacity() {
    return data.length;
  }

  @Override
  public int maxCapacity() {
    return maxCapacity;
  }

  @Override
  public boolean ensure(int minCapacity) {
    if (minCapacity >= 0 && minCapacity <= data.length && data.length > 0) {
      return true;
    }
    int next = BufferGrowth.nextCapacity(data.length, minCapacity, maxCapacity);
    if (next < 0) {
      free();
      return false;
    }
    try {
      data = Arrays.copyOf(data, next);
    } catch (OutOfMemoryError ex) {
      free();
      return false;
    }
    return true;
  }

  /**
   * Appends exactly {@code count} bytes.
   *
   * @param src source array
   * @param offset first byte to copy
   * @param count number of bytes to copy
   * @return {@code false} when the buffer could not grow (the buffer is then empty)
   */
  public boolean append(byte[] src, int offset, int count) {
    Objects.requireNonNull(src, "src");
    Objects.checkFromIndexSize(offset, count, src.length);
    if (!ensure(BufferGrowth.request(length, count + 1L))) {
      return false;
    }
    System.arraycopy(src, offset, data, length, count);
    length += count;
    data[length] = 0;
    return true;
  }

  /**
   * Appends bytes up to the first zero byte or {@code maxCount} bytes, whichever comes first.
   * Never reads beyond {@code offset + maxCount}.
   *
   * @return {@code false} when the buffer could not grow
   */
  public boolean appendBounded(byte[] src, int offset, int maxCount) {
    Objects.requireNonNull(src, "src");
    Objects.checkFromIndexSize(offset, maxCount, src.length);
    return append(src, offset, boundedLength(src, offset, maxCount));
  }

  /**
   * Appends a single byte.
   *
   * @param value byte value; only the low eight bits are stored
   * @return {@code false} when the buffer could not grow
   */
  public boolean appendByte(int value) {
    if (!ensure(BufferGrowth.request(length, 2))) {
      return false;
    }
    data[length++] = (byte) value;
    data[length] = 0;
    return true;
  }

  /**
   * Appends the content of another buffer.
   *
   * @return {@code false} when the buffer could not grow
   */
  public boolean concat(ByteTextBuffer other) {
    Objects.requireNonNull(other, "other");
    return append(other.data, 0, other.length);
  }

  /**
   * Replaces the content with a copy of {@code other}.
   *
   * @return {@code false} when the buffer could not grow
   */
  public boolean copyFrom(ByteTextBuffer other) {
    Objects.requireNonNull(other, "other");
    if (other == this) {
      return true;
    }
    length = 0;
    if (data.length > 0) {
      data[0] = 0;
    }
    return concat(other);
  }

  @Override
  public void clear() {
    length = 0;
    if (data.length > 0) {
      data[0] = 0;
    }
  }

  @Override
  public void free() {
    data = EMPTY;
    length = 0;
  }

  /**
   * Exposes the backing array for in-place encoding. The array is replaced on growth, so callers
   * must re-read it after every {@link #ensure(int)}.
   */
  public byte[] array() {
    return data;
  }

  /**
   * Publishes a new length after writing directly into {@link #array()} and writes a one-byte
   * terminator.
   *
   * @param newLength new length; {@code newLength + 1} must not exceed the capacity
   */
  public void setLength(int newLength) {
    terminate(newLength, 1);
  }

  /**
   * Publishes a new length and writes {@code width} zero bytes after it. UTF-16 text uses a
   * two-byte terminator.
   *
   * @param newLength new length in bytes
   * @param width terminator width in bytes, 1 or 2
   */
  public void terminate(int newLength, int width) {
    if (newLength < 0 || width < 1 || width > 2 || newLength + width > data.length) {
      throw new IndexOutOfBoundsException(
          "length " + newLength + " + terminator " + width + " exceeds capacity " + data.length);
    }
    length = newLength;
    for (int i = 0; i < width; i++) {
      data[newLength + i] = 0;
    }
  }

  public int byteAt(int index) {
    Objects.checkIndex(index, length);
    return data[index] & 0xFF;
  }

  /** Copies the stored bytes into a new array. */
  public byte[] toByteArray() {
    return Arrays.copyOf(data, length);
  }

  /**
   * Decodes the stored bytes with {@code charset}; malformed input is replaced by the JDK default.
   */
  public String toString(Charset charset) {
    return new String(data, 0, length, charset);
  }

  /** Returns {@code true} when the stored bytes equal {@code other}. */
  public boolean contentEquals(byte[] other) {
    return other != null && Arrays.equals(data, 0, length, other, 0, other.length);
  }

  /**
   * Length of a zero-terminated byte string, bounded by {@code maxCount}.
   *
   * @return index of the first zero byte relative to {@code offset}, or {@code maxCount}
   */
  public static int boundedLength(byte[] src, int offset, int maxCount) {
    int n = 0;
    while (n < maxCount && src[offset + n] != 0) {
      n++;
    }
    return n;
  }

  /**
   * Length in bytes of a string of 16-bit units terminated by a zero unit, bounded by
   * {@code maxCount} bytes. A trailing odd byte is not counted.
   */
  public static int boundedLength16(byte[] src, int offset, int maxCount) {
    int n = 0;
    while (n + 1 < maxCount && (src[offset + n] != 0 || src[offset + n + 1] != 0)) {
      n += 2;
    }
    return n;
  }

  @Override
  public String toString() {
    return "ByteTextBuffer[length=" + length + ", capacity=" + data.length + "]";
  }
}
