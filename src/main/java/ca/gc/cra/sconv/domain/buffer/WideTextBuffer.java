package ca.gc.cra.sconv.domain.buffer;

import java.util.Arrays;
import java.util.Objects;

/**
 * Growable string of UTF-16 {@code char} units, the wide form of a name.
 *
 * @since 0.1.0
 */
public final class WideTextBuffer implements TextBuffer {
  private static final char[] EMPTY = new char[0];

  private final int maxCapacity;
  private char[] data = EMPTY;
  private int length;

  public WideTextBuffer() {
    this(BufferGrowth.MAX_ARRAY_CAPACITY);
  }

  /**
   * @param maxCapacity largest capacity, in chars, this buffer may reach
   */
  public WideTextBuffer(int maxCapacity) {
    if (maxCapacity <= 0) {
      throw new IllegalArgumentException("maxCapacity must be positive");
    }
    this.maxCapacity = Math.min(maxCapacity, BufferGrowth.MAX_ARRAY_CAPACITY);
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

  public boolean append(char[] src, int offset, int count) {
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

  public boolean append(CharSequence text) {
    Objects.requireNonNull(text, "text");
    int count = text.length();
    if (!ensure(BufferGrowth.request(length, count + 1L))) {
      return false;
    }
    for (int i = 0; i < count; i++) {
      data[length + i] = text.charAt(i);
    }
    length += count;
    data[length] = 0;
    return true;
  }

  /**
   * Appends chars up to the first zero char or {@code maxCount} chars.
   */
  public boolean appendBounded(char[] src, int offset, int maxCount) {
    Objects.requireNonNull(src, "src");
    Objects.checkFromIndexSize(offset, maxCount, src.length);
    int n = 0;
    while (n < maxCount && src[offset + n] != 0) {
      n++;
    }
    return append(src, offset, n);
  }

  public boolean appendChar(char value) {
    if (!ensure(BufferGrowth.request(length, 2))) {
      return false;
    }
    data[length++] = value;
    data[length] = 0;
    return true;
  }

  /** Appends a code point, as a surrogate pair when supplementary. */
  public boolean appendCodePoint(int codePoint) {
    if (Character.isBmpCodePoint(codePoint)) {
      return appendChar((char) codePoint);
    }
    if (!ensure(BufferGrowth.request(length, 3))) {
      return false;
    }
    data[length++] = Character.highSurrogate(codePoint);
    data[length++] = Character.lowSurrogate(codePoint);
    data[length] = 0;
    return true;
  }

  public boolean concat(WideTextBuffer other) {
    Objects.requireNonNull(other, "other");
    return append(other.data, 0, other.length);
  }

  public boolean copyFrom(WideTextBuffer other) {
    Objects.requireNonNull(other, "other");
    if (other == this) {
      return true;
    }
    clear();
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

  /** Backing array; replaced on growth. */
  public char[] array() {
    return data;
  }

  public char charAt(int index) {
    Objects.checkIndex(index, length);
    return data[index];
  }

  public void setLength(int newLength) {
    if (newLength < 0 || newLength + 1 > data.length) {
      throw new IndexOutOfBoundsException(
          "length " + newLength + " exceeds capacity " + data.length);
    }
    length = newLength;
    data[newLength] = 0;
  }

  /** Returns the stored text. */
  @Override
  public String toString() {
    return new String(data, 0, length);
  }
}
