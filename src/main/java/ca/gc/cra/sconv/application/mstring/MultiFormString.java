package ca.gc.cra.sconv.application.mstring;

import ca.gc.cra.sconv.application.conversion.ConversionDirection;
import ca.gc.cra.sconv.application.conversion.ConversionProfile;
import ca.gc.cra.sconv.application.conversion.ProfileSource;
import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.buffer.TextBuffer;
import ca.gc.cra.sconv.domain.buffer.WideTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeCodec;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> One text value (a path, user name, link target) cached in up to three
 * representations.
 * <p><strong>Why:</strong> Archive readers receive a name in one form and are asked for it in others;
 * each conversion should run once, and a failed conversion must not destroy forms that are already
 * known to be exact.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive a missing form from one that is present: wide and system through the native wide
 *       codec, wide and UTF-8 directly, system and UTF-8 through a conversion profile.</li>
 *   <li>Mark a form present only when its derivation was exact; keep best-effort values
 *       available without marking them.</li>
 *   <li>Convert the system form through a caller-supplied profile on demand.</li>
 * </ul>
 * <p><strong>Invariants:</strong> storing a form clears every other form; once set, a form stays set
 * until the next store or {@link #clear()}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Observability:</strong> Counts {@code sconv.mstring.derived} for every derivation attempt.</p>
 *
 * @since 0.1.0
 */
public final class MultiFormString {
  private static final String UTF_8 = UnicodeForm.UTF_8.charsetName();

  private final ProfileSource profiles;
  private final MetricsPort metrics;
  private final EnumSet<TextForm> present = EnumSet.noneOf(TextForm.class);
  private final ByteTextBuffer utf8 = new ByteTextBuffer();
  private final ByteTextBuffer system = new ByteTextBuffer();
  private final WideTextBuffer wide = new WideTextBuffer();
  private final ByteTextBuffer localized = new ByteTextBuffer();

  public MultiFormString(ProfileSource profiles) {
    this(profiles, MetricsPort.NO_OP);
  }

  public MultiFormString(ProfileSource profiles, MetricsPort metrics) {
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /** Forms currently held exactly. */
  public Set<TextForm> forms() {
    return Collections.unmodifiableSet(EnumSet.copyOf(present));
  }

  public boolean has(TextForm form) {
    return present.contains(form);
  }

  /** Returns {@code true} when no form is held. */
  public boolean isEmpty() {
    return present.isEmpty();
  }

  /**
   * Returns the requested form, deriving and caching it when needed.
   *
   * @throws ConversionException when a profile cannot be built or a buffer cannot grow
   */
  public FormResult<?> get(TextForm form) throws ConversionException {
    return switch (Objects.requireNonNull(form, "form")) {
      case UTF8 -> utf8();
      case SYSTEM -> system();
      case WIDE -> wide();
    };
  }

  /**
   * UTF-8 form. Derived from wide text directly, or from system text through a profile.
   *
   * @throws ConversionException when a profile cannot be built or a buffer cannot grow
   */
  public FormResult<ByteTextBuffer> utf8() throws ConversionException {
    if (present.contains(TextForm.UTF8)) {
      return FormResult.exact(utf8);
    }
    ConversionResult result;
    if (present.contains(TextForm.WIDE)) {
      utf8.clear();
      result = wideToUtf8(wide, utf8);
    } else if (present.contains(TextForm.SYSTEM)) {
      utf8.clear();
      result = convertThrough(profiles.systemCharset(), UTF_8, ConversionDirection.WRITE,
          system, utf8);
    } else {
      return FormResult.absent();
    }
    return derived(TextForm.UTF8, utf8, result);
  }

  /**
   * System-charset form. Derived from wide text through the native codec, or from UTF-8 through a
   * reading profile.
   *
   * @throws ConversionException when a profile cannot be built or a buffer cannot grow
   */
  public FormResult<ByteTextBuffer> system() throws ConversionException {
    if (present.contains(TextForm.SYSTEM)) {
      return FormResult.exact(system);
    }
    ConversionResult result;
    if (present.contains(TextForm.WIDE)) {
      system.clear();
      result = profiles.wideCodec().encode(wide.array(), 0, wide.length(), system);
    } else if (present.contains(TextForm.UTF8)) {
      system.clear();
      result = convertThrough(UTF_8, profiles.systemCharset(), ConversionDirection.READ,
          utf8, system);
    } else {
      return FormResult.absent();
    }
    return derived(TextForm.SYSTEM, system, result);
  }

  /**
   * Wide form. Derived from system text through the native codec, or from UTF-8 directly.
   *
   * @throws ConversionException when a buffer cannot grow
   */
  public FormResult<WideTextBuffer> wide() throws ConversionException {
    if (present.contains(TextForm.WIDE)) {
      return FormResult.exact(wide);
    }
    ConversionResult result;
    if (present.contains(TextForm.SYSTEM)) {
      wide.clear();
      result = profiles.wideCodec().decode(system.array(), 0, system.length(), wide);
    } else if (present.contains(TextForm.UTF8)) {
      wide.clear();
      result = utf8ToWide(utf8, wide);
    } else {
      return FormResult.absent();
    }
    return derived(TextForm.WIDE, wide, result);
  }

  /**
   * System form converted through {@code profile} into a separate buffer. With a {@code null}
   * profile the system form itself is returned. When only wide text is held the system form is
   * derived first.
   *
   * @throws ConversionException when a buffer cannot grow
   */
  public FormResult<ByteTextBuffer> localized(ConversionProfile profile)
      throws ConversionException {
    ConversionResult result = ConversionResult.complete();
    if (!present.contains(TextForm.SYSTEM) && present.contains(TextForm.WIDE)) {
      system.clear();
      result = profiles.wideCodec().encode(wide.array(), 0, wide.length(), system);
      metrics.increment("sconv.mstring.derived");
      if (result.isComplete()) {
        present.add(TextForm.SYSTEM);
      }
    }
    if (!present.contains(TextForm.SYSTEM)) {
      return new FormResult<>(null, result);
    }
    if (profile == null) {
      return new FormResult<>(system, result);
    }
    ConversionResult converted = profile.convertInto(system.array(), 0, system.length(),
        localized);
    return new FormResult<>(localized, result.merge(converted));
  }

  /**
   * Stores UTF-8 or system-charset bytes, up to the first zero byte, as the only form held.
   * {@code null} clears the string.
   *
   * @throws IllegalArgumentException for {@link TextForm#WIDE}; use {@link #copyWide}
   * @throws BufferExhaustedException when the buffer cannot grow; the string is then empty
   */
  public void copyInto(TextForm form, byte[] bytes, int offset, int length)
      throws BufferExhaustedException {
    Objects.requireNonNull(form, "form");
    if (form == TextForm.WIDE) {
      throw new IllegalArgumentException("wide text is stored with copyWide");
    }
    present.clear();
    if (bytes == null) {
      return;
    }
    ByteTextBuffer target = form == TextForm.UTF8 ? utf8 : system;
    resetAll();
    if (!target.appendBounded(bytes, offset, length)) {
      throw new BufferExhaustedException((long) length + 1);
    }
    present.add(form);
  }

  /** Stores a whole array. */
  public void copyInto(TextForm form, byte[] bytes) throws BufferExhaustedException {
    copyInto(form, bytes, 0, bytes == null ? 0 : bytes.length);
  }

  /**
   * Stores wide text as the only form held. {@code null} clears the string.
   *
   * @throws BufferExhaustedException when the buffer cannot grow; the string is then empty
   */
  public void copyWide(CharSequence text) throws BufferExhaustedException {
    present.clear();
    if (text == null) {
      return;
    }
    resetAll();
    if (!wide.append(text)) {
      throw new BufferExhaustedException((long) text.length() + 1);
    }
    present.add(TextForm.WIDE);
  }

  /**
   * Converts archive bytes through {@code profile} and stores them as the system form. The form
   * is marked present only when the conversion was exact; otherwise the string holds no form and
   * the best-effort text is left in the system buffer.
   *
   * @throws BufferExhaustedException when a buffer cannot grow
   */
  public ConversionResult copyConverted(byte[] bytes, int offset, int length,
      ConversionProfile profile) throws BufferExhaustedException {
    Objects.requireNonNull(profile, "profile");
    present.clear();
    if (bytes == null) {
      return ConversionResult.complete();
    }
    resetAll();
    ConversionResult result = profile.convert(bytes, offset, length, system);
    if (result.isComplete()) {
      present.add(TextForm.SYSTEM);
    }
    return result;
  }

  /**
   * Stores UTF-8 text and eagerly derives the system form, then the wide form. Stops at the first
   * inexact step; the UTF-8 form and any exact forms stay set, and best-effort text remains in its
   * buffer. {@code null} clears the string.
   *
   * @throws ConversionException when a profile cannot be built or a buffer cannot grow
   */
  public ConversionResult update(byte[] utf8Text) throws ConversionException {
    present.clear();
    if (utf8Text == null) {
      return ConversionResult.complete();
    }
    resetAll();
    if (!utf8.appendBounded(utf8Text, 0, utf8Text.length)) {
      throw new BufferExhaustedException((long) utf8Text.length + 1);
    }
    present.add(TextForm.UTF8);

    ConversionResult toSystem = convertThrough(UTF_8, profiles.systemCharset(),
        ConversionDirection.READ, utf8, system);
    if (!toSystem.isComplete()) {
      return toSystem;
    }
    present.add(TextForm.SYSTEM);

    ConversionResult toWide = profiles.wideCodec().decode(system.array(), 0, system.length(),
        wide);
    if (!toWide.isComplete()) {
      return toWide;
    }
    present.add(TextForm.WIDE);
    return ConversionResult.complete();
  }

  /** Replaces this string's forms with copies of {@code other}'s. */
  public void copyFrom(MultiFormString other) throws BufferExhaustedException {
    Objects.requireNonNull(other, "other");
    if (other == this) {
      return;
    }
    present.clear();
    resetAll();
    if (!utf8.copyFrom(other.utf8) || !system.copyFrom(other.system)
        || !wide.copyFrom(other.wide)) {
      throw new BufferExhaustedException(
          Math.max(other.utf8.length(), Math.max(other.system.length(), other.wide.length())));
    }
    present.addAll(other.present);
  }

  /** Forgets every form and releases the buffers. */
  public void clear() {
    present.clear();
    utf8.free();
    system.free();
    wide.free();
    localized.free();
  }

  private void resetAll() {
    utf8.clear();
    system.clear();
    wide.clear();
    localized.clear();
  }

  private <T extends TextBuffer> FormResult<T> derived(TextForm form, T value,
      ConversionResult result) {
    metrics.increment("sconv.mstring.derived");
    if (result.isComplete()) {
      present.add(form);
    }
    return new FormResult<>(value, result);
  }

  private ConversionResult convertThrough(String source, String target,
      ConversionDirection direction, ByteTextBuffer from, ByteTextBuffer to)
      throws ConversionException {
    ConversionProfile profile = profiles.acquire(source, target, direction, true);
    try {
      return profile.convertInto(from.array(), 0, from.length(), to);
    } finally {
      profiles.release(profile);
    }
  }

  private static ConversionResult wideToUtf8(WideTextBuffer src, ByteTextBuffer dst)
      throws BufferExhaustedException {
    ConversionResult result = ConversionResult.complete();
    char[] chars = src.array();
    int length = src.length();
    int i = 0;
    while (i < length) {
      int codePoint = chars[i++];
      if (UnicodeCodec.isHighSurrogate(codePoint) && i < length
          && UnicodeCodec.isLowSurrogate(chars[i])) {
        codePoint = UnicodeCodec.combineSurrogates(codePoint, chars[i++]);
      } else if (UnicodeCodec.isSurrogate(codePoint)) {
        codePoint = UnicodeCodec.REPLACEMENT_CHARACTER;
        result = result.with(ConversionIssue.MALFORMED_INPUT);
      }
      if (!UnicodeForm.UTF_8.append(dst, codePoint)) {
        throw new BufferExhaustedException(dst.length() + 5L);
      }
    }
    dst.reserve(dst.length() + 1);
    dst.setLength(dst.length());
    return result;
  }

  private static ConversionResult utf8ToWide(ByteTextBuffer src, WideTextBuffer dst)
      throws BufferExhaustedException {
    ConversionResult result = ConversionResult.complete();
    byte[] bytes = src.array();
    int limit = src.length();
    int position = 0;
    while (true) {
      long decoded = UnicodeForm.UTF_8.decode(bytes, position, limit);
      int n = UnicodeCodec.consumed(decoded);
      if (n == 0) {
        break;
      }
      if (n < 0) {
        result = result.with(ConversionIssue.MALFORMED_INPUT);
      }
      position += Math.abs(n);
      if (!dst.appendCodePoint(UnicodeCodec.codePoint(decoded))) {
        throw new BufferExhaustedException(dst.length() + 3L);
      }
    }
    dst.reserve(dst.length() + 1);
    dst.setLength(dst.length());
    return result;
  }
}
