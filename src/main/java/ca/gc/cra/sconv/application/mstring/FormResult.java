package ca.gc.cra.sconv.application.mstring;

import ca.gc.cra.sconv.domain.buffer.TextBuffer;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import java.util.Objects;

/**
 * A representation read from a {@link MultiFormString} together with how exactly it was derived.
 *
 * @param value the cached buffer, or {@code null} when the string holds no form to derive from
 * @param result issues met while deriving; a stored best-effort value carries its issues here
 * @param <T> buffer type of the form
 * @since 0.1.0
 */
public record FormResult<T extends TextBuffer>(T value, ConversionResult result) {
  public FormResult {
    Objects.requireNonNull(result, "result");
  }

  static <T extends TextBuffer> FormResult<T> exact(T value) {
    return new FormResult<>(value, ConversionResult.complete());
  }

  static <T extends TextBuffer> FormResult<T> absent() {
    return new FormResult<>(null, ConversionResult.complete());
  }

  /** Returns {@code true} when a value is available, exact or not. */
  public boolean isPresent() {
    return value != null;
  }

  /** Returns {@code true} when a value is available and represents the text exactly. */
  public boolean isExact() {
    return value != null && result.isComplete();
  }
}
