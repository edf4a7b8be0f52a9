package ca.gc.cra.sconv.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by the configuration, CLI and profile
 * layers.
 * <p><strong>Why:</strong> Charset names arrive from archive headers and command lines; they must be
 * sanitized before they become registry keys or backend lookups.
 * <p><strong>Role:</strong> Support utilities invoked before ports/adapters allocate resources.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Restrict charset names to the IANA name alphabet.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with minimal allocations (trimmed copy only when needed).</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern CHARSET_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9.:_+-]*$");
  private static final int MAX_CHARSET_LENGTH = 64;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a charset name such as {@code UTF-8}, {@code CP932} or {@code ISO-8859-1}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate charset name; must not be {@code null}
   * @return trimmed charset name, case preserved
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the name is blank, too long, or uses characters outside
   *         {@code [A-Za-z0-9.:_+-]}
   *
   * <p><strong>Concurrency:</strong> Thread-safe; method uses only locals.</p>
   */
  public static String requireCharsetName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > MAX_CHARSET_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_CHARSET_LENGTH));
    }
    if (!CHARSET_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, colon, underscore, plus, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Ensures the value is printable ASCII and no longer than {@code maxLength}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @param maxLength maximum allowed length after trimming
   * @return trimmed input
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
