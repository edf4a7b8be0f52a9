package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} command arguments into the override map fed to the configuration merger.
 *
 * <p>{@code --key=value} is accepted as a spelling of {@code key=value}. An empty value
 * ({@code systemCharset=}) is kept so that it can blank out a value from a configuration file.
 * Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses {@code args} in order.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument has no {@code '='}, a key is malformed or
   *         repeated, or a value contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = stripDashes(raw.trim());
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = arg.substring(idx + 1);
      String checked = value.isBlank() ? "" : Strings.requireNonBlank(key, value);
      if (map.putIfAbsent(key, checked) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static String stripDashes(String arg) {
    if (arg.startsWith("--")) {
      return arg.substring(2);
    }
    return arg;
  }
}
