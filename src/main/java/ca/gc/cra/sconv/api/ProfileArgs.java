package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.application.conversion.ConversionDirection;
import ca.gc.cra.sconv.application.conversion.ConversionProfile;
import ca.gc.cra.sconv.application.conversion.ConversionProfileRegistry;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.validation.Strings;
import java.util.Locale;
import java.util.Map;

/**
 * Charset pair requested on the command line. Reading may omit {@code to} and writing may omit
 * {@code from}; the missing side is the system charset.
 */
record ProfileArgs(String from, String to, ConversionDirection direction, boolean bestEffort) {

  static ProfileArgs fromMap(Map<String, String> effective, boolean bestEffortFlag) {
    ConversionDirection direction =
        switch (effective.getOrDefault("direction", "read").trim().toLowerCase(Locale.ROOT)) {
          case "", "read" -> ConversionDirection.READ;
          case "write" -> ConversionDirection.WRITE;
          default -> throw new IllegalArgumentException("direction must be read or write");
        };
    String from = optionalCharset("from", effective.get("from"));
    String to = optionalCharset("to", effective.get("to"));
    if (direction == ConversionDirection.READ && from == null) {
      throw new IllegalArgumentException("from is required when reading");
    }
    if (direction == ConversionDirection.WRITE && to == null) {
      throw new IllegalArgumentException("to is required when writing");
    }
    boolean bestEffort = bestEffortFlag || ConfigCliUtils.parseBoolean(effective, "bestEffort");
    return new ProfileArgs(from, to, direction, bestEffort);
  }

  ConversionProfile open(ConversionProfileRegistry registry)
      throws UnsupportedConversionException {
    if (from != null && to != null) {
      return registry.get(from, to, direction, bestEffort);
    }
    return direction == ConversionDirection.READ
        ? registry.forRead(from, bestEffort)
        : registry.forWrite(to, bestEffort);
  }

  private static String optionalCharset(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return Strings.requireCharsetName(key, raw);
  }
}
