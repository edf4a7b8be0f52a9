package ca.gc.cra.sconv.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each sconv command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command name (convert, inspect)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "convert" -> buildConvertDefaults();
      case "inspect" -> buildInspectDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ConversionConfig defaults = ConversionConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("systemCharset", defaults.systemCharset());
    map.put("backend", defaults.backend().name());
    map.put("legacyUtf8", Boolean.toString(defaults.legacyUtf8()));
    map.put("normalization", "");
    map.put("normalizationRunLimit", Integer.toString(defaults.normalizationRunLimit()));
    map.put("allocationPolicy", defaults.allocationPolicy().name());
    map.put("maxBufferCapacity", Integer.toString(defaults.maxBufferCapacity()));
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", Boolean.toString(defaults.verbose()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildConvertDefaults() {
    Map<String, String> map = buildInspectDefaults();
    map.put("in", "");
    map.put("out", "");
    return map;
  }

  private static Map<String, String> buildInspectDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("direction", "read");
    map.put("bestEffort", "false");
    return map;
  }
}
