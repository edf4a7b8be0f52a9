package ca.gc.cra.sconv.config;

import ca.gc.cra.sconv.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, properties, YAML and CLI sources while enforcing precedence
 * and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @see #buildEffectiveConfig(String, Map, Optional, Map, Map, Consumer)
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    return buildEffectiveConfig(mode, Map.of(), yaml, cli, defaults, warn);
  }

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; properties &gt;
   * defaults.
   *
   * @param mode active command
   * @param properties settings from a properties file (may be empty)
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Map<String, String> properties,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    if (properties != null) {
      merged.putAll(properties);
    }
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    for (String key : new String[] {"from", "to", "systemCharset"}) {
      String value = trim(effective.get(key));
      if (!value.isEmpty()) {
        Strings.requireCharsetName(key, value);
      }
    }
    String direction = trim(effective.get("direction")).toLowerCase(Locale.ROOT);
    if (!direction.isEmpty() && !direction.equals("read") && !direction.equals("write")) {
      throw new IllegalArgumentException("direction must be read or write for " + mode);
    }
    if (!trim(effective.get("otelEndpoint")).isEmpty()
        && trim(effective.get("metricsExporter")).equalsIgnoreCase("none")) {
      throw new IllegalArgumentException("otelEndpoint requires metricsExporter=otlp");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
