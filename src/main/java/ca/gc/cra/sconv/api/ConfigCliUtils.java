package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.config.ConfigLoader;
import ca.gc.cra.sconv.config.ConfigMerger;
import ca.gc.cra.sconv.config.DefaultsForMode;
import ca.gc.cra.sconv.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    return extract(args, "config", "--config");
  }

  static String extractPropertiesPath(Map<String, String> args) {
    return extract(args, "properties", "--properties");
  }

  /**
   * Resolves the effective configuration for {@code mode}: CLI arguments over the YAML file named
   * by {@code config=}, over the properties file named by {@code properties=}, over defaults.
   * Both path keys are removed from {@code args}.
   *
   * @throws NoSuchFileException when a named file does not exist
   * @throws IOException when a file cannot be read
   * @throws IllegalArgumentException when a file or value is malformed
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> args,
      Consumer<String> warn) throws IOException {
    String yamlPath = extractConfigPath(args);
    String propertiesPath = extractPropertiesPath(args);

    Optional<Map<String, String>> yaml = Optional.empty();
    if (yamlPath != null) {
      yaml = YamlConfigLoader.load(requireExisting(yamlPath), mode);
    }
    Map<String, String> properties = Map.of();
    if (propertiesPath != null) {
      properties = ConfigLoader.fromProperties(requireExisting(propertiesPath));
    }
    return ConfigMerger.buildEffectiveConfig(mode, properties, yaml, args,
        DefaultsForMode.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Path requireExisting(String raw) throws NoSuchFileException {
    Path path = Path.of(raw);
    if (!Files.exists(path)) {
      throw new NoSuchFileException(raw, null, "configuration file does not exist");
    }
    return path;
  }

  private static String extract(Map<String, String> args, String... keys) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : keys) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
