package ca.gc.cra.sconv.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * <strong>What:</strong> Loads flat settings from a {@code .properties} file.
 * <p><strong>Why:</strong> Embedders that do not ship YAML can still override conversion defaults
 * with a plain properties file.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Callers should log when configuration files are missing or
 * malformed.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private ConfigLoader() {}

  /**
   * Reads properties from {@code path}.
   *
   * @param path properties file path; may be {@code null} or non-existent
   * @return keys and trimmed values, empty when there is no file
   * @throws IOException if the file exists but cannot be read
   */
  public static Map<String, String> fromProperties(Path path) throws IOException {
    if (path == null || !Files.exists(path)) {
      return Map.of();
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String key : props.stringPropertyNames()) {
      values.put(key, props.getProperty(key).trim());
    }
    return Map.copyOf(values);
  }

  /**
   * Reads a properties file straight into a configuration, defaults filling missing keys.
   *
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException when a value is malformed
   */
  public static ConversionConfig load(Path path) throws IOException {
    return ConversionConfig.fromMap(fromProperties(path));
  }
}
