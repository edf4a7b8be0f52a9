package ca.gc.cra.sconv.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads an sconv YAML file into the flat key/value map used by {@link ConfigMerger}.
 *
 * <p>The document is a mapping with up to three sections: {@code common}, {@code convert} and
 * {@code inspect}. The requested command's section overrides {@code common}; nested mappings
 * become dotted keys. Any other top-level key is rejected so that a misspelt section does not
 * silently fall back to defaults.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Set<String> SECTIONS = Set.of(COMMON, "convert", "inspect");

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} and {@code mode} sections of {@code path}.
   *
   * @param path location of the YAML configuration
   * @param mode command name (convert, inspect)
   * @return flat map of settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or has an unexpected shape
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (MarkedYAMLException ex) {
      Mark mark = ex.getProblemMark();
      String where = mark == null ? "" : " (line " + (mark.getLine() + 1) + ")";
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + where, ex);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : mapping(document, "document").entrySet()) {
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        throw new IllegalArgumentException("unknown YAML section '" + entry.getKey()
            + "' (expected common, convert or inspect)");
      }
      sections.put(name, entry.getValue());
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    for (String name : new String[] {COMMON, section}) {
      Object body = sections.get(name);
      if (body != null) {
        flatten(mapping(body, name), "", flattened);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix,
      Map<String, String> target) {
    source.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?>) {
        flatten(mapping(value, dotted), dotted, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + dotted);
      } else {
        target.put(dotted, value == null ? "" : value.toString());
      }
    });
  }
}
