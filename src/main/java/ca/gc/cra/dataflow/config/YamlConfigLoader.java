package ca.gc.cra.dataflow.config;

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
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads pipeline settings from YAML. The {@code common} section applies to every pipeline and the named
 * pipeline section overrides it; nested mappings flatten to dotted keys and scalar lists to comma-separated
 * values.
 */
public final class YamlConfigLoader {
  static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges {@code common} with the section named {@code pipeline}.
   *
   * @param path YAML file
   * @param pipeline section to overlay on {@code common}; matched case-insensitively
   * @return merged flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of sections
   */
  public static Optional<Map<String, String>> load(Path path, String pipeline) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(pipeline, "pipeline");
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> sections = mapping(document, "document");
      Map<String, String> settings = new LinkedHashMap<>();
      section(sections, COMMON).ifPresent(common -> flatten(mapping(common, COMMON), "", settings));
      String wanted = pipeline.trim().toLowerCase(Locale.ROOT);
      section(sections, wanted).ifPresent(own -> flatten(mapping(own, wanted), "", settings));
      return Optional.of(Map.copyOf(settings));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + path, ex);
    }
  }

  private static Optional<Object> section(Map<String, Object> sections, String name) {
    return sections.entrySet().stream()
        .filter(e -> e.getKey().trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst();
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    raw.forEach((k, v) -> {
      if (!(k instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-string key");
      }
      out.put(key, v);
    });
    return out;
  }

  private static void flatten(Map<String, Object> node, String prefix, Map<String, String> out) {
    node.forEach((key, value) -> {
      String path = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        out.put(path, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, path), path, out);
      } else if (value instanceof Iterable<?> items) {
        StringJoiner joined = new StringJoiner(",");
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException(path + " may only list scalar values");
          }
          joined.add(String.valueOf(item));
        }
        out.put(path, joined.toString());
      } else {
        out.put(path, value.toString());
      }
    });
  }
}
