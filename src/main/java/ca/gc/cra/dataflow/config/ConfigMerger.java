package ca.gc.cra.dataflow.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI over YAML over defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective key/value settings and validates them by parsing a {@link PipelineConfig}.
   *
   * @param yaml settings loaded from YAML, if any
   * @param cli command-line overrides; may be empty
   * @param defaults baseline values; may be empty
   * @param warn receives a message for every CLI key that replaces a YAML value; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are invalid
   */
  public static Map<String, String> merge(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> fromYaml = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (warn != null && fromYaml.containsKey(key) && !value.equals(fromYaml.get(key))) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }
    PipelineConfig.fromMap(merged);
    return Map.copyOf(merged);
  }
}
