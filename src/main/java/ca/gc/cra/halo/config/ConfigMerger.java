package ca.gc.cra.halo.config;

import ca.gc.cra.halo.application.session.SessionMode;
import ca.gc.cra.halo.domain.storage.OutputFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults, then checks the
 * cross-key rules that a single {@link PipelineConfig} field cannot express.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML settings for the mode
   * @param cli CLI {@code key=value} overrides, may be empty
   * @param defaults embedded defaults for the mode
   * @param warn receives a message for every CLI key that overrides a YAML key
   * @return immutable merged map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String format = trim(effective.get("format"));
    if (!format.isEmpty()) {
      OutputFormat.parse(format);
    }
    if ("live".equalsIgnoreCase(mode) && parseBoolean(effective.get("autoTrigger"))) {
      throw new IllegalArgumentException("autoTrigger only applies to session mode");
    }
    String analysis = trim(effective.get("analysis"));
    if (!analysis.isEmpty()) {
      SessionMode parsed = SessionMode.parse(analysis);
      if ("live".equalsIgnoreCase(mode) && parsed != SessionMode.FACE) {
        throw new IllegalArgumentException("analysis=complete only applies to session mode");
      }
    }
    if ("view".equalsIgnoreCase(mode) && trim(effective.get("in")).isEmpty()) {
      throw new IllegalArgumentException("view requires in=<results file>");
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
