package ca.gc.cra.halo.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened defaults for each CLI mode, expressed with the same keys users pass on the command line.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode {@code live}, {@code session} or {@code view}
   * @return unmodifiable map of defaults
   * @throws IllegalArgumentException when the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "live" -> buildLiveDefaults();
      case "session" -> buildSessionDefaults();
      case "view" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPipelineDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("device", defaults.device());
    map.put("out", defaults.outputDirectory().toString());
    map.put("format", defaults.outputFormat().name());
    map.put("filePrefix", defaults.filePrefix());
    map.put("flushIntervalSec", Long.toString(defaults.flushInterval().toSeconds()));
    map.put("gpu", Boolean.toString(defaults.gpuAcceleration()));
    map.put("cascade", defaults.cascadePath().toString());
    map.put("minFaceSize", Integer.toString(defaults.minFaceSize()));
    map.put("display", "auto");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildLiveDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = buildPipelineDefaults();
    map.put("frameSkip", Integer.toString(defaults.frameSkip()));
    map.put("overlay", Boolean.toString(defaults.overlayEnabled()));
    map.put("idleSleepMs", Long.toString(defaults.idleSleepMillis()));
    map.put("shutdownTimeoutMs", Long.toString(defaults.shutdownTimeout().toMillis()));
    return map;
  }

  private static Map<String, String> buildSessionDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = buildPipelineDefaults();
    map.put("countdownSec", Long.toString(defaults.countdown().toSeconds()));
    map.put("autoTrigger", Boolean.toString(defaults.autoTrigger()));
    map.put("analysis", defaults.analysis().name().toLowerCase(Locale.ROOT));
    return map;
  }
}
