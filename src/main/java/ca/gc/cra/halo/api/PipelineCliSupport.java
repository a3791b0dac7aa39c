package ca.gc.cra.halo.api;

import ca.gc.cra.halo.config.ConfigMerger;
import ca.gc.cra.halo.config.DefaultsForMode;
import ca.gc.cra.halo.config.PipelineConfig;
import ca.gc.cra.halo.config.YamlConfigLoader;
import ca.gc.cra.halo.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Argument handling shared by the {@code live} and {@code session} commands: YAML loading, merging,
 * telemetry settings, {@link PipelineConfig} materialization and pre-flight filesystem checks.
 */
final class PipelineCliSupport {

  private PipelineCliSupport() {}

  /**
   * Resolves the effective configuration for {@code mode}.
   *
   * @param mode {@code live} or {@code session}
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @param log caller's logger
   * @return validated configuration
   * @throws CliAbort carrying the exit code when any step fails
   */
  static PipelineConfig resolve(String mode, CliInput input, String usage, Logger log) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> yaml = loadYaml(ConfigCliUtils.extractConfigPath(cliKv), mode, usage, log);

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      return PipelineConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Checks the cascade file and output directory before any device is opened.
   *
   * @param config resolved configuration
   * @param createOutput create the output directory when missing; {@code false} for dry runs
   * @param log caller's logger
   * @return the validated output directory
   * @throws CliAbort with {@link ExitCode#CONFIG_ERROR} when a check fails
   */
  static Path preflight(PipelineConfig config, boolean createOutput, Logger log) throws CliAbort {
    try {
      Paths.requireReadableFile("cascade", config.cascadePath());
      return Paths.validateWritableDir(config.outputDirectory(), createOutput);
    } catch (IllegalArgumentException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    }
  }

  static List<String> dryRunPlan(String mode, PipelineConfig config, Path outputDir) {
    List<String> lines = new ArrayList<>();
    lines.add(capitalize(mode) + " dry-run: no camera will be opened.");
    lines.add(" Device           : " + config.device());
    lines.add(" Display          : " + config.display());
    lines.add(" Cascade          : " + config.cascadePath());
    lines.add(" Min face size    : " + config.minFaceSize() + " px");
    lines.add(" GPU requested    : " + config.gpuAcceleration());
    lines.add(" Output dir       : " + outputDir);
    lines.add(" Output format    : " + config.outputFormat().extension());
    lines.add(" File prefix      : " + config.filePrefix());
    if ("live".equals(mode)) {
      lines.add(" Flush interval   : " + config.flushInterval().toSeconds() + " s");
      lines.add(" Frame skip       : " + config.frameSkip());
      lines.add(" Overlay          : " + (config.overlayEnabled() ? "on" : "off"));
    } else {
      lines.add(" Countdown        : " + config.countdown().toSeconds() + " s");
      lines.add(" Auto trigger     : " + config.autoTrigger());
      lines.add(" Analysis         : " + config.analysis().name().toLowerCase(Locale.ROOT));
    }
    lines.add(" Re-run without --dry-run to start.");
    return lines;
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage, Logger log)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static String capitalize(String value) {
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }

  /** Ends a command early with a specific exit code after the failure has been logged. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
