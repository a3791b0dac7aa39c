package ca.gc.cra.halo.api;

import ca.gc.cra.halo.api.PipelineCliSupport.CliAbort;
import ca.gc.cra.halo.application.session.SessionOutcome;
import ca.gc.cra.halo.config.CompositionRoot;
import ca.gc.cra.halo.config.PipelineConfig;
import ca.gc.cra.halo.domain.error.CaptureException;
import ca.gc.cra.halo.domain.error.DeviceUnavailableException;
import ca.gc.cra.halo.domain.error.HaloException;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.logging.LoggingConfigurator;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one countdown capture, analyses the best frame and saves the result.
 *
 * @since 0.1.0
 */
public final class SessionCli {
  private static final Logger log = LoggerFactory.getLogger(SessionCli.class);
  private static final String MODE = "session";
  private static final String SUMMARY_USAGE =
      "usage: halo session [device=INDEX|PATH] [out=DIR] [format=json|csv|xlsx] [countdownSec=0-60] "
          + "[autoTrigger=true|false] [analysis=face|complete] [cascade=PATH] [display=auto|canvas|headless] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      HALO single-shot capture session

      Usage:
        halo session [options]

      Options:
        device=INDEX|PATH         Camera index (default 0) or path to a video file
        out=DIR                   Result directory (default ~/.halo/out)
        format=json|csv|xlsx      Result file format (default json)
        filePrefix=NAME           Result file prefix (default facial_analysis)
        countdownSec=0-60         Countdown after pressing space (default 3)
        autoTrigger=true|false    Start the countdown without waiting for a key (default false)
        analysis=face|complete    Face only, or face then full body (default face)
        gpu=true|false            Use OpenCL when available (default false)
        cascade=PATH              Haar cascade XML (default ~/.halo/models/haarcascade_frontalface_default.xml)
        minFaceSize=16-2000       Smallest face side in pixels (default 80)
        display=auto|canvas|headless  Window or console (default auto)
        config=FILE               YAML file with common/session sections
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        --dry-run                 Validate inputs and print the plan
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Keys: space starts the countdown, q quits (in complete analysis q skips the current part).
      """;

  private SessionCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for session CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    PipelineConfig config;
    Path outputDir;
    try {
      config = PipelineCliSupport.resolve(MODE, input, SUMMARY_USAGE, log);
      outputDir = PipelineCliSupport.preflight(config, !dryRun, log);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    if (dryRun) {
      CliPrinter.printLines(PipelineCliSupport.dryRunPlan(MODE, config, outputDir));
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      SessionOutcome outcome = root.captureSessionUseCase().run();
      report(outcome);
      return ExitCode.SUCCESS;
    } catch (DeviceUnavailableException ex) {
      log.error("Cannot open device {}: {}", ex.device(), ex.getMessage());
      return ExitCode.DEVICE_UNAVAILABLE;
    } catch (CaptureException ex) {
      log.error("Frame capture failed on device {}", config.device(), ex);
      return ExitCode.IO_ERROR;
    } catch (HaloException ex) {
      log.error("Capture session failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Capture session configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in capture session", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void report(SessionOutcome outcome) {
    if (!outcome.captured() || outcome.result().isEmpty()) {
      CliPrinter.println("Session ended without a capture (" + outcome.state() + ").");
      return;
    }
    SessionResult result = outcome.result().get();
    CliPrinter.printLines(ResultsReport.details(result));
    CliPrinter.println(outcome.savedFile()
        .map(path -> "Saved to " + path)
        .orElse("Result was not saved; see the log for details."));
  }
}
