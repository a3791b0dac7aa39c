package ca.gc.cra.halo.api;

import ca.gc.cra.halo.api.PipelineCliSupport.CliAbort;
import ca.gc.cra.halo.application.pipeline.LiveAnalysisUseCase;
import ca.gc.cra.halo.application.pipeline.LiveRunSummary;
import ca.gc.cra.halo.config.CompositionRoot;
import ca.gc.cra.halo.config.PipelineConfig;
import ca.gc.cra.halo.domain.error.CaptureException;
import ca.gc.cra.halo.domain.error.DeviceUnavailableException;
import ca.gc.cra.halo.domain.error.HaloException;
import ca.gc.cra.halo.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the continuous camera analysis pipeline until the user quits.
 *
 * @since 0.1.0
 */
public final class LiveCli {
  private static final Logger log = LoggerFactory.getLogger(LiveCli.class);
  private static final String MODE = "live";
  private static final String SUMMARY_USAGE =
      "usage: halo live [device=INDEX|PATH] [out=DIR] [format=json|csv|xlsx] [flushIntervalSec=1-3600] "
          + "[frameSkip=1-120] [overlay=true|false] [gpu=true|false] [cascade=PATH] [display=auto|canvas|headless] "
          + "[config=FILE] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      HALO live facial analysis

      Usage:
        halo live [options]

      Options:
        device=INDEX|PATH         Camera index (default 0) or path to a video file
        out=DIR                   Result directory (default ~/.halo/out)
        format=json|csv|xlsx      Result file format (default json)
        filePrefix=NAME           Result file prefix (default facial_analysis)
        flushIntervalSec=1-3600   Seconds between periodic saves (default 10)
        frameSkip=1-120           Display every n-th frame (default 1)
        overlay=true|false        Start with the overlay visible (default true)
        gpu=true|false            Use OpenCL when available (default false)
        cascade=PATH              Haar cascade XML (default ~/.halo/models/haarcascade_frontalface_default.xml)
        minFaceSize=16-2000       Smallest face side in pixels (default 80)
        display=auto|canvas|headless  Window or console (default auto)
        idleSleepMs=1-1000        Analysis back-off when no new frame is ready (default 10)
        shutdownTimeoutMs=N       Wait for background workers at exit (default 5000)
        config=FILE               YAML file with common/live sections
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                 Validate inputs and print the plan
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Keys: q quits, space saves pending results now, o toggles the overlay.
      """;

  private LiveCli() {}

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
      log.debug("Verbose logging enabled for live CLI");
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
      return execute(root.liveAnalysisUseCase(), config);
    } catch (IllegalArgumentException ex) {
      log.error("Live pipeline configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in live pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode execute(LiveAnalysisUseCase useCase, PipelineConfig config) {
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      useCase.stop();
      try {
        if (!finished.await(config.shutdownTimeout().toMillis() * 2, TimeUnit.MILLISECONDS)) {
          log.warn("Live pipeline did not stop within the shutdown timeout");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "halo-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      log.info("Starting live analysis on device {}", config.device());
      LiveRunSummary summary = useCase.run();
      log.info(
          "Live analysis finished: {} frames captured, {} dropped, {} results unsaved, last file {}",
          summary.framesCaptured(),
          summary.framesDropped(),
          summary.resultsUnsaved(),
          summary.lastSavedFile().map(Path::toString).orElse("<none>"));
      return ExitCode.SUCCESS;
    } catch (DeviceUnavailableException ex) {
      log.error("Cannot open device {}: {}", ex.device(), ex.getMessage());
      return ExitCode.DEVICE_UNAVAILABLE;
    } catch (CaptureException ex) {
      log.error("Frame capture failed on device {}", config.device(), ex);
      return ExitCode.IO_ERROR;
    } catch (HaloException ex) {
      log.error("Live analysis failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Live analysis interrupted on device {}", config.device(), ex);
      return ExitCode.INTERRUPTED;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException shuttingDown) {
      log.debug("JVM is shutting down; shutdown hook stays registered");
    }
  }
}
