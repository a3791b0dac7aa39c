package ca.gc.cra.halo.config;

import ca.gc.cra.halo.application.pipeline.AnalysisEngine;
import ca.gc.cra.halo.application.pipeline.LiveAnalysisUseCase;
import ca.gc.cra.halo.application.pipeline.LiveSettings;
import ca.gc.cra.halo.application.pipeline.RenderSettings;
import ca.gc.cra.halo.application.persistence.FlushSettings;
import ca.gc.cra.halo.application.port.CaptureSource;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.DisplaySurface;
import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.application.port.StorageBackend;
import ca.gc.cra.halo.application.scoring.HealthScoreCalculator;
import ca.gc.cra.halo.application.scoring.RecommendationRules;
import ca.gc.cra.halo.application.session.CaptureSessionUseCase;
import ca.gc.cra.halo.application.session.SessionMode;
import ca.gc.cra.halo.application.session.SessionSettings;
import ca.gc.cra.halo.application.trend.TrendAggregator;
import ca.gc.cra.halo.infrastructure.capture.OpenCvAcceleration;
import ca.gc.cra.halo.infrastructure.capture.OpenCvCaptureSource;
import ca.gc.cra.halo.infrastructure.detect.HaarCascadeRegionDetector;
import ca.gc.cra.halo.infrastructure.detect.SilhouetteBodyDetector;
import ca.gc.cra.halo.infrastructure.display.CanvasDisplaySurface;
import ca.gc.cra.halo.infrastructure.display.HeadlessDisplaySurface;
import ca.gc.cra.halo.infrastructure.extract.GeometryFeatureExtractor;
import ca.gc.cra.halo.infrastructure.extract.SilhouetteKeypointExtractor;
import ca.gc.cra.halo.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.halo.infrastructure.score.HeuristicIndicatorScorer;
import ca.gc.cra.halo.infrastructure.score.PostureIndicatorScorer;
import ca.gc.cra.halo.infrastructure.storage.FileStorageBackend;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires HALO use cases to their OpenCV, display, storage and metrics adapters.
 * <p><strong>Why:</strong> Keeps adapter choice in one place so the CLIs only translate arguments and map
 * exit codes.</p>
 * <p><strong>Role:</strong> Composition root for the {@code live}, {@code session} and {@code view}
 * commands.</p>
 * <p><strong>Thread-safety:</strong> Build use cases on the CLI thread; the root is not synchronized.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and closes it, flushing pending exports,
 * in {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final String WINDOW_TITLE = "HALO facial analysis";
  private static final long FLUSH_POLL_MILLIS = 100L;

  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Deque<AutoCloseable> owned = new ArrayDeque<>();

  /**
   * Creates a root with an OpenTelemetry metrics adapter configured from system properties.
   *
   * @param config effective configuration
   */
  public CompositionRoot(PipelineConfig config) {
    this(config, null, ClockPort.SYSTEM);
  }

  /**
   * Creates a root with explicit metrics and clock, mainly for tests.
   *
   * @param config effective configuration
   * @param metrics metrics port; {@code null} builds an OpenTelemetry adapter owned by this root
   * @param clock wall clock
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (metrics == null) {
      OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter();
      owned.push(adapter);
      this.metrics = adapter;
    } else {
      this.metrics = metrics;
    }
  }

  /** Builds the continuous live pipeline. */
  public LiveAnalysisUseCase liveAnalysisUseCase() {
    String accelerationLabel = OpenCvAcceleration.configure(config.gpuAcceleration());
    LiveSettings settings = new LiveSettings(
        config.device(),
        new RenderSettings(config.frameSkip(), config.overlayEnabled(), accelerationLabel),
        flushSettings(),
        config.idleSleepMillis(),
        config.shutdownTimeout());
    return new LiveAnalysisUseCase(
        captureSource(), display(), analysisEngine(UUID.randomUUID().toString()), storageBackend(), settings,
        metrics, clock);
  }

  /** Builds the single-shot countdown capture session, with a body countdown in complete mode. */
  public CaptureSessionUseCase captureSessionUseCase() {
    OpenCvAcceleration.configure(config.gpuAcceleration());
    SessionSettings settings = new SessionSettings(
        config.device(), config.countdown(), flushSettings(), config.autoTrigger(), config.analysis());
    String sessionId = UUID.randomUUID().toString();
    AnalysisEngine bodyEngine =
        config.analysis() == SessionMode.COMPLETE ? bodyAnalysisEngine(sessionId) : null;
    return new CaptureSessionUseCase(
        captureSource(), display(), analysisEngine(sessionId), bodyEngine, storageBackend(), settings, metrics, clock);
  }

  /** Storage adapter shared by the pipelines and the {@code view} command. */
  public StorageBackend storageBackend() {
    return new FileStorageBackend();
  }

  /** Face detection, extraction and scoring for one pipeline run. */
  AnalysisEngine analysisEngine(String sessionId) {
    HaarCascadeRegionDetector detector =
        new HaarCascadeRegionDetector(config.cascadePath(), config.minFaceSize());
    owned.push(detector);
    log.debug("Analysis session {} uses cascade {}", sessionId, config.cascadePath());
    return new AnalysisEngine(
        sessionId, detector, new GeometryFeatureExtractor(), new HeuristicIndicatorScorer(), clock);
  }

  /** Silhouette keypoints and posture scoring for the body part of a complete session. */
  AnalysisEngine bodyAnalysisEngine(String sessionId) {
    return new AnalysisEngine(
        sessionId,
        new SilhouetteBodyDetector(),
        new SilhouetteKeypointExtractor(),
        new PostureIndicatorScorer(),
        new TrendAggregator(),
        HealthScoreCalculator.body(),
        RecommendationRules.body(),
        clock);
  }

  FlushSettings flushSettings() {
    return new FlushSettings(
        config.outputDirectory(),
        config.filePrefix(),
        config.outputFormat(),
        config.flushInterval(),
        FLUSH_POLL_MILLIS);
  }

  private CaptureSource captureSource() {
    return new OpenCvCaptureSource(clock);
  }

  private DisplaySurface display() {
    return switch (config.display()) {
      case CANVAS -> new CanvasDisplaySurface(WINDOW_TITLE);
      case HEADLESS -> {
        log.info("Running headless; type q to quit, c (or Enter) to capture, o to toggle the overlay");
        yield new HeadlessDisplaySurface(System.in);
      }
    };
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public PipelineConfig config() {
    return config;
  }

  /** Releases the detector and the owned metrics adapter, most recent first. */
  @Override
  public void close() {
    while (!owned.isEmpty()) {
      AutoCloseable resource = owned.pop();
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
      }
    }
  }
}
