package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.application.port.CaptureSource;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.DisplaySurface;
import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.application.port.UserCommand;
import ca.gc.cra.halo.domain.error.CaptureException;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Foreground loop owning the display.
 *
 * <p>Every cycle reads one frame from the capture source and publishes it to the frame slot. Only
 * every {@code frameSkip}-th frame is drawn, with the latest analysis snapshot and performance
 * counters on top; the snapshot may be a few cycles old. Keys are polled every cycle: quit clears the
 * shared running flag, capture invokes the capture callback, overlay toggles the detail lines.
 *
 * <p>A capture failure clears the running flag and is rethrown, ending the run.
 *
 * @since 0.1.0
 */
public final class RenderLoop {
  private static final Logger log = LoggerFactory.getLogger(RenderLoop.class);

  private final CaptureSource source;
  private final DisplaySurface display;
  private final LatestSlot<Frame> frames;
  private final LatestSlot<AnalysisSnapshot> results;
  private final AtomicBoolean running;
  private final FpsMeter analysisFps;
  private final Runnable onCapture;
  private final RenderSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final FpsMeter captureFps = new FpsMeter();

  private boolean overlayEnabled;
  private long frameCount;

  public RenderLoop(
      CaptureSource source,
      DisplaySurface display,
      LatestSlot<Frame> frames,
      LatestSlot<AnalysisSnapshot> results,
      AtomicBoolean running,
      FpsMeter analysisFps,
      Runnable onCapture,
      RenderSettings settings,
      MetricsPort metrics,
      ClockPort clock) {
    this.source = Objects.requireNonNull(source, "source");
    this.display = Objects.requireNonNull(display, "display");
    this.frames = Objects.requireNonNull(frames, "frames");
    this.results = Objects.requireNonNull(results, "results");
    this.running = Objects.requireNonNull(running, "running");
    this.analysisFps = Objects.requireNonNull(analysisFps, "analysisFps");
    this.onCapture = Objects.requireNonNull(onCapture, "onCapture");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.overlayEnabled = settings.overlayEnabled();
  }

  /**
   * Runs until quit, window close or capture failure.
   *
   * @return number of frames read
   * @throws CaptureException when the capture source fails
   */
  public long run() throws CaptureException {
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        if (!display.isOpen()) {
          log.info("Display closed; stopping pipeline");
          running.set(false);
          break;
        }
        cycle();
      }
    } catch (CaptureException ex) {
      running.set(false);
      log.error("Capture failed after {} frames", frameCount, ex);
      throw ex;
    }
    return frameCount;
  }

  /** Runs one read/publish/render/poll cycle. */
  void cycle() throws CaptureException {
    Frame frame = source.readFrame();
    frameCount++;
    metrics.increment("halo.capture.frames");
    captureFps.tick(clock.nowMillis());
    if (frames.publish(frame)) {
      metrics.increment("halo.slot.frames.dropped");
    }

    if (frameCount % settings.frameSkip() == 0) {
      Optional<AnalysisSnapshot> snapshot = results.takeLatest();
      display.show(frame, OverlayFormatter.format(
          captureFps.fps(),
          analysisFps.fps(),
          source.backendName(),
          settings.accelerationLabel(),
          snapshot,
          overlayEnabled));
    }
    pollKeys();
  }

  boolean overlayEnabled() {
    return overlayEnabled;
  }

  double captureFps() {
    return captureFps.fps();
  }

  private void pollKeys() {
    Optional<UserCommand> command;
    while ((command = display.pollKey()).isPresent()) {
      switch (command.get()) {
        case QUIT -> {
          log.info("Quit requested after {} frames", frameCount);
          running.set(false);
          return;
        }
        case CAPTURE -> onCapture.run();
        case TOGGLE_OVERLAY -> {
          overlayEnabled = !overlayEnabled;
          log.debug("Overlay {}", overlayEnabled ? "enabled" : "disabled");
        }
        default -> log.debug("Ignoring command {}", command.get());
      }
    }
  }
}
