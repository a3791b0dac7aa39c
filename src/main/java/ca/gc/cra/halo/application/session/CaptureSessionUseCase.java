package ca.gc.cra.halo.application.session;

import ca.gc.cra.halo.application.persistence.PersistenceFlusher;
import ca.gc.cra.halo.application.persistence.PersistenceQueue;
import ca.gc.cra.halo.application.pipeline.AnalysisEngine;
import ca.gc.cra.halo.application.port.CaptureSource;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.DisplaySurface;
import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.application.port.Overlay;
import ca.gc.cra.halo.application.port.StorageBackend;
import ca.gc.cra.halo.application.port.UserCommand;
import ca.gc.cra.halo.domain.error.HaloException;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Interactive single-shot assessment driven by {@link CaptureSession}s.
 *
 * <p>Runs entirely on the calling thread: reads frames, shows them with instructions or the
 * countdown, maps the capture key to {@link CaptureSession#trigger()} and quit to
 * {@link CaptureSession#quit()}. When a result is captured it is queued once and flushed
 * immediately.
 *
 * <p>In {@link SessionMode#COMPLETE} a body countdown follows the face countdown on the same device.
 * Quit skips the current part; closing the window ends both. The captured parts are saved as one
 * {@link CompleteAssessment}.
 *
 * @since 0.1.0
 */
public final class CaptureSessionUseCase {
  private static final Logger log = LoggerFactory.getLogger(CaptureSessionUseCase.class);
  static final String INSTRUCTIONS = "Press SPACE to capture, Q to quit";
  static final String SKIP_INSTRUCTIONS = "Press SPACE to capture, Q to skip";
  static final String BODY_INSTRUCTIONS = "Stand back so your full body is visible";

  private final CaptureSource captureSource;
  private final DisplaySurface display;
  private final AnalysisEngine engine;
  private final AnalysisEngine bodyEngine;
  private final StorageBackend storage;
  private final SessionSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public CaptureSessionUseCase(
      CaptureSource captureSource,
      DisplaySurface display,
      AnalysisEngine engine,
      StorageBackend storage,
      SessionSettings settings,
      MetricsPort metrics,
      ClockPort clock) {
    this(captureSource, display, engine, null, storage, settings, metrics, clock);
  }

  /**
   * @param bodyEngine analysis of the body countdown; required in {@link SessionMode#COMPLETE}
   */
  public CaptureSessionUseCase(
      CaptureSource captureSource,
      DisplaySurface display,
      AnalysisEngine engine,
      AnalysisEngine bodyEngine,
      StorageBackend storage,
      SessionSettings settings,
      MetricsPort metrics,
      ClockPort clock) {
    this.captureSource = Objects.requireNonNull(captureSource, "captureSource");
    this.display = Objects.requireNonNull(display, "display");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (settings.mode() == SessionMode.COMPLETE && bodyEngine == null) {
      throw new IllegalArgumentException("complete sessions need a body engine");
    }
    this.bodyEngine = bodyEngine;
  }

  /**
   * Runs the session until a result is captured or the user quits.
   *
   * @return terminal outcome
   * @throws HaloException when the device cannot be opened or a frame read fails
   */
  public SessionOutcome run() throws HaloException {
    MDC.put("pipeline", "session");
    PersistenceQueue queue = new PersistenceQueue(metrics);
    PersistenceFlusher flusher = new PersistenceFlusher(
        queue, storage, settings.flush(), clock, metrics, new AtomicBoolean(false));
    try {
      captureSource.open(settings.device());
      log.info("Capture session started on {} ({}) in {} mode",
          settings.device(), captureSource.backendName(), settings.mode());
      boolean complete = settings.mode() == SessionMode.COMPLETE;
      CaptureSession face = new CaptureSession(engine, CaptureSession.FACE, settings.countdown(), clock);
      runPhase(face, complete);
      Optional<SessionResult> faceResult = face.result().map(AnalysisSnapshot::result);
      if (!complete) {
        return finish(face.state(), faceResult, queue, flusher);
      }

      CaptureSession body = new CaptureSession(bodyEngine, CaptureSession.BODY, settings.countdown(), clock);
      runPhase(body, true);
      Optional<SessionResult> combined =
          CompleteAssessment.combine(faceResult, body.result().map(AnalysisSnapshot::result));
      log.info("Complete session finished: face {}, body {}", face.state(), body.state());
      CaptureSession.State state =
          combined.isPresent() ? CaptureSession.State.CAPTURED : CaptureSession.State.ABORTED;
      return finish(state, combined, queue, flusher);
    } finally {
      closeQuietly();
      MDC.remove("pipeline");
    }
  }

  /** Feeds frames to {@code session} until it reaches a terminal state or the window closes. */
  private void runPhase(CaptureSession session, boolean complete) throws HaloException {
    while (!session.state().isTerminal()) {
      if (!display.isOpen()) {
        session.quit();
        break;
      }
      Frame frame = captureSource.readFrame();
      metrics.increment("halo.capture.frames");
      if (settings.autoTrigger() && session.state() == CaptureSession.State.IDLE
          && session.lastFailure().isEmpty()) {
        session.trigger();
      }
      session.onFrame(frame);
      display.show(frame, Overlay.text(statusLines(session, complete)));
      handleKeys(session);
    }
  }

  private SessionOutcome finish(
      CaptureSession.State state,
      Optional<SessionResult> captured,
      PersistenceQueue queue,
      PersistenceFlusher flusher) {
    if (state != CaptureSession.State.CAPTURED || captured.isEmpty()) {
      return new SessionOutcome(state, Optional.empty(), Optional.empty());
    }
    SessionResult result = captured.get();
    queue.enqueue(result);
    Optional<Path> saved = flusher.flushRemaining();
    if (saved.isEmpty()) {
      log.error("Captured result could not be saved to {}", settings.flush().outputDirectory());
    }
    return new SessionOutcome(state, Optional.of(result), saved);
  }

  private void handleKeys(CaptureSession session) {
    Optional<UserCommand> command;
    while ((command = display.pollKey()).isPresent()) {
      switch (command.get()) {
        case QUIT -> session.quit();
        case CAPTURE -> session.trigger();
        default -> log.debug("Ignoring command {} during capture session", command.get());
      }
    }
  }

  static List<String> statusLines(CaptureSession session, boolean complete) {
    List<String> lines = new ArrayList<>();
    boolean body = CaptureSession.BODY.equals(session.subject());
    if (complete) {
      lines.add(body ? "Body analysis" : "Facial analysis");
    }
    switch (session.state()) {
      case IDLE -> {
        session.lastFailure().ifPresent(lines::add);
        if (body) {
          lines.add(BODY_INSTRUCTIONS);
        }
        lines.add(complete ? SKIP_INSTRUCTIONS : INSTRUCTIONS);
      }
      case ARMED -> {
        lines.add("Capturing in " + session.remainingSeconds() + "...");
        lines.add(session.hasCandidate()
            ? (body ? "Body" : "Face") + " detected - hold still"
            : "Looking for a " + session.subject());
      }
      case CAPTURED -> lines.add("Captured");
      case ABORTED -> lines.add(complete ? "Skipped" : "Cancelled");
      default -> throw new IllegalStateException("Unexpected state " + session.state());
    }
    return lines;
  }

  private void closeQuietly() {
    try {
      captureSource.close();
    } catch (RuntimeException ex) {
      log.error("Failed to release capture device", ex);
    }
    try {
      display.close();
    } catch (RuntimeException ex) {
      log.error("Failed to close display", ex);
    }
    try {
      storage.close();
    } catch (Exception ex) {
      log.error("Failed to close storage backend", ex);
    }
  }
}
