package ca.gc.cra.halo.application.session;

import ca.gc.cra.halo.application.pipeline.AnalysisEngine;
import ca.gc.cra.halo.application.pipeline.PrimaryRegionSelector;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.domain.error.AnalysisException;
import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Countdown capture state machine for single-shot assessments.
 *
 * <pre>
 *   IDLE  --trigger-------------------------&gt; ARMED
 *   ARMED --countdown elapsed, best frame---&gt; CAPTURED (result available)
 *   ARMED --countdown elapsed, no region----&gt; IDLE     (failure reported)
 *   IDLE/ARMED --quit-----------------------&gt; ABORTED
 * </pre>
 *
 * <p>While armed every frame is run through detection and the frame whose primary region has the
 * largest area is kept. When the countdown elapses that frame, not the last one, is analysed. A
 * detection failure while armed, checked or not, counts as a frame without a region; a failure of
 * the final analysis returns to IDLE with the reason kept in {@link #lastFailure()}.
 *
 * <p>Not thread-safe; driven from the foreground loop.
 *
 * @since 0.1.0
 */
public final class CaptureSession {
  private static final Logger log = LoggerFactory.getLogger(CaptureSession.class);

  public static final String FACE = "face";
  public static final String BODY = "body";

  /** Session states. {@link #CAPTURED} and {@link #ABORTED} are terminal. */
  public enum State {
    IDLE,
    ARMED,
    CAPTURED,
    ABORTED;

    public boolean isTerminal() {
      return this == CAPTURED || this == ABORTED;
    }
  }

  /** Frame kept during the countdown together with its primary region. */
  record Candidate(Frame frame, DetectedRegion region) {}

  private final AnalysisEngine engine;
  private final String subject;
  private final Duration countdown;
  private final ClockPort clock;
  private final BestFrameReducer<Candidate> reducer =
      new BestFrameReducer<>(Comparator.comparingLong((Candidate c) -> c.region().area()));

  private State state = State.IDLE;
  private long armedAtMillis;
  private AnalysisSnapshot result;
  private String lastFailure;

  public CaptureSession(AnalysisEngine engine, Duration countdown, ClockPort clock) {
    this(engine, FACE, countdown, clock);
  }

  /**
   * @param engine analysis for the captured frame
   * @param subject what the detector looks for, used in status and failure messages
   * @param countdown delay between trigger and capture
   * @param clock time source for the countdown
   */
  public CaptureSession(AnalysisEngine engine, String subject, Duration countdown, ClockPort clock) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.subject = Objects.requireNonNull(subject, "subject");
    this.countdown = Objects.requireNonNull(countdown, "countdown");
    if (countdown.isNegative()) {
      throw new IllegalArgumentException("countdown must not be negative");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Starts the countdown.
   *
   * @return {@code true} when the session moved from IDLE to ARMED
   */
  public boolean trigger() {
    if (state != State.IDLE) {
      return false;
    }
    state = State.ARMED;
    armedAtMillis = clock.nowMillis();
    lastFailure = null;
    reducer.reset();
    log.info("Capture armed; countdown {} ms", countdown.toMillis());
    return true;
  }

  /** Aborts the session from any non-terminal state. */
  public void quit() {
    if (!state.isTerminal()) {
      log.info("Capture session aborted in state {}", state);
      state = State.ABORTED;
      reducer.reset();
    }
  }

  /**
   * Feeds the next frame.
   *
   * <p>In ARMED the frame is ranked as a candidate first, then the countdown is checked. The frame
   * that reaches the deadline therefore still competes; once the countdown has elapsed the retained
   * best frame is analysed.
   *
   * @return state after the frame
   */
  public State onFrame(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    if (state != State.ARMED) {
      return state;
    }
    try {
      Optional<DetectedRegion> primary = PrimaryRegionSelector.select(engine.detect(frame));
      if (primary.isPresent() && reducer.offer(new Candidate(frame, primary.get()))) {
        log.debug("New best frame {} with region area {}", frame.sequence(), primary.get().area());
      }
    } catch (DetectionException ex) {
      log.warn("Detection failed on frame {} during countdown", frame.sequence(), ex);
    } catch (RuntimeException ex) {
      log.warn("Detector error on frame {} during countdown", frame.sequence(), ex);
    }
    // The frame that reaches the deadline is still a candidate.
    if (countdownElapsed()) {
      complete();
    }
    return state;
  }

  /** Whole seconds left on the countdown, rounded up; zero unless ARMED. */
  public long remainingSeconds() {
    if (state != State.ARMED) {
      return 0;
    }
    long remaining = countdown.toMillis() - (clock.nowMillis() - armedAtMillis);
    return remaining <= 0 ? 0 : (remaining + 999) / 1000;
  }

  public State state() {
    return state;
  }

  public String subject() {
    return subject;
  }

  /** Result of the capture once CAPTURED. */
  public Optional<AnalysisSnapshot> result() {
    return Optional.ofNullable(result);
  }

  /** Reason the last countdown returned to IDLE, if it did. */
  public Optional<String> lastFailure() {
    return Optional.ofNullable(lastFailure);
  }

  /** Whether a candidate frame with a region has been retained in the current countdown. */
  public boolean hasCandidate() {
    return reducer.best().isPresent();
  }

  static String noRegionFailure(String subject) {
    return "Analysis failed: no " + subject + " detected during countdown";
  }

  private boolean countdownElapsed() {
    return clock.nowMillis() - armedAtMillis >= countdown.toMillis();
  }

  private void complete() {
    Optional<Candidate> best = reducer.best();
    reducer.reset();
    if (best.isEmpty()) {
      state = State.IDLE;
      lastFailure = noRegionFailure(subject);
      log.warn("Countdown elapsed without a detected {}; back to idle", subject);
      return;
    }
    try {
      result = engine.analyzeRegion(best.get().frame(), best.get().region());
      state = State.CAPTURED;
      log.info("Captured frame {} with status {}", best.get().frame().sequence(), result.result().status());
    } catch (AnalysisException ex) {
      state = State.IDLE;
      lastFailure = "Analysis failed: " + ex.getMessage();
      log.warn("Analysis of best frame failed at {}; back to idle", ex.stage(), ex);
    } catch (RuntimeException ex) {
      state = State.IDLE;
      lastFailure = "Analysis failed: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
      log.warn("Unexpected error analysing best frame; back to idle", ex);
    }
  }
}
