package ca.gc.cra.halo.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.application.pipeline.AnalysisEngine;
import ca.gc.cra.halo.application.port.RegionDetector;
import ca.gc.cra.halo.application.scoring.HealthScoreCalculator;
import ca.gc.cra.halo.application.scoring.RecommendationRules;
import ca.gc.cra.halo.application.trend.TrendAggregator;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.error.ScoringException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.fixtures.Engines;
import ca.gc.cra.halo.fixtures.Frames;
import ca.gc.cra.halo.fixtures.ManualClock;
import ca.gc.cra.halo.infrastructure.detect.SilhouetteBodyDetector;
import ca.gc.cra.halo.infrastructure.extract.SilhouetteKeypointExtractor;
import ca.gc.cra.halo.infrastructure.score.PostureIndicatorScorer;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CaptureSessionTest {
  private static final Duration COUNTDOWN = Duration.ofSeconds(3);

  private final ManualClock clock = new ManualClock(10_000L);

  @Test
  void startsIdleAndIgnoresFrames() {
    CaptureSession session = new CaptureSession(Engines.engine(Engines.alwaysFace(), clock), COUNTDOWN, clock);

    assertEquals(CaptureSession.State.IDLE, session.onFrame(Frames.gray(1)));
    assertFalse(session.hasCandidate());
    assertEquals(0L, session.remainingSeconds());
  }

  @Test
  void capturesFrameWithLargestFaceNotTheLastOne() {
    RegionDetector detector = bySequence(Map.of(1L, 10, 2L, 40, 3L, 20, 4L, 12));
    CaptureSession session = new CaptureSession(Engines.engine(detector, clock), COUNTDOWN, clock);

    assertTrue(session.trigger());
    assertEquals(3L, session.remainingSeconds());
    for (long seq = 1; seq <= 3; seq++) {
      assertEquals(CaptureSession.State.ARMED, session.onFrame(Frames.gray(seq)));
      clock.advance(1_000);
    }
    assertEquals(CaptureSession.State.CAPTURED, session.onFrame(Frames.gray(4)));

    AnalysisSnapshot snapshot = session.result().orElseThrow();
    assertEquals(2L, snapshot.result().frameId());
    assertEquals(40, snapshot.region().width());
  }

  @Test
  void countdownWithoutFaceReturnsToIdleWithFailure() {
    CaptureSession session =
        new CaptureSession(Engines.engine(frame -> List.of(), clock), COUNTDOWN, clock);
    session.trigger();

    session.onFrame(Frames.gray(1));
    clock.advance(3_000);

    assertEquals(CaptureSession.State.IDLE, session.onFrame(Frames.gray(2)));
    assertTrue(session.result().isEmpty());
    assertEquals(CaptureSession.noRegionFailure("face"), session.lastFailure().orElseThrow());
    assertTrue(session.trigger(), "a failed countdown can be retried");
    assertTrue(session.lastFailure().isEmpty());
  }

  @Test
  void bodyCountdownWithoutSilhouetteNamesTheBody() {
    CaptureSession session =
        new CaptureSession(Engines.engine(frame -> List.of(), clock), CaptureSession.BODY, COUNTDOWN, clock);
    session.trigger();

    session.onFrame(Frames.gray(1));
    clock.advance(3_000);

    assertEquals(CaptureSession.State.IDLE, session.onFrame(Frames.gray(2)));
    assertEquals("Analysis failed: no body detected during countdown", session.lastFailure().orElseThrow());
  }

  @Test
  void bodySessionScoresStandingSilhouette() {
    AnalysisEngine engine = new AnalysisEngine(
        "s",
        new SilhouetteBodyDetector(),
        new SilhouetteKeypointExtractor(),
        new PostureIndicatorScorer(),
        new TrendAggregator(),
        HealthScoreCalculator.body(),
        RecommendationRules.body(),
        clock);
    CaptureSession session = new CaptureSession(engine, CaptureSession.BODY, Duration.ZERO, clock);
    session.trigger();

    assertEquals(CaptureSession.State.CAPTURED, session.onFrame(Frames.standing(1, 20, 10, 24, 70)));

    AnalysisSnapshot snapshot = session.result().orElseThrow();
    SessionResult result = snapshot.result();
    assertEquals(24, snapshot.region().width());
    assertEquals(70, snapshot.region().height());
    assertEquals("Excellent", result.indicators().label(Indicators.POSTURE_QUALITY).orElseThrow());
    assertEquals(10d, result.healthScore().orElseThrow(), 1e-9);
    assertEquals(HealthStatus.EXCELLENT, result.status());
    assertEquals(
        List.of("Regular stretching and full body movement can improve overall body alignment"),
        result.recommendations());
  }

  @Test
  void detectionFailureCountsAsFrameWithoutFace() {
    RegionDetector detector = frame -> {
      if (frame.sequence() == 1) {
        throw new DetectionException("cascade error");
      }
      return List.of(DetectedRegion.of(0, 0, 16, 16));
    };
    CaptureSession session = new CaptureSession(Engines.engine(detector, clock), COUNTDOWN, clock);
    session.trigger();

    session.onFrame(Frames.gray(1));
    assertFalse(session.hasCandidate());
    session.onFrame(Frames.gray(2));
    assertTrue(session.hasCandidate());
    clock.advance(3_000);

    assertEquals(CaptureSession.State.CAPTURED, session.onFrame(Frames.gray(3)));
    assertEquals(2L, session.result().orElseThrow().result().frameId());
  }

  @Test
  void analysisFailureReturnsToIdle() {
    AnalysisEngine engine = new AnalysisEngine(
        "s",
        Engines.alwaysFace(),
        Engines.widthExtractor(),
        measurements -> {
          throw new ScoringException("no usable measurements");
        },
        clock);
    CaptureSession session = new CaptureSession(engine, Duration.ZERO, clock);
    session.trigger();

    assertEquals(CaptureSession.State.IDLE, session.onFrame(Frames.gray(1)));
    assertEquals("Analysis failed: no usable measurements", session.lastFailure().orElseThrow());
  }

  @Test
  void uncheckedExtractorErrorReturnsToIdle() {
    AnalysisEngine engine = new AnalysisEngine(
        "s",
        Engines.alwaysFace(),
        (frame, region) -> {
          throw new IllegalStateException("landmark index out of range");
        },
        Engines.symmetryScorer(),
        clock);
    CaptureSession session = new CaptureSession(engine, Duration.ZERO, clock);
    session.trigger();

    assertEquals(CaptureSession.State.IDLE, session.onFrame(Frames.gray(1)));
    assertTrue(session.result().isEmpty());
    assertEquals("Analysis failed: landmark index out of range", session.lastFailure().orElseThrow());
    assertTrue(session.trigger());
  }

  @Test
  void uncheckedDetectorErrorCountsAsFrameWithoutFace() {
    RegionDetector detector = frame -> {
      if (frame.sequence() == 1) {
        throw new IllegalStateException("native crash");
      }
      return List.of(DetectedRegion.of(0, 0, 24, 24));
    };
    CaptureSession session = new CaptureSession(Engines.engine(detector, clock), COUNTDOWN, clock);
    session.trigger();

    assertEquals(CaptureSession.State.ARMED, session.onFrame(Frames.gray(1)));
    assertFalse(session.hasCandidate());
    assertEquals(CaptureSession.State.ARMED, session.onFrame(Frames.gray(2)));
    clock.advance(3_000);

    assertEquals(CaptureSession.State.CAPTURED, session.onFrame(Frames.gray(3)));
    assertEquals(2L, session.result().orElseThrow().result().frameId());
  }

  @Test
  void zeroCountdownCapturesFirstFrameWithFace() {
    CaptureSession session =
        new CaptureSession(Engines.engine(Engines.alwaysFace(), clock), Duration.ZERO, clock);
    session.trigger();

    assertEquals(CaptureSession.State.CAPTURED, session.onFrame(Frames.gray(7)));
    assertEquals(7L, session.result().orElseThrow().result().frameId());
  }

  @Test
  void triggerOnlyFromIdle() {
    CaptureSession session = new CaptureSession(Engines.engine(Engines.alwaysFace(), clock), COUNTDOWN, clock);

    assertTrue(session.trigger());
    assertFalse(session.trigger());
  }

  @Test
  void quitAbortsAndIsTerminal() {
    CaptureSession session = new CaptureSession(Engines.engine(Engines.alwaysFace(), clock), COUNTDOWN, clock);
    session.trigger();
    session.onFrame(Frames.gray(1));

    session.quit();

    assertEquals(CaptureSession.State.ABORTED, session.state());
    assertFalse(session.trigger());
    clock.advance(5_000);
    assertEquals(CaptureSession.State.ABORTED, session.onFrame(Frames.gray(2)));
    assertTrue(session.result().isEmpty());
  }

  @Test
  void remainingSecondsRoundsUp() {
    CaptureSession session = new CaptureSession(Engines.engine(Engines.alwaysFace(), clock), COUNTDOWN, clock);
    session.trigger();

    clock.advance(1_200);
    assertEquals(2L, session.remainingSeconds());
    clock.advance(1_799);
    assertEquals(1L, session.remainingSeconds());
  }

  private static RegionDetector bySequence(Map<Long, Integer> sides) {
    return frame -> {
      Integer side = sides.get(frame.sequence());
      return side == null ? List.of() : List.of(DetectedRegion.of(0, 0, side, side));
    };
  }
}
