package ca.gc.cra.halo.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.application.port.FeatureExtractor;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.analysis.Trend;
import ca.gc.cra.halo.domain.error.AnalysisStage;
import ca.gc.cra.halo.domain.error.ExtractionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.fixtures.Engines;
import ca.gc.cra.halo.fixtures.Frames;
import ca.gc.cra.halo.fixtures.ManualClock;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AnalysisEngineTest {
  private final ManualClock clock = new ManualClock(42_000L);

  @Test
  void noRegionMeansNoSnapshot() throws Exception {
    AnalysisEngine engine = Engines.engine(frame -> List.of(), clock);
    assertTrue(engine.analyze(Frames.gray(1)).isEmpty());
  }

  @Test
  void nullDetectionIsTreatedAsEmpty() throws Exception {
    AnalysisEngine engine = Engines.engine(frame -> null, clock);
    assertTrue(engine.analyze(Frames.gray(1)).isEmpty());
  }

  @Test
  void analysesLargestRegionClippedToFrame() throws Exception {
    DetectedRegion small = DetectedRegion.of(0, 0, 10, 10);
    DetectedRegion overflowing = DetectedRegion.of(40, 20, 40, 40);
    AnalysisEngine engine = Engines.engine(frame -> List.of(small, overflowing), clock);

    AnalysisSnapshot snapshot = engine.analyze(Frames.gray(3)).orElseThrow();

    assertEquals(DetectedRegion.of(40, 20, 24, 28), snapshot.region());
    SessionResult result = snapshot.result();
    assertEquals(24d, result.measurements().scalar(MeasurementBundle.GROUP_METRICS, "face_width").getAsDouble());
    assertEquals(3L, result.frameId());
    assertEquals(42_000L, result.timestampMillis());
    assertEquals("session-test", result.sessionId());
    assertEquals(Optional.of(9.0d), result.healthScore());
    assertEquals(HealthStatus.EXCELLENT, result.status());
    assertEquals(List.of("Maintain healthy habits and adequate rest"), result.recommendations());
  }

  @Test
  void trendsAppearOnceEnoughHistoryExists() throws Exception {
    AnalysisEngine engine = Engines.engine(Engines.alwaysFace(), clock);
    AnalysisSnapshot snapshot = null;
    for (int i = 1; i <= 9; i++) {
      snapshot = engine.analyze(Frames.gray(i)).orElseThrow();
    }
    assertTrue(snapshot.trends().isEmpty());

    snapshot = engine.analyze(Frames.gray(10)).orElseThrow();

    assertEquals(Trend.STABLE, snapshot.trends().get(Indicators.FACIAL_SYMMETRY));
    assertEquals(snapshot.trends(), engine.trends());
  }

  @Test
  void extractionFailurePropagatesWithStage() {
    FeatureExtractor failing = (frame, region) -> {
      throw new ExtractionException("region too small");
    };
    AnalysisEngine engine = new AnalysisEngine(
        "s", Engines.alwaysFace(), failing, Engines.symmetryScorer(), clock);

    ExtractionException ex = assertThrows(ExtractionException.class, () -> engine.analyze(Frames.gray(1)));
    assertEquals(AnalysisStage.EXTRACTION, ex.stage());
  }
}
