package ca.gc.cra.halo.fixtures;

import ca.gc.cra.halo.application.pipeline.AnalysisEngine;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.FeatureExtractor;
import ca.gc.cra.halo.application.port.IndicatorScorer;
import ca.gc.cra.halo.application.port.RegionDetector;
import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import java.util.List;

/** Analysis engines wired with deterministic stages. */
public final class Engines {
  public static final DetectedRegion FACE = DetectedRegion.of(8, 8, 32, 32);

  private Engines() {}

  public static RegionDetector alwaysFace() {
    return frame -> List.of(FACE);
  }

  public static FeatureExtractor widthExtractor() {
    return (frame, region) -> MeasurementBundle.builder()
        .put(MeasurementBundle.GROUP_METRICS, "face_width", region.width())
        .put(MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity", 0.9d)
        .build();
  }

  public static IndicatorScorer symmetryScorer() {
    return measurements -> IndicatorSet.builder()
        .score(
            Indicators.FACIAL_SYMMETRY,
            measurements.scalar(MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity").orElse(0d))
        .build();
  }

  public static AnalysisEngine engine(RegionDetector detector, ClockPort clock) {
    return new AnalysisEngine("session-test", detector, widthExtractor(), symmetryScorer(), clock);
  }
}
