package ca.gc.cra.halo.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.fixtures.Results;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CompleteAssessmentTest {

  @Test
  void bothPartsAreWeightedAndMerged() {
    SessionResult face = Results.result(3, Optional.of(8d));
    SessionResult body = bodyResult(9, Optional.of(6d));

    SessionResult combined = CompleteAssessment.combine(Optional.of(face), Optional.of(body)).orElseThrow();

    assertEquals(7.2d, combined.healthScore().orElseThrow(), 1e-9);
    assertEquals(HealthStatus.GOOD, combined.status());
    assertEquals(3L, combined.frameId());
    assertEquals(body.timestampMillis(), combined.timestampMillis());
    assertEquals(8d, combined.indicators().score(Indicators.FACE_HEALTH_SCORE).getAsDouble(), 1e-9);
    assertEquals(6d, combined.indicators().score(Indicators.BODY_HEALTH_SCORE).getAsDouble(), 1e-9);
    assertEquals(0.82d, combined.indicators().score(Indicators.FACIAL_SYMMETRY).getAsDouble(), 1e-9);
    assertEquals("Fair", combined.indicators().label(Indicators.POSTURE_QUALITY).orElseThrow());
    assertEquals(List.of("Lighting was uneven", "Limited body analysis data available."),
        combined.indicators().notes());
    assertEquals(180d, combined.measurements().scalar(MeasurementBundle.GROUP_METRICS, "face_width").getAsDouble());
    assertEquals(70d, combined.measurements().scalar(MeasurementBundle.GROUP_BODY, "height_pixels").getAsDouble());
    assertEquals(
        List.of("Maintain healthy habits and adequate rest", "Consider posture improvement exercises"),
        combined.recommendations());
  }

  @Test
  void singlePartKeepsItsOwnScore() {
    SessionResult body = bodyResult(4, Optional.of(6.5d));

    SessionResult combined = CompleteAssessment.combine(Optional.empty(), Optional.of(body)).orElseThrow();

    assertEquals(6.5d, combined.healthScore().orElseThrow(), 1e-9);
    assertEquals(HealthStatus.FAIR, combined.status());
    assertTrue(combined.indicators().get(Indicators.FACE_HEALTH_SCORE).isEmpty());
    assertEquals(6.5d, combined.indicators().score(Indicators.BODY_HEALTH_SCORE).getAsDouble(), 1e-9);
  }

  @Test
  void unscoredPartsAreInsufficientData() {
    SessionResult face = Results.result(1, Optional.empty());
    SessionResult body = bodyResult(2, Optional.empty());

    SessionResult combined = CompleteAssessment.combine(Optional.of(face), Optional.of(body)).orElseThrow();

    assertTrue(combined.healthScore().isEmpty());
    assertEquals(HealthStatus.INSUFFICIENT_DATA, combined.status());
  }

  @Test
  void nothingCapturedHasNoResult() {
    assertTrue(CompleteAssessment.combine(Optional.empty(), Optional.empty()).isEmpty());
  }

  @Test
  void overallScoreRoundsToOneDecimal() {
    assertEquals(7.3d, CompleteAssessment.overallScore(Optional.of(7.7d), Optional.of(6.7d)).orElseThrow(), 1e-9);
    assertEquals(5d, CompleteAssessment.overallScore(Optional.of(5d), Optional.empty()).orElseThrow(), 1e-9);
  }

  private static SessionResult bodyResult(long frameId, Optional<Double> score) {
    HealthStatus status = score.map(HealthStatus::fromScore).orElse(HealthStatus.INSUFFICIENT_DATA);
    return new SessionResult(
        1_700_000_000_000L + frameId * 1_000L,
        frameId,
        "session-1",
        MeasurementBundle.builder().put(MeasurementBundle.GROUP_BODY, "height_pixels", 70d).build(),
        IndicatorSet.builder()
            .label(Indicators.POSTURE_QUALITY, "Fair")
            .addNote("Limited body analysis data available.")
            .build(),
        score,
        status,
        List.of("Consider posture improvement exercises", "Maintain healthy habits and adequate rest"));
  }
}
