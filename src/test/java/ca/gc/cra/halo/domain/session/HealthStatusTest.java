package ca.gc.cra.halo.domain.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HealthStatusTest {

  @Test
  void bandsUseInclusiveLowerBounds() {
    assertEquals(HealthStatus.EXCELLENT, HealthStatus.fromScore(8.5d));
    assertEquals(HealthStatus.GOOD, HealthStatus.fromScore(8.49d));
    assertEquals(HealthStatus.GOOD, HealthStatus.fromScore(7.0d));
    assertEquals(HealthStatus.FAIR, HealthStatus.fromScore(5.5d));
    assertEquals(HealthStatus.CONCERNING, HealthStatus.fromScore(4.0d));
    assertEquals(HealthStatus.POOR, HealthStatus.fromScore(3.99d));
    assertEquals(HealthStatus.POOR, HealthStatus.fromScore(0d));
  }

  @Test
  void resultRequiresInsufficientDataExactlyWhenScoreMissing() {
    assertThrows(IllegalArgumentException.class, () -> result(Optional.empty(), HealthStatus.POOR));
    assertThrows(
        IllegalArgumentException.class, () -> result(Optional.of(5d), HealthStatus.INSUFFICIENT_DATA));
    assertEquals(HealthStatus.INSUFFICIENT_DATA, result(Optional.empty(), HealthStatus.INSUFFICIENT_DATA).status());
  }

  private static SessionResult result(Optional<Double> score, HealthStatus status) {
    return new SessionResult(
        0L, 1L, "s", MeasurementBundle.empty(), IndicatorSet.empty(), score, status, List.of());
  }
}
