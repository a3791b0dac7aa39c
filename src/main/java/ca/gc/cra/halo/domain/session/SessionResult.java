package ca.gc.cra.halo.domain.session;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one full analysis cycle, published to the overlay and queued for storage.
 *
 * @param timestampMillis analysis completion time in epoch milliseconds
 * @param frameId capture sequence of the analysed frame
 * @param sessionId identifier of the pipeline run that produced the result
 * @param measurements extracted measurements, possibly partial
 * @param indicators scored indicators
 * @param healthScore weighted aggregate score rounded to one decimal; empty when no weighted
 *     indicator was present
 * @param status band derived from {@code healthScore}
 * @param recommendations ordered advice strings; never empty
 * @since 0.1.0
 */
public record SessionResult(
    long timestampMillis,
    long frameId,
    String sessionId,
    MeasurementBundle measurements,
    IndicatorSet indicators,
    Optional<Double> healthScore,
    HealthStatus status,
    List<String> recommendations) {

  public SessionResult {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(measurements, "measurements");
    Objects.requireNonNull(indicators, "indicators");
    Objects.requireNonNull(healthScore, "healthScore");
    Objects.requireNonNull(status, "status");
    recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations"));
    if (healthScore.isEmpty() != (status == HealthStatus.INSUFFICIENT_DATA)) {
      throw new IllegalArgumentException("status must be INSUFFICIENT_DATA exactly when no score exists");
    }
  }
}
