package ca.gc.cra.halo.application.session;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Combines the face and body results of a complete session into one result.
 *
 * <p>Measurement groups, indicators and notes of both parts are kept side by side, face first. The
 * part scores are kept as {@code face_health_score} and {@code body_health_score}. With both scores
 * the overall score is {@value #FACE_WEIGHT} face plus {@value #BODY_WEIGHT} body, rounded to one
 * decimal; with one it is that score. Recommendations are merged in order without duplicates.
 *
 * @since 0.1.0
 */
public final class CompleteAssessment {
  static final double FACE_WEIGHT = 0.6d;
  static final double BODY_WEIGHT = 0.4d;

  private CompleteAssessment() {}

  /**
   * @param face face result, if the face countdown captured one
   * @param body body result, if the body countdown captured one
   * @return combined result, or empty when neither part was captured
   */
  public static Optional<SessionResult> combine(Optional<SessionResult> face, Optional<SessionResult> body) {
    if (face.isEmpty() && body.isEmpty()) {
      return Optional.empty();
    }
    List<SessionResult> parts = new ArrayList<>(2);
    face.ifPresent(parts::add);
    body.ifPresent(parts::add);
    SessionResult first = parts.get(0);

    MeasurementBundle.Builder measurements = MeasurementBundle.builder();
    IndicatorSet.Builder indicators = IndicatorSet.builder();
    Set<String> recommendations = new LinkedHashSet<>();
    long timestamp = first.timestampMillis();
    for (SessionResult part : parts) {
      part.measurements().groups().forEach((group, values) ->
          values.forEach((name, value) -> measurements.put(group, name, value)));
      part.indicators().values().forEach(indicators::put);
      part.indicators().notes().forEach(indicators::addNote);
      recommendations.addAll(part.recommendations());
      timestamp = Math.max(timestamp, part.timestampMillis());
    }
    face.flatMap(SessionResult::healthScore).ifPresent(v -> indicators.score(Indicators.FACE_HEALTH_SCORE, v));
    body.flatMap(SessionResult::healthScore).ifPresent(v -> indicators.score(Indicators.BODY_HEALTH_SCORE, v));

    Optional<Double> score = overallScore(
        face.flatMap(SessionResult::healthScore), body.flatMap(SessionResult::healthScore));
    HealthStatus status = score.map(HealthStatus::fromScore).orElse(HealthStatus.INSUFFICIENT_DATA);
    return Optional.of(new SessionResult(
        timestamp,
        first.frameId(),
        first.sessionId(),
        measurements.build(),
        indicators.build(),
        score,
        status,
        new ArrayList<>(recommendations)));
  }

  static Optional<Double> overallScore(Optional<Double> face, Optional<Double> body) {
    if (face.isPresent() && body.isPresent()) {
      double combined = face.get() * FACE_WEIGHT + body.get() * BODY_WEIGHT;
      return Optional.of(Math.round(combined * 10d) / 10d);
    }
    return face.isPresent() ? face : body;
  }
}
