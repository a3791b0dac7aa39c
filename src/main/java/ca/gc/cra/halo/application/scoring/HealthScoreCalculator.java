package ca.gc.cra.halo.application.scoring;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.IndicatorValue;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.session.HealthStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * Weighted aggregate health score on the 0-10 scale.
 *
 * <p>Each weighted indicator is converted to a 0-10 sub-score; the aggregate is the weighted mean
 * over the indicators actually present. Absent indicators carry no weight. When none is present the
 * result is {@link HealthStatus#INSUFFICIENT_DATA} without a score.
 *
 * <p>The default instance weighs facial indicators; {@link #body()} gives spine alignment, body
 * symmetry and weight distribution equal weight.
 *
 * <p>Stateless and thread-safe.
 *
 * @since 0.1.0
 */
public final class HealthScoreCalculator {
  /** Facial weights in descending order of importance. */
  static final Map<String, Double> WEIGHTS = buildWeights();
  static final Map<String, Double> BODY_WEIGHTS = buildBodyWeights();

  private static final double TEXTURE_SMOOTH = 5d;
  private static final double TEXTURE_ROUGH = 40d;
  private static final double EYE_LEVEL_SCALE = 12.5d;

  /**
   * Aggregate score with its status band.
   *
   * @param score rounded to one decimal; empty when no weighted indicator was present
   * @param status band for {@code score}
   */
  public record Assessment(Optional<Double> score, HealthStatus status) {}

  private final Map<String, Double> weights;

  public HealthScoreCalculator() {
    this(WEIGHTS);
  }

  private HealthScoreCalculator(Map<String, Double> weights) {
    this.weights = weights;
  }

  /** Calculator for the posture indicators of a body capture. */
  public static HealthScoreCalculator body() {
    return new HealthScoreCalculator(BODY_WEIGHTS);
  }

  public Assessment assess(IndicatorSet indicators) {
    double weightedSum = 0d;
    double totalWeight = 0d;
    for (Map.Entry<String, Double> entry : weights.entrySet()) {
      OptionalDouble subScore = subScore(entry.getKey(), indicators);
      if (subScore.isPresent()) {
        weightedSum += entry.getValue() * subScore.getAsDouble();
        totalWeight += entry.getValue();
      }
    }
    if (totalWeight == 0d) {
      return new Assessment(Optional.empty(), HealthStatus.INSUFFICIENT_DATA);
    }
    double score = Math.round(weightedSum / totalWeight * 10d) / 10d;
    return new Assessment(Optional.of(score), HealthStatus.fromScore(score));
  }

  /**
   * Converts one indicator into its 0-10 sub-score.
   *
   * @return sub-score, or empty when the indicator is missing or its label has no proxy
   */
  OptionalDouble subScore(String name, IndicatorSet indicators) {
    Optional<IndicatorValue> value = indicators.get(name);
    if (value.isEmpty()) {
      return OptionalDouble.empty();
    }
    return switch (name) {
      case Indicators.FACIAL_SYMMETRY, Indicators.GOLDEN_RATIO_HARMONY, Indicators.SPINE_ALIGNMENT,
          Indicators.BODY_SYMMETRY, Indicators.WEIGHT_DISTRIBUTION ->
          map(numeric(value.get()), v -> clamp(v * 10d));
      case Indicators.EYES_LEVEL_SYMMETRY -> map(numeric(value.get()), v -> clamp(v * EYE_LEVEL_SCALE));
      case Indicators.EYE_FATIGUE -> map(fatigueProxy(value.get()), p -> clamp((1d - p) * 10d));
      case Indicators.SKIN_TEXTURE -> map(numeric(value.get()), HealthScoreCalculator::textureScore);
      default -> OptionalDouble.empty();
    };
  }

  private static double textureScore(double texture) {
    double normalized = (TEXTURE_ROUGH - texture) / (TEXTURE_ROUGH - TEXTURE_SMOOTH);
    return Math.max(0d, Math.min(1d, normalized)) * 10d;
  }

  private static OptionalDouble numeric(IndicatorValue value) {
    if (value instanceof IndicatorValue.Score score) {
      return OptionalDouble.of(score.value());
    }
    return OptionalDouble.empty();
  }

  private static OptionalDouble fatigueProxy(IndicatorValue value) {
    if (value instanceof IndicatorValue.Label label) {
      return LabelProxies.severity(label.value());
    }
    return numeric(value);
  }

  private static OptionalDouble map(OptionalDouble value, DoubleUnaryOperator fn) {
    return value.isPresent() ? OptionalDouble.of(fn.applyAsDouble(value.getAsDouble())) : value;
  }

  private static double clamp(double score) {
    return Math.max(0d, Math.min(10d, score));
  }

  private static Map<String, Double> buildWeights() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put(Indicators.FACIAL_SYMMETRY, 2.5d);
    weights.put(Indicators.EYES_LEVEL_SYMMETRY, 1.5d);
    weights.put(Indicators.EYE_FATIGUE, 1.2d);
    weights.put(Indicators.SKIN_TEXTURE, 1.0d);
    weights.put(Indicators.GOLDEN_RATIO_HARMONY, 0.8d);
    return Collections.unmodifiableMap(weights);
  }

  private static Map<String, Double> buildBodyWeights() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put(Indicators.SPINE_ALIGNMENT, 1.0d);
    weights.put(Indicators.BODY_SYMMETRY, 1.0d);
    weights.put(Indicators.WEIGHT_DISTRIBUTION, 1.0d);
    return Collections.unmodifiableMap(weights);
  }
}
