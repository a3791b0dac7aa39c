package ca.gc.cra.halo.infrastructure.score;

import ca.gc.cra.halo.application.port.IndicatorScorer;
import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ScoringException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Maps {@code GeometryFeatureExtractor} measurements to indicators with fixed thresholds.
 *
 * <p>An indicator is produced only when its measurements exist. Thresholds are heuristics and make no
 * claim of clinical accuracy.
 */
public final class HeuristicIndicatorScorer implements IndicatorScorer {
  static final double GOLDEN_RATIO = 1.618d;

  @Override
  public IndicatorSet score(MeasurementBundle measurements) throws ScoringException {
    if (measurements.isEmpty()) {
      throw new ScoringException("no measurements to score");
    }
    IndicatorSet.Builder indicators = IndicatorSet.builder();

    measurements.scalar(MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity")
        .ifPresent(v -> indicators.score(Indicators.FACIAL_SYMMETRY, v));
    measurements.scalar(MeasurementBundle.GROUP_SYMMETRY, "eye_alignment")
        .ifPresent(v -> indicators.score(Indicators.EYES_LEVEL_SYMMETRY, v));
    measurements.scalar(MeasurementBundle.GROUP_METRICS, "texture")
        .ifPresent(v -> indicators.score(Indicators.SKIN_TEXTURE, v));

    OptionalDouble darkness = measurements.scalar(MeasurementBundle.GROUP_COLOR, "under_eye_darkness");
    if (darkness.isPresent()) {
      indicators.label(Indicators.EYE_FATIGUE, fatigueLevel(darkness.getAsDouble()));
      indicators.label(Indicators.EYE_BAGS, eyeBagLevel(darkness.getAsDouble()));
    }

    Optional<Measurement> cheek = measurements.find(MeasurementBundle.GROUP_COLOR, "cheek_bgr");
    cheek.filter(m -> m.values().size() == 3)
        .ifPresent(m -> indicators.note(Indicators.SKIN_TONE_NOTE, skinToneNote(m.values())));

    measurements.scalar(MeasurementBundle.GROUP_RATIOS, "lower_to_upper")
        .ifPresent(v -> indicators.score(Indicators.GOLDEN_RATIO_HARMONY, harmony(v)));
    measurements.scalar(MeasurementBundle.GROUP_RATIOS, "lower_fullness")
        .ifPresent(v -> indicators.score(Indicators.FACIAL_FULLNESS, v));

    if (measurements.scalar(MeasurementBundle.GROUP_METRICS, "face_width").orElse(0d) < 64d) {
      indicators.addNote("Face is small in frame; move closer for more reliable results");
    }
    return indicators.build();
  }

  static String fatigueLevel(double darkness) {
    if (darkness < 0.05d) {
      return "Minimal";
    }
    if (darkness < 0.12d) {
      return "Mild";
    }
    if (darkness < 0.20d) {
      return "Moderate";
    }
    return "Severe";
  }

  static String eyeBagLevel(double darkness) {
    if (darkness < 0.08d) {
      return "None";
    }
    if (darkness < 0.15d) {
      return "Mild";
    }
    if (darkness < 0.25d) {
      return "Moderate";
    }
    return "Severe";
  }

  static String skinToneNote(List<Double> bgr) {
    double b = bgr.get(0);
    double g = bgr.get(1);
    double r = bgr.get(2);
    if ((r + g) / 2d - b > 45d && g > 0.85d * r) {
      return "Slightly yellowish undertone";
    }
    if (r - g > 50d) {
      return "Reddish undertone, possible irritation";
    }
    if (r + g + b < 150d) {
      return "Low light; skin tone unreliable";
    }
    return "Balanced skin tone";
  }

  /** 1 at the golden ratio, falling linearly to 0 at twice its distance. */
  static double harmony(double ratio) {
    double deviation = Math.abs(ratio - GOLDEN_RATIO) / GOLDEN_RATIO;
    return Math.max(0d, 1d - deviation);
  }
}
