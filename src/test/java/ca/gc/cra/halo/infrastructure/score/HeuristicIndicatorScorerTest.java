package ca.gc.cra.halo.infrastructure.score;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ScoringException;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeuristicIndicatorScorerTest {
  private final HeuristicIndicatorScorer scorer = new HeuristicIndicatorScorer();

  @Test
  void mapsFullBundleToIndicators() throws Exception {
    MeasurementBundle bundle = MeasurementBundle.builder()
        .put(MeasurementBundle.GROUP_METRICS, "face_width", 160d)
        .put(MeasurementBundle.GROUP_METRICS, "texture", 14d)
        .put(MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity", 0.86d)
        .put(MeasurementBundle.GROUP_SYMMETRY, "eye_alignment", 0.9d)
        .put(MeasurementBundle.GROUP_RATIOS, "lower_to_upper", 1.618d)
        .put(MeasurementBundle.GROUP_RATIOS, "lower_fullness", 0.7d)
        .put(MeasurementBundle.GROUP_COLOR, "cheek_bgr", Measurement.vector(120d, 140d, 180d))
        .put(MeasurementBundle.GROUP_COLOR, "under_eye_darkness", 0.16d)
        .build();

    IndicatorSet set = scorer.score(bundle);

    assertEquals(0.86d, set.score(Indicators.FACIAL_SYMMETRY).getAsDouble());
    assertEquals(0.9d, set.score(Indicators.EYES_LEVEL_SYMMETRY).getAsDouble());
    assertEquals(14d, set.score(Indicators.SKIN_TEXTURE).getAsDouble());
    assertEquals(1d, set.score(Indicators.GOLDEN_RATIO_HARMONY).getAsDouble(), 1e-9);
    assertEquals(0.7d, set.score(Indicators.FACIAL_FULLNESS).getAsDouble());
    assertEquals("Moderate", set.label(Indicators.EYE_FATIGUE).orElseThrow());
    assertEquals("Moderate", set.label(Indicators.EYE_BAGS).orElseThrow());
    assertEquals("Balanced skin tone", set.note(Indicators.SKIN_TONE_NOTE).orElseThrow());
    assertTrue(set.notes().isEmpty());
  }

  @Test
  void sparseBundleOnlyYieldsAvailableIndicators() throws Exception {
    MeasurementBundle bundle = MeasurementBundle.builder()
        .put(MeasurementBundle.GROUP_METRICS, "face_width", 40d)
        .put(MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity", 0.7d)
        .build();

    IndicatorSet set = scorer.score(bundle);

    assertEquals(List.of(Indicators.FACIAL_SYMMETRY), List.copyOf(set.values().keySet()));
    assertEquals(List.of("Face is small in frame; move closer for more reliable results"), set.notes());
  }

  @Test
  void emptyBundleCannotBeScored() {
    assertThrows(ScoringException.class, () -> scorer.score(MeasurementBundle.empty()));
  }

  @Test
  void fatigueAndEyeBagBands() {
    assertEquals("Minimal", HeuristicIndicatorScorer.fatigueLevel(0.01d));
    assertEquals("Mild", HeuristicIndicatorScorer.fatigueLevel(0.05d));
    assertEquals("Moderate", HeuristicIndicatorScorer.fatigueLevel(0.12d));
    assertEquals("Severe", HeuristicIndicatorScorer.fatigueLevel(0.2d));
    assertEquals("None", HeuristicIndicatorScorer.eyeBagLevel(0.07d));
    assertEquals("Mild", HeuristicIndicatorScorer.eyeBagLevel(0.08d));
    assertEquals("Severe", HeuristicIndicatorScorer.eyeBagLevel(0.3d));
  }

  @Test
  void skinToneNotes() {
    assertEquals("Slightly yellowish undertone", HeuristicIndicatorScorer.skinToneNote(List.of(80d, 150d, 160d)));
    assertEquals(
        "Reddish undertone, possible irritation", HeuristicIndicatorScorer.skinToneNote(List.of(100d, 100d, 170d)));
    assertEquals("Low light; skin tone unreliable", HeuristicIndicatorScorer.skinToneNote(List.of(30d, 40d, 50d)));
    assertEquals("Balanced skin tone", HeuristicIndicatorScorer.skinToneNote(List.of(120d, 140d, 180d)));
  }

  @Test
  void harmonyFallsOffAwayFromGoldenRatio() {
    assertEquals(1d, HeuristicIndicatorScorer.harmony(1.618d), 1e-9);
    assertEquals(0.5d, HeuristicIndicatorScorer.harmony(0.809d), 1e-9);
    assertEquals(0d, HeuristicIndicatorScorer.harmony(4d), 1e-9);
  }
}
