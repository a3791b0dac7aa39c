package ca.gc.cra.halo.infrastructure.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ExtractionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.fixtures.Frames;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeometryFeatureExtractorTest {
  private final GeometryFeatureExtractor extractor = new GeometryFeatureExtractor();

  @Test
  void uniformFaceIsPerfectlySymmetricAndSmooth() throws Exception {
    Frame frame = Frames.filled(1, 64, 64, 1, (byte) 90);

    MeasurementBundle bundle = extractor.extract(frame, DetectedRegion.of(8, 8, 40, 40));

    assertEquals(40d, scalar(bundle, MeasurementBundle.GROUP_METRICS, "face_width"));
    assertEquals(0d, scalar(bundle, MeasurementBundle.GROUP_METRICS, "texture"), 1e-9);
    assertEquals(1d, scalar(bundle, MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity"), 1e-9);
    assertEquals(1d, scalar(bundle, MeasurementBundle.GROUP_SYMMETRY, "eye_alignment"), 1e-9);
    assertEquals(1d, scalar(bundle, MeasurementBundle.GROUP_RATIOS, "lower_fullness"), 1e-9);
    assertEquals(0d, scalar(bundle, MeasurementBundle.GROUP_COLOR, "under_eye_darkness"), 1e-9);
    assertEquals(
        List.of(90d, 90d, 90d),
        bundle.find(MeasurementBundle.GROUP_COLOR, "cheek_bgr").map(Measurement::values).orElseThrow());
  }

  @Test
  void brightnessDifferenceBetweenHalvesLowersMirrorSimilarity() throws Exception {
    int w = 32;
    int h = 32;
    byte[] pixels = new byte[w * h];
    for (int y = 0; y < h; y++) {
      Arrays.fill(pixels, y * w + w / 2, (y + 1) * w, (byte) 200);
    }
    Frame frame = new Frame(1, 0, w, h, 1, pixels);

    MeasurementBundle bundle = extractor.extract(frame, DetectedRegion.of(0, 0, w, h));

    assertEquals(1d - 200d / 255d, scalar(bundle, MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity"), 1e-9);
  }

  @Test
  void unevenEyeRowsReduceAlignment() throws Exception {
    int side = 60;
    byte[] pixels = new byte[side * side];
    Arrays.fill(pixels, (byte) 200);
    darkRow(pixels, side, 15, 9, 27);
    darkRow(pixels, side, 24, 33, 51);
    Frame frame = new Frame(1, 0, side, side, 1, pixels);

    MeasurementBundle bundle = extractor.extract(frame, DetectedRegion.of(0, 0, side, side));

    assertEquals(19.5d, scalar(bundle, MeasurementBundle.GROUP_METRICS, "eye_row"), 1e-9);
    assertEquals(0.5d, scalar(bundle, MeasurementBundle.GROUP_SYMMETRY, "eye_alignment"), 1e-9);
    assertEquals(40.5d / 19.5d, scalar(bundle, MeasurementBundle.GROUP_RATIOS, "lower_to_upper"), 1e-9);
    assertTrue(scalar(bundle, MeasurementBundle.GROUP_METRICS, "texture") > 0d);
  }

  @Test
  void smallBoxSkipsDetailGroups() throws Exception {
    Frame frame = Frames.filled(1, 64, 48, 3, (byte) 120);

    MeasurementBundle bundle = extractor.extract(frame, DetectedRegion.of(0, 0, 16, 16));

    assertTrue(bundle.group(MeasurementBundle.GROUP_METRICS).containsKey("texture"));
    assertTrue(bundle.group(MeasurementBundle.GROUP_RATIOS).isEmpty());
    assertTrue(bundle.group(MeasurementBundle.GROUP_COLOR).isEmpty());
    assertFalse(bundle.group(MeasurementBundle.GROUP_SYMMETRY).containsKey("eye_alignment"));
  }

  @Test
  void rejectsTinyOrOutOfFrameRegions() {
    Frame frame = Frames.gray(1);

    assertThrows(ExtractionException.class, () -> extractor.extract(frame, DetectedRegion.of(0, 0, 7, 30)));
    assertThrows(ExtractionException.class, () -> extractor.extract(frame, DetectedRegion.of(40, 0, 30, 30)));
  }

  private static double scalar(MeasurementBundle bundle, String group, String name) {
    return bundle.scalar(group, name).orElseThrow();
  }

  private static void darkRow(byte[] pixels, int width, int row, int fromX, int toX) {
    Arrays.fill(pixels, row * width + fromX, row * width + toX, (byte) 10);
  }
}
