package ca.gc.cra.halo.infrastructure.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.fixtures.Frames;
import java.util.List;
import org.junit.jupiter.api.Test;

class SilhouetteBodyDetectorTest {
  private final SilhouetteBodyDetector detector = new SilhouetteBodyDetector();

  @Test
  void brightBoxIsReportedAsBody() throws Exception {
    List<DetectedRegion> regions = detector.detect(Frames.standing(1, 20, 10, 24, 80));

    assertEquals(List.of(new DetectedRegion(20, 10, 24, 80, 1d)), regions);
  }

  @Test
  void largestComponentWins() throws Exception {
    List<DetectedRegion> regions = detector.detect(Frames.silhouette(1, 64, 96,
        (x, y) -> (x < 4 && y < 4) || (x >= 30 && x < 50 && y >= 20 && y < 60)));

    assertEquals(1, regions.size());
    assertEquals(DetectedRegion.of(30, 20, 20, 40), regions.get(0));
  }

  @Test
  void confidenceIsShareOfBoxFilled() throws Exception {
    // L shape: a 10x40 bar plus a 30x10 foot fills 700 of the 40x40 box.
    List<DetectedRegion> regions = detector.detect(Frames.silhouette(1, 64, 96,
        (x, y) -> (x >= 10 && x < 20 && y >= 10 && y < 50) || (x >= 10 && x < 50 && y >= 40 && y < 50)));

    DetectedRegion region = regions.get(0);
    assertEquals(DetectedRegion.of(10, 10, 40, 40).area(), region.area());
    assertEquals(700d / 1600d, region.confidence(), 1e-9);
  }

  @Test
  void darkOrSpeckledFrameHasNoBody() throws Exception {
    assertTrue(detector.detect(Frames.silhouette(1, 64, 96, (x, y) -> false)).isEmpty());
    assertTrue(detector.detect(Frames.silhouette(2, 64, 96, (x, y) -> x < 5 && y < 5)).isEmpty());
  }

  @Test
  void detectorIsReusableAcrossFrameSizes() throws Exception {
    detector.detect(Frames.standing(1, 20, 10, 24, 80));

    List<DetectedRegion> regions = detector.detect(Frames.silhouette(2, 32, 32, (x, y) -> x >= 8 && x < 24));

    assertEquals(DetectedRegion.of(8, 0, 16, 32), regions.get(0));
  }
}
