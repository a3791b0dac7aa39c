package ca.gc.cra.halo.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.frame.DetectedRegion;
import java.util.List;
import org.junit.jupiter.api.Test;

class PrimaryRegionSelectorTest {

  @Test
  void emptyListHasNoPrimary() {
    assertTrue(PrimaryRegionSelector.select(List.of()).isEmpty());
  }

  @Test
  void picksLargestArea() {
    DetectedRegion small = DetectedRegion.of(0, 0, 10, 10);
    DetectedRegion large = DetectedRegion.of(5, 5, 40, 30);
    DetectedRegion medium = DetectedRegion.of(1, 1, 20, 20);

    assertEquals(large, PrimaryRegionSelector.select(List.of(small, large, medium)).orElseThrow());
  }

  @Test
  void tiesKeepFirstDetection() {
    DetectedRegion first = DetectedRegion.of(0, 0, 20, 10);
    DetectedRegion second = DetectedRegion.of(30, 0, 10, 20);

    assertEquals(first, PrimaryRegionSelector.select(List.of(first, second)).orElseThrow());
  }
}
