package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.domain.frame.DetectedRegion;
import java.util.List;
import java.util.Optional;

/**
 * Picks the region analysed each cycle: the one with the largest area.
 *
 * <p>Ties keep the region the detector reported first. The tie-break is arbitrary; detectors that
 * care about ordering should sort their output.
 *
 * @since 0.1.0
 */
public final class PrimaryRegionSelector {

  private PrimaryRegionSelector() {}

  public static Optional<DetectedRegion> select(List<DetectedRegion> regions) {
    DetectedRegion best = null;
    for (DetectedRegion region : regions) {
      if (best == null || region.area() > best.area()) {
        best = region;
      }
    }
    return Optional.ofNullable(best);
  }
}
