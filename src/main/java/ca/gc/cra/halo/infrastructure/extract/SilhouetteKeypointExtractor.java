package ca.gc.cra.halo.infrastructure.extract;

import ca.gc.cra.halo.application.port.FeatureExtractor;
import ca.gc.cra.halo.domain.analysis.BodyKeypoint;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ExtractionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import java.util.EnumMap;
import java.util.Map;

/**
 * Approximates body joints from the silhouette inside a body box.
 *
 * <p>Each joint sits on a fixed row of the box (a fraction of its height) at a fixed fraction of the
 * foreground span found on that row. A leaning or shifted silhouette therefore moves the joints with
 * it. Joints on rows without foreground are left out.
 *
 * <p>Measurements:
 * <ul>
 *   <li>{@code keypoints}: one {@code (x, y, confidence)} vector per detected joint.</li>
 *   <li>{@code body_metrics}: height between the highest and lowest joint, joint count, mean joint
 *       confidence and the waist width on the torso row.</li>
 * </ul>
 */
public final class SilhouetteKeypointExtractor implements FeatureExtractor {
  static final int FOREGROUND_LUMA = 20;
  static final int MIN_BODY_HEIGHT = 24;
  static final int MIN_BODY_WIDTH = 8;

  /** Row fraction, span fraction and confidence per joint. */
  private static final Map<BodyKeypoint, double[]> LAYOUT = layout();

  @Override
  public MeasurementBundle extract(Frame frame, DetectedRegion region) throws ExtractionException {
    if (region.width() < MIN_BODY_WIDTH || region.height() < MIN_BODY_HEIGHT) {
      throw new ExtractionException(
          "region " + region.width() + "x" + region.height() + " is too small for body keypoints");
    }
    if (region.x() + region.width() > frame.width() || region.y() + region.height() > frame.height()) {
      throw new ExtractionException("region lies outside the frame");
    }
    MeasurementBundle.Builder bundle = MeasurementBundle.builder();
    int detected = 0;
    double confidenceSum = 0d;
    double minY = Double.MAX_VALUE;
    double maxY = -Double.MAX_VALUE;
    for (Map.Entry<BodyKeypoint, double[]> entry : LAYOUT.entrySet()) {
      double[] placement = entry.getValue();
      int row = rowAt(region, placement[0]);
      int[] span = span(frame, region, row);
      if (span == null) {
        continue;
      }
      double x = span[0] + placement[1] * (span[1] - span[0]);
      bundle.put(MeasurementBundle.GROUP_KEYPOINTS, entry.getKey().key(), Measurement.vector(x, row, placement[2]));
      detected++;
      confidenceSum += placement[2];
      minY = Math.min(minY, row);
      maxY = Math.max(maxY, row);
    }
    if (detected == 0) {
      throw new ExtractionException("no body keypoints found inside the region");
    }
    bundle.put(MeasurementBundle.GROUP_BODY, "height_pixels", maxY - minY)
        .put(MeasurementBundle.GROUP_BODY, "keypoints_detected", detected)
        .put(MeasurementBundle.GROUP_BODY, "keypoint_confidence", confidenceSum / detected);
    int[] waist = span(frame, region, rowAt(region, LAYOUT.get(BodyKeypoint.TORSO)[0]));
    if (waist != null) {
      bundle.put(MeasurementBundle.GROUP_BODY, "waist_width", (waist[1] - waist[0]) / 3d);
    }
    return bundle.build();
  }

  private static int rowAt(DetectedRegion region, double fraction) {
    int offset = (int) Math.round(fraction * (region.height() - 1));
    return region.y() + Math.min(region.height() - 1, offset);
  }

  /** Leftmost and rightmost foreground column on {@code row} inside the box, or {@code null}. */
  private static int[] span(Frame frame, DetectedRegion region, int row) {
    int left = -1;
    int right = -1;
    for (int x = region.x(); x < region.x() + region.width(); x++) {
      if (frame.luma(x, row) > FOREGROUND_LUMA) {
        if (left < 0) {
          left = x;
        }
        right = x;
      }
    }
    return left < 0 ? null : new int[] {left, right};
  }

  private static Map<BodyKeypoint, double[]> layout() {
    Map<BodyKeypoint, double[]> layout = new EnumMap<>(BodyKeypoint.class);
    layout.put(BodyKeypoint.NOSE, new double[] {1d / 8d, 0.5d, 0.8d});
    layout.put(BodyKeypoint.NECK, new double[] {1d / 6d, 0.5d, 0.7d});
    layout.put(BodyKeypoint.LEFT_SHOULDER, new double[] {0.25d, 0.25d, 0.8d});
    layout.put(BodyKeypoint.RIGHT_SHOULDER, new double[] {0.25d, 0.75d, 0.8d});
    layout.put(BodyKeypoint.LEFT_ELBOW, new double[] {0.5d, 1d / 6d, 0.7d});
    layout.put(BodyKeypoint.RIGHT_ELBOW, new double[] {0.5d, 5d / 6d, 0.7d});
    layout.put(BodyKeypoint.LEFT_WRIST, new double[] {2d / 3d, 1d / 8d, 0.6d});
    layout.put(BodyKeypoint.RIGHT_WRIST, new double[] {2d / 3d, 7d / 8d, 0.6d});
    layout.put(BodyKeypoint.TORSO, new double[] {0.5d, 0.5d, 0.9d});
    layout.put(BodyKeypoint.LEFT_HIP, new double[] {2d / 3d, 1d / 3d, 0.8d});
    layout.put(BodyKeypoint.RIGHT_HIP, new double[] {2d / 3d, 2d / 3d, 0.8d});
    layout.put(BodyKeypoint.LEFT_KNEE, new double[] {0.75d, 1d / 3d, 0.7d});
    layout.put(BodyKeypoint.RIGHT_KNEE, new double[] {0.75d, 2d / 3d, 0.7d});
    layout.put(BodyKeypoint.LEFT_ANKLE, new double[] {1d, 1d / 3d, 0.6d});
    layout.put(BodyKeypoint.RIGHT_ANKLE, new double[] {1d, 2d / 3d, 0.6d});
    return layout;
  }
}
