package ca.gc.cra.halo.domain.analysis;

import java.util.Locale;

/**
 * Body joints reported in the {@link MeasurementBundle#GROUP_KEYPOINTS} group. Each keypoint is
 * stored as a vector {@code (x, y, confidence)} in frame pixels; undetected joints are absent.
 *
 * <p>Left and right refer to the image, not to the subject.
 *
 * @since 0.1.0
 */
public enum BodyKeypoint {
  NOSE,
  NECK,
  LEFT_SHOULDER,
  RIGHT_SHOULDER,
  LEFT_ELBOW,
  RIGHT_ELBOW,
  LEFT_WRIST,
  RIGHT_WRIST,
  TORSO,
  LEFT_HIP,
  RIGHT_HIP,
  LEFT_KNEE,
  RIGHT_KNEE,
  LEFT_ANKLE,
  RIGHT_ANKLE;

  /** Measurement name, for example {@code left_shoulder}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
