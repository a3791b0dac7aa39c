package ca.gc.cra.halo.domain.analysis;

/**
 * Well-known indicator names produced by scorers and consumed by aggregation and recommendations.
 *
 * @since 0.1.0
 */
public final class Indicators {
  public static final String FACIAL_SYMMETRY = "facial_symmetry";
  public static final String EYES_LEVEL_SYMMETRY = "eyes_level_symmetry";
  public static final String EYE_FATIGUE = "eye_fatigue";
  public static final String SKIN_TEXTURE = "skin_texture";
  public static final String GOLDEN_RATIO_HARMONY = "golden_ratio_harmony";
  public static final String SKIN_TONE_NOTE = "skin_tone_note";
  public static final String EYE_BAGS = "eye_bags";
  public static final String FACIAL_FULLNESS = "facial_fullness";

  public static final String SPINE_ALIGNMENT = "spine_alignment";
  public static final String POSTURE_DEVIATION = "posture_deviation_degrees";
  public static final String POSTURE_QUALITY = "posture_quality";
  public static final String POSTURE_NOTE = "posture_note";
  public static final String WAIST_HIP_RATIO = "waist_hip_ratio";
  public static final String SHOULDER_WIDTH_RATIO = "shoulder_width_ratio";
  public static final String LEG_TORSO_RATIO = "leg_torso_ratio";
  public static final String PROPORTION_NOTE = "proportion_note";
  public static final String SHOULDER_SYMMETRY = "shoulder_symmetry";
  public static final String HIP_SYMMETRY = "hip_symmetry";
  public static final String BODY_SYMMETRY = "body_symmetry";
  public static final String BODY_SYMMETRY_NOTE = "body_symmetry_note";
  public static final String WEIGHT_DISTRIBUTION = "weight_distribution";
  public static final String BALANCE_QUALITY = "balance_quality";

  /** Part scores kept on a combined face and body result. */
  public static final String FACE_HEALTH_SCORE = "face_health_score";
  public static final String BODY_HEALTH_SCORE = "body_health_score";

  private Indicators() {}
}
