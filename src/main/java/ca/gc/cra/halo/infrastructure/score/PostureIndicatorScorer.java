package ca.gc.cra.halo.infrastructure.score;

import ca.gc.cra.halo.application.port.IndicatorScorer;
import ca.gc.cra.halo.domain.analysis.BodyKeypoint;
import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ScoringException;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Maps body keypoints to posture, proportion, symmetry and balance indicators.
 *
 * <ul>
 *   <li>Posture: angle of the neck-to-hip-centre line from vertical.</li>
 *   <li>Proportions: waist to hip, shoulder to hip and leg to torso ratios.</li>
 *   <li>Symmetry: level and spread of the shoulders and hips around the head-torso centre line.</li>
 *   <li>Balance: offset of the ankle midpoint from the head centre, relative to half the stance.</li>
 * </ul>
 * An indicator is produced only when the joints it needs were detected. A one-line summary is added
 * as a note.
 */
public final class PostureIndicatorScorer implements IndicatorScorer {
  static final double MAX_DEVIATION_DEGREES = 45d;

  @Override
  public IndicatorSet score(MeasurementBundle measurements) throws ScoringException {
    if (measurements.group(MeasurementBundle.GROUP_KEYPOINTS).isEmpty()) {
      throw new ScoringException("no body keypoints to score");
    }
    Joints joints = new Joints(measurements);
    IndicatorSet.Builder indicators = IndicatorSet.builder();

    Optional<String> postureQuality = posture(joints, indicators);
    proportions(joints, measurements, indicators);
    OptionalDouble overallSymmetry = symmetry(joints, indicators);
    balance(joints, indicators);

    indicators.addNote(summary(postureQuality, overallSymmetry));
    return indicators.build();
  }

  private static Optional<String> posture(Joints joints, IndicatorSet.Builder indicators) {
    Optional<Point> neck = joints.get(BodyKeypoint.NECK);
    Optional<Point> hips = joints.midpoint(BodyKeypoint.LEFT_HIP, BodyKeypoint.RIGHT_HIP);
    if (neck.isEmpty() || hips.isEmpty() || joints.get(BodyKeypoint.TORSO).isEmpty()) {
      indicators.note(Indicators.POSTURE_NOTE, "Could not analyze posture from image");
      return Optional.empty();
    }
    double deviation = verticalDeviation(neck.get(), hips.get());
    String quality = postureQuality(deviation);
    indicators.score(Indicators.SPINE_ALIGNMENT, Math.max(0d, 1d - deviation / MAX_DEVIATION_DEGREES))
        .score(Indicators.POSTURE_DEVIATION, deviation)
        .label(Indicators.POSTURE_QUALITY, quality)
        .note(Indicators.POSTURE_NOTE, postureNote(quality));
    return Optional.of(quality);
  }

  private static void proportions(Joints joints, MeasurementBundle measurements, IndicatorSet.Builder indicators) {
    OptionalDouble hipWidth = joints.width(BodyKeypoint.LEFT_HIP, BodyKeypoint.RIGHT_HIP);
    OptionalDouble waistHip = OptionalDouble.empty();
    OptionalDouble waist = measurements.scalar(MeasurementBundle.GROUP_BODY, "waist_width");
    if (hipWidth.isPresent() && hipWidth.getAsDouble() > 0d && waist.isPresent()) {
      waistHip = OptionalDouble.of(waist.getAsDouble() / hipWidth.getAsDouble());
      indicators.score(Indicators.WAIST_HIP_RATIO, waistHip.getAsDouble());
    }
    OptionalDouble shoulderWidth = joints.width(BodyKeypoint.LEFT_SHOULDER, BodyKeypoint.RIGHT_SHOULDER);
    boolean shoulderRatio = shoulderWidth.isPresent() && hipWidth.isPresent() && hipWidth.getAsDouble() > 0d;
    if (shoulderRatio) {
      indicators.score(Indicators.SHOULDER_WIDTH_RATIO, shoulderWidth.getAsDouble() / hipWidth.getAsDouble());
    }

    Optional<Point> neck = joints.get(BodyKeypoint.NECK);
    Optional<Point> hips = joints.midpoint(BodyKeypoint.LEFT_HIP, BodyKeypoint.RIGHT_HIP);
    Optional<Point> ankles = joints.midpoint(BodyKeypoint.LEFT_ANKLE, BodyKeypoint.RIGHT_ANKLE);
    if (neck.isPresent() && hips.isPresent() && ankles.isPresent()) {
      double torso = hips.get().y() - neck.get().y();
      if (torso > 0d) {
        indicators.score(Indicators.LEG_TORSO_RATIO, (ankles.get().y() - hips.get().y()) / torso);
      }
    }
    indicators.note(Indicators.PROPORTION_NOTE, proportionNote(waistHip, shoulderRatio));
  }

  private static OptionalDouble symmetry(Joints joints, IndicatorSet.Builder indicators) {
    Optional<Point> nose = joints.get(BodyKeypoint.NOSE);
    Optional<Point> neck = joints.get(BodyKeypoint.NECK);
    Optional<Point> torso = joints.get(BodyKeypoint.TORSO);
    if (nose.isEmpty() || neck.isEmpty() || torso.isEmpty()) {
      indicators.note(Indicators.BODY_SYMMETRY_NOTE, "Could not analyze symmetry completely");
      return OptionalDouble.empty();
    }
    double centre = (nose.get().x() + neck.get().x() + torso.get().x()) / 3d;
    OptionalDouble shoulders = pairSymmetry(joints, BodyKeypoint.LEFT_SHOULDER, BodyKeypoint.RIGHT_SHOULDER, centre);
    OptionalDouble hips = pairSymmetry(joints, BodyKeypoint.LEFT_HIP, BodyKeypoint.RIGHT_HIP, centre);
    shoulders.ifPresent(v -> indicators.score(Indicators.SHOULDER_SYMMETRY, v));
    hips.ifPresent(v -> indicators.score(Indicators.HIP_SYMMETRY, v));
    if (shoulders.isEmpty() || hips.isEmpty()) {
      indicators.note(Indicators.BODY_SYMMETRY_NOTE, "Could not analyze symmetry completely");
      return OptionalDouble.empty();
    }
    double overall = (shoulders.getAsDouble() + hips.getAsDouble()) / 2d;
    indicators.score(Indicators.BODY_SYMMETRY, overall)
        .note(Indicators.BODY_SYMMETRY_NOTE, symmetryNote(overall));
    return OptionalDouble.of(overall);
  }

  /** 70% level of the pair, 30% balance of their distances to the centre line. */
  static OptionalDouble pairSymmetry(Joints joints, BodyKeypoint left, BodyKeypoint right, double centre) {
    Optional<Point> l = joints.get(left);
    Optional<Point> r = joints.get(right);
    if (l.isEmpty() || r.isEmpty()) {
      return OptionalDouble.empty();
    }
    double leftDistance = Math.abs(centre - l.get().x());
    double rightDistance = Math.abs(r.get().x() - centre);
    double farther = Math.max(leftDistance, rightDistance);
    double averageY = (l.get().y() + r.get().y()) / 2d;
    if (farther <= 0d || averageY <= 0d) {
      return OptionalDouble.empty();
    }
    double level = 1d - Math.min(1d, Math.abs(l.get().y() - r.get().y()) / (averageY * 0.2d));
    double spread = Math.min(leftDistance, rightDistance) / farther;
    return OptionalDouble.of(level * 0.7d + spread * 0.3d);
  }

  private static void balance(Joints joints, IndicatorSet.Builder indicators) {
    Optional<Point> head = joints.midpoint(BodyKeypoint.NOSE, BodyKeypoint.NECK);
    Optional<Point> leftAnkle = joints.get(BodyKeypoint.LEFT_ANKLE);
    Optional<Point> rightAnkle = joints.get(BodyKeypoint.RIGHT_ANKLE);
    if (head.isEmpty() || leftAnkle.isEmpty() || rightAnkle.isEmpty()) {
      return;
    }
    double halfStance = Math.abs(leftAnkle.get().x() - rightAnkle.get().x()) / 2d;
    if (halfStance <= 0d) {
      return;
    }
    double ankleMid = (leftAnkle.get().x() + rightAnkle.get().x()) / 2d;
    double distribution = 1d - Math.min(1d, Math.abs(head.get().x() - ankleMid) / halfStance);
    indicators.score(Indicators.WEIGHT_DISTRIBUTION, distribution)
        .label(Indicators.BALANCE_QUALITY, balanceQuality(distribution));
  }

  /** Angle in degrees between the neck-to-hip line and the vertical; 0 when upright. */
  static double verticalDeviation(Point neck, Point hips) {
    double dx = Math.abs(neck.x() - hips.x());
    double dy = Math.abs(neck.y() - hips.y());
    if (dx == 0d && dy == 0d) {
      return 0d;
    }
    return Math.toDegrees(Math.atan2(dx, dy));
  }

  static String postureQuality(double deviation) {
    if (deviation < 5d) {
      return "Excellent";
    }
    if (deviation < 10d) {
      return "Good";
    }
    if (deviation < 15d) {
      return "Fair";
    }
    return "Concerning";
  }

  private static String postureNote(String quality) {
    return switch (quality) {
      case "Excellent" -> "Great vertical alignment";
      case "Good" -> "Good posture with slight deviation";
      case "Fair" -> "Moderate posture issues observed";
      default -> "Significant posture deviation detected";
    };
  }

  static String balanceQuality(double distribution) {
    if (distribution > 0.9d) {
      return "Excellent";
    }
    if (distribution > 0.85d) {
      return "Good";
    }
    if (distribution > 0.75d) {
      return "Fair";
    }
    return "Concerning";
  }

  static String symmetryNote(double overall) {
    if (overall > 0.9d) {
      return "Excellent body symmetry";
    }
    if (overall > 0.8d) {
      return "Good body symmetry";
    }
    if (overall > 0.7d) {
      return "Fair body symmetry";
    }
    return "Body asymmetry detected";
  }

  private static String proportionNote(OptionalDouble waistHip, boolean shoulderRatio) {
    if (waistHip.isPresent()) {
      if (waistHip.getAsDouble() > 0.9d) {
        return "Higher waist-hip ratio detected";
      }
      if (waistHip.getAsDouble() < 0.7d) {
        return "Lower waist-hip ratio detected";
      }
      return "Body proportions within normal range";
    }
    return shoulderRatio ? "Body proportions within normal range" : "Could not analyze proportions completely";
  }

  static String summary(Optional<String> postureQuality, OptionalDouble overallSymmetry) {
    if (postureQuality.isEmpty() || overallSymmetry.isEmpty()) {
      return "Limited body analysis data available.";
    }
    String quality = postureQuality.get();
    double symmetry = overallSymmetry.getAsDouble();
    if (("Excellent".equals(quality) || "Good".equals(quality)) && symmetry > 0.8d) {
      return "Body analysis indicates good overall posture and alignment.";
    }
    if ("Fair".equals(quality) || (symmetry <= 0.8d && symmetry > 0.7d)) {
      return "Body analysis shows some alignment issues that may benefit from attention.";
    }
    return "Body analysis indicates several posture and alignment issues that should be addressed.";
  }

  record Point(double x, double y) {}

  /** Keypoint lookup over the {@code keypoints} measurement group. */
  static final class Joints {
    private final MeasurementBundle measurements;

    Joints(MeasurementBundle measurements) {
      this.measurements = measurements;
    }

    Optional<Point> get(BodyKeypoint keypoint) {
      Optional<Measurement> found = measurements.find(MeasurementBundle.GROUP_KEYPOINTS, keypoint.key());
      return found.filter(m -> m.values().size() >= 2)
          .map(m -> new Point(m.values().get(0), m.values().get(1)));
    }

    Optional<Point> midpoint(BodyKeypoint a, BodyKeypoint b) {
      Optional<Point> first = get(a);
      Optional<Point> second = get(b);
      if (first.isEmpty() || second.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new Point(
          (first.get().x() + second.get().x()) / 2d, (first.get().y() + second.get().y()) / 2d));
    }

    OptionalDouble width(BodyKeypoint a, BodyKeypoint b) {
      Optional<Point> first = get(a);
      Optional<Point> second = get(b);
      if (first.isEmpty() || second.isEmpty()) {
        return OptionalDouble.empty();
      }
      return OptionalDouble.of(Math.abs(first.get().x() - second.get().x()));
    }
  }
}
