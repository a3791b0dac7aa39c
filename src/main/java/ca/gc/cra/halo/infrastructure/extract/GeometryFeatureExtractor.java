package ca.gc.cra.halo.infrastructure.extract;

import ca.gc.cra.halo.application.port.FeatureExtractor;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ExtractionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;

/**
 * Landmark-free feature extractor working directly on the pixels of the face box.
 *
 * <p>Measurements:
 * <ul>
 *   <li>{@code metrics}: box size, eye band row, texture (mean absolute Laplacian of luma).</li>
 *   <li>{@code symmetry}: mirror similarity of the two halves and the vertical alignment of the
 *       darkest rows of each eye quadrant.</li>
 *   <li>{@code facial_ratios}: lower-to-upper face ratio around the eye band, lower-face fullness.</li>
 *   <li>{@code color}: mean cheek BGR and under-eye darkness relative to the cheeks.</li>
 * </ul>
 * Groups that cannot be computed for a small box are left out.
 */
public final class GeometryFeatureExtractor implements FeatureExtractor {
  static final int MIN_REGION_SIDE = 8;
  static final int MIN_DETAIL_SIDE = 24;

  @Override
  public MeasurementBundle extract(Frame frame, DetectedRegion region) throws ExtractionException {
    if (region.width() < MIN_REGION_SIDE || region.height() < MIN_REGION_SIDE) {
      throw new ExtractionException(
          "region " + region.width() + "x" + region.height() + " is too small to measure");
    }
    if (region.x() + region.width() > frame.width() || region.y() + region.height() > frame.height()) {
      throw new ExtractionException("region lies outside the frame");
    }
    FaceBox box = new FaceBox(frame, region);
    MeasurementBundle.Builder bundle = MeasurementBundle.builder()
        .put(MeasurementBundle.GROUP_METRICS, "face_width", region.width())
        .put(MeasurementBundle.GROUP_METRICS, "face_height", region.height())
        .put(MeasurementBundle.GROUP_METRICS, "texture", box.texture())
        .put(MeasurementBundle.GROUP_SYMMETRY, "mirror_similarity", box.mirrorSimilarity());

    if (region.width() >= MIN_DETAIL_SIDE && region.height() >= MIN_DETAIL_SIDE) {
      int leftEyeRow = box.darkestRow(0.15d, 0.45d, 0.20d, 0.50d);
      int rightEyeRow = box.darkestRow(0.55d, 0.85d, 0.20d, 0.50d);
      double eyeRow = (leftEyeRow + rightEyeRow) / 2d;
      double eyeAlignment = 1d - Math.abs(leftEyeRow - rightEyeRow) / (0.30d * region.height());
      bundle.put(MeasurementBundle.GROUP_METRICS, "eye_row", eyeRow)
          .put(MeasurementBundle.GROUP_SYMMETRY, "eye_alignment", clamp01(eyeAlignment))
          .put(MeasurementBundle.GROUP_RATIOS, "lower_to_upper", (region.height() - eyeRow) / Math.max(1d, eyeRow))
          .put(MeasurementBundle.GROUP_RATIOS, "lower_fullness", box.lowerFullness());

      double[] cheek = box.meanBgr(0.20d, 0.80d, 0.55d, 0.75d);
      double cheekLuma = luma(cheek);
      double underEyeLuma = luma(box.meanBgr(0.20d, 0.80d, 0.45d, 0.55d));
      double darkness = cheekLuma <= 0d ? 0d : clamp01(1d - underEyeLuma / cheekLuma);
      bundle.put(MeasurementBundle.GROUP_COLOR, "cheek_bgr", Measurement.vector(cheek))
          .put(MeasurementBundle.GROUP_COLOR, "under_eye_darkness", darkness);
    }
    return bundle.build();
  }

  private static double luma(double[] bgr) {
    return 0.114d * bgr[0] + 0.587d * bgr[1] + 0.299d * bgr[2];
  }

  static double clamp01(double value) {
    return Math.max(0d, Math.min(1d, value));
  }

  /** Pixel accessors relative to the face box. */
  private static final class FaceBox {
    private final Frame frame;
    private final DetectedRegion region;

    FaceBox(Frame frame, DetectedRegion region) {
      this.frame = frame;
      this.region = region;
    }

    private double luma(int dx, int dy) {
      return frame.luma(region.x() + dx, region.y() + dy);
    }

    /** 1 minus the mean absolute difference between each pixel and its mirror, scaled to [0, 1]. */
    double mirrorSimilarity() {
      int w = region.width();
      int h = region.height();
      double diff = 0d;
      long samples = 0;
      for (int dy = 0; dy < h; dy++) {
        for (int dx = 0; dx < w / 2; dx++) {
          diff += Math.abs(luma(dx, dy) - luma(w - 1 - dx, dy));
          samples++;
        }
      }
      return samples == 0 ? 1d : clamp01(1d - diff / samples / 255d);
    }

    /** Mean absolute 4-neighbour Laplacian over the inner box. */
    double texture() {
      int w = region.width();
      int h = region.height();
      double sum = 0d;
      long samples = 0;
      for (int dy = 1; dy < h - 1; dy++) {
        for (int dx = 1; dx < w - 1; dx++) {
          double laplacian = luma(dx - 1, dy) + luma(dx + 1, dy) + luma(dx, dy - 1) + luma(dx, dy + 1)
              - 4d * luma(dx, dy);
          sum += Math.abs(laplacian);
          samples++;
        }
      }
      return samples == 0 ? 0d : sum / samples;
    }

    /** Row (relative to the box) with the lowest mean luma inside the given fractional window. */
    int darkestRow(double x0, double x1, double y0, double y1) {
      int w = region.width();
      int h = region.height();
      int fromX = (int) (w * x0);
      int toX = Math.max(fromX + 1, (int) (w * x1));
      int fromY = (int) (h * y0);
      int toY = Math.max(fromY + 1, (int) (h * y1));
      int bestRow = fromY;
      double bestMean = Double.MAX_VALUE;
      for (int dy = fromY; dy < toY; dy++) {
        double sum = 0d;
        for (int dx = fromX; dx < toX; dx++) {
          sum += luma(dx, dy);
        }
        double mean = sum / (toX - fromX);
        if (mean < bestMean) {
          bestMean = mean;
          bestRow = dy;
        }
      }
      return bestRow;
    }

    /** Mean BGR inside the given fractional window; grey frames repeat the single channel. */
    double[] meanBgr(double x0, double x1, double y0, double y1) {
      int w = region.width();
      int h = region.height();
      int fromX = (int) (w * x0);
      int toX = Math.max(fromX + 1, (int) (w * x1));
      int fromY = (int) (h * y0);
      int toY = Math.max(fromY + 1, (int) (h * y1));
      double[] sum = new double[3];
      long samples = 0;
      for (int dy = fromY; dy < toY; dy++) {
        for (int dx = fromX; dx < toX; dx++) {
          for (int c = 0; c < 3; c++) {
            int channel = frame.channels() == 3 ? c : 0;
            sum[c] += frame.intensity(region.x() + dx, region.y() + dy, channel);
          }
          samples++;
        }
      }
      for (int c = 0; c < 3; c++) {
        sum[c] /= samples;
      }
      return sum;
    }

    /**
     * Ratio of skin-like pixels in the lower third to the middle third. Values near 1 mean the lower
     * face is as wide as the cheeks.
     */
    double lowerFullness() {
      double middle = skinFraction(1d / 3d, 2d / 3d);
      double lower = skinFraction(2d / 3d, 1d);
      if (middle <= 0d) {
        return 0d;
      }
      return Math.min(1.5d, lower / middle);
    }

    private double skinFraction(double y0, double y1) {
      int w = region.width();
      int h = region.height();
      int fromY = (int) (h * y0);
      int toY = Math.max(fromY + 1, (int) (h * y1));
      long skin = 0;
      long total = 0;
      for (int dy = fromY; dy < toY && dy < h; dy++) {
        for (int dx = 0; dx < w; dx++) {
          if (isSkin(region.x() + dx, region.y() + dy)) {
            skin++;
          }
          total++;
        }
      }
      return total == 0 ? 0d : (double) skin / total;
    }

    /** Chroma rule in YCrCb space; grey frames fall back to a luma band. */
    private boolean isSkin(int x, int y) {
      if (frame.channels() == 1) {
        int v = frame.intensity(x, y, 0);
        return v > 60 && v < 230;
      }
      int b = frame.intensity(x, y, 0);
      int g = frame.intensity(x, y, 1);
      int r = frame.intensity(x, y, 2);
      double yy = 0.299d * r + 0.587d * g + 0.114d * b;
      double cr = (r - yy) * 0.713d + 128d;
      double cb = (b - yy) * 0.564d + 128d;
      return cr >= 133d && cr <= 173d && cb >= 77d && cb <= 127d;
    }
  }
}
