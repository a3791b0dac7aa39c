package ca.gc.cra.halo.domain.frame;

/**
 * Axis-aligned bounding box reported by a region detector.
 *
 * @param x left edge in pixels
 * @param y top edge in pixels
 * @param width box width in pixels
 * @param height box height in pixels
 * @param confidence detector confidence in {@code [0, 1]}
 * @since 0.1.0
 */
public record DetectedRegion(int x, int y, int width, int height, double confidence) {

  public DetectedRegion {
    if (x < 0 || y < 0) {
      throw new IllegalArgumentException("region origin must be non-negative");
    }
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("region dimensions must be positive");
    }
    if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
      throw new IllegalArgumentException("confidence must be within [0, 1]");
    }
  }

  /** Convenience factory for detectors that do not report confidence. */
  public static DetectedRegion of(int x, int y, int width, int height) {
    return new DetectedRegion(x, y, width, height, 1d);
  }

  /** Returns {@code width * height}. */
  public long area() {
    return (long) width * height;
  }

  /** Returns a copy clipped to the given frame bounds. */
  public DetectedRegion clipTo(int frameWidth, int frameHeight) {
    int clippedX = Math.min(x, frameWidth - 1);
    int clippedY = Math.min(y, frameHeight - 1);
    int clippedW = Math.max(1, Math.min(width, frameWidth - clippedX));
    int clippedH = Math.max(1, Math.min(height, frameHeight - clippedY));
    return new DetectedRegion(clippedX, clippedY, clippedW, clippedH, confidence);
  }
}
