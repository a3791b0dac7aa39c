package ca.gc.cra.halo.domain.frame;

import java.util.Arrays;

/**
 * Packed BGR pixel buffer captured from a camera or video source.
 *
 * <p>Pixels are stored row-major, {@code channels} bytes per pixel. The buffer is cloned on
 * construction so a published frame can never be mutated by the capture adapter that produced it.
 *
 * @param sequence monotonically increasing capture sequence assigned by the source
 * @param capturedAtMillis wall-clock capture timestamp in epoch milliseconds
 * @param width frame width in pixels
 * @param height frame height in pixels
 * @param channels bytes per pixel (1 for grey, 3 for BGR)
 * @param pixels packed pixel data of length {@code width * height * channels}
 * @since 0.1.0
 */
public record Frame(
    long sequence, long capturedAtMillis, int width, int height, int channels, byte[] pixels) {

  /**
   * Validates dimensions and clones the pixel buffer.
   *
   * @throws IllegalArgumentException if dimensions are not positive or the buffer length mismatches
   */
  public Frame {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("frame dimensions must be positive");
    }
    if (channels != 1 && channels != 3) {
      throw new IllegalArgumentException("channels must be 1 or 3 (was " + channels + ")");
    }
    if (pixels == null || pixels.length != width * height * channels) {
      throw new IllegalArgumentException(
          "pixel buffer must hold " + (width * height * channels) + " bytes");
    }
    pixels = pixels.clone();
  }

  /** Returns a deep copy safe to hand to another thread. */
  public Frame copy() {
    return new Frame(sequence, capturedAtMillis, width, height, channels, pixels);
  }

  /**
   * Returns the unsigned intensity of a pixel channel.
   *
   * @param x column
   * @param y row
   * @param channel channel index; 0 = blue, 1 = green, 2 = red for BGR frames
   * @return value in {@code [0, 255]}
   */
  public int intensity(int x, int y, int channel) {
    return pixels[(y * width + x) * channels + channel] & 0xFF;
  }

  /** Returns the luma of a pixel using BT.601 weights, or the raw value for grey frames. */
  public double luma(int x, int y) {
    if (channels == 1) {
      return intensity(x, y, 0);
    }
    int offset = (y * width + x) * 3;
    int b = pixels[offset] & 0xFF;
    int g = pixels[offset + 1] & 0xFF;
    int r = pixels[offset + 2] & 0xFF;
    return 0.114d * b + 0.587d * g + 0.299d * r;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Frame that)) {
      return false;
    }
    return sequence == that.sequence
        && capturedAtMillis == that.capturedAtMillis
        && width == that.width
        && height == that.height
        && channels == that.channels
        && Arrays.equals(pixels, that.pixels);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(sequence);
    result = 31 * result + Long.hashCode(capturedAtMillis);
    result = 31 * result + width;
    result = 31 * result + height;
    result = 31 * result + channels;
    result = 31 * result + Arrays.hashCode(pixels);
    return result;
  }

  @Override
  public String toString() {
    return "Frame{"
        + "sequence=" + sequence
        + ", capturedAtMillis=" + capturedAtMillis
        + ", size=" + width + "x" + height + "x" + channels
        + '}';
  }
}
