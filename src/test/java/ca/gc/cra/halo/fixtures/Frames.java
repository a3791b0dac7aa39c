package ca.gc.cra.halo.fixtures;

import ca.gc.cra.halo.domain.frame.Frame;
import java.util.Arrays;
import java.util.function.BiPredicate;

/** Small synthetic frames for pipeline tests. */
public final class Frames {
  private Frames() {}

  public static Frame gray(long sequence) {
    return filled(sequence, 64, 48, 1, (byte) 90);
  }

  public static Frame filled(long sequence, int width, int height, int channels, byte value) {
    byte[] pixels = new byte[width * height * channels];
    Arrays.fill(pixels, value);
    return new Frame(sequence, 1_000L + sequence, width, height, channels, pixels);
  }

  /** Grey frame, dark except where {@code foreground} holds for {@code (x, y)}. */
  public static Frame silhouette(long sequence, int width, int height, BiPredicate<Integer, Integer> foreground) {
    byte[] pixels = new byte[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        pixels[y * width + x] = foreground.test(x, y) ? (byte) 200 : (byte) 5;
      }
    }
    return new Frame(sequence, 1_000L + sequence, width, height, 1, pixels);
  }

  /** Dark frame with one bright upright box. */
  public static Frame standing(long sequence, int x, int y, int width, int height) {
    return silhouette(sequence, 64, 96, (px, py) -> px >= x && px < x + width && py >= y && py < y + height);
  }
}
