package ca.gc.cra.halo.domain.frame;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FrameTest {

  @Test
  void constructorCopiesPixelBuffer() {
    byte[] pixels = new byte[] {1, 2, 3, 4};
    Frame frame = new Frame(7L, 100L, 2, 2, 1, pixels);

    pixels[0] = 99;

    assertEquals(1, frame.intensity(0, 0, 0));
  }

  @Test
  void copyIsEqualButIndependent() {
    Frame frame = new Frame(1L, 5L, 1, 1, 3, new byte[] {10, 20, 30});
    Frame copy = frame.copy();

    assertEquals(frame, copy);
    assertNotSame(frame.pixels(), copy.pixels());
  }

  @Test
  void lumaWeightsBgrChannels() {
    Frame frame = new Frame(1L, 5L, 1, 1, 3, new byte[] {0, 0, (byte) 200});

    assertEquals(0.299d * 200, frame.luma(0, 0), 1e-9);
  }

  @Test
  void rejectsMismatchedBuffer() {
    assertThrows(IllegalArgumentException.class, () -> new Frame(1L, 0L, 2, 2, 3, new byte[4]));
    assertThrows(IllegalArgumentException.class, () -> new Frame(1L, 0L, 2, 2, 2, new byte[8]));
    assertThrows(IllegalArgumentException.class, () -> new Frame(1L, 0L, 0, 2, 1, new byte[0]));
  }
}
