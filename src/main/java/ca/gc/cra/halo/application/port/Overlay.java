package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.frame.DetectedRegion;
import java.util.List;
import java.util.Objects;

/**
 * Text and boxes drawn over a displayed frame.
 *
 * @param lines text lines, top to bottom
 * @param boxes regions outlined on the frame
 * @since 0.1.0
 */
public record Overlay(List<String> lines, List<DetectedRegion> boxes) {
  private static final Overlay NONE = new Overlay(List.of(), List.of());

  public Overlay {
    lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    boxes = List.copyOf(Objects.requireNonNull(boxes, "boxes"));
  }

  public static Overlay none() {
    return NONE;
  }

  public static Overlay text(List<String> lines) {
    return new Overlay(lines, List.of());
  }
}
