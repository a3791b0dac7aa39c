package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.frame.Frame;
import java.util.Optional;

/**
 * Window (or headless stand-in) showing frames with overlay text and collecting key presses.
 *
 * <p>Owned by the foreground thread; implementations are not required to be thread-safe.
 *
 * @since 0.1.0
 */
public interface DisplaySurface extends AutoCloseable {

  /**
   * Shows a frame with the overlay drawn on top.
   *
   * @param frame frame to display
   * @param overlay text and boxes; {@link Overlay#none()} for a bare frame
   */
  void show(Frame frame, Overlay overlay);

  /** Returns the next pending command without blocking. */
  Optional<UserCommand> pollKey();

  /** Returns {@code false} once the user closed the window. */
  default boolean isOpen() {
    return true;
  }

  @Override
  void close();
}
