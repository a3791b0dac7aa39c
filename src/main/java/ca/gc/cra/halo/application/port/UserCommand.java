package ca.gc.cra.halo.application.port;

/**
 * Keyboard commands understood by the render loop and the capture session.
 *
 * @since 0.1.0
 */
public enum UserCommand {
  /** Stop the pipeline ({@code q}). */
  QUIT,
  /** Start a countdown capture, or force a flush in live mode (space bar). */
  CAPTURE,
  /** Show or hide the analysis overlay ({@code o}). */
  TOGGLE_OVERLAY
}
