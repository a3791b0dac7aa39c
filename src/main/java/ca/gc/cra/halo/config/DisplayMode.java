package ca.gc.cra.halo.config;

import java.awt.GraphicsEnvironment;
import java.util.Locale;

/**
 * Where frames and overlays are shown.
 *
 * @since 0.1.0
 */
public enum DisplayMode {
  /** Desktop window with keyboard controls. */
  CANVAS,
  /** No window; commands are read from standard input. */
  HEADLESS;

  /**
   * Parses a configured display mode. {@code auto} or a blank value picks {@link #HEADLESS} when the JVM
   * has no display and {@link #CANVAS} otherwise.
   *
   * @param raw configured value, may be {@code null}
   * @return resolved mode
   * @throws IllegalArgumentException when the value is not recognised
   */
  public static DisplayMode resolve(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("auto")) {
      return GraphicsEnvironment.isHeadless() ? HEADLESS : CANVAS;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("display must be canvas, headless or auto (was '" + raw + "')", ex);
    }
  }
}
