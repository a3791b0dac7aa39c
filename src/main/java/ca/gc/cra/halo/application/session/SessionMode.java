package ca.gc.cra.halo.application.session;

import java.util.Locale;

/**
 * What a capture session assesses.
 *
 * @since 0.1.0
 */
public enum SessionMode {
  /** One face countdown. */
  FACE,
  /** A face countdown followed by a body countdown, saved as one combined result. */
  COMPLETE;

  /**
   * Parses {@code face} or {@code complete}, ignoring case.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static SessionMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("analysis mode must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (SessionMode mode : values()) {
      if (mode.name().equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("analysis must be face or complete (was '" + raw + "')");
  }
}
