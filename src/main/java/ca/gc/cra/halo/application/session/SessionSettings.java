package ca.gc.cra.halo.application.session;

import ca.gc.cra.halo.application.persistence.FlushSettings;
import ca.gc.cra.halo.validation.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * Options of a single-shot capture session.
 *
 * @param device camera index or video path
 * @param countdown delay between trigger and capture
 * @param flush where the captured result is written
 * @param autoTrigger arm the countdown on the first frame instead of waiting for the capture key
 * @param mode face only, or face followed by body
 * @since 0.1.0
 */
public record SessionSettings(
    String device, Duration countdown, FlushSettings flush, boolean autoTrigger, SessionMode mode) {

  public SessionSettings {
    device = Strings.requireNonBlank("device", device);
    Objects.requireNonNull(countdown, "countdown");
    if (countdown.isNegative()) {
      throw new IllegalArgumentException("countdown must not be negative");
    }
    Objects.requireNonNull(flush, "flush");
    Objects.requireNonNull(mode, "mode");
  }

  public SessionSettings(String device, Duration countdown, FlushSettings flush, boolean autoTrigger) {
    this(device, countdown, flush, autoTrigger, SessionMode.FACE);
  }
}
