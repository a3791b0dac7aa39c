package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.application.persistence.FlushSettings;
import ca.gc.cra.halo.validation.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * Runtime options of a continuous live run.
 *
 * @param device camera index or video path handed to the capture source
 * @param render display options
 * @param flush persistence options
 * @param idleSleepMillis analysis worker sleep when no new frame is available
 * @param shutdownTimeout how long to wait for the worker and flusher after the run ends
 * @since 0.1.0
 */
public record LiveSettings(
    String device,
    RenderSettings render,
    FlushSettings flush,
    long idleSleepMillis,
    Duration shutdownTimeout) {

  public LiveSettings {
    device = Strings.requireNonBlank("device", device);
    Objects.requireNonNull(render, "render");
    Objects.requireNonNull(flush, "flush");
    if (idleSleepMillis <= 0) {
      throw new IllegalArgumentException("idleSleepMillis must be positive");
    }
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
      throw new IllegalArgumentException("shutdownTimeout must be positive");
    }
  }
}
