package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.validation.Numbers;
import java.util.Objects;

/**
 * Display options for the {@link RenderLoop}.
 *
 * @param frameSkip render only every Nth captured frame; 1 renders all
 * @param overlayEnabled initial overlay visibility
 * @param accelerationLabel compute backend shown on screen, for example {@code CPU} or {@code OpenCL}
 * @since 0.1.0
 */
public record RenderSettings(int frameSkip, boolean overlayEnabled, String accelerationLabel) {

  public RenderSettings {
    Numbers.requireRange("frameSkip", frameSkip, 1, 120);
    Objects.requireNonNull(accelerationLabel, "accelerationLabel");
  }
}
