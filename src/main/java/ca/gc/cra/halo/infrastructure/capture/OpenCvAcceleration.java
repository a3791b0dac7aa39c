package ca.gc.cra.halo.infrastructure.capture;

import org.bytedeco.opencv.global.opencv_core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Toggles OpenCV's OpenCL path, which the Haar detector and colour conversions use when enabled.
 */
public final class OpenCvAcceleration {
  private static final Logger log = LoggerFactory.getLogger(OpenCvAcceleration.class);

  private OpenCvAcceleration() {}

  /**
   * Applies the acceleration preference.
   *
   * @param requested whether GPU acceleration was requested
   * @return label of the active compute path, {@code OpenCL} or {@code CPU}
   */
  public static String configure(boolean requested) {
    try {
      boolean available = opencv_core.haveOpenCL();
      opencv_core.setUseOpenCL(requested && available);
      if (requested && !available) {
        log.warn("GPU acceleration requested but OpenCL is unavailable; using CPU");
      }
      return opencv_core.useOpenCL() ? "OpenCL" : "CPU";
    } catch (UnsatisfiedLinkError ex) {
      log.warn("OpenCV natives unavailable; acceleration cannot be configured", ex);
      return "CPU";
    }
  }
}
