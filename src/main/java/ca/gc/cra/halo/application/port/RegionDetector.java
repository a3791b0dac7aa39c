package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import java.util.List;

/**
 * Locates candidate regions of interest (faces) in a frame.
 *
 * <p>Implementations are used from a single analysis thread at a time but a live run and a capture
 * session may each hold their own instance.
 *
 * @since 0.1.0
 */
public interface RegionDetector {

  /**
   * Detects regions in {@code frame}.
   *
   * @param frame frame to inspect; never mutated
   * @return regions in detector order, possibly empty
   * @throws DetectionException if detection fails for this frame
   */
  List<DetectedRegion> detect(Frame frame) throws DetectionException;
}
