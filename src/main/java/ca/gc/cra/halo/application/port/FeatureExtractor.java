package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ExtractionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;

/**
 * Extracts feature measurements for one region of a frame.
 *
 * @since 0.1.0
 */
public interface FeatureExtractor {

  /**
   * @param frame source frame
   * @param region primary region inside {@code frame}
   * @return measurements; may be partially populated
   * @throws ExtractionException if no measurement could be computed
   */
  MeasurementBundle extract(Frame frame, DetectedRegion region) throws ExtractionException;
}
