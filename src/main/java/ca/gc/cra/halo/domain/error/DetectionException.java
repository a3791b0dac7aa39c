package ca.gc.cra.halo.domain.error;

/**
 * Region detection failed for one frame.
 *
 * @since 0.1.0
 */
public final class DetectionException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  public DetectionException(String message) {
    super(AnalysisStage.DETECTION, message, null);
  }

  public DetectionException(String message, Throwable cause) {
    super(AnalysisStage.DETECTION, message, cause);
  }
}
