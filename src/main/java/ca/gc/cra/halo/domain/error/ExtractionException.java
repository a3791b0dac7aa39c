package ca.gc.cra.halo.domain.error;

/**
 * Feature extraction failed for one frame.
 *
 * @since 0.1.0
 */
public final class ExtractionException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  public ExtractionException(String message) {
    super(AnalysisStage.EXTRACTION, message, null);
  }

  public ExtractionException(String message, Throwable cause) {
    super(AnalysisStage.EXTRACTION, message, cause);
  }
}
