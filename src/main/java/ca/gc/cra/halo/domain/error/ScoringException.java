package ca.gc.cra.halo.domain.error;

/**
 * Indicator scoring failed for one frame.
 *
 * @since 0.1.0
 */
public final class ScoringException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  public ScoringException(String message) {
    super(AnalysisStage.SCORING, message, null);
  }

  public ScoringException(String message, Throwable cause) {
    super(AnalysisStage.SCORING, message, cause);
  }
}
