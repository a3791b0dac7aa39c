package ca.gc.cra.halo.domain.error;

import java.util.Objects;

/**
 * Failure of a single analysis stage. Aborts the current cycle only.
 *
 * @since 0.1.0
 */
public abstract class AnalysisException extends HaloException {
  private static final long serialVersionUID = 1L;

  private final AnalysisStage stage;

  protected AnalysisException(AnalysisStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public AnalysisStage stage() {
    return stage;
  }
}
