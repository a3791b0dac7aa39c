package ca.gc.cra.halo.domain.error;

import java.util.Locale;

/**
 * Analysis pipeline stage, used to tag per-cycle failures in logs and metrics.
 *
 * @since 0.1.0
 */
public enum AnalysisStage {
  DETECTION,
  EXTRACTION,
  SCORING;

  /** Lower-case name used as a metric suffix. */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
