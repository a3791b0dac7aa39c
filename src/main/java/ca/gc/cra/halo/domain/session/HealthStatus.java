package ca.gc.cra.halo.domain.session;

/**
 * Status band derived from an aggregate health score on the 0-10 scale.
 *
 * @since 0.1.0
 */
public enum HealthStatus {
  EXCELLENT("Excellent", 8.5d),
  GOOD("Good", 7.0d),
  FAIR("Fair", 5.5d),
  CONCERNING("Concerning", 4.0d),
  POOR("Poor", Double.NEGATIVE_INFINITY),
  /** No weighted indicator was available, so no score was computed. */
  INSUFFICIENT_DATA("Insufficient data", Double.NaN);

  private final String displayName;
  private final double lowerBound;

  HealthStatus(String displayName, double lowerBound) {
    this.displayName = displayName;
    this.lowerBound = lowerBound;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Classifies a score into the first band whose lower bound it meets.
   *
   * @param score aggregate score in {@code [0, 10]}
   * @return matching band; never {@link #INSUFFICIENT_DATA}
   */
  public static HealthStatus fromScore(double score) {
    for (HealthStatus status : values()) {
      if (status != INSUFFICIENT_DATA && score >= status.lowerBound) {
        return status;
      }
    }
    return POOR;
  }
}
