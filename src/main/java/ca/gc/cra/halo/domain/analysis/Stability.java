package ca.gc.cra.halo.domain.analysis;

/**
 * Spread of a metric over its retained history window, independent of its {@link Trend}.
 *
 * @since 0.1.0
 */
public enum Stability {
  STABLE("Stable"),
  VARIABLE("Variable");

  private final String label;

  Stability(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
