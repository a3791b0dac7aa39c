package ca.gc.cra.halo.domain.analysis;

/**
 * Direction of a metric over its retained history window.
 *
 * @since 0.1.0
 */
public enum Trend {
  INCREASING("↑"),
  DECREASING("↓"),
  STABLE("→");

  private final String arrow;

  Trend(String arrow) {
    this.arrow = arrow;
  }

  /** Arrow glyph used by the overlay. */
  public String arrow() {
    return arrow;
  }
}
