package ca.gc.cra.halo.domain.analysis;

import java.util.Objects;

/**
 * Value of a derived indicator: a numeric score, a classification label or a free-text note.
 *
 * @since 0.1.0
 */
public sealed interface IndicatorValue
    permits IndicatorValue.Score, IndicatorValue.Label, IndicatorValue.Note {

  /** Returns a printable representation used by overlays and flattened exports. */
  String display();

  /** Numeric indicator, for example a symmetry ratio in {@code [0, 1]}. */
  record Score(double value) implements IndicatorValue {
    public Score {
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("score must be finite");
      }
    }

    @Override
    public String display() {
      return String.format(java.util.Locale.ROOT, "%.3f", value);
    }
  }

  /** Classification such as {@code Mild} or {@code Severe}. */
  record Label(String value) implements IndicatorValue {
    public Label {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value;
    }
  }

  /** Free-text observation such as a skin tone remark. */
  record Note(String text) implements IndicatorValue {
    public Note {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String display() {
      return text;
    }
  }
}
