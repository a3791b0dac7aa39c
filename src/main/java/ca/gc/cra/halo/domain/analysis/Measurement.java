package ca.gc.cra.halo.domain.analysis;

import java.util.List;

/**
 * Single named measurement: a scalar or a short vector (for example a mean BGR colour).
 *
 * @param values measurement components; never empty
 * @since 0.1.0
 */
public record Measurement(List<Double> values) {

  public Measurement {
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("measurement must have at least one value");
    }
    for (Double value : values) {
      if (value == null || !Double.isFinite(value)) {
        throw new IllegalArgumentException("measurement values must be finite");
      }
    }
    values = List.copyOf(values);
  }

  public static Measurement scalar(double value) {
    return new Measurement(List.of(value));
  }

  public static Measurement vector(double... components) {
    Double[] boxed = new Double[components.length];
    for (int i = 0; i < components.length; i++) {
      boxed[i] = components[i];
    }
    return new Measurement(List.of(boxed));
  }

  public boolean isScalar() {
    return values.size() == 1;
  }

  /** Returns the first component; for vectors this is the first channel. */
  public double asScalar() {
    return values.get(0);
  }
}
