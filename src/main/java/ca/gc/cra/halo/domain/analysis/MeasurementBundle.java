package ca.gc.cra.halo.domain.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Grouped feature measurements extracted from one region of one frame.
 *
 * <p>Groups and names keep insertion order so persisted output is stable. A bundle may be partially
 * populated when an extractor could only compute some groups.
 *
 * @since 0.1.0
 */
public final class MeasurementBundle {
  public static final String GROUP_METRICS = "metrics";
  public static final String GROUP_SYMMETRY = "symmetry";
  public static final String GROUP_RATIOS = "facial_ratios";
  public static final String GROUP_COLOR = "color";
  public static final String GROUP_KEYPOINTS = "keypoints";
  public static final String GROUP_BODY = "body_metrics";

  private static final MeasurementBundle EMPTY = new MeasurementBundle(Map.of());

  private final Map<String, Map<String, Measurement>> groups;

  private MeasurementBundle(Map<String, Map<String, Measurement>> groups) {
    this.groups = groups;
  }

  public static MeasurementBundle empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the measurements of {@code group}, or an empty map. */
  public Map<String, Measurement> group(String group) {
    return groups.getOrDefault(group, Map.of());
  }

  public Optional<Measurement> find(String group, String name) {
    return Optional.ofNullable(group(group).get(name));
  }

  /** Returns the scalar value of a measurement when present. */
  public OptionalDouble scalar(String group, String name) {
    Measurement measurement = group(group).get(name);
    return measurement == null ? OptionalDouble.empty() : OptionalDouble.of(measurement.asScalar());
  }

  /** Returns all groups in insertion order. */
  public Map<String, Map<String, Measurement>> groups() {
    return groups;
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof MeasurementBundle that && groups.equals(that.groups);
  }

  @Override
  public int hashCode() {
    return groups.hashCode();
  }

  @Override
  public String toString() {
    return "MeasurementBundle" + groups;
  }

  /** Mutable builder; not thread-safe. */
  public static final class Builder {
    private final Map<String, Map<String, Measurement>> groups = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String group, String name, Measurement value) {
      Objects.requireNonNull(group, "group");
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
      groups.computeIfAbsent(group, g -> new LinkedHashMap<>()).put(name, value);
      return this;
    }

    public Builder put(String group, String name, double value) {
      return put(group, name, Measurement.scalar(value));
    }

    public MeasurementBundle build() {
      if (groups.isEmpty()) {
        return EMPTY;
      }
      Map<String, Map<String, Measurement>> copy = new LinkedHashMap<>();
      groups.forEach((group, values) ->
          copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
      return new MeasurementBundle(Collections.unmodifiableMap(copy));
    }
  }
}
