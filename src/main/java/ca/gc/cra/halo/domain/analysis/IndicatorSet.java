package ca.gc.cra.halo.domain.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Named indicators derived from a {@link MeasurementBundle}, plus advisory notes.
 *
 * @since 0.1.0
 */
public final class IndicatorSet {
  private static final IndicatorSet EMPTY = new IndicatorSet(Map.of(), List.of());

  private final Map<String, IndicatorValue> values;
  private final List<String> notes;

  private IndicatorSet(Map<String, IndicatorValue> values, List<String> notes) {
    this.values = values;
    this.notes = notes;
  }

  public static IndicatorSet empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<IndicatorValue> get(String name) {
    return Optional.ofNullable(values.get(name));
  }

  /** Returns the numeric value when {@code name} is present as a {@link IndicatorValue.Score}. */
  public OptionalDouble score(String name) {
    if (values.get(name) instanceof IndicatorValue.Score score) {
      return OptionalDouble.of(score.value());
    }
    return OptionalDouble.empty();
  }

  /** Returns the label when {@code name} is present as a {@link IndicatorValue.Label}. */
  public Optional<String> label(String name) {
    if (values.get(name) instanceof IndicatorValue.Label label) {
      return Optional.of(label.value());
    }
    return Optional.empty();
  }

  /** Returns the text when {@code name} is present as a {@link IndicatorValue.Note}. */
  public Optional<String> note(String name) {
    if (values.get(name) instanceof IndicatorValue.Note note) {
      return Optional.of(note.text());
    }
    return Optional.empty();
  }

  public Map<String, IndicatorValue> values() {
    return values;
  }

  public List<String> notes() {
    return notes;
  }

  public boolean isEmpty() {
    return values.isEmpty() && notes.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof IndicatorSet that && values.equals(that.values) && notes.equals(that.notes);
  }

  @Override
  public int hashCode() {
    return 31 * values.hashCode() + notes.hashCode();
  }

  @Override
  public String toString() {
    return "IndicatorSet{values=" + values + ", notes=" + notes + '}';
  }

  /** Mutable builder; not thread-safe. */
  public static final class Builder {
    private final Map<String, IndicatorValue> values = new LinkedHashMap<>();
    private final List<String> notes = new ArrayList<>();

    private Builder() {}

    public Builder put(String name, IndicatorValue value) {
      values.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder score(String name, double value) {
      return put(name, new IndicatorValue.Score(value));
    }

    public Builder label(String name, String value) {
      return put(name, new IndicatorValue.Label(value));
    }

    public Builder note(String name, String text) {
      return put(name, new IndicatorValue.Note(text));
    }

    public Builder addNote(String note) {
      notes.add(Objects.requireNonNull(note, "note"));
      return this;
    }

    public IndicatorSet build() {
      if (values.isEmpty() && notes.isEmpty()) {
        return EMPTY;
      }
      return new IndicatorSet(
          Collections.unmodifiableMap(new LinkedHashMap<>(values)), List.copyOf(notes));
    }
  }
}
