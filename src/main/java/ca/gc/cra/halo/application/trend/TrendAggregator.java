package ca.gc.cra.halo.application.trend;

import ca.gc.cra.halo.domain.analysis.Stability;
import ca.gc.cra.halo.domain.analysis.Trend;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-metric history windows with a two-window mean-shift trend.
 *
 * <p>With at least {@value #MIN_SAMPLES} samples, the mean of the latest {@value #EDGE_SAMPLES}
 * samples is compared to the mean of the earliest {@value #EDGE_SAMPLES} retained samples. A
 * difference above {@value #BAND} is {@link Trend#INCREASING}, below {@code -BAND} is
 * {@link Trend#DECREASING}, anything inside the band is {@link Trend#STABLE}. This is a cheap
 * comparison of two windows, not a regression, and ignores noise smaller than the band.
 *
 * <p>Alongside the trend, the population standard deviation of the whole window gives the
 * metric's {@link Stability}: above {@value #SPREAD_LIMIT} it is {@link Stability#VARIABLE}. A
 * metric can hold a stable trend while swinging from frame to frame.
 *
 * <p>Not thread-safe; owned by a single analysis engine.
 *
 * @since 0.1.0
 */
public final class TrendAggregator {
  static final int MIN_SAMPLES = 10;
  static final int EDGE_SAMPLES = 5;
  static final double BAND = 0.2d;
  static final double SPREAD_LIMIT = 0.1d;

  private final int capacity;
  private final Map<String, HistoryWindow> windows = new LinkedHashMap<>();

  public TrendAggregator() {
    this(HistoryWindow.DEFAULT_CAPACITY);
  }

  public TrendAggregator(int capacity) {
    if (capacity < MIN_SAMPLES) {
      throw new IllegalArgumentException("capacity must be at least " + MIN_SAMPLES);
    }
    this.capacity = capacity;
  }

  /** Appends a sample to the window of {@code metric}, creating the window on first use. */
  public void record(String metric, double value) {
    Objects.requireNonNull(metric, "metric");
    windows.computeIfAbsent(metric, m -> new HistoryWindow(capacity)).add(value);
  }

  /** Returns the trend of {@code metric}, or empty while fewer than ten samples are held. */
  public Optional<Trend> trend(String metric) {
    HistoryWindow window = windows.get(metric);
    if (window == null) {
      return Optional.empty();
    }
    return classify(window.snapshot());
  }

  /** Returns the trend of every metric that has enough history. */
  public Map<String, Trend> trends() {
    Map<String, Trend> result = new LinkedHashMap<>();
    for (Map.Entry<String, HistoryWindow> entry : windows.entrySet()) {
      classify(entry.getValue().snapshot()).ifPresent(trend -> result.put(entry.getKey(), trend));
    }
    return Collections.unmodifiableMap(result);
  }

  /** Returns the stability of {@code metric}, or empty while fewer than ten samples are held. */
  public Optional<Stability> stability(String metric) {
    HistoryWindow window = windows.get(metric);
    if (window == null) {
      return Optional.empty();
    }
    return classifyStability(window.snapshot());
  }

  /** Returns the stability of every metric that has enough history. */
  public Map<String, Stability> stabilities() {
    Map<String, Stability> result = new LinkedHashMap<>();
    for (Map.Entry<String, HistoryWindow> entry : windows.entrySet()) {
      classifyStability(entry.getValue().snapshot())
          .ifPresent(stability -> result.put(entry.getKey(), stability));
    }
    return Collections.unmodifiableMap(result);
  }

  /** Returns the number of samples held for {@code metric}. */
  public int sampleCount(String metric) {
    HistoryWindow window = windows.get(metric);
    return window == null ? 0 : window.size();
  }

  public void clear() {
    windows.clear();
  }

  /**
   * Classifies an oldest-first sample list.
   *
   * @param samples retained samples, oldest first
   * @return trend, or empty with fewer than ten samples
   */
  public static Optional<Trend> classify(List<Double> samples) {
    if (samples.size() < MIN_SAMPLES) {
      return Optional.empty();
    }
    double earliest = mean(samples.subList(0, EDGE_SAMPLES));
    double latest = mean(samples.subList(samples.size() - EDGE_SAMPLES, samples.size()));
    double delta = latest - earliest;
    if (delta > BAND) {
      return Optional.of(Trend.INCREASING);
    }
    if (delta < -BAND) {
      return Optional.of(Trend.DECREASING);
    }
    return Optional.of(Trend.STABLE);
  }

  /**
   * Classifies the spread of an oldest-first sample list.
   *
   * @param samples retained samples, oldest first
   * @return stability, or empty with fewer than ten samples
   */
  public static Optional<Stability> classifyStability(List<Double> samples) {
    if (samples.size() < MIN_SAMPLES) {
      return Optional.empty();
    }
    double mean = mean(samples);
    double squares = 0d;
    for (double value : samples) {
      squares += (value - mean) * (value - mean);
    }
    double deviation = Math.sqrt(squares / samples.size());
    return Optional.of(deviation > SPREAD_LIMIT ? Stability.VARIABLE : Stability.STABLE);
  }

  private static double mean(List<Double> values) {
    double sum = 0d;
    for (double value : values) {
      sum += value;
    }
    return sum / values.size();
  }
}
