package ca.gc.cra.halo.application.trend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity FIFO of samples for one metric. The oldest sample is evicted first.
 *
 * <p>Not thread-safe; owned by a single analysis engine.
 *
 * @since 0.1.0
 */
public final class HistoryWindow {
  public static final int DEFAULT_CAPACITY = 30;

  private final int capacity;
  private final Deque<Double> samples;

  public HistoryWindow() {
    this(DEFAULT_CAPACITY);
  }

  public HistoryWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.samples = new ArrayDeque<>(capacity);
  }

  /** Appends a sample, evicting the oldest one when full. */
  public void add(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("sample must be finite");
    }
    if (samples.size() == capacity) {
      samples.removeFirst();
    }
    samples.addLast(value);
  }

  public int size() {
    return samples.size();
  }

  public int capacity() {
    return capacity;
  }

  /** Returns the retained samples, oldest first. */
  public List<Double> snapshot() {
    return new ArrayList<>(samples);
  }

  public void clear() {
    samples.clear();
  }
}
