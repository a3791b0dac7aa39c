package ca.gc.cra.halo.application.pipeline;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling frames-per-second estimate over the last {@value #WINDOW} ticks.
 *
 * <p>Written by one thread and read by the render loop, so access is synchronized.
 *
 * @since 0.1.0
 */
public final class FpsMeter {
  static final int WINDOW = 30;

  private final Deque<Long> ticks = new ArrayDeque<>(WINDOW + 1);

  /** Records one event at {@code nowMillis}. */
  public synchronized void tick(long nowMillis) {
    ticks.addLast(nowMillis);
    if (ticks.size() > WINDOW) {
      ticks.removeFirst();
    }
  }

  /** Returns events per second across the window, or 0 with fewer than two ticks. */
  public synchronized double fps() {
    if (ticks.size() < 2) {
      return 0d;
    }
    long span = ticks.peekLast() - ticks.peekFirst();
    if (span <= 0) {
      return 0d;
    }
    return (ticks.size() - 1) * 1000d / span;
  }
}
