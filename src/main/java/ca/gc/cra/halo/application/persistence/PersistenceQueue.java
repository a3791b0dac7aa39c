package ca.gc.cra.halo.application.persistence;

import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.util.Collection;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Unbounded hand-off between result producers and the {@link PersistenceFlusher}.
 *
 * <p>{@link #enqueue} never blocks. Producers are the analysis worker and the capture session; the
 * only consumer is the flusher.
 *
 * @since 0.1.0
 */
public final class PersistenceQueue {
  private final Queue<SessionResult> queue = new ConcurrentLinkedQueue<>();
  private final MetricsPort metrics;

  public PersistenceQueue(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Appends a result; each result must be enqueued exactly once. */
  public void enqueue(SessionResult result) {
    queue.add(Objects.requireNonNull(result, "result"));
    metrics.increment("halo.persist.enqueued");
  }

  /**
   * Moves every currently queued result into {@code target} without blocking.
   *
   * @return number of results moved
   */
  public int drainTo(Collection<SessionResult> target) {
    int drained = 0;
    SessionResult next;
    while ((next = queue.poll()) != null) {
      target.add(next);
      drained++;
    }
    return drained;
  }

  public int size() {
    return queue.size();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }
}
