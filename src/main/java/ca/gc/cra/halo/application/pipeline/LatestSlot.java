package ca.gc.cra.halo.application.pipeline;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Single-value mailbox with most-recent-wins semantics.
 *
 * <p>{@link #publish} overwrites unconditionally and never blocks on anything but the slot lock.
 * {@link #takeLatest} returns a copy of the newest value; the copy is made outside the lock so a
 * slow reader never delays the producer. A value is never observed half-written because the lock
 * only guards the reference swap. {@link #takeUnread} skips the copy when nothing new arrived since
 * the previous read, for pollers that only care about fresh values.
 *
 * <p>Values overwritten before any reader saw them are counted as dropped; this is the intended
 * backpressure policy, not an error.
 *
 * @param <T> slot value type
 * @since 0.1.0
 */
public final class LatestSlot<T> {
  private final Object lock = new Object();
  private final UnaryOperator<T> copier;

  private T value;
  private boolean unread;
  private long dropped;

  /**
   * @param copier produces the copy handed to readers; {@link UnaryOperator#identity()} for
   *     immutable values
   */
  public LatestSlot(UnaryOperator<T> copier) {
    this.copier = Objects.requireNonNull(copier, "copier");
  }

  /**
   * Replaces the slot content.
   *
   * @return {@code true} when an unread value was overwritten
   */
  public boolean publish(T next) {
    Objects.requireNonNull(next, "next");
    synchronized (lock) {
      boolean overwrote = unread;
      if (overwrote) {
        dropped++;
      }
      value = next;
      unread = true;
      return overwrote;
    }
  }

  /** Returns a copy of the most recent value, or empty when nothing was published yet. */
  public Optional<T> takeLatest() {
    T current;
    synchronized (lock) {
      current = value;
      unread = false;
    }
    return current == null ? Optional.empty() : Optional.of(copier.apply(current));
  }

  /**
   * Returns a copy of the most recent value only if it was published after the previous read.
   *
   * @return the new value, or empty when the slot is empty or its value was already read
   */
  public Optional<T> takeUnread() {
    T current;
    synchronized (lock) {
      if (!unread) {
        return Optional.empty();
      }
      current = value;
      unread = false;
    }
    return Optional.of(copier.apply(current));
  }

  /** Number of values overwritten before being read. */
  public long droppedCount() {
    synchronized (lock) {
      return dropped;
    }
  }

  /** Empties the slot; used when a pipeline run ends. */
  public void clear() {
    synchronized (lock) {
      value = null;
      unread = false;
    }
  }
}
