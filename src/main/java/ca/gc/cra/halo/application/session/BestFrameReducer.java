package ca.gc.cra.halo.application.session;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the best candidate offered so far according to a comparator.
 *
 * <p>A candidate replaces the current best only when it compares strictly greater, so among equals
 * the earliest offer wins.
 *
 * @param <T> candidate type
 * @since 0.1.0
 */
public final class BestFrameReducer<T> {
  private final Comparator<? super T> order;
  private T best;

  public BestFrameReducer(Comparator<? super T> order) {
    this.order = Objects.requireNonNull(order, "order");
  }

  /**
   * Offers a candidate.
   *
   * @return {@code true} when the candidate became the new best
   */
  public boolean offer(T candidate) {
    Objects.requireNonNull(candidate, "candidate");
    if (best == null || order.compare(candidate, best) > 0) {
      best = candidate;
      return true;
    }
    return false;
  }

  public Optional<T> best() {
    return Optional.ofNullable(best);
  }

  public void reset() {
    best = null;
  }
}
