package ca.gc.cra.halo.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the background threads of a HALO pipeline run.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor with one dedicated thread per long-running task.
   *
   * <p>Tasks are handed over directly; submitting more tasks than threads is rejected so a wiring
   * mistake surfaces immediately instead of queueing a loop behind another loop.
   *
   * @param size number of long-running tasks
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newPipelinePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedThreadFactory(prefix, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Returns a factory creating non-daemon threads named {@code prefix-N}.
   *
   * @param prefix thread-name prefix; defaults to {@code halo-pipeline} when blank
   * @param handler uncaught exception handler; a no-op handler when {@code null}
   */
  public static ThreadFactory namedThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "halo-pipeline" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
