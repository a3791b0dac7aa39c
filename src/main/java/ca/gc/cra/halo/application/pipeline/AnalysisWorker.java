package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.application.persistence.PersistenceQueue;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.domain.error.AnalysisException;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Background loop analysing the newest captured frame.
 *
 * <p>Each cycle takes the latest frame from the frame slot. When nothing new was published the
 * worker sleeps briefly and polls again. Otherwise the frame runs through the {@link AnalysisEngine};
 * a produced snapshot is published to the result slot for the overlay and its result is queued for
 * persistence.
 *
 * <p>A failing detection, extraction or scoring step only aborts its own cycle: the failure is
 * logged and counted under {@code halo.analysis.failure.<stage>} and the loop moves on to the next
 * frame. The loop ends when the shared running flag clears or the thread is interrupted.
 *
 * @since 0.1.0
 */
public final class AnalysisWorker implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(AnalysisWorker.class);
  private static final int FAILURE_LOG_INTERVAL = 100;

  private final LatestSlot<Frame> frames;
  private final LatestSlot<AnalysisSnapshot> results;
  private final AnalysisEngine engine;
  private final PersistenceQueue queue;
  private final AtomicBoolean running;
  private final FpsMeter analysisFps;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final long idleSleepMillis;
  private final AtomicInteger failureCount = new AtomicInteger();

  public AnalysisWorker(
      LatestSlot<Frame> frames,
      LatestSlot<AnalysisSnapshot> results,
      AnalysisEngine engine,
      PersistenceQueue queue,
      AtomicBoolean running,
      FpsMeter analysisFps,
      MetricsPort metrics,
      ClockPort clock,
      long idleSleepMillis) {
    this.frames = Objects.requireNonNull(frames, "frames");
    this.results = Objects.requireNonNull(results, "results");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.running = Objects.requireNonNull(running, "running");
    this.analysisFps = Objects.requireNonNull(analysisFps, "analysisFps");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (idleSleepMillis <= 0) {
      throw new IllegalArgumentException("idleSleepMillis must be positive");
    }
    this.idleSleepMillis = idleSleepMillis;
  }

  @Override
  public void run() {
    MDC.put("pipeline", "analysis");
    log.info("Analysis worker started for session {}", engine.sessionId());
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        if (!runCycle()) {
          try {
            TimeUnit.MILLISECONDS.sleep(idleSleepMillis);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            break;
          }
        }
      }
    } finally {
      log.info("Analysis worker stopped after {} failed cycles", failureCount.get());
      MDC.remove("pipeline");
    }
  }

  /**
   * Runs one cycle.
   *
   * @return {@code false} when no new frame was available, so the caller should idle
   */
  boolean runCycle() {
    Optional<Frame> next = frames.takeUnread();
    if (next.isEmpty()) {
      return false;
    }
    Frame frame = next.get();
    metrics.increment("halo.analysis.cycles");
    long start = System.nanoTime();
    try {
      Optional<AnalysisSnapshot> snapshot = engine.analyze(frame);
      analysisFps.tick(clock.nowMillis());
      if (snapshot.isEmpty()) {
        metrics.increment("halo.analysis.noRegion");
        return true;
      }
      results.publish(snapshot.get());
      queue.enqueue(snapshot.get().result());
      metrics.increment("halo.analysis.published");
      metrics.observe("halo.analysis.latencyNanos", System.nanoTime() - start);
    } catch (AnalysisException ex) {
      metrics.increment("halo.analysis.failure." + ex.stage().metricName());
      logFailure(frame, ex.stage().metricName(), ex);
    } catch (RuntimeException ex) {
      metrics.increment("halo.analysis.failure.unexpected");
      logFailure(frame, "unexpected", ex);
    }
    return true;
  }

  private void logFailure(Frame frame, String stage, Exception ex) {
    int failures = failureCount.incrementAndGet();
    if (failures == 1 || failures % FAILURE_LOG_INTERVAL == 0) {
      log.warn("Analysis {} failed on frame {} ({} failures so far)", stage, frame.sequence(), failures, ex);
    } else {
      log.debug("Analysis {} failed on frame {}: {}", stage, frame.sequence(), ex.getMessage());
    }
  }
}
