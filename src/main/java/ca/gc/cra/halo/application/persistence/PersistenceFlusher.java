package ca.gc.cra.halo.application.persistence;

import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.application.port.StorageBackend;
import ca.gc.cra.halo.domain.error.StorageException;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Background task batching queued results into periodic storage writes.
 *
 * <p>Each {@link #tick()} drains the queue into an accumulator. Once the flush interval has elapsed
 * since the previous attempt and the accumulator is non-empty, the whole accumulator is saved as one
 * file. A successful save clears it; a failed save keeps every record so the next attempt writes the
 * union of old and new records. Attempts are spaced by the interval whether they succeed or not.
 *
 * <p>A backend that never recovers makes the accumulator grow without bound. That condition is only
 * reported through ERROR logs, {@code halo.persist.flush.error} and
 * {@code halo.persist.accumulator.size}.
 *
 * <p>When the running flag clears, {@link #run()} drains and flushes one last time regardless of the
 * interval.
 *
 * @since 0.1.0
 */
public final class PersistenceFlusher implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(PersistenceFlusher.class);
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final PersistenceQueue queue;
  private final StorageBackend storage;
  private final FlushSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AtomicBoolean running;
  private final AtomicBoolean flushRequested = new AtomicBoolean();
  private final List<SessionResult> accumulator = new ArrayList<>();
  private final ZoneId zone;

  private long lastAttemptMillis;
  private Path lastSavedFile;

  public PersistenceFlusher(
      PersistenceQueue queue,
      StorageBackend storage,
      FlushSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      AtomicBoolean running) {
    this(queue, storage, settings, clock, metrics, running, ZoneId.systemDefault());
  }

  PersistenceFlusher(
      PersistenceQueue queue,
      StorageBackend storage,
      FlushSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      AtomicBoolean running,
      ZoneId zone) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.running = Objects.requireNonNull(running, "running");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.lastAttemptMillis = clock.nowMillis();
  }

  @Override
  public void run() {
    MDC.put("pipeline", "flush");
    log.info(
        "Persistence flusher started; writing {} every {}s to {}",
        settings.format(),
        settings.interval().toSeconds(),
        settings.outputDirectory());
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        tick();
        try {
          TimeUnit.MILLISECONDS.sleep(settings.pollMillis());
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    } finally {
      flushRemaining();
      MDC.remove("pipeline");
    }
  }

  /**
   * Drains the queue and saves when the interval has elapsed or a flush was requested.
   *
   * @return {@code true} when a save succeeded during this tick
   */
  public synchronized boolean tick() {
    queue.drainTo(accumulator);
    metrics.observe("halo.persist.accumulator.size", accumulator.size());
    if (accumulator.isEmpty()) {
      flushRequested.set(false);
      return false;
    }
    long now = clock.nowMillis();
    boolean due = now - lastAttemptMillis >= settings.interval().toMillis();
    if (!due && !flushRequested.getAndSet(false)) {
      return false;
    }
    lastAttemptMillis = now;
    return save(now);
  }

  /**
   * Drains and saves whatever is pending, ignoring the interval.
   *
   * @return the written file, or empty when nothing was pending or the save failed
   */
  public synchronized Optional<Path> flushRemaining() {
    queue.drainTo(accumulator);
    if (accumulator.isEmpty()) {
      return Optional.empty();
    }
    long now = clock.nowMillis();
    lastAttemptMillis = now;
    if (save(now)) {
      return Optional.of(lastSavedFile);
    }
    log.error("Final flush failed; {} results were not persisted", accumulator.size());
    return Optional.empty();
  }

  /** Asks the next {@link #tick()} to save immediately. */
  public void requestFlush() {
    flushRequested.set(true);
  }

  /** Number of records waiting in the accumulator. */
  public synchronized int pendingCount() {
    return accumulator.size();
  }

  /** File written by the most recent successful save, if any. */
  public synchronized Optional<Path> lastSavedFile() {
    return Optional.ofNullable(lastSavedFile);
  }

  private boolean save(long now) {
    Path basePath = settings.outputDirectory().resolve(fileStem(now));
    List<SessionResult> batch = List.copyOf(accumulator);
    long start = System.nanoTime();
    try {
      Path written = storage.save(batch, basePath, settings.format());
      metrics.observe("halo.persist.flush.latencyNanos", System.nanoTime() - start);
      metrics.observe("halo.persist.flush.records", batch.size());
      metrics.increment("halo.persist.flush.success");
      accumulator.clear();
      lastSavedFile = written;
      log.info("Saved {} results to {}", batch.size(), written);
      return true;
    } catch (StorageException ex) {
      metrics.increment("halo.persist.flush.error");
      log.error(
          "Failed to save {} results to {}; keeping them for the next attempt",
          batch.size(),
          basePath,
          ex);
      return false;
    } catch (RuntimeException ex) {
      metrics.increment("halo.persist.flush.error");
      log.error("Unexpected failure saving {} results; keeping them for the next attempt", batch.size(), ex);
      return false;
    }
  }

  private String fileStem(long nowMillis) {
    return settings.filePrefix() + "_" + FILE_TIMESTAMP.format(Instant.ofEpochMilli(nowMillis).atZone(zone));
  }
}
