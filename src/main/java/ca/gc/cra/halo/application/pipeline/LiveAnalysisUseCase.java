package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.application.persistence.PersistenceFlusher;
import ca.gc.cra.halo.application.persistence.PersistenceQueue;
import ca.gc.cra.halo.application.port.CaptureSource;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.DisplaySurface;
import ca.gc.cra.halo.application.port.MetricsPort;
import ca.gc.cra.halo.application.port.StorageBackend;
import ca.gc.cra.halo.domain.error.DeviceUnavailableException;
import ca.gc.cra.halo.domain.error.HaloException;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Continuous live analysis: capture, background analysis, batched persistence.
 * <p><strong>Why:</strong> Keeps the display responsive while analysis and disk writes run at their own pace.</p>
 * <p><strong>Role:</strong> Application service wiring the three long-running tasks of a live run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the capture device before any thread starts; a missing device fails fast.</li>
 *   <li>Run the {@link AnalysisWorker} and {@link PersistenceFlusher} on dedicated threads and the
 *       {@link RenderLoop} on the calling thread.</li>
 *   <li>Stop every task through one shared running flag, wait a bounded time for the background
 *       threads, then release the device, display and storage.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A single instance runs at most once at a time.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code pipeline=live}; emits {@code halo.capture.*},
 * {@code halo.analysis.*} and {@code halo.persist.*} metrics through its collaborators.</p>
 *
 * @since 0.1.0
 */
public final class LiveAnalysisUseCase {
  private static final Logger log = LoggerFactory.getLogger(LiveAnalysisUseCase.class);

  private final CaptureSource captureSource;
  private final DisplaySurface display;
  private final AnalysisEngine engine;
  private final StorageBackend storage;
  private final LiveSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final AtomicReference<Throwable> backgroundFailure = new AtomicReference<>();

  private volatile ExecutorService executor;

  public LiveAnalysisUseCase(
      CaptureSource captureSource,
      DisplaySurface display,
      AnalysisEngine engine,
      StorageBackend storage,
      LiveSettings settings,
      MetricsPort metrics,
      ClockPort clock) {
    this.captureSource = Objects.requireNonNull(captureSource, "captureSource");
    this.display = Objects.requireNonNull(display, "display");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs until the user quits, the window closes or capture fails.
   *
   * @return summary of the run
   * @throws HaloException when the device cannot be opened or a frame read fails
   * @throws InterruptedException when interrupted while waiting for background tasks
   */
  public LiveRunSummary run() throws HaloException, InterruptedException {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Live analysis already running");
    }
    MDC.put("pipeline", "live");
    try {
      try {
        captureSource.open(settings.device());
      } catch (DeviceUnavailableException ex) {
        closeQuietly();
        throw ex;
      }
      log.info("Capture device {} opened using {}", settings.device(), captureSource.backendName());

      LatestSlot<Frame> frames = new LatestSlot<>(Frame::copy);
      LatestSlot<AnalysisSnapshot> results = new LatestSlot<>(UnaryOperator.identity());
      PersistenceQueue queue = new PersistenceQueue(metrics);
      FpsMeter analysisFps = new FpsMeter();
      running.set(true);
      backgroundFailure.set(null);

      PersistenceFlusher flusher =
          new PersistenceFlusher(queue, storage, settings.flush(), clock, metrics, running);
      AnalysisWorker worker = new AnalysisWorker(
          frames, results, engine, queue, running, analysisFps, metrics, clock, settings.idleSleepMillis());
      RenderLoop renderLoop = new RenderLoop(
          captureSource, display, frames, results, running, analysisFps,
          flusher::requestFlush, settings.render(), metrics, clock);

      HaloException primaryFailure = null;
      long frameCount = 0;
      startBackground(worker, flusher);
      try {
        frameCount = renderLoop.run();
      } catch (HaloException ex) {
        primaryFailure = ex;
      } finally {
        running.set(false);
        try {
          shutdownBackground();
          // Results queued by the worker after the flusher's last drain.
          flusher.flushRemaining();
        } finally {
          closeQuietly();
          frames.clear();
          results.clear();
        }
      }

      Throwable crash = backgroundFailure.get();
      if (crash != null) {
        log.error("A background task terminated abnormally", crash);
      }
      if (primaryFailure != null) {
        throw primaryFailure;
      }
      Optional<Path> lastFile = flusher.lastSavedFile();
      LiveRunSummary summary = new LiveRunSummary(frameCount, frames.droppedCount(), flusher.pendingCount(), lastFile);
      log.info(
          "Live analysis finished after {} frames ({} dropped before analysis); last file {}",
          summary.framesCaptured(),
          summary.framesDropped(),
          lastFile.map(Object::toString).orElse("<none>"));
      return summary;
    } finally {
      runThread.set(null);
      MDC.remove("pipeline");
    }
  }

  /** Requests a stop from another thread; the run returns after its current cycle. */
  public void stop() {
    running.set(false);
  }

  boolean isRunning() {
    return running.get();
  }

  private void startBackground(AnalysisWorker worker, PersistenceFlusher flusher) {
    UncaughtExceptionHandler handler = (thread, ex) -> {
      metrics.increment("halo.pipeline.uncaught");
      backgroundFailure.compareAndSet(null, ex);
      log.error("Uncaught failure in {}; stopping pipeline", thread.getName(), ex);
      running.set(false);
    };
    String prefix = "halo-live-" + Integer.toHexString(System.identityHashCode(this));
    executor = ExecutorFactories.newPipelinePool(2, prefix, handler);
    executor.execute(worker);
    executor.execute(flusher);
    log.info("Started analysis worker and persistence flusher on {}-*", prefix);
  }

  private void shutdownBackground() throws InterruptedException {
    ExecutorService current = executor;
    if (current == null) {
      return;
    }
    current.shutdown();
    long timeoutMillis = settings.shutdownTimeout().toMillis();
    if (!current.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
      log.warn("Background tasks did not stop within {} ms; interrupting", timeoutMillis);
      current.shutdownNow();
      if (!current.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.error("Background tasks ignored interruption; continuing shutdown");
      }
    }
    executor = null;
  }

  private void closeQuietly() {
    try {
      captureSource.close();
      log.info("Capture device released");
    } catch (RuntimeException ex) {
      log.error("Failed to release capture device", ex);
    }
    try {
      display.close();
    } catch (RuntimeException ex) {
      log.error("Failed to close display", ex);
    }
    try {
      storage.close();
    } catch (Exception ex) {
      log.error("Failed to close storage backend", ex);
    }
  }
}
