package ca.gc.cra.halo.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.application.persistence.PersistenceQueue;
import ca.gc.cra.halo.application.port.RegionDetector;
import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.fixtures.Engines;
import ca.gc.cra.halo.fixtures.Frames;
import ca.gc.cra.halo.fixtures.ManualClock;
import ca.gc.cra.halo.fixtures.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class AnalysisWorkerTest {
  private final ManualClock clock = new ManualClock(0L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final LatestSlot<Frame> frames = new LatestSlot<>(Frame::copy);
  private final LatestSlot<AnalysisSnapshot> results = new LatestSlot<>(UnaryOperator.identity());
  private final PersistenceQueue queue = new PersistenceQueue(metrics);
  private final AtomicBoolean running = new AtomicBoolean(true);

  @Test
  void idleWhenNoFrameAvailable() {
    AnalysisWorker worker = worker(Engines.alwaysFace());
    assertFalse(worker.runCycle());
    assertEquals(0, metrics.count("halo.analysis.cycles"));
  }

  @Test
  void publishesSnapshotAndQueuesResult() {
    AnalysisWorker worker = worker(Engines.alwaysFace());
    frames.publish(Frames.gray(5));

    assertTrue(worker.runCycle());

    AnalysisSnapshot snapshot = results.takeLatest().orElseThrow();
    assertEquals(5L, snapshot.result().frameId());
    List<SessionResult> queued = new ArrayList<>();
    queue.drainTo(queued);
    assertEquals(List.of(snapshot.result()), queued);
    assertEquals(1, metrics.count("halo.analysis.published"));
    assertEquals(1, metrics.observed("halo.analysis.latencyNanos").size());
  }

  @Test
  void sameFrameIsNotAnalysedTwice() {
    AnalysisWorker worker = worker(Engines.alwaysFace());
    frames.publish(Frames.gray(1));

    assertTrue(worker.runCycle());
    assertFalse(worker.runCycle());

    frames.publish(Frames.gray(2));
    assertTrue(worker.runCycle());
    assertEquals(2, queue.size());
  }

  @Test
  void frameWithoutFaceIsCountedButNotQueued() {
    AnalysisWorker worker = worker(frame -> List.of());
    frames.publish(Frames.gray(1));

    assertTrue(worker.runCycle());

    assertTrue(queue.isEmpty());
    assertTrue(results.takeLatest().isEmpty());
    assertEquals(1, metrics.count("halo.analysis.noRegion"));
  }

  @Test
  void detectorFailureDoesNotStopLaterFrames() {
    RegionDetector flaky = frame -> {
      if (frame.sequence() == 1) {
        throw new DetectionException("model not loaded");
      }
      return List.of(Engines.FACE);
    };
    AnalysisWorker worker = worker(flaky);

    frames.publish(Frames.gray(1));
    assertTrue(worker.runCycle());
    frames.publish(Frames.gray(2));
    assertTrue(worker.runCycle());

    assertEquals(1, metrics.count("halo.analysis.failure.detection"));
    assertEquals(1, queue.size());
  }

  @Test
  void unexpectedRuntimeFailureIsContained() {
    AnalysisWorker worker = worker(frame -> {
      throw new IllegalStateException("boom");
    });
    frames.publish(Frames.gray(1));

    assertTrue(worker.runCycle());
    assertEquals(1, metrics.count("halo.analysis.failure.unexpected"));
  }

  @Test
  void runLoopExitsWhenFlagCleared() throws Exception {
    AnalysisWorker worker = worker(Engines.alwaysFace());
    frames.publish(Frames.gray(1));
    Thread thread = new Thread(worker, "analysis-test");
    thread.start();

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (queue.isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    running.set(false);
    thread.join(2_000);

    assertFalse(thread.isAlive());
    assertEquals(1, queue.size());
  }

  private AnalysisWorker worker(RegionDetector detector) {
    return new AnalysisWorker(
        frames,
        results,
        Engines.engine(detector, clock),
        queue,
        running,
        new FpsMeter(),
        metrics,
        clock,
        1L);
  }
}
