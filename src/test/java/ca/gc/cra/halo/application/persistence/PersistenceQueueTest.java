package ca.gc.cra.halo.application.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.fixtures.RecordingMetricsPort;
import ca.gc.cra.halo.fixtures.Results;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PersistenceQueueTest {

  @Test
  void drainPreservesOrderAndEmptiesQueue() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    PersistenceQueue queue = new PersistenceQueue(metrics);
    queue.enqueue(Results.result(1));
    queue.enqueue(Results.result(2));

    List<SessionResult> drained = new ArrayList<>();
    assertEquals(2, queue.drainTo(drained));

    assertEquals(List.of(1L, 2L), drained.stream().map(SessionResult::frameId).toList());
    assertTrue(queue.isEmpty());
    assertEquals(2, metrics.count("halo.persist.enqueued"));
  }

  @Test
  void concurrentProducersLoseNothing() throws Exception {
    PersistenceQueue queue = new PersistenceQueue(new RecordingMetricsPort());
    int producers = 4;
    int perProducer = 500;
    ExecutorService pool = Executors.newFixedThreadPool(producers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int p = 0; p < producers; p++) {
        pool.execute(() -> {
          try {
            start.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return;
          }
          for (int i = 0; i < perProducer; i++) {
            queue.enqueue(Results.result(i));
          }
        });
      }
      start.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    List<SessionResult> drained = new ArrayList<>();
    queue.drainTo(drained);
    assertEquals(producers * perProducer, drained.size());
  }
}
