package ca.gc.cra.halo.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.fixtures.Frames;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class LatestSlotTest {

  @Test
  void emptySlotYieldsNothing() {
    LatestSlot<String> slot = new LatestSlot<>(UnaryOperator.identity());
    assertTrue(slot.takeLatest().isEmpty());
  }

  @Test
  void newerPublishReplacesUnreadValue() {
    LatestSlot<String> slot = new LatestSlot<>(UnaryOperator.identity());

    assertFalse(slot.publish("a"));
    assertTrue(slot.publish("b"));

    assertEquals(Optional.of("b"), slot.takeLatest());
    assertEquals(1L, slot.droppedCount());
  }

  @Test
  void takeLatestDoesNotClearValue() {
    LatestSlot<String> slot = new LatestSlot<>(UnaryOperator.identity());
    slot.publish("a");

    assertEquals(Optional.of("a"), slot.takeLatest());
    assertEquals(Optional.of("a"), slot.takeLatest());
    assertFalse(slot.publish("b"), "value was read so nothing is dropped");
    assertEquals(0L, slot.droppedCount());
  }

  @Test
  void readersReceiveCopies() {
    LatestSlot<Frame> slot = new LatestSlot<>(Frame::copy);
    Frame frame = Frames.gray(1);
    slot.publish(frame);

    Frame taken = slot.takeLatest().orElseThrow();

    assertEquals(frame, taken);
    assertNotSame(frame.pixels(), taken.pixels());
  }

  @Test
  void takeUnreadCopiesOnlyFreshValues() {
    AtomicLong copies = new AtomicLong();
    LatestSlot<Frame> slot = new LatestSlot<>(frame -> {
      copies.incrementAndGet();
      return frame.copy();
    });

    assertTrue(slot.takeUnread().isEmpty());
    slot.publish(Frames.gray(1));
    assertEquals(1L, slot.takeUnread().orElseThrow().sequence());
    for (int i = 0; i < 100; i++) {
      assertTrue(slot.takeUnread().isEmpty());
    }
    assertEquals(1L, copies.get());

    slot.publish(Frames.gray(2));
    assertEquals(2L, slot.takeUnread().orElseThrow().sequence());
    assertEquals(2L, copies.get());
    assertEquals(2L, slot.takeLatest().orElseThrow().sequence());
  }

  @Test
  void clearEmptiesSlot() {
    LatestSlot<String> slot = new LatestSlot<>(UnaryOperator.identity());
    slot.publish("a");
    slot.clear();
    assertTrue(slot.takeLatest().isEmpty());
  }

  @Test
  void readerNeverSeesOlderValueThanPreviouslyRead() throws Exception {
    LatestSlot<Long> slot = new LatestSlot<>(UnaryOperator.identity());
    int total = 50_000;
    CountDownLatch done = new CountDownLatch(1);
    AtomicLong regressions = new AtomicLong();

    Thread reader = new Thread(() -> {
      long last = -1;
      while (done.getCount() > 0) {
        Optional<Long> value = slot.takeLatest();
        if (value.isPresent()) {
          if (value.get() < last) {
            regressions.incrementAndGet();
          }
          last = value.get();
        }
      }
    }, "slot-reader");
    reader.start();
    for (long i = 0; i < total; i++) {
      slot.publish(i);
    }
    done.countDown();
    reader.join(TimeUnit.SECONDS.toMillis(5));

    assertEquals(0L, regressions.get());
    assertEquals(Optional.of((long) total - 1), slot.takeLatest());
  }
}
