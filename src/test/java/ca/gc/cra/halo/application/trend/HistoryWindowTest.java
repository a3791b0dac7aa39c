package ca.gc.cra.halo.application.trend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class HistoryWindowTest {

  @Test
  void evictsOldestBeyondCapacity() {
    HistoryWindow window = new HistoryWindow(3);
    for (int i = 1; i <= 5; i++) {
      window.add(i);
    }
    assertEquals(List.of(3d, 4d, 5d), window.snapshot());
    assertEquals(3, window.size());
  }

  @Test
  void defaultCapacityIsThirty() {
    HistoryWindow window = new HistoryWindow();
    for (int i = 0; i < 40; i++) {
      window.add(i);
    }
    assertEquals(30, window.size());
    assertEquals(10d, window.snapshot().get(0));
  }

  @Test
  void rejectsNonFiniteSamples() {
    HistoryWindow window = new HistoryWindow();
    assertThrows(IllegalArgumentException.class, () -> window.add(Double.NaN));
    assertEquals(0, window.size());
  }
}
