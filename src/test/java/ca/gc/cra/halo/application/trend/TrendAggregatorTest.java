package ca.gc.cra.halo.application.trend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.analysis.Stability;
import ca.gc.cra.halo.domain.analysis.Trend;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TrendAggregatorTest {

  @Test
  void fewerThanTenSamplesHaveNoTrend() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "symmetry", 9, 0.5d);

    assertTrue(aggregator.trend("symmetry").isEmpty());
    assertFalse(aggregator.trends().containsKey("symmetry"));
  }

  @Test
  void identicalSamplesAreStable() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "symmetry", 10, 0.7d);

    assertEquals(Trend.STABLE, aggregator.trend("symmetry").orElseThrow());
  }

  @Test
  void risingMeanIsIncreasing() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "texture", 5, 0.1d);
    record(aggregator, "texture", 5, 0.5d);

    assertEquals(Trend.INCREASING, aggregator.trend("texture").orElseThrow());
  }

  @Test
  void fallingMeanIsDecreasing() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "texture", 5, 0.5d);
    record(aggregator, "texture", 5, 0.1d);

    assertEquals(Trend.DECREASING, aggregator.trend("texture").orElseThrow());
  }

  @Test
  void changeInsideBandIsStable() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "texture", 5, 1.0d);
    record(aggregator, "texture", 5, 1.15d);

    assertEquals(Trend.STABLE, aggregator.trend("texture").orElseThrow());
  }

  @Test
  void onlyEdgesOfWindowMatter() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "m", 5, 1d);
    record(aggregator, "m", 10, 50d);
    record(aggregator, "m", 5, 1d);

    assertEquals(Trend.STABLE, aggregator.trend("m").orElseThrow());
  }

  @Test
  void windowKeepsLastThirtySamples() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "m", 30, 5d);
    record(aggregator, "m", 30, 1d);

    assertEquals(30, aggregator.sampleCount("m"));
    assertEquals(Trend.STABLE, aggregator.trend("m").orElseThrow());
  }

  @Test
  void metricsAreTrackedIndependently() {
    TrendAggregator aggregator = new TrendAggregator();
    record(aggregator, "up", 5, 0d);
    record(aggregator, "up", 5, 1d);
    record(aggregator, "short", 3, 1d);

    Map<String, Trend> trends = aggregator.trends();
    assertEquals(Map.of("up", Trend.INCREASING), trends);
  }

  @Test
  void alternatingSymmetryIsVariableWithStableTrend() {
    TrendAggregator aggregator = new TrendAggregator();
    for (int i = 0; i < 10; i++) {
      aggregator.record("symmetry", i % 2 == 0 ? 0.6d : 0.9d);
    }

    assertEquals(Trend.STABLE, aggregator.trend("symmetry").orElseThrow());
    assertEquals(Stability.VARIABLE, aggregator.stability("symmetry").orElseThrow());
  }

  @Test
  void smallSpreadIsStable() {
    TrendAggregator aggregator = new TrendAggregator();
    for (int i = 0; i < 10; i++) {
      aggregator.record("symmetry", i % 2 == 0 ? 0.80d : 0.95d);
    }
    record(aggregator, "short", 9, 0d);

    assertEquals(Map.of("symmetry", Stability.STABLE), aggregator.stabilities());
    assertTrue(aggregator.stability("short").isEmpty());
    assertTrue(aggregator.stability("unknown").isEmpty());
  }

  private static void record(TrendAggregator aggregator, String metric, int count, double value) {
    for (int i = 0; i < count; i++) {
      aggregator.record(metric, value);
    }
  }
}
