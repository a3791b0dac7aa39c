package ca.gc.cra.halo.domain.session;

import ca.gc.cra.halo.domain.analysis.Stability;
import ca.gc.cra.halo.domain.analysis.Trend;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import java.util.Map;
import java.util.Objects;

/**
 * Latest result as seen by the render loop: the result, the region it came from and the history
 * signals of every tracked metric at publication time.
 *
 * @param result published analysis result
 * @param region primary region the result was computed from
 * @param trends trend per metric; metrics with too little history are absent
 * @param stabilities spread per metric; metrics with too little history are absent
 * @since 0.1.0
 */
public record AnalysisSnapshot(
    SessionResult result,
    DetectedRegion region,
    Map<String, Trend> trends,
    Map<String, Stability> stabilities) {

  public AnalysisSnapshot {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(region, "region");
    trends = Map.copyOf(Objects.requireNonNull(trends, "trends"));
    stabilities = Map.copyOf(Objects.requireNonNull(stabilities, "stabilities"));
  }

  public AnalysisSnapshot(SessionResult result, DetectedRegion region, Map<String, Trend> trends) {
    this(result, region, trends, Map.of());
  }
}
