package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.application.port.FeatureExtractor;
import ca.gc.cra.halo.application.port.IndicatorScorer;
import ca.gc.cra.halo.application.port.RegionDetector;
import ca.gc.cra.halo.application.scoring.HealthScoreCalculator;
import ca.gc.cra.halo.application.scoring.LabelProxies;
import ca.gc.cra.halo.application.scoring.RecommendationRules;
import ca.gc.cra.halo.application.trend.TrendAggregator;
import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.IndicatorValue;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.analysis.Trend;
import ca.gc.cra.halo.domain.error.AnalysisException;
import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One synchronous analysis cycle: detect, select, extract, score, track, aggregate, advise.
 *
 * <p>The engine owns its {@link TrendAggregator}; live and single-shot runs each build their own
 * engine so histories never mix. Not thread-safe.
 *
 * @since 0.1.0
 */
public final class AnalysisEngine {
  private final String sessionId;
  private final RegionDetector detector;
  private final FeatureExtractor extractor;
  private final IndicatorScorer scorer;
  private final TrendAggregator trends;
  private final HealthScoreCalculator calculator;
  private final RecommendationRules rules;
  private final ClockPort clock;

  public AnalysisEngine(
      String sessionId,
      RegionDetector detector,
      FeatureExtractor extractor,
      IndicatorScorer scorer,
      ClockPort clock) {
    this(
        sessionId,
        detector,
        extractor,
        scorer,
        new TrendAggregator(),
        new HealthScoreCalculator(),
        new RecommendationRules(),
        clock);
  }

  public AnalysisEngine(
      String sessionId,
      RegionDetector detector,
      FeatureExtractor extractor,
      IndicatorScorer scorer,
      TrendAggregator trends,
      HealthScoreCalculator calculator,
      RecommendationRules rules,
      ClockPort clock) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.scorer = Objects.requireNonNull(scorer, "scorer");
    this.trends = Objects.requireNonNull(trends, "trends");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.rules = Objects.requireNonNull(rules, "rules");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs a full cycle over {@code frame}.
   *
   * @return snapshot of the result, or empty when no region was detected
   * @throws AnalysisException when detection, extraction or scoring fails
   */
  public Optional<AnalysisSnapshot> analyze(Frame frame) throws AnalysisException {
    Optional<DetectedRegion> primary = PrimaryRegionSelector.select(detect(frame));
    if (primary.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(analyzeRegion(frame, primary.get()));
  }

  /** Runs detection only; used by the countdown to rank candidate frames. */
  public List<DetectedRegion> detect(Frame frame) throws DetectionException {
    List<DetectedRegion> regions = detector.detect(Objects.requireNonNull(frame, "frame"));
    return regions == null ? List.of() : regions;
  }

  /**
   * Runs extraction onwards for an already selected region.
   *
   * @throws AnalysisException when extraction or scoring fails
   */
  public AnalysisSnapshot analyzeRegion(Frame frame, DetectedRegion region) throws AnalysisException {
    DetectedRegion clipped = region.clipTo(frame.width(), frame.height());
    MeasurementBundle measurements = extractor.extract(frame, clipped);
    IndicatorSet indicators = scorer.score(measurements);
    recordHistory(indicators);

    HealthScoreCalculator.Assessment assessment = calculator.assess(indicators);
    List<String> recommendations = rules.recommend(indicators, assessment.score());
    SessionResult result = new SessionResult(
        clock.nowMillis(),
        frame.sequence(),
        sessionId,
        measurements,
        indicators,
        assessment.score(),
        assessment.status(),
        recommendations);
    return new AnalysisSnapshot(result, clipped, trends.trends(), trends.stabilities());
  }

  /** Returns current trends of every tracked metric. */
  public Map<String, Trend> trends() {
    return trends.trends();
  }

  public String sessionId() {
    return sessionId;
  }

  private void recordHistory(IndicatorSet indicators) {
    for (Map.Entry<String, IndicatorValue> entry : indicators.values().entrySet()) {
      OptionalDouble sample = numericSample(entry.getValue());
      if (sample.isPresent()) {
        trends.record(entry.getKey(), sample.getAsDouble());
      }
    }
  }

  private static OptionalDouble numericSample(IndicatorValue value) {
    if (value instanceof IndicatorValue.Score score) {
      return OptionalDouble.of(score.value());
    }
    if (value instanceof IndicatorValue.Label label) {
      return LabelProxies.severity(label.value());
    }
    return OptionalDouble.empty();
  }
}
