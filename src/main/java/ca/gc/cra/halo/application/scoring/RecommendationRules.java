package ca.gc.cra.halo.application.scoring;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.Indicators;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered threshold rules turning indicators into advice.
 *
 * <p>Rules are evaluated independently in declaration order and every firing rule contributes its
 * recommendations, so the list order is the rule order. When no rule fires a single default is
 * returned: a referral when the score is below {@value #REFERRAL_THRESHOLD}, otherwise a
 * maintenance reminder.
 *
 * <p>{@link #body()} holds the posture rules. Its fallback tops up any list shorter than two: a
 * physical therapy referral when the body score is below {@value #BODY_REFERRAL_THRESHOLD}, then a
 * stretching reminder.
 *
 * @since 0.1.0
 */
public final class RecommendationRules {
  static final double REFERRAL_THRESHOLD = 6.0d;
  static final String DEFAULT_MAINTAIN = "Maintain healthy habits and adequate rest";
  static final String DEFAULT_REFERRAL = "Consider consulting a healthcare professional";
  static final double BODY_REFERRAL_THRESHOLD = 7.0d;
  static final String BODY_REFERRAL = "Consider consulting with a physical therapist for assessment";
  static final String BODY_STRETCHING = "Regular stretching and full body movement can improve overall body alignment";

  private final List<Rule> rules;
  private final Fallback fallback;

  public RecommendationRules() {
    this(defaultRules());
  }

  RecommendationRules(List<Rule> rules) {
    this(rules, RecommendationRules::faceFallback);
  }

  private RecommendationRules(List<Rule> rules, Fallback fallback) {
    this.rules = List.copyOf(rules);
    this.fallback = fallback;
  }

  /** Rules for the posture indicators of a body capture. */
  public static RecommendationRules body() {
    return new RecommendationRules(bodyRules(), RecommendationRules::bodyFallback);
  }

  /**
   * Evaluates every rule against {@code indicators}.
   *
   * @param indicators latest indicators
   * @param score aggregate score, if one was computed
   * @return non-empty ordered recommendations
   */
  public List<String> recommend(IndicatorSet indicators, Optional<Double> score) {
    List<String> result = new ArrayList<>();
    for (Rule rule : rules) {
      if (rule.condition().test(indicators)) {
        result.addAll(rule.advice());
      }
    }
    fallback.complete(result, score);
    return List.copyOf(result);
  }

  /** One threshold rule; {@code name} is only used in logs and tests. */
  record Rule(String name, Predicate<IndicatorSet> condition, List<String> advice) {}

  /** Adds default advice after the rules have run. */
  @FunctionalInterface
  interface Fallback {
    void complete(List<String> advice, Optional<Double> score);
  }

  private static void faceFallback(List<String> advice, Optional<Double> score) {
    if (advice.isEmpty()) {
      boolean low = score.isPresent() && score.get() < REFERRAL_THRESHOLD;
      advice.add(low ? DEFAULT_REFERRAL : DEFAULT_MAINTAIN);
    }
  }

  private static void bodyFallback(List<String> advice, Optional<Double> score) {
    if (advice.size() >= 2) {
      return;
    }
    if (score.isPresent() && score.get() < BODY_REFERRAL_THRESHOLD) {
      advice.add(BODY_REFERRAL);
    }
    advice.add(BODY_STRETCHING);
  }

  static List<Rule> defaultRules() {
    return List.of(
        new Rule("fatigue",
            set -> set.label(Indicators.EYE_FATIGUE)
                .filter(l -> LabelProxies.isAnyOf(l, "Moderate", "Severe", "High"))
                .isPresent(),
            List.of(
                "Take a break from screen time",
                "Apply the 20-20-20 rule (look 20ft away for 20s every 20min)")),
        new Rule("symmetry",
            set -> below(set, Indicators.FACIAL_SYMMETRY, 0.7d),
            List.of(
                "Check for sleeping position issues",
                "Consider facial exercises to improve muscle tone")),
        new Rule("texture",
            set -> above(set, Indicators.SKIN_TEXTURE, 30d),
            List.of("Consider hydration and skincare routine")),
        new Rule("skinTone",
            set -> set.note(Indicators.SKIN_TONE_NOTE)
                .filter(n -> n.toLowerCase(Locale.ROOT).contains("yellowish"))
                .isPresent(),
            List.of("Consider checking liver health & hydration")),
        new Rule("eyeBags",
            set -> set.label(Indicators.EYE_BAGS)
                .filter(l -> LabelProxies.isAnyOf(l, "Moderate", "Severe"))
                .isPresent(),
            List.of("Improve sleep quality and duration", "Consider reducing salt intake")),
        new Rule("fullness",
            set -> above(set, Indicators.FACIAL_FULLNESS, 0.9d),
            List.of("Monitor for fluid retention/edema")));
  }

  static List<Rule> bodyRules() {
    return List.of(
        new Rule("posture",
            set -> set.label(Indicators.POSTURE_QUALITY)
                .filter(l -> LabelProxies.isAnyOf(l, "Concerning", "Fair"))
                .isPresent(),
            List.of("Consider posture improvement exercises")),
        new Rule("postureDeviation",
            set -> above(set, Indicators.POSTURE_DEVIATION, 15d)
                && set.label(Indicators.POSTURE_QUALITY)
                    .filter(l -> LabelProxies.isAnyOf(l, "Concerning", "Fair"))
                    .isPresent(),
            List.of("Practice standing with back against wall to improve alignment")),
        new Rule("shoulderSymmetry",
            set -> below(set, Indicators.SHOULDER_SYMMETRY, 0.8d),
            List.of("Consider exercises to strengthen weaker side")),
        new Rule("bodySymmetry",
            set -> below(set, Indicators.BODY_SYMMETRY, 0.75d),
            List.of("Consult with a physical therapist about body asymmetry")),
        new Rule("weightDistribution",
            set -> below(set, Indicators.WEIGHT_DISTRIBUTION, 0.7d),
            List.of("Practice balance exercises and weight distribution awareness")),
        new Rule("balance",
            set -> set.label(Indicators.BALANCE_QUALITY)
                .filter(l -> LabelProxies.isAnyOf(l, "Concerning", "Fair"))
                .isPresent(),
            List.of("Consider single-leg balance exercises to improve stability")));
  }

  private static boolean below(IndicatorSet set, String name, double threshold) {
    return set.score(name).isPresent() && set.score(name).getAsDouble() < threshold;
  }

  private static boolean above(IndicatorSet set, String name, double threshold) {
    return set.score(name).isPresent() && set.score(name).getAsDouble() > threshold;
  }
}
