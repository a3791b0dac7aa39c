package ca.gc.cra.halo.application.pipeline;

import ca.gc.cra.halo.application.port.Overlay;
import ca.gc.cra.halo.domain.analysis.IndicatorValue;
import ca.gc.cra.halo.domain.analysis.Stability;
import ca.gc.cra.halo.domain.analysis.Trend;
import ca.gc.cra.halo.domain.session.AnalysisSnapshot;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Builds the text drawn over live frames. */
final class OverlayFormatter {
  private static final int MAX_RECOMMENDATIONS = 2;

  private OverlayFormatter() {}

  static Overlay format(
      double captureFps,
      double analysisFps,
      String backend,
      String acceleration,
      Optional<AnalysisSnapshot> snapshot,
      boolean detailsEnabled) {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, "Capture FPS: %.1f", captureFps));
    lines.add(String.format(Locale.ROOT, "Analysis FPS: %.1f", analysisFps));
    lines.add("Backend: " + backend + " / " + acceleration);
    lines.add("Primary face detected: " + (snapshot.isPresent() ? "Yes" : "No"));
    if (snapshot.isEmpty() || !detailsEnabled) {
      return Overlay.text(lines);
    }

    SessionResult result = snapshot.get().result();
    Map<String, Trend> trends = snapshot.get().trends();
    Map<String, Stability> stabilities = snapshot.get().stabilities();
    lines.add(result.healthScore()
        .map(score -> String.format(Locale.ROOT, "Health score: %.1f (%s)", score, result.status().displayName()))
        .orElse("Health score: n/a (" + result.status().displayName() + ")"));
    for (Map.Entry<String, IndicatorValue> entry : result.indicators().values().entrySet()) {
      Trend trend = trends.get(entry.getKey());
      String suffix = trend == null ? "" : " " + trend.arrow();
      if (stabilities.get(entry.getKey()) == Stability.VARIABLE) {
        suffix += " (" + Stability.VARIABLE.label() + ")";
      }
      lines.add(entry.getKey() + ": " + entry.getValue().display() + suffix);
    }
    result.recommendations().stream()
        .limit(MAX_RECOMMENDATIONS)
        .forEach(advice -> lines.add("- " + advice));
    return new Overlay(lines, List.of(snapshot.get().region()));
  }
}
