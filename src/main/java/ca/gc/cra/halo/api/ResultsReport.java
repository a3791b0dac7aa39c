package ca.gc.cra.halo.api;

import ca.gc.cra.halo.domain.analysis.IndicatorValue;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/** Console layout of stored results for the {@code view} and {@code session} commands. */
final class ResultsReport {
  private static final DateTimeFormatter TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());
  private static final String RULE = "=".repeat(72);

  private ResultsReport() {}

  /** One line per record, numbered from 1. */
  static List<String> listing(List<SessionResult> results) {
    List<String> lines = new ArrayList<>(results.size() + 1);
    for (int i = 0; i < results.size(); i++) {
      SessionResult result = results.get(i);
      lines.add(String.format(Locale.ROOT, "%3d. %s  frame %-6d %s",
          i + 1, TIME.format(Instant.ofEpochMilli(result.timestampMillis())), result.frameId(), scoreText(result)));
    }
    return lines;
  }

  /** Score statistics over the records that have a score. */
  static List<String> summary(List<SessionResult> results) {
    OptionalDouble average = results.stream()
        .filter(r -> r.healthScore().isPresent())
        .mapToDouble(r -> r.healthScore().get())
        .average();
    long scored = results.stream().filter(r -> r.healthScore().isPresent()).count();
    List<String> lines = new ArrayList<>();
    lines.add("Records: " + results.size() + " (" + scored + " scored)");
    if (average.isPresent()) {
      double mean = Math.round(average.getAsDouble() * 10d) / 10d;
      lines.add(String.format(Locale.ROOT, "Average health score: %.1f/10 (%s)",
          mean, HealthStatus.fromScore(mean).displayName()));
    }
    return lines;
  }

  /** Full breakdown of one record. */
  static List<String> details(SessionResult result) {
    List<String> lines = new ArrayList<>();
    lines.add(RULE);
    lines.add("Facial analysis details");
    lines.add(RULE);
    lines.add("Timestamp : " + TIME.format(Instant.ofEpochMilli(result.timestampMillis())));
    lines.add("Frame     : " + result.frameId());
    lines.add("Session   : " + result.sessionId());
    lines.add("Health    : " + scoreText(result));

    if (!result.indicators().values().isEmpty()) {
      lines.add("");
      lines.add("  Indicators:");
      for (Map.Entry<String, IndicatorValue> entry : result.indicators().values().entrySet()) {
        lines.add("    " + entry.getKey() + ": " + entry.getValue().display());
      }
    }
    for (Map.Entry<String, Map<String, Measurement>> group : result.measurements().groups().entrySet()) {
      lines.add("");
      lines.add("  Measurements (" + group.getKey() + "):");
      for (Map.Entry<String, Measurement> m : group.getValue().entrySet()) {
        lines.add("    " + m.getKey() + ": " + format(m.getValue()));
      }
    }
    if (!result.indicators().notes().isEmpty()) {
      lines.add("");
      lines.add("  Notes:");
      result.indicators().notes().forEach(note -> lines.add("    - " + note));
    }
    lines.add("");
    lines.add("  Recommendations:");
    result.recommendations().forEach(r -> lines.add("    - " + r));
    return lines;
  }

  private static String scoreText(SessionResult result) {
    return result.healthScore()
        .map(score -> String.format(Locale.ROOT, "%.1f/10 (%s)", score, result.status().displayName()))
        .orElse(result.status().displayName());
  }

  private static String format(Measurement measurement) {
    if (measurement.isScalar()) {
      return String.format(Locale.ROOT, "%.2f", measurement.asScalar());
    }
    List<String> parts = new ArrayList<>();
    for (Double value : measurement.values()) {
      parts.add(String.format(Locale.ROOT, "%.2f", value));
    }
    return "[" + String.join(", ", parts) + "]";
  }
}
