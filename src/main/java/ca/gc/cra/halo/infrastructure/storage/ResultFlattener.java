package ca.gc.cra.halo.infrastructure.storage;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.IndicatorValue;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts results to and from the single-row column layout shared by the CSV and spreadsheet
 * formats.
 *
 * <p>Column naming:
 * <ul>
 *   <li>fixed columns first: {@code timestamp}, {@code timestamp_millis}, {@code frame_id},
 *       {@code session_id}, {@code health_score}, {@code health_status}, {@code recommendations},
 *       {@code notes};</li>
 *   <li>measurements as {@code metric_}, {@code symmetry_}, {@code ratio_}, {@code color_},
 *       {@code keypoint_} or {@code body_} plus the measurement name, vectors joined with {@code ;};</li>
 *   <li>indicators as {@code indicator_} plus the indicator name.</li>
 * </ul>
 * When reading back, a numeric indicator cell becomes a score, a name ending in {@code _note} becomes a
 * note and anything else a label.
 */
final class ResultFlattener {
  static final String TIMESTAMP = "timestamp";
  static final String TIMESTAMP_MILLIS = "timestamp_millis";
  static final String FRAME_ID = "frame_id";
  static final String SESSION_ID = "session_id";
  static final String HEALTH_SCORE = "health_score";
  static final String HEALTH_STATUS = "health_status";
  static final String RECOMMENDATIONS = "recommendations";
  static final String NOTES = "notes";
  static final String INDICATOR_PREFIX = "indicator_";
  static final String LIST_SEPARATOR = " | ";
  static final String VECTOR_SEPARATOR = ";";

  private static final List<String> FIXED_COLUMNS = List.of(
      TIMESTAMP, TIMESTAMP_MILLIS, FRAME_ID, SESSION_ID, HEALTH_SCORE, HEALTH_STATUS, RECOMMENDATIONS, NOTES);

  private static final Map<String, String> GROUP_PREFIXES = Map.of(
      MeasurementBundle.GROUP_METRICS, "metric_",
      MeasurementBundle.GROUP_SYMMETRY, "symmetry_",
      MeasurementBundle.GROUP_RATIOS, "ratio_",
      MeasurementBundle.GROUP_COLOR, "color_",
      MeasurementBundle.GROUP_KEYPOINTS, "keypoint_",
      MeasurementBundle.GROUP_BODY, "body_");

  private ResultFlattener() {}

  static Map<String, String> flatten(SessionResult result) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put(TIMESTAMP, Instant.ofEpochMilli(result.timestampMillis()).toString());
    row.put(TIMESTAMP_MILLIS, Long.toString(result.timestampMillis()));
    row.put(FRAME_ID, Long.toString(result.frameId()));
    row.put(SESSION_ID, result.sessionId());
    row.put(HEALTH_SCORE, result.healthScore().map(ResultFlattener::formatNumber).orElse(""));
    row.put(HEALTH_STATUS, result.status().name());
    row.put(RECOMMENDATIONS, String.join(LIST_SEPARATOR, result.recommendations()));
    row.put(NOTES, String.join(LIST_SEPARATOR, result.indicators().notes()));
    result.measurements().groups().forEach((group, values) -> {
      String prefix = GROUP_PREFIXES.getOrDefault(group, group + "_");
      values.forEach((name, measurement) -> row.put(prefix + name, formatMeasurement(measurement)));
    });
    result.indicators().values().forEach((name, value) -> row.put(INDICATOR_PREFIX + name, value.display()));
    return row;
  }

  /** Union of the columns of every row, fixed columns first and the rest in first-seen order. */
  static List<String> columns(List<Map<String, String>> rows) {
    Set<String> columns = new LinkedHashSet<>(FIXED_COLUMNS);
    for (Map<String, String> row : rows) {
      columns.addAll(row.keySet());
    }
    return new ArrayList<>(columns);
  }

  static SessionResult unflatten(Map<String, String> row) {
    long timestamp = parseLong(row, TIMESTAMP_MILLIS);
    long frameId = parseLong(row, FRAME_ID);
    String sessionId = row.getOrDefault(SESSION_ID, "");
    String scoreCell = blankToEmpty(row.get(HEALTH_SCORE));
    Optional<Double> score = scoreCell.isEmpty() ? Optional.empty() : Optional.of(Double.parseDouble(scoreCell));
    HealthStatus status = score.isEmpty()
        ? HealthStatus.INSUFFICIENT_DATA
        : parseStatus(row.get(HEALTH_STATUS), score.get());

    MeasurementBundle.Builder measurements = MeasurementBundle.builder();
    IndicatorSet.Builder indicators = IndicatorSet.builder();
    for (String note : split(row.get(NOTES))) {
      indicators.addNote(note);
    }
    for (Map.Entry<String, String> cell : row.entrySet()) {
      String column = cell.getKey();
      String value = blankToEmpty(cell.getValue());
      if (value.isEmpty() || FIXED_COLUMNS.contains(column)) {
        continue;
      }
      if (column.startsWith(INDICATOR_PREFIX)) {
        String name = column.substring(INDICATOR_PREFIX.length());
        indicators.put(name, indicatorValue(name, value));
        continue;
      }
      for (Map.Entry<String, String> prefix : GROUP_PREFIXES.entrySet()) {
        if (column.startsWith(prefix.getValue())) {
          measurements.put(prefix.getKey(), column.substring(prefix.getValue().length()), parseMeasurement(value));
          break;
        }
      }
    }
    List<String> recommendations = split(row.get(RECOMMENDATIONS));
    return new SessionResult(
        timestamp, frameId, sessionId, measurements.build(), indicators.build(), score, status, recommendations);
  }

  static IndicatorValue indicatorValue(String name, String raw) {
    if (name.endsWith("_note")) {
      return new IndicatorValue.Note(raw);
    }
    try {
      return new IndicatorValue.Score(Double.parseDouble(raw));
    } catch (NumberFormatException notNumeric) {
      return new IndicatorValue.Label(raw);
    }
  }

  static String formatNumber(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static String formatMeasurement(Measurement measurement) {
    StringBuilder sb = new StringBuilder();
    for (Double component : measurement.values()) {
      if (sb.length() > 0) {
        sb.append(VECTOR_SEPARATOR);
      }
      sb.append(formatNumber(component));
    }
    return sb.toString();
  }

  private static Measurement parseMeasurement(String raw) {
    String[] parts = raw.split(VECTOR_SEPARATOR);
    List<Double> values = new ArrayList<>(parts.length);
    for (String part : parts) {
      values.add(Double.parseDouble(part.trim()));
    }
    return new Measurement(values);
  }

  private static HealthStatus parseStatus(String raw, double score) {
    String value = blankToEmpty(raw);
    if (value.isEmpty()) {
      return HealthStatus.fromScore(score);
    }
    HealthStatus status = HealthStatus.valueOf(value.toUpperCase(Locale.ROOT));
    return status == HealthStatus.INSUFFICIENT_DATA ? HealthStatus.fromScore(score) : status;
  }

  private static long parseLong(Map<String, String> row, String column) {
    String value = blankToEmpty(row.get(column));
    if (value.isEmpty()) {
      throw new IllegalArgumentException("missing column " + column);
    }
    return (long) Double.parseDouble(value);
  }

  private static List<String> split(String joined) {
    String value = blankToEmpty(joined);
    if (value.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(value.split("\\s\\|\\s")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }

  private static String blankToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
