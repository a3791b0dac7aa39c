package ca.gc.cra.halo.infrastructure.storage;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.IndicatorValue;
import ca.gc.cra.halo.domain.analysis.Measurement;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.session.HealthStatus;
import ca.gc.cra.halo.domain.session.SessionResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON layout of a result batch: an array of objects with nested {@code measurements} and
 * {@code indicators}.
 */
final class JsonResultCodec {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();
  private final ObjectMapper mapper = new ObjectMapper();

  void write(List<SessionResult> results, OutputStream out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartArray();
      for (SessionResult result : results) {
        writeResult(gen, result);
      }
      gen.writeEndArray();
    }
  }

  private void writeResult(JsonGenerator gen, SessionResult result) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
    gen.writeStringField("timestamp", Instant.ofEpochMilli(result.timestampMillis()).toString());
    gen.writeNumberField("timestampMillis", result.timestampMillis());
    gen.writeNumberField("frameId", result.frameId());
    gen.writeStringField("sessionId", result.sessionId());
    if (result.healthScore().isPresent()) {
      gen.writeNumberField("healthScore", result.healthScore().get());
    } else {
      gen.writeNullField("healthScore");
    }
    gen.writeStringField("healthStatus", result.status().name());

    gen.writeObjectFieldStart("measurements");
    for (Map.Entry<String, Map<String, Measurement>> group : result.measurements().groups().entrySet()) {
      gen.writeObjectFieldStart(group.getKey());
      for (Map.Entry<String, Measurement> m : group.getValue().entrySet()) {
        if (m.getValue().isScalar()) {
          gen.writeNumberField(m.getKey(), m.getValue().asScalar());
        } else {
          gen.writeArrayFieldStart(m.getKey());
          for (Double component : m.getValue().values()) {
            gen.writeNumber(component);
          }
          gen.writeEndArray();
        }
      }
      gen.writeEndObject();
    }
    gen.writeEndObject();

    gen.writeObjectFieldStart("indicators");
    for (Map.Entry<String, IndicatorValue> indicator : result.indicators().values().entrySet()) {
      if (indicator.getValue() instanceof IndicatorValue.Score score) {
        gen.writeNumberField(indicator.getKey(), score.value());
      } else {
        gen.writeStringField(indicator.getKey(), indicator.getValue().display());
      }
    }
    gen.writeEndObject();

    writeStrings(gen, "notes", result.indicators().notes());
    writeStrings(gen, "recommendations", result.recommendations());
    gen.writeEndObject();
  }

  private static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  List<SessionResult> read(InputStream in) throws IOException {
    JsonNode root = mapper.readTree(in);
    if (root == null || !root.isArray()) {
      throw new IOException("expected a JSON array of results");
    }
    List<SessionResult> results = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      results.add(readResult(node));
    }
    return results;
  }

  private SessionResult readResult(JsonNode node) throws IOException {
    JsonNode millis = node.get("timestampMillis");
    JsonNode frameId = node.get("frameId");
    if (millis == null || frameId == null) {
      throw new IOException("result is missing timestampMillis or frameId");
    }
    MeasurementBundle.Builder measurements = MeasurementBundle.builder();
    Iterator<Map.Entry<String, JsonNode>> groups = node.path("measurements").fields();
    while (groups.hasNext()) {
      Map.Entry<String, JsonNode> group = groups.next();
      Iterator<Map.Entry<String, JsonNode>> values = group.getValue().fields();
      while (values.hasNext()) {
        Map.Entry<String, JsonNode> value = values.next();
        measurements.put(group.getKey(), value.getKey(), toMeasurement(value.getValue()));
      }
    }

    IndicatorSet.Builder indicators = IndicatorSet.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = node.path("indicators").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      indicators.put(field.getKey(), value.isNumber()
          ? new IndicatorValue.Score(value.asDouble())
          : ResultFlattener.indicatorValue(field.getKey(), value.asText()));
    }
    for (JsonNode note : node.path("notes")) {
      indicators.addNote(note.asText());
    }

    JsonNode scoreNode = node.get("healthScore");
    Optional<Double> score = scoreNode == null || scoreNode.isNull()
        ? Optional.empty()
        : Optional.of(scoreNode.asDouble());
    HealthStatus status = score.isEmpty()
        ? HealthStatus.INSUFFICIENT_DATA
        : HealthStatus.valueOf(node.path("healthStatus").asText(HealthStatus.fromScore(score.get()).name()));

    List<String> recommendations = new ArrayList<>();
    for (JsonNode recommendation : node.path("recommendations")) {
      recommendations.add(recommendation.asText());
    }
    return new SessionResult(
        millis.asLong(),
        frameId.asLong(),
        node.path("sessionId").asText(""),
        measurements.build(),
        indicators.build(),
        score,
        status,
        recommendations);
  }

  private static Measurement toMeasurement(JsonNode value) throws IOException {
    if (value.isNumber()) {
      return Measurement.scalar(value.asDouble());
    }
    if (value.isArray()) {
      List<Double> components = new ArrayList<>(value.size());
      for (JsonNode component : value) {
        components.add(component.asDouble());
      }
      return new Measurement(components);
    }
    throw new IOException("measurement must be a number or an array of numbers");
  }
}
