package ca.gc.cra.halo.infrastructure.storage;

import ca.gc.cra.halo.domain.session.SessionResult;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** One header row with the union of flattened columns, then one row per result. */
final class CsvResultCodec {
  private final CsvMapper mapper = new CsvMapper();

  void write(List<SessionResult> results, OutputStream out) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(results.size());
    for (SessionResult result : results) {
      rows.add(ResultFlattener.flatten(result));
    }
    CsvSchema.Builder schema = CsvSchema.builder();
    for (String column : ResultFlattener.columns(rows)) {
      schema.addColumn(column);
    }
    try (SequenceWriter writer = mapper.writer(schema.build().withHeader()).writeValues(out)) {
      writer.writeAll(rows);
    }
  }

  List<SessionResult> read(InputStream in) throws IOException {
    List<SessionResult> results = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows =
        mapper.readerForMapOf(String.class).with(CsvSchema.emptySchema().withHeader()).readValues(in)) {
      while (rows.hasNext()) {
        results.add(ResultFlattener.unflatten(rows.next()));
      }
    }
    return results;
  }
}
