package ca.gc.cra.halo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.domain.storage.OutputFormat;
import ca.gc.cra.halo.fixtures.RecordingStorage;
import ca.gc.cra.halo.fixtures.Results;
import ca.gc.cra.halo.infrastructure.storage.FileStorageBackend;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ViewCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(ViewCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void listsSavedResultsWithSummary() throws Exception {
    Path file = saveJson(List.of(Results.result(1), Results.result(2, Optional.empty())));

    ExitCode code = ViewCli.run(new String[] {"in=" + file}, new FileStorageBackend());

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Results in " + file.getFileName()));
    assertTrue(out.contains("Records: 2 (1 scored)"));
    assertTrue(out.contains("  1. "));
    assertTrue(out.contains("  2. "));
  }

  @Test
  void recordShowsDetailsOfOneResult() throws Exception {
    Path file = saveJson(List.of(Results.result(1), Results.result(7)));

    ExitCode code = ViewCli.run(new String[] {"in=" + file, "record=2"}, new FileStorageBackend());

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Frame     : 7"));
    assertFalse(out.contains("Records:"));
  }

  @Test
  void recordOutOfRangeIsRejected() throws Exception {
    Path file = saveJson(List.of(Results.result(1)));

    ExitCode code = ViewCli.run(new String[] {"in=" + file, "record=3"}, new FileStorageBackend());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("out of range"));
  }

  @Test
  void missingInputArgumentPrintsUsage() {
    ExitCode code = ViewCli.run(new String[] {"record=1"}, new RecordingStorage());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: halo view"));
    assertTrue(hasLogContaining("in=FILE is required"));
  }

  @Test
  void missingFileIsAnArgumentError() {
    ExitCode code = ViewCli.run(
        new String[] {"in=" + tempDir.resolve("absent.json")}, new RecordingStorage());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Cannot read results"));
  }

  @Test
  void unreadableExistingFileIsAnIoError() throws Exception {
    Path file = Files.writeString(tempDir.resolve("broken.json"), "{not json");

    ExitCode code = ViewCli.run(new String[] {"in=" + file}, new FileStorageBackend());

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void emptyBatchIsReported() throws Exception {
    RecordingStorage storage = new RecordingStorage();
    Path file = storage.save(List.of(), tempDir.resolve("empty"), OutputFormat.JSON);

    ExitCode code = ViewCli.run(new String[] {"in=" + file}, storage);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("No results found in empty.json"));
  }

  private Path saveJson(List<SessionResult> results) throws Exception {
    try (FileStorageBackend storage = new FileStorageBackend()) {
      return storage.save(results, tempDir.resolve("facial_analysis_20240101_120000"), OutputFormat.JSON);
    }
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
