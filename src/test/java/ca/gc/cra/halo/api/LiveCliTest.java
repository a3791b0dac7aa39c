package ca.gc.cra.halo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LiveCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Path cascade;

  @BeforeEach
  void setUp() throws IOException {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(LiveCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    cascade = Files.writeString(tempDir.resolve("cascade.xml"), "<opencv_storage/>");
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void dryRunPrintsPlanWithoutCreatingOutput() {
    Path out = tempDir.resolve("results");

    ExitCode code = LiveCli.run(new String[] {
        "device=2",
        "out=" + out,
        "format=csv",
        "frameSkip=3",
        "overlay=false",
        "cascade=" + cascade,
        "display=headless",
        "metricsExporter=none",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String plan = buffer.toString();
    assertTrue(plan.contains("Live dry-run"));
    assertTrue(plan.contains("Device           : 2"));
    assertTrue(plan.contains("Output format    : csv"));
    assertTrue(plan.contains("Frame skip       : 3"));
    assertTrue(plan.contains("Overlay          : off"));
    assertTrue(Files.notExists(out));
  }

  @Test
  void yamlSuppliesDefaultsAndCliOverrides() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("halo.yaml"), """
        common:
          format: json
          metricsExporter: none
        live:
          flushIntervalSec: 45
          frameSkip: 4
        """);

    ExitCode code = LiveCli.run(new String[] {
        "config=" + yaml,
        "frameSkip=2",
        "out=" + tempDir.resolve("out"),
        "cascade=" + cascade,
        "display=headless",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String plan = buffer.toString();
    assertTrue(plan.contains("Flush interval   : 45 s"));
    assertTrue(plan.contains("Frame skip       : 2"));
  }

  @Test
  void autoTriggerIsRejectedForLive() {
    ExitCode code = LiveCli.run(new String[] {"autoTrigger=true", "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: halo live"));
  }

  @Test
  void outOfRangeFrameSkipIsRejected() {
    ExitCode code = LiveCli.run(new String[] {"frameSkip=0", "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("frameSkip must be between 1 and 120"));
  }

  @Test
  void missingCascadeIsAConfigurationError() {
    ExitCode code = LiveCli.run(new String[] {
        "cascade=" + tempDir.resolve("missing.xml"),
        "out=" + tempDir.resolve("out"),
        "display=headless",
        "metricsExporter=none",
        "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLogContaining("cascade does not exist"));
  }

  @Test
  void missingYamlFileIsAnArgumentError() {
    ExitCode code = LiveCli.run(new String[] {"config=" + tempDir.resolve("nope.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
