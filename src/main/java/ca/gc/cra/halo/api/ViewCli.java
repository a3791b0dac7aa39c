package ca.gc.cra.halo.api;

import ca.gc.cra.halo.application.port.StorageBackend;
import ca.gc.cra.halo.domain.error.StorageException;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.infrastructure.storage.FileStorageBackend;
import ca.gc.cra.halo.logging.LoggingConfigurator;
import ca.gc.cra.halo.validation.Numbers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints results previously saved by {@code live} or {@code session}.
 *
 * @since 0.1.0
 */
public final class ViewCli {
  private static final Logger log = LoggerFactory.getLogger(ViewCli.class);
  private static final String SUMMARY_USAGE = "usage: halo view in=FILE [record=N]";
  private static final String HELP_TEXT = """
      HALO results viewer

      Usage:
        halo view in=FILE [record=N]

      Options:
        in=FILE      Results file (.json, .csv or .xlsx)
        record=N     Show the full breakdown of record N (1-based); lists all records when omitted
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private ViewCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, new FileStorageBackend());
  }

  static ExitCode run(String[] args, StorageBackend storage) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path file;
    Integer record = null;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String in = kv.get("in");
      if (in == null) {
        throw new IllegalArgumentException("in=FILE is required");
      }
      file = Path.of(in).toAbsolutePath().normalize();
      if (kv.containsKey("record")) {
        record = (int) Numbers.parseRange("record", kv.get("record"), 1, Integer.MAX_VALUE);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<SessionResult> results;
    try {
      results = storage.load(file);
    } catch (StorageException ex) {
      log.error("Cannot read results from {}: {}", ex.path(), ex.getMessage(), ex);
      return Files.exists(file) ? ExitCode.IO_ERROR : ExitCode.INVALID_ARGS;
    }

    if (results.isEmpty()) {
      CliPrinter.println("No results found in " + file.getFileName());
      return ExitCode.SUCCESS;
    }
    if (record != null) {
      if (record > results.size()) {
        log.error("record={} is out of range; {} holds {} records", record, file.getFileName(), results.size());
        return ExitCode.INVALID_ARGS;
      }
      CliPrinter.printLines(ResultsReport.details(results.get(record - 1)));
      return ExitCode.SUCCESS;
    }
    CliPrinter.println("Results in " + file.getFileName());
    CliPrinter.printLines(ResultsReport.summary(results));
    CliPrinter.printLines(ResultsReport.listing(results));
    return ExitCode.SUCCESS;
  }
}
