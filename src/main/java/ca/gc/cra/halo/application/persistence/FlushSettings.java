package ca.gc.cra.halo.application.persistence;

import ca.gc.cra.halo.domain.storage.OutputFormat;
import ca.gc.cra.halo.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Where, how and how often the flusher writes accumulated results.
 *
 * @param outputDirectory directory receiving result files
 * @param filePrefix file name prefix, followed by {@code _yyyyMMdd_HHmmss}
 * @param format output format
 * @param interval minimum time between flush attempts
 * @param pollMillis flusher loop sleep between drains
 * @since 0.1.0
 */
public record FlushSettings(
    Path outputDirectory, String filePrefix, OutputFormat format, Duration interval, long pollMillis) {

  public FlushSettings {
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    filePrefix = Strings.requireNonBlank("filePrefix", filePrefix);
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(interval, "interval");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (pollMillis <= 0) {
      throw new IllegalArgumentException("pollMillis must be positive");
    }
  }
}
