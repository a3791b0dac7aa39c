package ca.gc.cra.halo.config;

import ca.gc.cra.halo.application.session.SessionMode;
import ca.gc.cra.halo.domain.storage.OutputFormat;
import ca.gc.cra.halo.validation.Numbers;
import ca.gc.cra.halo.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Effective settings of one {@code live} or {@code session} run after defaults, YAML and CLI overrides
 * have been merged.
 *
 * @param device camera index ({@code 0}, {@code 1}, ...) or path to a video file
 * @param outputDirectory directory receiving result files
 * @param outputFormat result file format
 * @param flushInterval minimum time between periodic flushes
 * @param gpuAcceleration request OpenCL acceleration when available
 * @param frameSkip display every n-th captured frame
 * @param overlayEnabled whether the overlay starts visible
 * @param countdown capture session countdown
 * @param idleSleepMillis analysis worker back-off when no new frame is available
 * @param shutdownTimeout bound on waiting for background workers at shutdown
 * @param cascadePath Haar cascade XML used for face detection
 * @param minFaceSize smallest face side in pixels passed to the detector
 * @param display display mode
 * @param filePrefix result file name prefix
 * @param autoTrigger arm the session countdown without waiting for the capture key
 * @param analysis what a session assesses: the face only, or the face then the body
 * @since 0.1.0
 */
public record PipelineConfig(
    String device,
    Path outputDirectory,
    OutputFormat outputFormat,
    Duration flushInterval,
    boolean gpuAcceleration,
    int frameSkip,
    boolean overlayEnabled,
    Duration countdown,
    long idleSleepMillis,
    Duration shutdownTimeout,
    Path cascadePath,
    int minFaceSize,
    DisplayMode display,
    String filePrefix,
    boolean autoTrigger,
    SessionMode analysis) {

  static final String DEFAULT_DEVICE = "0";
  static final String DEFAULT_FILE_PREFIX = "facial_analysis";
  static final String CASCADE_FILE_NAME = "haarcascade_frontalface_default.xml";
  static final int DEFAULT_FLUSH_INTERVAL_SECONDS = 10;
  static final int DEFAULT_COUNTDOWN_SECONDS = 3;
  static final int DEFAULT_IDLE_SLEEP_MILLIS = 10;
  static final int DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 5_000;
  static final int DEFAULT_MIN_FACE_SIZE = 80;
  private static final int MAX_FILE_PREFIX_LENGTH = 64;

  public PipelineConfig {
    device = Strings.requireNonBlank("device", device);
    if (outputDirectory == null || outputFormat == null || flushInterval == null || countdown == null
        || shutdownTimeout == null || cascadePath == null || display == null || analysis == null) {
      throw new IllegalArgumentException("pipeline configuration is incomplete");
    }
    Numbers.requireRange("frameSkip", frameSkip, 1, 120);
    Numbers.requireRange("minFaceSize", minFaceSize, 16, 2_000);
    Numbers.requireRange("idleSleepMs", idleSleepMillis, 1, 1_000);
    filePrefix = Strings.requireFileNameSafe("filePrefix", filePrefix, MAX_FILE_PREFIX_LENGTH);
  }

  /** Defaults used when neither YAML nor CLI supply a value. */
  public static PipelineConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Materializes a configuration from a flat key/value map.
   *
   * <p>Keys: {@code device}, {@code out}, {@code format}, {@code flushIntervalSec}, {@code gpu},
   * {@code frameSkip}, {@code overlay}, {@code countdownSec}, {@code idleSleepMs},
   * {@code shutdownTimeoutMs}, {@code cascade}, {@code minFaceSize}, {@code display},
   * {@code filePrefix}, {@code autoTrigger}, {@code analysis}. Missing keys take their defaults; unknown keys are
   * ignored.
   *
   * @param kv merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> kv) {
    Map<String, String> map = kv == null ? Map.of() : kv;
    Path base = defaultBaseDirectory();
    String device = nonBlankOr(map.get("device"), DEFAULT_DEVICE);
    Path out = parsePath("out", nonBlankOr(map.get("out"), base.resolve("out").toString()));
    String formatRaw = nonBlankOr(map.get("format"), OutputFormat.JSON.name());
    OutputFormat format = OutputFormat.parse(formatRaw);
    Duration flushInterval = Duration.ofSeconds(
        parseBounded(map, "flushIntervalSec", DEFAULT_FLUSH_INTERVAL_SECONDS, 1, 3_600));
    boolean gpu = parseBoolean(map.get("gpu"), false);
    int frameSkip = (int) parseBounded(map, "frameSkip", 1, 1, 120);
    boolean overlay = parseBoolean(map.get("overlay"), true);
    Duration countdown = Duration.ofSeconds(
        parseBounded(map, "countdownSec", DEFAULT_COUNTDOWN_SECONDS, 0, 60));
    long idleSleep = parseBounded(map, "idleSleepMs", DEFAULT_IDLE_SLEEP_MILLIS, 1, 1_000);
    Duration shutdownTimeout = Duration.ofMillis(
        parseBounded(map, "shutdownTimeoutMs", DEFAULT_SHUTDOWN_TIMEOUT_MILLIS, 100, 60_000));
    Path cascade = parsePath("cascade",
        nonBlankOr(map.get("cascade"), base.resolve("models").resolve(CASCADE_FILE_NAME).toString()));
    int minFaceSize = (int) parseBounded(map, "minFaceSize", DEFAULT_MIN_FACE_SIZE, 16, 2_000);
    DisplayMode display = DisplayMode.resolve(map.get("display"));
    String filePrefix = nonBlankOr(map.get("filePrefix"), DEFAULT_FILE_PREFIX);
    boolean autoTrigger = parseBoolean(map.get("autoTrigger"), false);
    SessionMode analysis = SessionMode.parse(nonBlankOr(map.get("analysis"), SessionMode.FACE.name()));
    return new PipelineConfig(
        device,
        out,
        format,
        flushInterval,
        gpu,
        frameSkip,
        overlay,
        countdown,
        idleSleep,
        shutdownTimeout,
        cascade,
        minFaceSize,
        display,
        filePrefix,
        autoTrigger,
        analysis);
  }

  static Path defaultBaseDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".halo");
  }

  private static long parseBounded(Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, defaultValue, min, max);
    }
    return Numbers.parseRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim();
    if (!normalized.equalsIgnoreCase("true") && !normalized.equalsIgnoreCase("false")) {
      throw new IllegalArgumentException("expected true or false (was '" + value + "')");
    }
    return Boolean.parseBoolean(normalized);
  }

  private static Path parsePath(String name, String value) {
    try {
      String raw = Strings.requireNonBlank(name, value);
      if (raw.startsWith("~/")) {
        raw = System.getProperty("user.home", ".") + raw.substring(1);
      }
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static String nonBlankOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
