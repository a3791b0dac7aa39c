package ca.gc.cra.halo.domain.storage;

import java.util.Locale;

/**
 * Persisted file format for analysis results.
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  JSON("json"),
  CSV("csv"),
  SPREADSHEET("xlsx");

  private final String extension;

  OutputFormat(String extension) {
    this.extension = extension;
  }

  /** File extension without the leading dot. */
  public String extension() {
    return extension;
  }

  /**
   * Parses a user supplied format name. Accepts {@code excel} and {@code xlsx} as aliases of
   * {@link #SPREADSHEET}.
   *
   * @throws IllegalArgumentException when the name is blank or unknown
   */
  public static OutputFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("format must not be blank");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "json" -> JSON;
      case "csv" -> CSV;
      case "spreadsheet", "excel", "xlsx" -> SPREADSHEET;
      default -> throw new IllegalArgumentException(
          "format must be json, csv or spreadsheet (was '" + raw + "')");
    };
  }

  /**
   * Resolves the format from a file name extension.
   *
   * @throws IllegalArgumentException when the extension is not recognised
   */
  public static OutputFormat fromFileName(String fileName) {
    int dot = fileName == null ? -1 : fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      throw new IllegalArgumentException("file has no extension: " + fileName);
    }
    String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (OutputFormat format : values()) {
      if (format.extension.equals(ext)) {
        return format;
      }
    }
    throw new IllegalArgumentException("unsupported file extension: " + ext);
  }
}
