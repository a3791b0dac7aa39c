package ca.gc.cra.halo.infrastructure.storage;

import ca.gc.cra.halo.application.port.StorageBackend;
import ca.gc.cra.halo.domain.error.StorageException;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.domain.storage.OutputFormat;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local-file storage for result batches in JSON, CSV or XLSX.
 *
 * <p>Each batch is written to a temporary file in the target directory and moved into place, so a
 * failed save never leaves a partial file under the final name. When the target name already exists a
 * numeric suffix is appended rather than overwriting it.
 *
 * @since 0.1.0
 */
public final class FileStorageBackend implements StorageBackend {
  private static final Logger log = LoggerFactory.getLogger(FileStorageBackend.class);
  private static final int MAX_SUFFIX = 1_000;

  private final JsonResultCodec json = new JsonResultCodec();
  private final CsvResultCodec csv = new CsvResultCodec();
  private final SpreadsheetResultCodec spreadsheet = new SpreadsheetResultCodec();

  @Override
  public Path save(List<SessionResult> results, Path basePath, OutputFormat format) throws StorageException {
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(basePath, "basePath");
    Objects.requireNonNull(format, "format");
    if (results.isEmpty()) {
      throw new IllegalArgumentException("results must not be empty");
    }
    Path directory = basePath.toAbsolutePath().getParent();
    Path target = uniqueTarget(basePath, format);
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, ".halo-", ".tmp");
      try (OutputStream out = Files.newOutputStream(temp)) {
        write(results, format, out);
      }
      move(temp, target);
      temp = null;
      log.debug("Wrote {} results to {}", results.size(), target);
      return target;
    } catch (IOException | RuntimeException ex) {
      throw new StorageException(target, "Failed to write " + format.extension() + " results", ex);
    } finally {
      if (temp != null) {
        deleteTemp(temp);
      }
    }
  }

  @Override
  public List<SessionResult> load(Path file) throws StorageException {
    Objects.requireNonNull(file, "file");
    OutputFormat format;
    try {
      format = OutputFormat.fromFileName(file.getFileName().toString());
    } catch (IllegalArgumentException ex) {
      throw new StorageException(file, ex.getMessage(), ex);
    }
    if (!Files.isRegularFile(file)) {
      throw new StorageException(file, "Results file does not exist");
    }
    try (InputStream in = Files.newInputStream(file)) {
      return switch (format) {
        case JSON -> json.read(in);
        case CSV -> csv.read(in);
        case SPREADSHEET -> spreadsheet.read(in);
      };
    } catch (IOException | RuntimeException ex) {
      throw new StorageException(file, "Failed to read " + format.extension() + " results", ex);
    }
  }

  private void write(List<SessionResult> results, OutputFormat format, OutputStream out) throws IOException {
    switch (format) {
      case JSON -> json.write(results, out);
      case CSV -> csv.write(results, out);
      case SPREADSHEET -> spreadsheet.write(results, out);
      default -> throw new IllegalStateException("Unhandled format " + format);
    }
  }

  static Path uniqueTarget(Path basePath, OutputFormat format) throws StorageException {
    Path candidate = withExtension(basePath, "", format);
    for (int i = 1; Files.exists(candidate); i++) {
      if (i > MAX_SUFFIX) {
        throw new StorageException(candidate, "No free file name after " + MAX_SUFFIX + " attempts");
      }
      candidate = withExtension(basePath, "_" + i, format);
    }
    return candidate;
  }

  private static Path withExtension(Path basePath, String suffix, OutputFormat format) {
    return basePath.resolveSibling(basePath.getFileName() + suffix + "." + format.extension());
  }

  private static void move(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to plain move", target);
      Files.move(temp, target);
    }
  }

  private static void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.warn("Failed to delete temporary file {}", temp, ex);
    }
  }
}
