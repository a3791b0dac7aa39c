package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.error.StorageException;
import ca.gc.cra.halo.domain.session.SessionResult;
import ca.gc.cra.halo.domain.storage.OutputFormat;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port persisting batches of {@link SessionResult} records.
 * <p><strong>Why:</strong> Keeps file formats out of the flusher so batching and retry logic stay format
 * agnostic.</p>
 * <p><strong>Role:</strong> Driven adapter invoked by {@code PersistenceFlusher} on its own thread.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write a whole batch or nothing; a failed save must not leave a partial file behind.</li>
 *   <li>Append the format extension to the supplied base path.</li>
 *   <li>Read back previously saved batches by extension.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from one flusher thread; adapters need not synchronize.</p>
 * <p><strong>Performance:</strong> May block on disk I/O; never called from the render loop.</p>
 * <p><strong>Observability:</strong> The flusher records {@code halo.persist.flush.*} around each call.</p>
 *
 * @since 0.1.0
 */
public interface StorageBackend extends AutoCloseable {

  /**
   * Saves {@code results} to {@code basePath} plus the format extension.
   *
   * @param results non-empty batch, in enqueue order
   * @param basePath target path without extension
   * @param format output format
   * @return the file that was written
   * @throws StorageException if the batch could not be written
   */
  Path save(List<SessionResult> results, Path basePath, OutputFormat format) throws StorageException;

  /**
   * Loads results from a file previously written by {@link #save}.
   *
   * @param file file whose extension selects the format
   * @return stored results in file order
   * @throws StorageException if the file cannot be read or parsed
   */
  List<SessionResult> load(Path file) throws StorageException;

  @Override
  default void close() {}
}
