package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.error.CaptureException;
import ca.gc.cra.halo.domain.error.DeviceUnavailableException;
import ca.gc.cra.halo.domain.frame.Frame;

/**
 * <strong>What:</strong> Port producing frames from a camera or video input.
 * <p><strong>Why:</strong> Decouples the render loop and capture session from OpenCV device handling.</p>
 * <p><strong>Role:</strong> Driven adapter consumed by {@code RenderLoop} and {@code CaptureSessionUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the configured device exactly once, failing fast when it is missing.</li>
 *   <li>Return one frame per {@link #readFrame()} call, blocking at most one device period.</li>
 *   <li>Release the device on {@link #close()}; repeated calls are no-ops.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Only the foreground loop reads frames.</p>
 * <p><strong>Performance:</strong> Reads are bounded by the device frame rate; adapters must not retry
 * internally.</p>
 * <p><strong>Observability:</strong> Callers count frames with {@code halo.capture.frames}.</p>
 *
 * @since 0.1.0
 */
public interface CaptureSource extends AutoCloseable {

  /**
   * Opens the device.
   *
   * @param device numeric device index or a video file path
   * @throws DeviceUnavailableException if the device cannot be opened
   */
  void open(String device) throws DeviceUnavailableException;

  /**
   * Reads the next frame.
   *
   * @return captured frame; never {@code null}
   * @throws CaptureException on disconnect, end of stream or any other read failure
   */
  Frame readFrame() throws CaptureException;

  /** Returns a short description of the capture backend, shown on the overlay. */
  String backendName();

  /** Releases the device. Idempotent. */
  @Override
  void close();
}
