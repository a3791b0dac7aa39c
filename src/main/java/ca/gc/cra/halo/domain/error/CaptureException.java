package ca.gc.cra.halo.domain.error;

/**
 * A frame read failed after the device was opened (disconnect or end of stream).
 *
 * @since 0.1.0
 */
public final class CaptureException extends HaloException {
  private static final long serialVersionUID = 1L;

  public CaptureException(String message) {
    super(message);
  }

  public CaptureException(String message, Throwable cause) {
    super(message, cause);
  }
}
