package ca.gc.cra.halo.domain.error;

/**
 * The capture device could not be opened. Fatal at startup.
 *
 * @since 0.1.0
 */
public final class DeviceUnavailableException extends HaloException {
  private static final long serialVersionUID = 1L;

  private final String device;

  public DeviceUnavailableException(String device, String message) {
    super(message);
    this.device = device;
  }

  public DeviceUnavailableException(String device, String message, Throwable cause) {
    super(message, cause);
    this.device = device;
  }

  /** Returns the device index or path that failed to open. */
  public String device() {
    return device;
  }
}
