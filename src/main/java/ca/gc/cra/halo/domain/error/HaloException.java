package ca.gc.cra.halo.domain.error;

/**
 * Root of the checked failures raised across HALO port boundaries.
 *
 * @since 0.1.0
 */
public class HaloException extends Exception {
  private static final long serialVersionUID = 1L;

  public HaloException(String message) {
    super(message);
  }

  public HaloException(String message, Throwable cause) {
    super(message, cause);
  }
}
