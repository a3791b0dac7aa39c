package ca.gc.cra.halo.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the pipeline.
 * <p><strong>Why:</strong> The countdown, flush interval and FPS counters all depend on elapsed time; tests
 * drive them with a manual clock instead of sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate reads from the render, analysis and flusher
 * threads.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /** Default clock delegating to {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
