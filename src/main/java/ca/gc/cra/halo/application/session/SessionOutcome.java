package ca.gc.cra.halo.application.session;

import ca.gc.cra.halo.domain.session.SessionResult;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Final state of a capture session.
 *
 * @param state terminal state reached
 * @param result captured result when {@code state} is CAPTURED
 * @param savedFile file the result was written to, if the save succeeded
 * @since 0.1.0
 */
public record SessionOutcome(
    CaptureSession.State state, Optional<SessionResult> result, Optional<Path> savedFile) {

  public boolean captured() {
    return state == CaptureSession.State.CAPTURED;
  }
}
