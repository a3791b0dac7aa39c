package ca.gc.cra.halo.application.pipeline;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of a completed live run.
 *
 * @param framesCaptured frames read by the render loop
 * @param framesDropped frames overwritten in the slot before analysis could read them
 * @param resultsUnsaved results still in memory because the final flush failed
 * @param lastSavedFile most recent file written, if any
 * @since 0.1.0
 */
public record LiveRunSummary(
    long framesCaptured, long framesDropped, int resultsUnsaved, Optional<Path> lastSavedFile) {}
