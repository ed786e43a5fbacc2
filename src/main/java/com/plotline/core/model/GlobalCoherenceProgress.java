package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable snapshot of a running analysis, emitted on every state change.
 *
 * @param analysisId             run identifier
 * @param currentPass            pass in progress, null before the first pass
 * @param passNumber             1-based ordinal among enabled passes, 0 before the first pass
 * @param totalPasses            number of enabled passes
 * @param passProgress           progress within the current pass, 0 to 100
 * @param scenesAnalyzed         scenes covered so far in the current pass
 * @param totalScenes            scenes in the manuscript
 * @param currentScene           scene id being worked on, may be null
 * @param estimatedTimeRemaining linear extrapolation in milliseconds
 * @param errors                 pass-level failures so far
 * @param cancelled              true once cancellation was requested
 * @param finished               true only on the final emission
 */
public record GlobalCoherenceProgress(
    String analysisId,
    AnalysisPass currentPass,
    int passNumber,
    int totalPasses,
    int passProgress,
    int scenesAnalyzed,
    int totalScenes,
    String currentScene,
    long estimatedTimeRemaining,
    List<PassError> errors,
    boolean cancelled,
    boolean finished
) implements Serializable {

    public GlobalCoherenceProgress {
        passProgress = Math.max(0, Math.min(100, passProgress));
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
