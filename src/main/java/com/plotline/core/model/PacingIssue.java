package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A pacing problem across a run of scenes.
 *
 * @param tensionDelta spread of tension levels that triggered the issue, 0 when unknown
 */
public record PacingIssue(
    Severity severity,
    String description,
    List<String> affectedScenes,
    PacingPattern pattern,
    double tensionDelta
) implements CoherenceIssue, Serializable {

    public PacingIssue {
        description = description != null ? description : "";
        affectedScenes = affectedScenes != null ? List.copyOf(affectedScenes) : List.of();
    }

    @Override
    public String type() {
        return "pacing";
    }

    @Override
    public PacingIssue withSeverity(Severity newSeverity) {
        return new PacingIssue(newSeverity, description, affectedScenes, pattern, tensionDelta);
    }
}
