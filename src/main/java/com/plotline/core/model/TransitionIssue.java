package com.plotline.core.model;

import java.io.Serializable;

/**
 * A single problem found at a transition between two scenes.
 */
public record TransitionIssue(
    TransitionIssueType type,
    Severity severity,
    String description,
    String suggestion
) implements Serializable {

    public TransitionIssue {
        type = type != null ? type : TransitionIssueType.JARRING_PACE_CHANGE;
        severity = severity != null ? severity : Severity.CONSIDER;
        description = description != null ? description : "";
    }
}
