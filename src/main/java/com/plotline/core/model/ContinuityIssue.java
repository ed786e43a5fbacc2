package com.plotline.core.model;

import java.io.Serializable;

/**
 * A continuity issue local to one scene.
 *
 * @param type         issue category
 * @param severity     impact
 * @param description  human readable explanation
 * @param textSpan     offending span in the scene text, may be null
 * @param suggestedFix optional rewrite hint, may be null
 */
public record ContinuityIssue(
    ContinuityIssueType type,
    Severity severity,
    String description,
    TextSpan textSpan,
    String suggestedFix
) implements Serializable {

    public ContinuityIssue {
        type = type != null ? type : ContinuityIssueType.CONTEXT;
        severity = severity != null ? severity : Severity.CONSIDER;
        description = description != null ? description : "";
    }

    public ContinuityIssue withSeverityAndDescription(Severity newSeverity, String newDescription) {
        return new ContinuityIssue(type, newSeverity, newDescription, textSpan, suggestedFix);
    }
}
