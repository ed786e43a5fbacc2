package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A break in cause and effect or information flow across a run of scenes.
 */
public record NarrativeFlowIssue(
    Severity severity,
    String description,
    List<String> affectedScenes,
    FlowPattern pattern
) implements CoherenceIssue, Serializable {

    public NarrativeFlowIssue {
        description = description != null ? description : "";
        affectedScenes = affectedScenes != null ? List.copyOf(affectedScenes) : List.of();
    }

    @Override
    public String type() {
        return "flow";
    }

    @Override
    public NarrativeFlowIssue withSeverity(Severity newSeverity) {
        return new NarrativeFlowIssue(newSeverity, description, affectedScenes, pattern);
    }
}
