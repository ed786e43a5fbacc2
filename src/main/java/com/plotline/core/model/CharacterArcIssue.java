package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A character whose arc is left incomplete or behaves inconsistently.
 */
public record CharacterArcIssue(
    Severity severity,
    String description,
    List<String> affectedScenes,
    ArcIssuePattern pattern,
    String character
) implements CoherenceIssue, Serializable {

    public CharacterArcIssue {
        description = description != null ? description : "";
        affectedScenes = affectedScenes != null ? List.copyOf(affectedScenes) : List.of();
    }

    @Override
    public String type() {
        return "character";
    }

    @Override
    public CharacterArcIssue withSeverity(Severity newSeverity) {
        return new CharacterArcIssue(newSeverity, description, affectedScenes, pattern, character);
    }
}
