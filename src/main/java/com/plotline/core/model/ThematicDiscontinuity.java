package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A theme that is established and then dropped or contradicted.
 *
 * @param theme         the theme label
 * @param lastSeenScene id of the last scene where the theme was intact, may be empty
 * @param brokenAtScene id of the scene where the theme breaks, may be empty
 */
public record ThematicDiscontinuity(
    Severity severity,
    String description,
    List<String> affectedScenes,
    ThematicPattern pattern,
    String theme,
    String lastSeenScene,
    String brokenAtScene
) implements CoherenceIssue, Serializable {

    public ThematicDiscontinuity {
        description = description != null ? description : "";
        affectedScenes = affectedScenes != null ? List.copyOf(affectedScenes) : List.of();
        theme = theme != null ? theme : "";
        lastSeenScene = lastSeenScene != null ? lastSeenScene : "";
        brokenAtScene = brokenAtScene != null ? brokenAtScene : "";
    }

    @Override
    public String type() {
        return "theme";
    }

    @Override
    public ThematicDiscontinuity withSeverity(Severity newSeverity) {
        return new ThematicDiscontinuity(newSeverity, description, affectedScenes, pattern,
                theme, lastSeenScene, brokenAtScene);
    }
}
