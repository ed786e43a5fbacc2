package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * @param completeness how fully the arc is resolved, within [0, 1]
 * @param consistency  how consistently the character behaves, within [0, 1]
 * @param issues       missing or contradictory arc elements
 */
public record CharacterArc(
    double completeness,
    double consistency,
    List<String> issues
) implements Serializable {

    public CharacterArc {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
