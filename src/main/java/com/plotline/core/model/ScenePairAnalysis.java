package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of analyzing the transition from scene A to scene B.
 *
 * @param sceneAId        id of the earlier scene
 * @param sceneBId        id of the later scene
 * @param position        index of the pair, 0 for the first transition
 * @param transitionScore transition quality, always within [0, 1]
 * @param issues          problems found at this transition
 * @param strengths       positive observations reported by the provider
 * @param flags           structural hints
 */
public record ScenePairAnalysis(
    String sceneAId,
    String sceneBId,
    int position,
    double transitionScore,
    List<TransitionIssue> issues,
    List<String> strengths,
    TransitionFlags flags
) implements Serializable {

    public ScenePairAnalysis {
        transitionScore = Math.max(0.0, Math.min(1.0, transitionScore));
        issues = issues != null ? List.copyOf(issues) : List.of();
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        flags = flags != null ? flags : TransitionFlags.none();
    }
}
