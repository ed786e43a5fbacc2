package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Consolidated output of the sequence pass.
 */
public record SequenceResults(
    List<NarrativeFlowIssue> flowIssues,
    List<PacingIssue> pacingIssues,
    List<ThematicDiscontinuity> thematicIssues
) implements Serializable {

    public SequenceResults {
        flowIssues = flowIssues != null ? List.copyOf(flowIssues) : List.of();
        pacingIssues = pacingIssues != null ? List.copyOf(pacingIssues) : List.of();
        thematicIssues = thematicIssues != null ? List.copyOf(thematicIssues) : List.of();
    }

    public static SequenceResults empty() {
        return new SequenceResults(List.of(), List.of(), List.of());
    }

    public int size() {
        return flowIssues.size() + pacingIssues.size() + thematicIssues.size();
    }
}
