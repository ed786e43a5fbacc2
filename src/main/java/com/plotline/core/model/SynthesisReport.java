package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

public record SynthesisReport(
    double overallCoherenceScore,
    List<SynthesisPriority> topPriorities,
    List<String> actionPlan
) implements Serializable {

    public SynthesisReport {
        topPriorities = topPriorities != null ? List.copyOf(topPriorities) : List.of();
        actionPlan = actionPlan != null ? List.copyOf(actionPlan) : List.of();
    }
}
