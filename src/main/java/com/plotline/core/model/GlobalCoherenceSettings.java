package com.plotline.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied pass toggles and depth. Fixed for the duration of a run.
 */
public record GlobalCoherenceSettings(
    boolean enableTransitions,
    boolean enableSequences,
    boolean enableChapters,
    boolean enableArc,
    boolean enableSynthesis,
    AnalysisDepth depth
) implements Serializable {

    public GlobalCoherenceSettings {
        depth = depth != null ? depth : AnalysisDepth.STANDARD;
    }

    /** All passes enabled at standard depth. */
    public static GlobalCoherenceSettings defaults() {
        return new GlobalCoherenceSettings(true, true, true, true, true, AnalysisDepth.STANDARD);
    }

    public boolean isEnabled(AnalysisPass pass) {
        return switch (pass) {
            case TRANSITIONS -> enableTransitions;
            case SEQUENCES -> enableSequences;
            case CHAPTERS -> enableChapters;
            case ARC -> enableArc;
            case SYNTHESIS -> enableSynthesis;
        };
    }

    /** Enabled passes in execution order. */
    public List<AnalysisPass> enabledPasses() {
        List<AnalysisPass> passes = new ArrayList<>();
        for (AnalysisPass pass : AnalysisPass.values()) {
            if (isEnabled(pass)) {
                passes.add(pass);
            }
        }
        return List.copyOf(passes);
    }
}
