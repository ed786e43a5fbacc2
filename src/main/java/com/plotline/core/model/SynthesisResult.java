package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Cross-pass issue lists produced by the synthesis pass.
 *
 * @param report provider synthesis, null when the call was skipped or failed
 */
public record SynthesisResult(
    List<NarrativeFlowIssue> flowIssues,
    List<PacingIssue> pacingProblems,
    List<ThematicDiscontinuity> thematicBreaks,
    List<CharacterArcIssue> characterArcDisruptions,
    SynthesisReport report
) implements Serializable {

    public SynthesisResult {
        flowIssues = flowIssues != null ? List.copyOf(flowIssues) : List.of();
        pacingProblems = pacingProblems != null ? List.copyOf(pacingProblems) : List.of();
        thematicBreaks = thematicBreaks != null ? List.copyOf(thematicBreaks) : List.of();
        characterArcDisruptions = characterArcDisruptions != null ? List.copyOf(characterArcDisruptions) : List.of();
    }

    public static SynthesisResult empty() {
        return new SynthesisResult(List.of(), List.of(), List.of(), List.of(), null);
    }

    public int issueCount() {
        return flowIssues.size() + pacingProblems.size() + thematicBreaks.size() + characterArcDisruptions.size();
    }
}
