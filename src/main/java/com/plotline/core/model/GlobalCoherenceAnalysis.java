package com.plotline.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final aggregate of a global coherence run.
 *
 * @param sceneLevel              transition analyses, one per adjacent pair
 * @param chapterLevel            chapter analyses
 * @param manuscriptLevel         arc analysis, or the derived default when the arc pass did not run
 * @param flowIssues              narrative-flow issues
 * @param pacingProblems          pacing issues
 * @param thematicBreaks          thematic discontinuities
 * @param characterArcDisruptions character-arc issues
 * @param synthesis               provider synthesis, may be null
 * @param timestamp               when the run finished
 * @param totalAnalysisTime       wall-clock duration in milliseconds
 * @param modelsUsed              model name per pass id
 * @param settings                settings the run was started with
 */
public record GlobalCoherenceAnalysis(
    List<ScenePairAnalysis> sceneLevel,
    List<ChapterFlowAnalysis> chapterLevel,
    ManuscriptAnalysis manuscriptLevel,
    List<NarrativeFlowIssue> flowIssues,
    List<PacingIssue> pacingProblems,
    List<ThematicDiscontinuity> thematicBreaks,
    List<CharacterArcIssue> characterArcDisruptions,
    SynthesisReport synthesis,
    Instant timestamp,
    long totalAnalysisTime,
    Map<String, String> modelsUsed,
    GlobalCoherenceSettings settings
) implements Serializable {

    public GlobalCoherenceAnalysis {
        sceneLevel = sceneLevel != null ? List.copyOf(sceneLevel) : List.of();
        chapterLevel = chapterLevel != null ? List.copyOf(chapterLevel) : List.of();
        flowIssues = flowIssues != null ? List.copyOf(flowIssues) : List.of();
        pacingProblems = pacingProblems != null ? List.copyOf(pacingProblems) : List.of();
        thematicBreaks = thematicBreaks != null ? List.copyOf(thematicBreaks) : List.of();
        characterArcDisruptions = characterArcDisruptions != null ? List.copyOf(characterArcDisruptions) : List.of();
        modelsUsed = modelsUsed != null ? Map.copyOf(modelsUsed) : Map.of();
    }

    public int totalIssueCount() {
        return flowIssues.size() + pacingProblems.size() + thematicBreaks.size() + characterArcDisruptions.size();
    }
}
