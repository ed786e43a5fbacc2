package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Coherence assessment of one chapter.
 *
 * @param chapterNumber   1-based chapter number
 * @param sceneIds        scenes forming the chapter, in order
 * @param coherenceScore  chapter coherence, always within [0, 1]
 * @param issues          health flags, {@code true} meaning healthy
 * @param recommendations split/merge/orphan advice
 * @param pacingProfile   tension curve shape
 */
public record ChapterFlowAnalysis(
    int chapterNumber,
    List<String> sceneIds,
    double coherenceScore,
    ChapterHealth issues,
    ChapterRecommendations recommendations,
    PacingProfile pacingProfile
) implements Serializable {

    public ChapterFlowAnalysis {
        sceneIds = sceneIds != null ? List.copyOf(sceneIds) : List.of();
        coherenceScore = Math.max(0.0, Math.min(1.0, coherenceScore));
    }
}
