package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

public record ChapterRecommendations(
    boolean shouldSplit,
    boolean shouldMergeWithNext,
    List<String> orphanedScenes,
    List<String> missingElements
) implements Serializable {

    public ChapterRecommendations {
        orphanedScenes = orphanedScenes != null ? List.copyOf(orphanedScenes) : List.of();
        missingElements = missingElements != null ? List.copyOf(missingElements) : List.of();
    }
}
