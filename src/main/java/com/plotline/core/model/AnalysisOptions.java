package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

public record AnalysisOptions(
    List<String> focusAreas,
    ModelTier modelTier,
    AnalysisDepth depth
) implements Serializable {

    public AnalysisOptions {
        focusAreas = focusAreas != null ? List.copyOf(focusAreas) : List.of();
        modelTier = modelTier != null ? modelTier : ModelTier.STANDARD;
        depth = depth != null ? depth : AnalysisDepth.STANDARD;
    }
}
