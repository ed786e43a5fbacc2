package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Input to the AI analysis capability.
 *
 * @param scene          scene under analysis; passes that analyze groups put their prompt in the scene text
 * @param previousScenes preceding scenes for context, oldest first
 * @param analysisType   analysis breadth
 * @param readerContext  reader knowledge at this point
 * @param options        tier, depth and focus areas
 */
public record AnalysisRequest(
    Scene scene,
    List<Scene> previousScenes,
    AnalysisType analysisType,
    ReaderContext readerContext,
    AnalysisOptions options
) implements Serializable {

    public AnalysisRequest {
        previousScenes = previousScenes != null ? List.copyOf(previousScenes) : List.of();
        analysisType = analysisType != null ? analysisType : AnalysisType.SIMPLE;
        readerContext = readerContext != null ? readerContext : ReaderContext.empty();
        options = options != null ? options : new AnalysisOptions(List.of(), ModelTier.STANDARD, AnalysisDepth.STANDARD);
    }
}
