package com.plotline.core.llm;

import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;

/**
 * The single AI capability every analysis pass depends on: analyze a scene in context
 * and return structured issues.
 * <p>
 * Implementations may block and may throw. An {@link AiKeyException} means no further
 * call can succeed and aborts the whole run; every other exception is treated as a
 * failure of the one request.
 */
@FunctionalInterface
public interface ContinuityAnalyzer {

    AnalysisResponse analyze(AnalysisRequest request);
}
