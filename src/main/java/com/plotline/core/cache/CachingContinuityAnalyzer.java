package com.plotline.core.cache;

import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;

/**
 * Serves repeated requests from an {@link AnalysisCache}. Failures are never cached.
 */
public class CachingContinuityAnalyzer implements ContinuityAnalyzer {

    private final ContinuityAnalyzer delegate;
    private final AnalysisCache cache;

    public CachingContinuityAnalyzer(ContinuityAnalyzer delegate, AnalysisCache cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public AnalysisResponse analyze(AnalysisRequest request) {
        var cached = cache.get(request);
        if (cached.isPresent()) {
            AnalysisResponse hit = cached.get();
            return new AnalysisResponse(hit.issues(),
                    hit.metadata() != null ? hit.metadata().asCached() : null, hit.payload());
        }
        AnalysisResponse response = delegate.analyze(request);
        cache.put(request, response);
        return response;
    }

    public AnalysisCache cache() {
        return cache;
    }
}
