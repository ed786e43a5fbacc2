package com.plotline.core.cache;

import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;

import java.util.Collection;
import java.util.Optional;

/**
 * Stores AI analysis responses keyed by request content.
 */
public interface AnalysisCache {

    /** Prepares the cache for a run. Called once at the start of every analysis. */
    void init();

    /**
     * Marks requests whose responses are expected to be reused. Implementations may ignore it.
     */
    void warmCache(Collection<AnalysisRequest> requests);

    Optional<AnalysisResponse> get(AnalysisRequest request);

    void put(AnalysisRequest request, AnalysisResponse response);

    void clear();

    CacheStats getStats();

    /**
     * @param hits   lookups served from the cache
     * @param misses lookups that fell through to the provider
     * @param size   entries currently held
     */
    record CacheStats(long hits, long misses, int size) {

        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
