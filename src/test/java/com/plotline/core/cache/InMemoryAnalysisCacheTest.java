package com.plotline.core.cache;

import com.plotline.core.model.AnalysisDepth;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.ResponseMetadata;
import com.plotline.core.model.Scene;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryAnalysisCache}.
 */
class InMemoryAnalysisCacheTest {

    private InMemoryAnalysisCache cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryAnalysisCache();
        cache.init();
    }

    private static AnalysisRequest request(String text, ModelTier tier, AnalysisDepth depth) {
        return new AnalysisRequest(new Scene("s1", text, 0), List.of(), AnalysisType.SIMPLE, null,
                new AnalysisOptions(List.of(), tier, depth));
    }

    private static AnalysisResponse response() {
        return new AnalysisResponse(List.of(), new ResponseMetadata("gpt-4o-mini", "openai", 120, false), null);
    }

    @Test
    @DisplayName("a stored response is returned for an equal request")
    void hitAfterPut() {
        cache.put(request("The tide turned.", ModelTier.FAST, AnalysisDepth.QUICK), response());

        var hit = cache.get(request("The tide turned.", ModelTier.FAST, AnalysisDepth.QUICK));

        assertTrue(hit.isPresent());
        assertEquals(new AnalysisCache.CacheStats(1, 0, 1), cache.getStats());
    }

    @Test
    @DisplayName("tier and depth are part of the key")
    void keyCoversTierAndDepth() {
        cache.put(request("The tide turned.", ModelTier.FAST, AnalysisDepth.QUICK), response());

        assertTrue(cache.get(request("The tide turned.", ModelTier.DEEP, AnalysisDepth.QUICK)).isEmpty());
        assertTrue(cache.get(request("The tide turned.", ModelTier.FAST, AnalysisDepth.THOROUGH)).isEmpty());
        assertEquals(2, cache.getStats().misses());
    }

    @Test
    @DisplayName("keys are stable SHA-256 hex digests")
    void keysAreStable() {
        String key = InMemoryAnalysisCache.keyFor(request("x", ModelTier.STANDARD, AnalysisDepth.STANDARD));

        assertEquals(64, key.length());
        assertEquals(key, InMemoryAnalysisCache.keyFor(request("x", ModelTier.STANDARD, AnalysisDepth.STANDARD)));
    }

    @Test
    @DisplayName("warmCache leaves entries and statistics untouched")
    void warmCacheIsPassive() {
        cache.put(request("a", ModelTier.FAST, AnalysisDepth.QUICK), response());

        cache.warmCache(List.of(request("a", ModelTier.FAST, AnalysisDepth.QUICK),
                request("b", ModelTier.FAST, AnalysisDepth.QUICK)));

        assertEquals(new AnalysisCache.CacheStats(0, 0, 1), cache.getStats());
    }

    @Test
    @DisplayName("a full cache evicts the least recently used entry")
    void evictsLeastRecentlyUsed() {
        InMemoryAnalysisCache small = new InMemoryAnalysisCache(2);
        small.put(request("a", ModelTier.FAST, AnalysisDepth.QUICK), response());
        small.put(request("b", ModelTier.FAST, AnalysisDepth.QUICK), response());
        small.get(request("a", ModelTier.FAST, AnalysisDepth.QUICK));

        small.put(request("c", ModelTier.FAST, AnalysisDepth.QUICK), response());

        assertEquals(2, small.getStats().size());
        assertTrue(small.get(request("a", ModelTier.FAST, AnalysisDepth.QUICK)).isPresent());
        assertTrue(small.get(request("b", ModelTier.FAST, AnalysisDepth.QUICK)).isEmpty());
        assertTrue(small.get(request("c", ModelTier.FAST, AnalysisDepth.QUICK)).isPresent());
    }

    @Test
    @DisplayName("a non-positive capacity is rejected")
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryAnalysisCache(0));
    }

    @Test
    @DisplayName("clear empties the cache and resets statistics")
    void clearResets() {
        cache.put(request("a", ModelTier.FAST, AnalysisDepth.QUICK), response());
        cache.get(request("a", ModelTier.FAST, AnalysisDepth.QUICK));

        cache.clear();

        assertEquals(new AnalysisCache.CacheStats(0, 0, 0), cache.getStats());
        assertEquals(0.0, cache.getStats().hitRate());
    }
}
