package com.plotline.core.cache;

import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local cache keyed by the SHA-256 of the request's analysis type, model tier, depth,
 * scene text and previous scene ids.
 * <p>
 * Holds at most {@code maxEntries} responses and evicts the least recently used one when full.
 */
public class InMemoryAnalysisCache implements AnalysisCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAnalysisCache.class);

    static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Map<String, AnalysisResponse> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public InMemoryAnalysisCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public InMemoryAnalysisCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.entries = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AnalysisResponse> eldest) {
                return size() > maxEntries;
            }
        });
    }

    @Override
    public void init() {
        log.debug("Analysis cache ready with {} entries", entries.size());
    }

    @Override
    public void warmCache(Collection<AnalysisRequest> requests) {
        long present = requests.stream().map(InMemoryAnalysisCache::keyFor).filter(entries::containsKey).count();
        log.debug("Warm cache: {} of {} requests already cached", present, requests.size());
    }

    @Override
    public Optional<AnalysisResponse> get(AnalysisRequest request) {
        AnalysisResponse response = entries.get(keyFor(request));
        if (response == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(response);
    }

    @Override
    public void put(AnalysisRequest request, AnalysisResponse response) {
        entries.put(keyFor(request), response);
    }

    @Override
    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), entries.size());
    }

    static String keyFor(AnalysisRequest request) {
        String previous = request.previousScenes().stream().map(Scene::id).collect(Collectors.joining(","));
        String material = String.join("\u0000",
                request.analysisType().name(),
                request.options().modelTier().name(),
                request.options().depth().name(),
                request.scene() != null ? request.scene().text() : "",
                previous);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
