package com.plotline.core.model;

import java.io.Serializable;

/**
 * @param modelUsed  concrete model name that served the request
 * @param provider   provider id
 * @param durationMs call duration
 * @param cached     true when served from the analysis cache
 */
public record ResponseMetadata(
    String modelUsed,
    String provider,
    long durationMs,
    boolean cached
) implements Serializable {

    public ResponseMetadata asCached() {
        return new ResponseMetadata(modelUsed, provider, 0L, true);
    }
}
