package com.plotline.core.llm;

/**
 * Thrown before any provider call when no API key is configured for the active provider.
 */
public class MissingKeyException extends AiKeyException {

    public MissingKeyException(String provider) {
        super(provider, "Missing " + provider + " API key - set plotline.llm." + provider + "-api-key", null);
    }
}
