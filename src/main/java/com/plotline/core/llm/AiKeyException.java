package com.plotline.core.llm;

/**
 * Credential problem with the configured AI provider. Fatal for an analysis run.
 */
public abstract class AiKeyException extends RuntimeException {

    private final String provider;

    protected AiKeyException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
