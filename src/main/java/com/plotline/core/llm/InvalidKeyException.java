package com.plotline.core.llm;

/**
 * Thrown when the provider rejects the configured API key.
 */
public class InvalidKeyException extends AiKeyException {

    public InvalidKeyException(String provider, String details, Throwable cause) {
        super(provider, "Invalid " + provider + " API key: " + details, cause);
    }
}
