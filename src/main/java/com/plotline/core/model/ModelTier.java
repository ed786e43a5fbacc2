package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Capability tier requested from the provider. Resolved to a concrete model name by configuration.
 */
public enum ModelTier {
    FAST,
    STANDARD,
    DEEP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
