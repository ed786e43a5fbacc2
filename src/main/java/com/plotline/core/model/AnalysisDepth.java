package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How exhaustive the provider should be. Only affects prompt wording.
 */
public enum AnalysisDepth {
    QUICK,
    STANDARD,
    THOROUGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnalysisDepth fromWire(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
