package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PacingPattern {
    TOO_SLOW,
    TOO_FAST,
    INCONSISTENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PacingPattern normalize(String raw) {
        if (raw == null) {
            return INCONSISTENT;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.contains("slow")) return TOO_SLOW;
        if (value.contains("fast") || value.contains("rush")) return TOO_FAST;
        return INCONSISTENT;
    }
}
