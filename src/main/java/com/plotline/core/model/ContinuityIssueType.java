package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Categories of scene-local continuity issues.
 */
public enum ContinuityIssueType {
    PRONOUN,
    TIMELINE,
    CHARACTER,
    PLOT,
    CONTEXT,
    ENGAGEMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContinuityIssueType normalize(String raw) {
        if (raw != null) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            for (ContinuityIssueType type : values()) {
                if (type.wireName().equals(value)) {
                    return type;
                }
            }
        }
        return CONTEXT;
    }
}
