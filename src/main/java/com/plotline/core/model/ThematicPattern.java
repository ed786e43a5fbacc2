package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a theme was broken: dropped or interrupted ({@code discontinuity}) or undercut by an
 * abrupt change of emotional register ({@code tonal_shift}).
 */
public enum ThematicPattern {
    DISCONTINUITY,
    TONAL_SHIFT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ThematicPattern normalize(String raw) {
        if (raw != null) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            if (value.contains("tone") || value.contains("tonal") || value.contains("mood")) {
                return TONAL_SHIFT;
            }
        }
        return DISCONTINUITY;
    }
}
