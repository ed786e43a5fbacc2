package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Issue severity, declared from lowest to highest impact.
 */
public enum Severity {
    CONSIDER("consider"),
    SHOULD_FIX("should-fix"),
    MUST_FIX("must-fix");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Moves this severity up the scale by {@code steps}, capped at {@link #MUST_FIX}.
     */
    public Severity escalate(int steps) {
        int target = Math.min(ordinal() + Math.max(0, steps), MUST_FIX.ordinal());
        return values()[target];
    }

    /**
     * Maps free-form provider text onto the closed scale. Unknown values become {@link #CONSIDER}.
     */
    @JsonCreator
    public static Severity normalize(String raw) {
        if (raw == null) {
            return CONSIDER;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.wireName.equals(value)) {
                return severity;
            }
        }
        if (value.contains("critical") || value.contains("must")) return MUST_FIX;
        if (value.contains("should") || value.contains("important")) return SHOULD_FIX;
        if (value.contains("minor") || value.contains("small")) return CONSIDER;
        return CONSIDER;
    }
}
