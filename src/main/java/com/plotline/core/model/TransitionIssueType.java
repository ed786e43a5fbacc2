package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of problems a scene-to-scene transition can have.
 */
public enum TransitionIssueType {
    JARRING_PACE_CHANGE,
    EMOTIONAL_WHIPLASH,
    TIME_GAP,
    LOCATION_JUMP,
    UNRESOLVED_TENSION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a provider-supplied type label onto this enum. Exact names win, then
     * keyword matches; anything else is treated as a pace change.
     */
    @JsonCreator
    public static TransitionIssueType normalize(String raw) {
        if (raw == null) {
            return JARRING_PACE_CHANGE;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-_]+", "_");
        for (TransitionIssueType type : values()) {
            if (type.wireName().equals(value)) {
                return type;
            }
        }
        if (value.contains("pace") || value.contains("pacing")) return JARRING_PACE_CHANGE;
        if (value.contains("emotion") || value.contains("mood")) return EMOTIONAL_WHIPLASH;
        if (value.contains("time") || value.contains("temporal")) return TIME_GAP;
        if (value.contains("location") || value.contains("spatial")) return LOCATION_JUMP;
        if (value.contains("tension") || value.contains("unresolved")) return UNRESOLVED_TENSION;
        return JARRING_PACE_CHANGE;
    }
}
