package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Dominant emotional register of a scene. The compressor only ever detects the first five;
 * the remaining values exist so the opposite-tone table is total.
 */
public enum EmotionalTone {
    TENSE,
    SAD,
    HAPPY,
    SUSPENSE,
    NEUTRAL,
    RELAXED,
    PEACEFUL,
    ANGRY,
    CALM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EmotionalTone fromWire(String value) {
        if (value == null) {
            return NEUTRAL;
        }
        for (EmotionalTone tone : values()) {
            if (tone.wireName().equalsIgnoreCase(value.trim())) {
                return tone;
            }
        }
        return NEUTRAL;
    }
}
