package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The five passes of the global coherence pipeline, in execution order.
 */
public enum AnalysisPass {
    TRANSITIONS,
    SEQUENCES,
    CHAPTERS,
    ARC,
    SYNTHESIS;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnalysisPass fromId(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
