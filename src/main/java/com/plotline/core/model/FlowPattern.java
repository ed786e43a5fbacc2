package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FlowPattern {
    BROKEN_CAUSALITY,
    PASSIVE_SEQUENCE,
    INFO_DUMP,
    INFO_GAP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FlowPattern normalize(String raw) {
        if (raw == null) {
            return BROKEN_CAUSALITY;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.contains("cause") || value.contains("causal")) return BROKEN_CAUSALITY;
        if (value.contains("passive")) return PASSIVE_SEQUENCE;
        if (value.contains("dump")) return INFO_DUMP;
        if (value.contains("gap")) return INFO_GAP;
        return BROKEN_CAUSALITY;
    }
}
