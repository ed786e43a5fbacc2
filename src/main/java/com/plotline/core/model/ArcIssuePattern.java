package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ArcIssuePattern {
    INCOMPLETE,
    INCONSISTENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
