package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnalysisType {
    SIMPLE,
    CONSISTENCY,
    COMPLEX,
    FULL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
