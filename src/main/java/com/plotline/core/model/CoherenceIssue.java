package com.plotline.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Common shape of the typed issue variants produced by the sequence, chapter, arc and
 * synthesis passes. The {@link #type()} tag tells the variants apart on the wire.
 */
public interface CoherenceIssue {

    @JsonProperty("type")
    String type();

    Severity severity();

    String description();

    List<String> affectedScenes();

    /** Returns a copy of this issue with a different severity. */
    CoherenceIssue withSeverity(Severity severity);
}
