package com.plotline.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the AI analysis capability.
 *
 * @param issues   generic scene-local issues the provider reported
 * @param metadata model and timing information
 * @param payload  decoded provider JSON; passes read their own fields from it
 */
public record AnalysisResponse(
    List<ContinuityIssue> issues,
    ResponseMetadata metadata,
    JsonNode payload
) implements Serializable {

    public AnalysisResponse {
        issues = issues != null ? List.copyOf(issues) : List.of();
        payload = payload != null ? payload : MissingNode.getInstance();
    }

    public String modelUsed() {
        return metadata != null ? metadata.modelUsed() : null;
    }
}
