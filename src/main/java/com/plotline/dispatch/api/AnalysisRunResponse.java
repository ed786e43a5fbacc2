package com.plotline.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plotline.core.engine.AnalysisRunRegistry.AnalysisRun;
import com.plotline.core.model.GlobalCoherenceAnalysis;
import com.plotline.core.model.GlobalCoherenceProgress;

import java.time.Instant;

/**
 * JSON response for the analysis run endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRunResponse(
    @JsonProperty("analysis_id") String analysisId,
    String status,
    @JsonProperty("manuscript_title") String manuscriptTitle,
    GlobalCoherenceProgress progress,
    GlobalCoherenceAnalysis result,
    String error,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt
) {

    static AnalysisRunResponse from(AnalysisRun run) {
        return new AnalysisRunResponse(run.analysisId(), run.status().name(), run.manuscriptTitle(),
                run.progress(), run.result(), run.error(), run.startedAt(), run.finishedAt());
    }
}
