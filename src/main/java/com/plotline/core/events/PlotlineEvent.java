package com.plotline.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an analysis runs, streamed to SSE clients.
 *
 * @param eventType  "analysis.progress", "analysis.completed" or "analysis.failed"
 * @param analysisId the run this event belongs to
 * @param pass       pass id in progress, null for run-level events
 * @param payload    event data
 * @param timestamp  when the event occurred
 */
public record PlotlineEvent(
    String eventType,
    String analysisId,
    String pass,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PROGRESS = "analysis.progress";
    public static final String COMPLETED = "analysis.completed";
    public static final String FAILED = "analysis.failed";

    public boolean isTerminal() {
        return COMPLETED.equals(eventType) || FAILED.equals(eventType);
    }
}
