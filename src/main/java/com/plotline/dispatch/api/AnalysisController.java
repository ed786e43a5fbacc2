package com.plotline.dispatch.api;

import com.plotline.core.engine.AnalysisRunRegistry;
import com.plotline.core.engine.AnalysisRunRegistry.RunStatus;
import com.plotline.core.engine.GlobalAnalysisOrchestrator;
import com.plotline.core.events.EventBus;
import com.plotline.core.events.PlotlineEvent;
import com.plotline.core.model.GlobalCoherenceAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * REST controller for global coherence analysis runs.
 */
@RestController
@RequestMapping("/api/v1/analyses")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final GlobalAnalysisOrchestrator orchestrator;
    private final AnalysisRunRegistry registry;
    private final SseStreamingService sseStreamingService;
    private final EventBus eventBus;

    public AnalysisController(GlobalAnalysisOrchestrator orchestrator,
                              AnalysisRunRegistry registry,
                              SseStreamingService sseStreamingService,
                              EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.sseStreamingService = sseStreamingService;
        this.eventBus = eventBus;
    }

    /**
     * POST /api/v1/analyses: start an analysis. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startAnalysis(@RequestBody StartAnalysisRequest request) {
        if (request.manuscript() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Manuscript is required"));
        }

        String analysisId = orchestrator.generateAnalysisId();
        registry.register(analysisId, request.manuscript().title());
        log.info("Accepted analysis {}, launching async execution", analysisId);

        orchestrator.analyzeAsync(analysisId, request.manuscript(), request.settings(),
                        progress -> registry.updateProgress(analysisId, progress))
                .whenComplete((result, error) -> {
                    if (error == null) {
                        registry.complete(analysisId, result);
                        publishTerminal(analysisId, PlotlineEvent.COMPLETED, Map.of(
                                "status", registry.find(analysisId).map(r -> r.status().name()).orElse("COMPLETED"),
                                "issues", result.totalIssueCount()));
                    } else {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.error("Analysis {} failed", analysisId, cause);
                        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                        registry.fail(analysisId, message);
                        publishTerminal(analysisId, PlotlineEvent.FAILED, Map.of("error", message));
                    }
                });

        return ResponseEntity.accepted().body(Map.of(
                "analysis_id", analysisId,
                "status", RunStatus.RUNNING.name()
        ));
    }

    /**
     * GET /api/v1/analyses/last: latest finished analysis.
     */
    @GetMapping("/last")
    public ResponseEntity<GlobalCoherenceAnalysis> getLastAnalysis() {
        return registry.lastCompleted()
                .map(run -> ResponseEntity.ok(run.result()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/analyses/{id}: run status, latest progress and, once finished, the result.
     */
    @GetMapping("/{id}")
    public ResponseEntity<AnalysisRunResponse> getAnalysis(@PathVariable String id) {
        return registry.find(id)
                .map(run -> ResponseEntity.ok(AnalysisRunResponse.from(run)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/analyses/{id}/cancel: request cooperative cancellation.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelAnalysis(@PathVariable String id) {
        var run = registry.find(id);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean signalled = orchestrator.cancelAnalysis(id);
        log.info("Cancel requested for analysis {} (in flight: {})", id, signalled);
        return ResponseEntity.accepted().body(Map.of(
                "analysis_id", id,
                "status", signalled ? "CANCELLING" : run.get().status().name()
        ));
    }

    /**
     * GET /api/v1/analyses/{id}/events: SSE stream of progress events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (registry.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private void publishTerminal(String analysisId, String eventType, Map<String, Object> payload) {
        eventBus.publish(new PlotlineEvent(eventType, analysisId, null, payload, Instant.now()));
    }
}
