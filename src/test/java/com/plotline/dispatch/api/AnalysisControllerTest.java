package com.plotline.dispatch.api;

import com.plotline.core.engine.AnalysisRunRegistry;
import com.plotline.core.engine.AnalysisRunRegistry.AnalysisRun;
import com.plotline.core.engine.AnalysisRunRegistry.RunStatus;
import com.plotline.core.engine.GlobalAnalysisOrchestrator;
import com.plotline.core.events.EventBus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AnalysisControllerTest {

    private static final String MANUSCRIPT_BODY = """
            {"manuscript": {"id": "m1", "title": "The Salt Road", "scenes": [
                {"id": "s1", "text": "Mara left at dawn.", "wordCount": 4, "position": 0, "originalPosition": 0},
                {"id": "s2", "text": "The road was empty.", "wordCount": 4, "position": 1, "originalPosition": 1}
            ]},
             "settings": {"enableTransitions": true, "enableSequences": false, "enableChapters": false,
                          "enableArc": false, "enableSynthesis": false, "depth": "quick"}}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GlobalAnalysisOrchestrator orchestrator;

    @MockitoBean
    private AnalysisRunRegistry registry;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @MockitoBean
    private EventBus eventBus;

    private static AnalysisRun runningRun(String id) {
        return new AnalysisRun(id, "The Salt Road", RunStatus.RUNNING, null, null, null,
                Instant.parse("2026-03-01T10:00:00Z"), null);
    }

    // ── POST /api/v1/analyses ────────────────────────────────────────

    @Test
    @DisplayName("POST /analyses returns 202 Accepted with analysis_id")
    void startAnalysis() throws Exception {
        when(orchestrator.generateAnalysisId()).thenReturn("GC-2026-0001");
        when(orchestrator.analyzeAsync(eq("GC-2026-0001"), any(), any(), any()))
                .thenReturn(new CompletableFuture<>());

        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MANUSCRIPT_BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.analysis_id").value("GC-2026-0001"))
                .andExpect(jsonPath("$.status").value("RUNNING"));

        verify(registry).register("GC-2026-0001", "The Salt Road");
    }

    @Test
    @DisplayName("POST /analyses without a manuscript returns 400")
    void startAnalysisWithoutManuscript() throws Exception {
        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("required")));
    }

    // ── GET /api/v1/analyses/{id} ────────────────────────────────────

    @Test
    @DisplayName("GET /analyses/{id} returns 404 for unknown analysis")
    void getAnalysisNotFound() throws Exception {
        when(registry.find("GC-2026-9999")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analyses/GC-2026-9999"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /analyses/{id} returns the run while it is in flight")
    void getRunningAnalysis() throws Exception {
        when(registry.find("GC-2026-0002")).thenReturn(Optional.of(runningRun("GC-2026-0002")));

        mockMvc.perform(get("/api/v1/analyses/GC-2026-0002"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysis_id").value("GC-2026-0002"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.manuscript_title").value("The Salt Road"))
                .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    @DisplayName("GET /analyses/last returns 404 before any run finished")
    void lastAnalysisNotFound() throws Exception {
        when(registry.lastCompleted()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analyses/last"))
                .andExpect(status().isNotFound());
    }

    // ── POST /api/v1/analyses/{id}/cancel ────────────────────────────

    @Test
    @DisplayName("POST /analyses/{id}/cancel returns 404 for unknown analysis")
    void cancelNotFound() throws Exception {
        when(registry.find("GC-FAKE")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/analyses/GC-FAKE/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /analyses/{id}/cancel signals a run in flight")
    void cancelRunningAnalysis() throws Exception {
        when(registry.find("GC-2026-0003")).thenReturn(Optional.of(runningRun("GC-2026-0003")));
        when(orchestrator.cancelAnalysis("GC-2026-0003")).thenReturn(true);

        mockMvc.perform(post("/api/v1/analyses/GC-2026-0003/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("CANCELLING"));
    }

    // ── GET /api/v1/analyses/{id}/events ─────────────────────────────

    @Test
    @DisplayName("GET /analyses/{id}/events returns 404 for unknown analysis")
    void sseNotFound() throws Exception {
        when(registry.find("GC-FAKE")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analyses/GC-FAKE/events"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /analyses/{id}/events returns an SSE emitter for a known analysis")
    void sseReturnsEmitter() throws Exception {
        when(registry.find("GC-2026-0004")).thenReturn(Optional.of(runningRun("GC-2026-0004")));
        when(sseStreamingService.createEmitter("GC-2026-0004")).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/analyses/GC-2026-0004/events"))
                .andExpect(status().isOk());
    }
}
