package com.plotline.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plotline.core.cache.AnalysisCache;
import com.plotline.core.compress.CompressorProperties;
import com.plotline.core.compress.ManuscriptCompressor;
import com.plotline.core.events.EventBus;
import com.plotline.core.events.PlotlineEvent;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.MissingKeyException;
import com.plotline.core.model.AnalysisDepth;
import com.plotline.core.model.AnalysisPass;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.ContinuityIssue;
import com.plotline.core.model.ContinuityIssueType;
import com.plotline.core.model.FlowPattern;
import com.plotline.core.model.GlobalCoherenceAnalysis;
import com.plotline.core.model.GlobalCoherenceProgress;
import com.plotline.core.model.GlobalCoherenceSettings;
import com.plotline.core.model.Manuscript;
import com.plotline.core.model.NarrativeFlowIssue;
import com.plotline.core.model.ResponseMetadata;
import com.plotline.core.model.Scene;
import com.plotline.core.model.ScenePairAnalysis;
import com.plotline.core.model.Severity;
import com.plotline.core.model.TransitionFlags;
import com.plotline.core.passes.ArcValidator;
import com.plotline.core.passes.BatchRunner;
import com.plotline.core.passes.ChapterAnalyzer;
import com.plotline.core.passes.SequenceAnalyzer;
import com.plotline.core.passes.SynthesisEngine;
import com.plotline.core.passes.TransitionAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link GlobalAnalysisOrchestrator}.
 * <p>
 * Runs the real passes over a mocked {@link ContinuityAnalyzer}.
 */
class GlobalAnalysisOrchestratorTest {

    private static final String ALL_MARKERS = """
            {"transitionScore": 0.8, "flowIssues": [], "coherenceScore": 0.75,
             "structuralIntegrity": 0.9, "overallCoherenceScore": 0.7}
            """;

    private ExecutorService executor;
    private ContinuityAnalyzer analyzer;
    private EventBus eventBus;
    private GlobalAnalysisOrchestrator orchestrator;
    private final List<GlobalCoherenceProgress> emissions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        analyzer = mock(ContinuityAnalyzer.class);
        when(analyzer.analyze(any())).thenReturn(response(ALL_MARKERS));
        eventBus = new EventBus();
        orchestrator = orchestrator(new ChapterAnalyzer(analyzer));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private GlobalAnalysisOrchestrator orchestrator(ChapterAnalyzer chapterAnalyzer) {
        return orchestrator(chapterAnalyzer, executor, null);
    }

    private GlobalAnalysisOrchestrator orchestrator(ChapterAnalyzer chapterAnalyzer, Executor runExecutor,
                                                    AnalysisCache cache) {
        BatchRunner runner = new BatchRunner(executor);
        CompressorProperties compressorProperties = new CompressorProperties();
        compressorProperties.setDelayMsBetweenBatches(0);
        return new GlobalAnalysisOrchestrator(
                new ManuscriptCompressor(analyzer, compressorProperties, runner),
                new TransitionAnalyzer(analyzer, runner),
                new SequenceAnalyzer(analyzer, runner),
                chapterAnalyzer,
                new ArcValidator(analyzer),
                new SynthesisEngine(analyzer, null),
                eventBus,
                runExecutor,
                null,
                cache);
    }

    private static AnalysisResponse response(String json) {
        try {
            return new AnalysisResponse(List.of(), new ResponseMetadata("test-model", "openai", 3, false),
                    new ObjectMapper().readTree(json));
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static Manuscript manuscript(int sceneCount) {
        var scenes = new ArrayList<Scene>();
        for (int i = 0; i < sceneCount; i++) {
            scenes.add(new Scene("scene-" + i, "Mara walked along the harbor wall, scene " + i + ".", i));
        }
        return new Manuscript("m1", "Harbor Lights", scenes);
    }

    private static GlobalCoherenceSettings only(AnalysisPass... passes) {
        List<AnalysisPass> enabled = List.of(passes);
        return new GlobalCoherenceSettings(
                enabled.contains(AnalysisPass.TRANSITIONS),
                enabled.contains(AnalysisPass.SEQUENCES),
                enabled.contains(AnalysisPass.CHAPTERS),
                enabled.contains(AnalysisPass.ARC),
                enabled.contains(AnalysisPass.SYNTHESIS),
                AnalysisDepth.STANDARD);
    }

    private GlobalCoherenceProgress lastEmission() {
        return emissions.get(emissions.size() - 1);
    }

    @Test
    @DisplayName("transitions only on six scenes yields five pairs and single-pass progress")
    void transitionsOnly() {
        GlobalCoherenceAnalysis analysis = orchestrator.analyzeGlobalCoherence(
                manuscript(6), only(AnalysisPass.TRANSITIONS), emissions::add);

        assertEquals(5, analysis.sceneLevel().size());
        assertTrue(analysis.chapterLevel().isEmpty());
        assertTrue(analysis.flowIssues().isEmpty());
        assertNull(analysis.synthesis());
        assertEquals(Map.of("transitions", "test-model"), analysis.modelsUsed());
        verify(analyzer, times(5)).analyze(any());

        emissions.stream().filter(p -> p.passNumber() > 0).forEach(p -> {
            assertEquals(1, p.passNumber());
            assertEquals(1, p.totalPasses());
        });
        assertEquals(100, lastEmission().passProgress());
        assertTrue(lastEmission().finished());
        assertFalse(lastEmission().cancelled());
        assertEquals(1, emissions.stream().filter(GlobalCoherenceProgress::finished).count());
    }

    @Test
    @DisplayName("a configured cache is initialised at the start of every run")
    void initialisesCachePerRun() {
        AnalysisCache cache = mock(AnalysisCache.class);
        var cached = orchestrator(new ChapterAnalyzer(analyzer), executor, cache);

        cached.analyzeGlobalCoherence(manuscript(3), only(AnalysisPass.TRANSITIONS), null);
        cached.analyzeGlobalCoherence(manuscript(3), only(AnalysisPass.TRANSITIONS), null);

        verify(cache, times(2)).init();
    }

    @Test
    @DisplayName("with every pass disabled the result carries defaults and no AI call is made")
    void allPassesDisabled() {
        GlobalCoherenceAnalysis analysis = orchestrator.analyzeGlobalCoherence(
                manuscript(4), only(), emissions::add);

        assertTrue(analysis.sceneLevel().isEmpty());
        assertTrue(analysis.chapterLevel().isEmpty());
        assertEquals(0, analysis.totalIssueCount());
        assertEquals(0.7, analysis.manuscriptLevel().structuralIntegrity(), 1e-9);
        assertEquals(List.of(0.33, 0.33, 0.34), analysis.manuscriptLevel().actBalance());
        assertTrue(lastEmission().finished());
        assertEquals(0, lastEmission().totalPasses());
        verifyNoInteractions(analyzer);
    }

    @Test
    @DisplayName("every pass runs in order and the arc result replaces the basic analysis")
    void fullRun() {
        var passesSeen = new ArrayList<AnalysisPass>();
        GlobalCoherenceAnalysis analysis = orchestrator.analyzeGlobalCoherence(manuscript(6), null, progress -> {
            emissions.add(progress);
            if (progress.currentPass() != null && !passesSeen.contains(progress.currentPass())) {
                passesSeen.add(progress.currentPass());
            }
        });

        assertEquals(List.of(AnalysisPass.values()), passesSeen);
        assertEquals(5, analysis.sceneLevel().size());
        assertEquals(1, analysis.chapterLevel().size());
        assertEquals(0.75, analysis.chapterLevel().get(0).coherenceScore(), 1e-9);
        assertEquals(0.9, analysis.manuscriptLevel().structuralIntegrity(), 1e-9);
        assertEquals(GlobalCoherenceSettings.defaults(), analysis.settings());
        assertTrue(analysis.modelsUsed().keySet().containsAll(List.of("transitions", "sequences", "chapters", "arc")));
        assertEquals(5, lastEmission().totalPasses());
        assertTrue(lastEmission().errors().isEmpty());
    }

    @Test
    @DisplayName("cancelling at the end of pass 1 keeps its results and skips the rest")
    void cancellationAfterFirstPass() {
        GlobalCoherenceAnalysis analysis = orchestrator.analyzeGlobalCoherence(manuscript(6),
                only(AnalysisPass.TRANSITIONS, AnalysisPass.SEQUENCES, AnalysisPass.CHAPTERS), progress -> {
                    emissions.add(progress);
                    if (progress.passNumber() == 1 && progress.passProgress() == 100 && !progress.finished()) {
                        orchestrator.cancelAnalysis(progress.analysisId());
                    }
                });

        assertEquals(5, analysis.sceneLevel().size());
        assertTrue(analysis.chapterLevel().isEmpty());
        assertTrue(analysis.flowIssues().isEmpty());
        assertTrue(lastEmission().cancelled());
        assertTrue(lastEmission().finished());
        assertTrue(emissions.stream().noneMatch(p -> p.passNumber() > 1));
        verify(analyzer, times(5)).analyze(any());
    }

    @Test
    @DisplayName("cancelling every run midway through pass 1 keeps the finished batches")
    void cancelAllDuringFirstPass() {
        GlobalCoherenceAnalysis analysis = orchestrator.analyzeGlobalCoherence(manuscript(12),
                only(AnalysisPass.TRANSITIONS, AnalysisPass.SEQUENCES), progress -> {
                    emissions.add(progress);
                    if (progress.passNumber() == 1 && progress.passProgress() > 0 && progress.passProgress() < 100
                            && !progress.finished()) {
                        orchestrator.cancelAnalysis();
                    }
                });

        assertEquals(5, analysis.sceneLevel().size());
        assertTrue(analysis.flowIssues().isEmpty());
        assertTrue(lastEmission().cancelled());
        assertTrue(lastEmission().finished());
        assertTrue(emissions.stream().noneMatch(p -> p.passNumber() > 1));
        verify(analyzer, times(5)).analyze(any());
    }

    @Test
    @DisplayName("an async run can be cancelled while it is still queued")
    void cancelQueuedAsyncRun() {
        List<Runnable> queued = new ArrayList<>();
        GlobalAnalysisOrchestrator queueing = orchestrator(new ChapterAnalyzer(analyzer), queued::add, null);

        CompletableFuture<GlobalCoherenceAnalysis> future = queueing.analyzeAsync("GC-queued", manuscript(6),
                only(AnalysisPass.TRANSITIONS, AnalysisPass.SEQUENCES), emissions::add);

        assertTrue(queueing.isRunning("GC-queued"));
        assertTrue(queueing.cancelAnalysis("GC-queued"));
        assertEquals(1, queued.size());
        queued.get(0).run();

        GlobalCoherenceAnalysis analysis = future.join();
        assertTrue(analysis.sceneLevel().isEmpty());
        assertTrue(analysis.flowIssues().isEmpty());
        assertTrue(lastEmission().cancelled());
        assertTrue(lastEmission().finished());
        assertFalse(queueing.isRunning("GC-queued"));
        verifyNoInteractions(analyzer);
    }

    @Test
    @DisplayName("a credential error in a later pass aborts the whole run")
    void keyErrorAborts() {
        when(analyzer.analyze(argThat(request -> request != null
                && request.options().focusAreas().contains("chapter-coherence"))))
                .thenThrow(new MissingKeyException("openai"));
        String analysisId = orchestrator.generateAnalysisId();

        assertThrows(MissingKeyException.class, () -> orchestrator.analyzeGlobalCoherence(analysisId,
                manuscript(6), only(AnalysisPass.TRANSITIONS, AnalysisPass.CHAPTERS), emissions::add));

        assertFalse(orchestrator.isRunning(analysisId));
        assertTrue(emissions.stream().noneMatch(GlobalCoherenceProgress::finished));
    }

    @Test
    @DisplayName("a pass that throws is recorded and the run continues")
    void passErrorIsRecorded() {
        ChapterAnalyzer broken = mock(ChapterAnalyzer.class);
        when(broken.analyzeChapters(any(), any(), any())).thenThrow(new IllegalStateException("chapter parser crashed"));
        GlobalAnalysisOrchestrator withBrokenPass = orchestrator(broken);

        GlobalCoherenceAnalysis analysis = withBrokenPass.analyzeGlobalCoherence(manuscript(6),
                only(AnalysisPass.TRANSITIONS, AnalysisPass.CHAPTERS, AnalysisPass.ARC), emissions::add);

        assertEquals(5, analysis.sceneLevel().size());
        assertTrue(analysis.chapterLevel().isEmpty());
        assertEquals(0.9, analysis.manuscriptLevel().structuralIntegrity(), 1e-9);
        assertEquals(1, lastEmission().errors().size());
        assertEquals("chapters", lastEmission().errors().get(0).pass());
        assertEquals("chapter parser crashed", lastEmission().errors().get(0).message());
    }

    @Test
    @DisplayName("progress is published on the event bus")
    void publishesProgressEvents() {
        List<PlotlineEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);

        orchestrator.analyzeGlobalCoherence(manuscript(3), only(AnalysisPass.TRANSITIONS), null);

        assertFalse(events.isEmpty());
        assertTrue(events.stream().allMatch(e -> PlotlineEvent.PROGRESS.equals(e.eventType())));
        PlotlineEvent last = events.get(events.size() - 1);
        assertEquals(Boolean.TRUE, last.payload().get("finished"));
        assertEquals("transitions", last.pass());
    }

    @Test
    @DisplayName("analysis ids follow GC-YYYY-NNNN and are unique")
    void generatesIds() {
        String first = orchestrator.generateAnalysisId();
        String second = orchestrator.generateAnalysisId();

        assertTrue(first.matches("GC-\\d{4}-\\d{4,}"), first);
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("cancelling an unknown run reports false")
    void cancelUnknownRun() {
        assertFalse(orchestrator.cancelAnalysis("GC-1999-0001"));
    }

    @Test
    @DisplayName("analyzeAsync completes with the analysis")
    void analyzeAsync() {
        GlobalCoherenceAnalysis analysis = orchestrator
                .analyzeAsync("GC-async", manuscript(4), only(AnalysisPass.TRANSITIONS), null)
                .join();

        assertEquals(3, analysis.sceneLevel().size());
        assertFalse(orchestrator.isRunning("GC-async"));
    }

    @Nested
    @DisplayName("enrichSceneIssues")
    class EnrichSceneIssues {

        private GlobalCoherenceAnalysis analysis() {
            var pair = new ScenePairAnalysis("scene-1", "scene-2", 1, 0.4, List.of(), List.of(), TransitionFlags.none());
            var flow = new NarrativeFlowIssue(Severity.SHOULD_FIX, "Cause missing",
                    List.of("scene-2", "scene-3"), FlowPattern.BROKEN_CAUSALITY);
            return new GlobalCoherenceAnalysis(List.of(pair), List.of(), null, List.of(flow), List.of(), List.of(),
                    List.of(), null, Instant.now(), 10, Map.of(), GlobalCoherenceSettings.defaults());
        }

        private ContinuityIssue issue() {
            return new ContinuityIssue(ContinuityIssueType.PLOT, Severity.CONSIDER, "Ivo knows the code", null, null);
        }

        @Test
        @DisplayName("escalates one step per piece of global evidence")
        void escalatesPerEvidence() {
            Map<String, List<ContinuityIssue>> input = new LinkedHashMap<>();
            input.put("scene-1", List.of(issue()));
            input.put("scene-2", List.of(issue()));
            input.put("scene-9", List.of(issue()));

            Map<String, List<ContinuityIssue>> enriched = orchestrator.enrichSceneIssues(input, analysis());

            ContinuityIssue transitionOnly = enriched.get("scene-1").get(0);
            assertEquals(Severity.SHOULD_FIX, transitionOnly.severity());
            assertTrue(transitionOnly.description().endsWith(
                    " [Global context: Global transition score around this scene: 0.40.]"));

            ContinuityIssue both = enriched.get("scene-2").get(0);
            assertEquals(Severity.MUST_FIX, both.severity());
            assertTrue(both.description().contains("Sequence flow pattern flagged: broken_causality."));

            assertEquals(issue(), enriched.get("scene-9").get(0));
            assertEquals(Severity.CONSIDER, input.get("scene-2").get(0).severity());
        }
    }
}
