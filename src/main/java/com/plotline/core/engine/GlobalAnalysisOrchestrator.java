package com.plotline.core.engine;

import com.plotline.core.cache.AnalysisCache;
import com.plotline.core.compress.ManuscriptCompressor;
import com.plotline.core.events.EventBus;
import com.plotline.core.events.PlotlineEvent;
import com.plotline.core.llm.AiKeyException;
import com.plotline.core.logging.MdcContext;
import com.plotline.core.metrics.PlotlineMetrics;
import com.plotline.core.model.AnalysisPass;
import com.plotline.core.model.ChapterFlowAnalysis;
import com.plotline.core.model.CharacterArcIssue;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.ContinuityIssue;
import com.plotline.core.model.GlobalCoherenceAnalysis;
import com.plotline.core.model.GlobalCoherenceProgress;
import com.plotline.core.model.GlobalCoherenceSettings;
import com.plotline.core.model.Manuscript;
import com.plotline.core.model.ManuscriptAnalysis;
import com.plotline.core.model.NarrativeFlowIssue;
import com.plotline.core.model.PacingCurve;
import com.plotline.core.model.ScenePairAnalysis;
import com.plotline.core.model.SequenceResults;
import com.plotline.core.model.SynthesisResult;
import com.plotline.core.passes.ArcValidator;
import com.plotline.core.passes.ChapterAnalyzer;
import com.plotline.core.passes.ModelUsage;
import com.plotline.core.passes.PassContext;
import com.plotline.core.passes.SequenceAnalyzer;
import com.plotline.core.passes.SynthesisEngine;
import com.plotline.core.passes.TransitionAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs the enabled passes of a global coherence analysis in order and assembles the result.
 * <p>
 * A pass that throws is recorded in the progress errors and skipped. Only an
 * {@link AiKeyException} aborts the run, since no later pass could succeed without valid
 * credentials. Cancellation is cooperative: passes stop between units of work and whatever
 * they produced so far is kept.
 */
@Service
public class GlobalAnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GlobalAnalysisOrchestrator.class);
    private static final AtomicInteger ANALYSIS_COUNTER = new AtomicInteger(0);

    static final double DEFAULT_AVERAGE = 0.7;

    private final ManuscriptCompressor compressor;
    private final TransitionAnalyzer transitionAnalyzer;
    private final SequenceAnalyzer sequenceAnalyzer;
    private final ChapterAnalyzer chapterAnalyzer;
    private final ArcValidator arcValidator;
    private final SynthesisEngine synthesisEngine;
    private final EventBus eventBus;
    private final Executor runExecutor;
    private final PlotlineMetrics metrics;
    private final AnalysisCache cache;

    /** Cancellation tokens of the runs currently in flight, keyed by analysis id. */
    private final ConcurrentHashMap<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    public GlobalAnalysisOrchestrator(ManuscriptCompressor compressor,
                                      TransitionAnalyzer transitionAnalyzer,
                                      SequenceAnalyzer sequenceAnalyzer,
                                      ChapterAnalyzer chapterAnalyzer,
                                      ArcValidator arcValidator,
                                      SynthesisEngine synthesisEngine,
                                      EventBus eventBus,
                                      @Qualifier("analysisRunExecutor") Executor runExecutor,
                                      @Autowired(required = false) PlotlineMetrics metrics,
                                      @Autowired(required = false) AnalysisCache cache) {
        this.compressor = compressor;
        this.transitionAnalyzer = transitionAnalyzer;
        this.sequenceAnalyzer = sequenceAnalyzer;
        this.chapterAnalyzer = chapterAnalyzer;
        this.arcValidator = arcValidator;
        this.synthesisEngine = synthesisEngine;
        this.eventBus = eventBus;
        this.runExecutor = runExecutor;
        this.metrics = metrics;
        this.cache = cache;
    }

    public GlobalCoherenceAnalysis analyzeGlobalCoherence(Manuscript manuscript, GlobalCoherenceSettings settings,
                                                          Consumer<GlobalCoherenceProgress> progressCallback) {
        return analyzeGlobalCoherence(generateAnalysisId(), manuscript, settings, progressCallback);
    }

    /**
     * Runs the analysis under a caller-supplied id, e.g. one already handed out by the REST API.
     *
     * @throws AiKeyException when the provider credentials are missing or rejected
     */
    public GlobalCoherenceAnalysis analyzeGlobalCoherence(String analysisId, Manuscript manuscript,
                                                          GlobalCoherenceSettings settings,
                                                          Consumer<GlobalCoherenceProgress> progressCallback) {
        return run(analysisId, register(analysisId), manuscript, settings, progressCallback);
    }

    /**
     * Runs the analysis on the run executor. The id is cancellable as soon as this returns,
     * even while the run is still queued. The future fails with the fatal key error, if any.
     */
    public CompletableFuture<GlobalCoherenceAnalysis> analyzeAsync(String analysisId, Manuscript manuscript,
                                                                   GlobalCoherenceSettings settings,
                                                                   Consumer<GlobalCoherenceProgress> progressCallback) {
        CancellationToken token = register(analysisId);
        try {
            return CompletableFuture.supplyAsync(
                    () -> run(analysisId, token, manuscript, settings, progressCallback), runExecutor);
        } catch (RejectedExecutionException e) {
            activeRuns.remove(analysisId, token);
            throw e;
        }
    }

    private CancellationToken register(String analysisId) {
        CancellationToken token = new CancellationToken();
        activeRuns.put(analysisId, token);
        return token;
    }

    private GlobalCoherenceAnalysis run(String analysisId, CancellationToken token, Manuscript manuscript,
                                        GlobalCoherenceSettings settings,
                                        Consumer<GlobalCoherenceProgress> progressCallback) {
        GlobalCoherenceSettings effective = settings != null ? settings : GlobalCoherenceSettings.defaults();
        MdcContext.setAnalysis(analysisId);
        long startedAt = System.currentTimeMillis();
        try {
            List<AnalysisPass> passes = effective.enabledPasses();
            log.info("Starting global coherence analysis {} of '{}' ({} scenes, passes={}, depth={})",
                    analysisId, manuscript.title(), manuscript.scenes().size(), passes, effective.depth());

            if (cache != null) {
                cache.init();
            }

            ProgressTracker tracker = new ProgressTracker(analysisId, passes.size(), manuscript.scenes().size(),
                    progress -> {
                        publishProgress(progress);
                        if (progressCallback != null) {
                            progressCallback.accept(progress);
                        }
                    }, System::currentTimeMillis);
            tracker.start();

            List<CompressedScene> compressed = passes.isEmpty() || token.isCancelled()
                    ? List.of()
                    : compressor.prepareScenesForAnalysis(manuscript.scenes());

            List<ScenePairAnalysis> sceneLevel = List.of();
            SequenceResults sequences = SequenceResults.empty();
            List<ChapterFlowAnalysis> chapterLevel = List.of();
            ManuscriptAnalysis manuscriptLevel = null;
            SynthesisResult synthesis = null;
            Map<String, String> modelsUsed = new LinkedHashMap<>();

            for (AnalysisPass pass : passes) {
                if (token.isCancelled()) {
                    log.info("Analysis {} cancelled before pass {}", analysisId, pass.id());
                    break;
                }
                tracker.beginPass(pass);
                MdcContext.setPass(analysisId, pass.id());
                ModelUsage usage = new ModelUsage();
                PassContext context = new PassContext(token, tracker.listener(), effective.depth(), usage);
                long passStart = System.currentTimeMillis();
                try {
                    switch (pass) {
                        case TRANSITIONS -> sceneLevel = transitionAnalyzer.analyzeTransitions(compressed, context);
                        case SEQUENCES -> sequences = sequenceAnalyzer.analyzeSequences(compressed, context);
                        case CHAPTERS -> chapterLevel = chapterAnalyzer.analyzeChapters(manuscript, compressed, context);
                        case ARC -> manuscriptLevel = arcValidator
                                .validateArc(compressor.createManuscriptSkeleton(compressed), context)
                                .orElse(null);
                        case SYNTHESIS -> synthesis = synthesisEngine.synthesizeFindings(
                                sceneLevel, sequences, chapterLevel, manuscriptLevel, manuscript, context);
                    }
                } catch (AiKeyException e) {
                    log.error("Pass {} aborted the analysis: {}", pass.id(), e.getMessage());
                    recordFailure(pass);
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Pass {} failed, continuing with the next pass: {}", pass.id(), e.getMessage(), e);
                    tracker.recordError(pass, describe(e));
                    recordFailure(pass);
                } finally {
                    long passDuration = System.currentTimeMillis() - passStart;
                    if (metrics != null) {
                        metrics.recordPassDuration(pass.id(), passDuration);
                    }
                    String model = usage.first();
                    if (model != null) {
                        modelsUsed.put(pass.id(), model);
                    }
                    MdcContext.clearPass();
                }
            }

            if (token.isCancelled()) {
                tracker.markCancelled();
            }

            GlobalCoherenceAnalysis analysis = assemble(sceneLevel, sequences, chapterLevel, manuscriptLevel,
                    synthesis, modelsUsed, effective, System.currentTimeMillis() - startedAt);
            tracker.finish();

            if (metrics != null) {
                metrics.recordAnalysisResult(token.isCancelled() ? "cancelled" : "completed");
            }
            log.info("Analysis {} finished in {}ms: {} pairs, {} chapters, {} issues, {} pass errors",
                    analysisId, analysis.totalAnalysisTime(), analysis.sceneLevel().size(),
                    analysis.chapterLevel().size(), analysis.totalIssueCount(), tracker.errors().size());
            return analysis;
        } catch (RuntimeException e) {
            if (metrics != null) {
                metrics.recordAnalysisResult("failed");
            }
            throw e;
        } finally {
            activeRuns.remove(analysisId, token);
            MdcContext.clear();
        }
    }

    /**
     * Cancels every run in flight.
     */
    public void cancelAnalysis() {
        activeRuns.forEach((id, token) -> {
            log.info("Cancelling analysis {}", id);
            token.cancel();
        });
    }

    /**
     * @return false when no run with this id is in flight
     */
    public boolean cancelAnalysis(String analysisId) {
        CancellationToken token = activeRuns.get(analysisId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling analysis {}", analysisId);
        token.cancel();
        return true;
    }

    public boolean isRunning(String analysisId) {
        return activeRuns.containsKey(analysisId);
    }

    /**
     * Appends global context to scene-local issues and escalates their severity one step per
     * piece of evidence: a transition touching the scene and a flow issue naming it.
     *
     * @return a new map; the input is not modified
     */
    public Map<String, List<ContinuityIssue>> enrichSceneIssues(Map<String, List<ContinuityIssue>> sceneIssues,
                                                                GlobalCoherenceAnalysis analysis) {
        Map<String, List<ContinuityIssue>> enriched = new LinkedHashMap<>();
        sceneIssues.forEach((sceneId, issues) -> {
            ScenePairAnalysis transition = analysis.sceneLevel().stream()
                    .filter(pair -> sceneId.equals(pair.sceneAId()) || sceneId.equals(pair.sceneBId()))
                    .findFirst()
                    .orElse(null);
            NarrativeFlowIssue flow = analysis.flowIssues().stream()
                    .filter(issue -> issue.affectedScenes().contains(sceneId))
                    .findFirst()
                    .orElse(null);

            if (transition == null && flow == null) {
                enriched.put(sceneId, List.copyOf(issues));
                return;
            }
            String context = globalContext(transition, flow);
            int steps = (transition != null ? 1 : 0) + (flow != null ? 1 : 0);
            var updated = new ArrayList<ContinuityIssue>(issues.size());
            for (ContinuityIssue issue : issues) {
                updated.add(issue.withSeverityAndDescription(
                        issue.severity().escalate(steps), issue.description() + context));
            }
            enriched.put(sceneId, List.copyOf(updated));
        });
        return enriched;
    }

    /**
     * Generates a unique analysis id in the format GC-YYYY-NNNN.
     */
    public String generateAnalysisId() {
        int count = ANALYSIS_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("GC-%d-%04d", year, count);
    }

    private GlobalCoherenceAnalysis assemble(List<ScenePairAnalysis> sceneLevel,
                                             SequenceResults sequences,
                                             List<ChapterFlowAnalysis> chapterLevel,
                                             ManuscriptAnalysis manuscriptLevel,
                                             SynthesisResult synthesis,
                                             Map<String, String> modelsUsed,
                                             GlobalCoherenceSettings settings,
                                             long totalAnalysisTime) {
        ManuscriptAnalysis manuscript = manuscriptLevel != null
                ? manuscriptLevel
                : basicManuscriptAnalysis(sceneLevel, chapterLevel);
        if (synthesis != null) {
            return new GlobalCoherenceAnalysis(sceneLevel, chapterLevel, manuscript,
                    synthesis.flowIssues(), synthesis.pacingProblems(), synthesis.thematicBreaks(),
                    synthesis.characterArcDisruptions(), synthesis.report(),
                    Instant.now(), totalAnalysisTime, modelsUsed, settings);
        }
        return new GlobalCoherenceAnalysis(sceneLevel, chapterLevel, manuscript,
                sequences.flowIssues(), sequences.pacingIssues(), sequences.thematicIssues(),
                List.<CharacterArcIssue>of(), null,
                Instant.now(), totalAnalysisTime, modelsUsed, settings);
    }

    /**
     * Manuscript-level stand-in when the arc pass produced nothing, derived from the average
     * transition and chapter scores (0.7 each when absent).
     */
    static ManuscriptAnalysis basicManuscriptAnalysis(List<ScenePairAnalysis> sceneLevel,
                                                      List<ChapterFlowAnalysis> chapterLevel) {
        double avgTransition = sceneLevel.stream().mapToDouble(ScenePairAnalysis::transitionScore)
                .average().orElse(DEFAULT_AVERAGE);
        double avgChapter = chapterLevel.stream().mapToDouble(ChapterFlowAnalysis::coherenceScore)
                .average().orElse(DEFAULT_AVERAGE);
        return new ManuscriptAnalysis(
                Math.min(1.0, (avgTransition + avgChapter) / 2),
                List.of(0.33, 0.33, 0.34),
                Map.of(),
                List.of(),
                List.of(),
                PacingCurve.empty(),
                avgChapter,
                Math.max(0.5, avgTransition - 0.05),
                Math.max(0.5, avgChapter - 0.05));
    }

    private static String globalContext(ScenePairAnalysis transition, NarrativeFlowIssue flow) {
        StringBuilder sb = new StringBuilder(" [Global context:");
        if (transition != null) {
            sb.append(String.format(Locale.ROOT, " Global transition score around this scene: %.2f.",
                    transition.transitionScore()));
        }
        if (flow != null) {
            sb.append(" Sequence flow pattern flagged: ").append(flow.pattern().wireName()).append('.');
        }
        return sb.append(']').toString();
    }

    private void recordFailure(AnalysisPass pass) {
        if (metrics != null) {
            metrics.recordPassFailure(pass.id());
        }
    }

    private void publishProgress(GlobalCoherenceProgress progress) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("passNumber", progress.passNumber());
        payload.put("totalPasses", progress.totalPasses());
        payload.put("passProgress", progress.passProgress());
        payload.put("scenesAnalyzed", progress.scenesAnalyzed());
        payload.put("totalScenes", progress.totalScenes());
        payload.put("estimatedTimeRemaining", progress.estimatedTimeRemaining());
        payload.put("errors", progress.errors().size());
        payload.put("cancelled", progress.cancelled());
        payload.put("finished", progress.finished());
        if (progress.currentScene() != null) {
            payload.put("currentScene", progress.currentScene());
        }
        eventBus.publish(new PlotlineEvent(PlotlineEvent.PROGRESS, progress.analysisId(),
                progress.currentPass() != null ? progress.currentPass().id() : null,
                payload, Instant.now()));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
