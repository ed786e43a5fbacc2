package com.plotline.core.engine;

import com.plotline.core.model.GlobalCoherenceAnalysis;
import com.plotline.core.model.GlobalCoherenceProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory record of analysis runs started through the REST API.
 * <p>
 * Finished runs beyond {@link AnalysisProperties#getRetainedRuns()} are evicted oldest first.
 */
@Component
public class AnalysisRunRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunRegistry.class);

    public enum RunStatus { RUNNING, COMPLETED, FAILED, CANCELLED }

    /**
     * Snapshot of one run.
     *
     * @param progress latest progress emission, null until the first one
     * @param result   final analysis, set once the run completed or was cancelled
     * @param error    failure message, set only when FAILED
     */
    public record AnalysisRun(
        String analysisId,
        String manuscriptTitle,
        RunStatus status,
        GlobalCoherenceProgress progress,
        GlobalCoherenceAnalysis result,
        String error,
        Instant startedAt,
        Instant finishedAt
    ) {

        AnalysisRun withProgress(GlobalCoherenceProgress latest) {
            return new AnalysisRun(analysisId, manuscriptTitle, status, latest, result, error, startedAt, finishedAt);
        }

        AnalysisRun finish(RunStatus newStatus, GlobalCoherenceAnalysis newResult, String newError) {
            return new AnalysisRun(analysisId, manuscriptTitle, newStatus, progress, newResult, newError,
                    startedAt, Instant.now());
        }

        public boolean isFinished() {
            return status != RunStatus.RUNNING;
        }
    }

    private final ConcurrentHashMap<String, AnalysisRun> runs = new ConcurrentHashMap<>();
    private final AtomicReference<String> lastCompleted = new AtomicReference<>();
    private final int retainedRuns;

    public AnalysisRunRegistry(AnalysisProperties properties) {
        this.retainedRuns = Math.max(1, properties.getRetainedRuns());
    }

    public AnalysisRun register(String analysisId, String manuscriptTitle) {
        var run = new AnalysisRun(analysisId, manuscriptTitle, RunStatus.RUNNING, null, null, null,
                Instant.now(), null);
        runs.put(analysisId, run);
        return run;
    }

    public void updateProgress(String analysisId, GlobalCoherenceProgress progress) {
        runs.computeIfPresent(analysisId, (id, run) -> run.withProgress(progress));
    }

    public void complete(String analysisId, GlobalCoherenceAnalysis result) {
        AnalysisRun run = runs.computeIfPresent(analysisId, (id, current) -> {
            boolean cancelled = current.progress() != null && current.progress().cancelled();
            return current.finish(cancelled ? RunStatus.CANCELLED : RunStatus.COMPLETED, result, null);
        });
        if (run != null) {
            lastCompleted.set(analysisId);
            log.debug("Run {} recorded as {}", analysisId, run.status());
        }
        evict();
    }

    public void fail(String analysisId, String error) {
        runs.computeIfPresent(analysisId, (id, run) -> run.finish(RunStatus.FAILED, null, error));
        evict();
    }

    public Optional<AnalysisRun> find(String analysisId) {
        return Optional.ofNullable(runs.get(analysisId));
    }

    /**
     * The most recently finished run that produced an analysis.
     */
    public Optional<AnalysisRun> lastCompleted() {
        String id = lastCompleted.get();
        return id == null ? Optional.empty() : find(id);
    }

    public int size() {
        return runs.size();
    }

    private void evict() {
        while (runs.size() > retainedRuns) {
            Optional<AnalysisRun> oldest = runs.values().stream()
                    .filter(AnalysisRun::isFinished)
                    .filter(run -> !run.analysisId().equals(lastCompleted.get()))
                    .min(Comparator.comparing(AnalysisRun::startedAt));
            if (oldest.isEmpty()) {
                return;
            }
            runs.remove(oldest.get().analysisId());
            log.debug("Evicted run {}", oldest.get().analysisId());
        }
    }
}
