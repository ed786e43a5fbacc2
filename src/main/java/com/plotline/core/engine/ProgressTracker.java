package com.plotline.core.engine;

import com.plotline.core.model.AnalysisPass;
import com.plotline.core.model.GlobalCoherenceProgress;
import com.plotline.core.model.PassError;
import com.plotline.core.passes.PassProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Builds and emits progress snapshots for one run.
 * <p>
 * Owned by the orchestrator thread. Every state change produces a new immutable
 * {@link GlobalCoherenceProgress} handed to the callback.
 */
class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String analysisId;
    private final int totalPasses;
    private final int totalScenes;
    private final Consumer<GlobalCoherenceProgress> callback;
    private final LongSupplier clock;
    private final long startedAt;

    private final List<PassError> errors = new ArrayList<>();
    private AnalysisPass currentPass;
    private int passNumber;
    private int passProgress;
    private int scenesAnalyzed;
    private String currentScene;
    private long estimatedTimeRemaining;
    private boolean cancelled;
    private GlobalCoherenceProgress latest;

    ProgressTracker(String analysisId, int totalPasses, int totalScenes,
                    Consumer<GlobalCoherenceProgress> callback, LongSupplier clock) {
        this.analysisId = analysisId;
        this.totalPasses = totalPasses;
        this.totalScenes = totalScenes;
        this.callback = callback;
        this.clock = clock;
        this.startedAt = clock.getAsLong();
    }

    void start() {
        emit(false);
    }

    void beginPass(AnalysisPass pass) {
        currentPass = pass;
        passNumber++;
        passProgress = 0;
        scenesAnalyzed = 0;
        currentScene = null;
        estimatedTimeRemaining = estimateRemaining();
        emit(false);
    }

    /**
     * Listener handed to the running pass.
     */
    PassProgressListener listener() {
        return this::update;
    }

    void update(int percent, String scene) {
        passProgress = Math.max(0, Math.min(100, percent));
        scenesAnalyzed = scenesFor(currentPass, passProgress);
        if (scene != null) {
            currentScene = scene;
        }
        estimatedTimeRemaining = estimateRemaining();
        emit(false);
    }

    void recordError(AnalysisPass pass, String message) {
        errors.add(new PassError(pass.id(), message));
    }

    void markCancelled() {
        cancelled = true;
    }

    void finish() {
        passProgress = 100;
        estimatedTimeRemaining = 0;
        emit(true);
    }

    GlobalCoherenceProgress latest() {
        return latest;
    }

    List<PassError> errors() {
        return List.copyOf(errors);
    }

    long elapsed() {
        return clock.getAsLong() - startedAt;
    }

    /**
     * Pair and window passes count their units, the others count every scene.
     */
    int scenesFor(AnalysisPass pass, int percent) {
        if (pass == null) {
            return 0;
        }
        int units = switch (pass) {
            case TRANSITIONS -> Math.max(0, totalScenes - 1);
            case SEQUENCES -> Math.max(0, totalScenes - 2);
            default -> totalScenes;
        };
        return (int) Math.floor(units * percent / 100.0);
    }

    /**
     * Linear extrapolation from the fraction of all passes completed so far, in milliseconds.
     */
    long estimateRemaining() {
        if (totalPasses == 0 || passNumber == 0) {
            return 0;
        }
        double elapsed = elapsed();
        double fraction = (passNumber - 1 + passProgress / 100.0) / totalPasses;
        fraction = Math.min(0.999, Math.max(0.001, fraction));
        return Math.max(0, (long) Math.floor(elapsed / fraction - elapsed));
    }

    private void emit(boolean finished) {
        latest = new GlobalCoherenceProgress(analysisId, currentPass, passNumber, totalPasses, passProgress,
                scenesAnalyzed, totalScenes, currentScene, estimatedTimeRemaining, errors, cancelled, finished);
        if (callback == null) {
            return;
        }
        try {
            callback.accept(latest);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed for {}: {}", analysisId, e.getMessage(), e);
        }
    }
}
