package com.plotline.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plotline.core.engine.GlobalAnalysisOrchestrator;
import com.plotline.core.model.AnalysisDepth;
import com.plotline.core.model.AnalysisPass;
import com.plotline.core.model.GlobalCoherenceAnalysis;
import com.plotline.core.model.GlobalCoherenceProgress;
import com.plotline.core.model.GlobalCoherenceSettings;
import com.plotline.core.model.Manuscript;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CLI command: plotline analyze &lt;manuscript.json&gt;
 * <p>
 * Runs the global coherence pipeline in-process, printing per-pass progress and a summary.
 * Exits 0 when the analysis completes, 1 when it fails, 2 on invalid options.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Run a global coherence analysis on a manuscript JSON file")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Manuscript JSON file")
    private File manuscriptFile;

    @Option(names = {"--depth", "-d"}, description = "quick, standard or thorough", defaultValue = "standard")
    private String depth;

    @Option(names = "--skip", split = ",",
            description = "Passes to skip: transitions, sequences, chapters, arc, synthesis")
    private List<String> skip = List.of();

    @Option(names = {"--output", "-o"}, description = "Write the full analysis as JSON to this file")
    private File output;

    private final GlobalAnalysisOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(GlobalAnalysisOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        GlobalCoherenceSettings settings;
        try {
            settings = settings(AnalysisDepth.fromWire(depth), skippedPasses(skip));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid option: " + e.getMessage());
            return 2;
        }

        Manuscript manuscript;
        try {
            manuscript = objectMapper.readValue(manuscriptFile, Manuscript.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read manuscript " + manuscriptFile + ": " + rootCauseMessage(e));
            return 1;
        }
        ConsoleOutput.info("Analyzing '" + manuscript.title() + "' (" + manuscript.scenes().size()
                + " scenes, passes: " + settings.enabledPasses().stream().map(AnalysisPass::id).toList() + ")");

        AtomicReference<GlobalCoherenceProgress> last = new AtomicReference<>();
        GlobalCoherenceAnalysis analysis;
        try {
            analysis = orchestrator.analyzeGlobalCoherence(manuscript, settings, progress -> {
                GlobalCoherenceProgress previous = last.getAndSet(progress);
                if (progress.finished() || progress.currentPass() == null) {
                    return;
                }
                if (previous == null || previous.passNumber() != progress.passNumber()) {
                    ConsoleOutput.passStarted(progress);
                } else if (progress.passProgress() > previous.passProgress()) {
                    ConsoleOutput.passProgress(progress);
                }
            });
        } catch (RuntimeException e) {
            ConsoleOutput.error("Analysis failed: " + rootCauseMessage(e));
            return 1;
        }

        GlobalCoherenceProgress finalProgress = last.get();
        ConsoleOutput.summary(analysis, finalProgress != null ? finalProgress.errors() : List.of());

        if (output != null) {
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(output, analysis);
                ConsoleOutput.success("Analysis written to " + output);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot write " + output + ": " + rootCauseMessage(e));
                return 1;
            }
        }

        if (finalProgress != null && finalProgress.cancelled()) {
            ConsoleOutput.warn("Analysis cancelled; results are partial.");
        } else {
            ConsoleOutput.success("Analysis complete.");
        }
        return 0;
    }

    static Set<AnalysisPass> skippedPasses(List<String> names) {
        Set<AnalysisPass> skipped = EnumSet.noneOf(AnalysisPass.class);
        if (names != null) {
            for (String name : names) {
                if (!name.isBlank()) {
                    skipped.add(AnalysisPass.fromId(name));
                }
            }
        }
        return skipped;
    }

    static GlobalCoherenceSettings settings(AnalysisDepth depth, Set<AnalysisPass> skipped) {
        return new GlobalCoherenceSettings(
                !skipped.contains(AnalysisPass.TRANSITIONS),
                !skipped.contains(AnalysisPass.SEQUENCES),
                !skipped.contains(AnalysisPass.CHAPTERS),
                !skipped.contains(AnalysisPass.ARC),
                !skipped.contains(AnalysisPass.SYNTHESIS),
                depth);
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
