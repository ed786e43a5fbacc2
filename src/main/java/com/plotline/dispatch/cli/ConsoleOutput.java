package com.plotline.dispatch.cli;

import com.plotline.core.model.GlobalCoherenceAnalysis;
import com.plotline.core.model.GlobalCoherenceProgress;
import com.plotline.core.model.PassError;
import com.plotline.core.model.ScenePairAnalysis;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Plotline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLOTLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLOTLINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void passStarted(GlobalCoherenceProgress progress) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [PASS " + progress.passNumber() + "/" + progress.totalPasses() + "]|@ "
                        + progress.currentPass().id()));
    }

    public static void passProgress(GlobalCoherenceProgress progress) {
        String scene = progress.currentScene() != null ? " at " + progress.currentScene() : "";
        String eta = progress.estimatedTimeRemaining() > 0
                ? ", ~" + formatDuration(progress.estimatedTimeRemaining()) + " left"
                : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) " + progress.passProgress() + "%|@" + scene + eta));
    }

    public static void summary(GlobalCoherenceAnalysis analysis, List<PassError> errors) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Global Coherence|@"));
        double average = analysis.sceneLevel().stream()
                .mapToDouble(ScenePairAnalysis::transitionScore).average().orElse(Double.NaN);
        System.out.println("  Transitions: " + analysis.sceneLevel().size()
                + (Double.isNaN(average) ? "" : String.format(Locale.ROOT, " (average score %.2f)", average)));
        System.out.println("  Chapters: " + analysis.chapterLevel().size());
        System.out.println(String.format(Locale.ROOT, "  Structural integrity: %.2f",
                analysis.manuscriptLevel().structuralIntegrity()));
        System.out.println("  Issues: " + analysis.flowIssues().size() + " flow, "
                + analysis.pacingProblems().size() + " pacing, "
                + analysis.thematicBreaks().size() + " thematic, "
                + analysis.characterArcDisruptions().size() + " character arc");
        if (analysis.synthesis() != null) {
            System.out.println(String.format(Locale.ROOT, "  Overall coherence: %.2f",
                    analysis.synthesis().overallCoherenceScore()));
            for (String step : analysis.synthesis().actionPlan()) {
                System.out.println("    - " + step);
            }
        }
        System.out.println("  Duration: " + formatDuration(analysis.totalAnalysisTime()));
        if (!errors.isEmpty()) {
            error("Pass errors (" + errors.size() + "):");
            for (PassError passError : errors) {
                error("  " + passError.pass() + ": " + passError.message());
            }
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
