package com.plotline.core.passes;

import com.fasterxml.jackson.databind.JsonNode;
import com.plotline.core.llm.AiKeyException;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.ResponseDecoder;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.ContinuityIssue;
import com.plotline.core.model.ContinuityIssueType;
import com.plotline.core.model.FlowPattern;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.NarrativeFlowIssue;
import com.plotline.core.model.PacingIssue;
import com.plotline.core.model.PacingPattern;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.Scene;
import com.plotline.core.model.SequenceResults;
import com.plotline.core.model.Severity;
import com.plotline.core.model.ThematicDiscontinuity;
import com.plotline.core.model.ThematicPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Pass 2: narrative flow, pacing and theme over overlapping windows of three scenes.
 * <p>
 * A window whose AI call throws is scored with a tension-variance heuristic instead.
 * Issues are deduplicated across windows before they are returned.
 */
@Component
public class SequenceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SequenceAnalyzer.class);

    static final int WINDOW_SIZE = 3;
    static final int BATCH_SIZE = 3;

    private final ContinuityAnalyzer analyzer;
    private final BatchRunner batchRunner;

    public SequenceAnalyzer(ContinuityAnalyzer analyzer, BatchRunner batchRunner) {
        this.analyzer = analyzer;
        this.batchRunner = batchRunner;
    }

    public SequenceResults analyzeSequences(List<CompressedScene> scenes, PassContext context) {
        if (scenes == null || scenes.size() < WINDOW_SIZE) {
            log.debug("Not enough scenes for sequence analysis");
            return SequenceResults.empty();
        }
        var windows = slidingWindows(scenes);
        var flow = new ArrayList<NarrativeFlowIssue>();
        var pacing = new ArrayList<PacingIssue>();
        var theme = new ArrayList<ThematicDiscontinuity>();
        int processed = 0;

        for (int i = 0; i < windows.size(); i += BATCH_SIZE) {
            if (context.isCancelled()) {
                log.debug("Sequence analysis cancelled after {} windows", processed);
                break;
            }
            var batch = windows.subList(i, Math.min(i + BATCH_SIZE, windows.size()));
            var tasks = new ArrayList<Supplier<SequenceResults>>();
            for (var window : batch) {
                tasks.add(() -> analyzeWindow(window, context));
            }
            var settled = batchRunner.settleAll(tasks);
            for (var outcome : settled) {
                if (outcome.isSuccess()) {
                    flow.addAll(outcome.value().flowIssues());
                    pacing.addAll(outcome.value().pacingIssues());
                    theme.addAll(outcome.value().thematicIssues());
                } else {
                    log.debug("Sequence window rejected: {}", outcome.error().getMessage());
                }
            }
            processed += batch.size();
            var lastWindow = batch.get(batch.size() - 1);
            context.progress((int) Math.floor((double) processed / windows.size() * 100),
                    lastWindow.get(lastWindow.size() - 1).id());
        }
        return consolidateResults(new SequenceResults(flow, pacing, theme));
    }

    static List<List<CompressedScene>> slidingWindows(List<CompressedScene> scenes) {
        var windows = new ArrayList<List<CompressedScene>>();
        for (int i = 0; i + WINDOW_SIZE <= scenes.size(); i++) {
            windows.add(List.copyOf(scenes.subList(i, i + WINDOW_SIZE)));
        }
        return windows;
    }

    SequenceResults analyzeWindow(List<CompressedScene> window, PassContext context) {
        try {
            CompressedScene target = window.get(window.size() - 1);
            var characters = new LinkedHashSet<String>();
            var locations = new LinkedHashSet<String>();
            for (CompressedScene scene : window) {
                characters.addAll(scene.metadata().characters());
                locations.addAll(scene.metadata().locations());
            }
            Scene synthetic = new Scene(target.id(), CoherencePrompts.sequence(window), -1,
                    target.position(), target.position(), List.copyOf(characters), List.of(), List.copyOf(locations), false);
            AnalysisRequest request = new AnalysisRequest(
                    synthetic,
                    List.of(),
                    AnalysisType.CONSISTENCY,
                    new ReaderContext(List.copyOf(characters), List.copyOf(locations), List.of()),
                    new AnalysisOptions(List.of("sequence-flow", "pacing", "themes"), ModelTier.STANDARD, context.depth()));

            AnalysisResponse response = analyzer.analyze(request);
            context.modelUsage().record(response.modelUsed());
            return parseResponse(response, window);
        } catch (AiKeyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Sequence window ending at {} failed, using heuristic: {}",
                    window.get(window.size() - 1).id(), e.getMessage());
            return fallbackAnalysis(window);
        }
    }

    SequenceResults parseResponse(AnalysisResponse response, List<CompressedScene> window) {
        JsonNode data = ResponseDecoder.locate(response.payload(), "flowIssues", "sequenceAnalysis", "analysis");
        List<String> windowIds = window.stream().map(CompressedScene::id).toList();
        String firstId = windowIds.get(0);
        String targetId = windowIds.get(windowIds.size() - 1);

        var flow = new ArrayList<NarrativeFlowIssue>();
        for (JsonNode issue : ResponseDecoder.objects(data, "flowIssues")) {
            flow.add(new NarrativeFlowIssue(
                    Severity.normalize(ResponseDecoder.text(issue, "severity", null)),
                    ResponseDecoder.text(issue, "description", "Narrative flow disruption"),
                    affectedOrWindow(issue, windowIds),
                    FlowPattern.normalize(ResponseDecoder.text(issue, "pattern", null))));
        }
        var pacing = new ArrayList<PacingIssue>();
        for (JsonNode issue : ResponseDecoder.objects(data, "pacingIssues")) {
            pacing.add(new PacingIssue(
                    Severity.normalize(ResponseDecoder.text(issue, "severity", null)),
                    ResponseDecoder.text(issue, "description", "Pacing inconsistency"),
                    affectedOrWindow(issue, windowIds),
                    PacingPattern.normalize(ResponseDecoder.text(issue, "pattern", null)),
                    ResponseDecoder.number(issue, "tensionDelta", 0)));
        }
        var theme = new ArrayList<ThematicDiscontinuity>();
        for (JsonNode issue : ResponseDecoder.objects(data, "thematicIssues")) {
            String lastSeen = ResponseDecoder.text(issue, "lastSeenScene", firstId);
            String brokenAt = ResponseDecoder.text(issue, "brokenAtScene", targetId);
            theme.add(new ThematicDiscontinuity(
                    Severity.normalize(ResponseDecoder.text(issue, "severity", null)),
                    ResponseDecoder.text(issue, "description", "Thematic discontinuity"),
                    List.of(lastSeen, brokenAt),
                    ThematicPattern.normalize(ResponseDecoder.text(issue, "pattern", null)),
                    ResponseDecoder.text(issue, "theme", "unspecified"),
                    lastSeen,
                    brokenAt));
        }

        for (ContinuityIssue generic : response.issues()) {
            classifyGeneric(generic, windowIds, flow, pacing, theme);
        }
        return new SequenceResults(flow, pacing, theme);
    }

    /**
     * Sorts a generic continuity issue into the flow, pacing or theme bucket, or drops it.
     */
    static void classifyGeneric(ContinuityIssue issue, List<String> windowIds,
                                List<NarrativeFlowIssue> flow, List<PacingIssue> pacing,
                                List<ThematicDiscontinuity> theme) {
        String description = issue.description().toLowerCase(Locale.ROOT);
        ContinuityIssueType type = issue.type();

        if (type == ContinuityIssueType.PLOT || type == ContinuityIssueType.TIMELINE
                || description.contains("causality") || description.contains("cause") || description.contains("passive")) {
            FlowPattern pattern = description.contains("passive") ? FlowPattern.PASSIVE_SEQUENCE
                    : description.contains("info") ? FlowPattern.INFO_GAP
                    : FlowPattern.BROKEN_CAUSALITY;
            flow.add(new NarrativeFlowIssue(issue.severity(), issue.description(), windowIds, pattern));
            return;
        }
        if (type == ContinuityIssueType.ENGAGEMENT || description.contains("pacing")
                || description.contains("slow") || description.contains("fast") || description.contains("tension")) {
            PacingPattern pattern = description.contains("slow") ? PacingPattern.TOO_SLOW
                    : description.contains("fast") ? PacingPattern.TOO_FAST
                    : PacingPattern.INCONSISTENT;
            pacing.add(new PacingIssue(issue.severity(), issue.description(), windowIds, pattern, 0));
            return;
        }
        if (type == ContinuityIssueType.CONTEXT || description.contains("theme") || description.contains("motif")) {
            String first = windowIds.get(0);
            String last = windowIds.get(windowIds.size() - 1);
            theme.add(new ThematicDiscontinuity(issue.severity(), issue.description(), List.of(first, last),
                    ThematicPattern.DISCONTINUITY, "narrative", first, last));
        }
    }

    /**
     * Tension-variance heuristic. Pure: equal inputs give equal outputs.
     */
    static SequenceResults fallbackAnalysis(List<CompressedScene> window) {
        List<String> ids = window.stream().map(CompressedScene::id).toList();
        int[] tensions = window.stream().mapToInt(s -> s.metadata().tensionLevel()).toArray();
        double average = 0;
        for (int t : tensions) average += t;
        average /= tensions.length;
        double variance = 0;
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        for (int t : tensions) {
            variance += (t - average) * (t - average);
            max = Math.max(max, t);
            min = Math.min(min, t);
        }
        variance /= tensions.length;

        var pacing = new ArrayList<PacingIssue>();
        var flow = new ArrayList<NarrativeFlowIssue>();
        if (variance > 10) {
            pacing.add(new PacingIssue(Severity.SHOULD_FIX, "Inconsistent tension levels across sequence",
                    ids, PacingPattern.INCONSISTENT, max - min));
        }
        if (average < 3) {
            flow.add(new NarrativeFlowIssue(Severity.CONSIDER, "Low tension suggests passive sequence",
                    ids, FlowPattern.PASSIVE_SEQUENCE));
        }
        return new SequenceResults(flow, pacing, List.of());
    }

    /**
     * Drops duplicates across windows, keeping the first occurrence of each issue.
     */
    static SequenceResults consolidateResults(SequenceResults results) {
        return new SequenceResults(
                dedupe(results.flowIssues(), issue -> issue.description() + ":" + sortedIds(issue.affectedScenes()) + ":" + issue.pattern()),
                dedupe(results.pacingIssues(), issue -> issue.description() + ":" + sortedIds(issue.affectedScenes())
                        + ":" + issue.pattern() + ":" + issue.tensionDelta()),
                dedupe(results.thematicIssues(), issue -> issue.description() + ":" + issue.theme()
                        + ":" + issue.lastSeenScene() + ":" + issue.brokenAtScene()));
    }

    private static <T> List<T> dedupe(List<T> items, Function<T, String> key) {
        Set<String> seen = new HashSet<>();
        var out = new ArrayList<T>();
        for (T item : items) {
            if (seen.add(key.apply(item))) {
                out.add(item);
            }
        }
        return out;
    }

    private static String sortedIds(List<String> ids) {
        return String.join(",", ids.stream().sorted().toList());
    }

    private static List<String> affectedOrWindow(JsonNode issue, List<String> windowIds) {
        JsonNode affected = issue.get("affectedScenes");
        if (affected != null && affected.isArray()) {
            return ResponseDecoder.strings(issue, "affectedScenes");
        }
        return windowIds;
    }
}
