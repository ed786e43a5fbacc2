package com.plotline.core.passes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.plotline.core.llm.AiKeyException;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.ResponseDecoder;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.ContinuityIssue;
import com.plotline.core.model.EmotionalTone;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.Scene;
import com.plotline.core.model.ScenePairAnalysis;
import com.plotline.core.model.Severity;
import com.plotline.core.model.TransitionFlags;
import com.plotline.core.model.TransitionIssue;
import com.plotline.core.model.TransitionIssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Pass 1: scores every transition between adjacent scenes.
 * <p>
 * For N scenes this always yields N-1 analyses in position order, unless the run is
 * cancelled part way. A pair whose AI call fails gets a heuristic analysis computed from
 * tension and tone alone.
 */
@Component
public class TransitionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TransitionAnalyzer.class);

    static final int BATCH_SIZE = 5;

    private static final List<Set<EmotionalTone>> OPPOSITE_TONES = List.of(
            Set.of(EmotionalTone.HAPPY, EmotionalTone.SAD),
            Set.of(EmotionalTone.TENSE, EmotionalTone.RELAXED),
            Set.of(EmotionalTone.SUSPENSE, EmotionalTone.PEACEFUL),
            Set.of(EmotionalTone.ANGRY, EmotionalTone.CALM));

    private static final List<String> TRANSITION_KEYWORDS = List.of("transition", "flow", "jarring", "abrupt", "sudden");

    private final ContinuityAnalyzer analyzer;
    private final BatchRunner batchRunner;

    public TransitionAnalyzer(ContinuityAnalyzer analyzer, BatchRunner batchRunner) {
        this.analyzer = analyzer;
        this.batchRunner = batchRunner;
    }

    public List<ScenePairAnalysis> analyzeTransitions(List<CompressedScene> scenes, PassContext context) {
        if (scenes == null || scenes.size() < 2) {
            log.debug("Not enough scenes for transition analysis");
            return List.of();
        }
        int totalPairs = scenes.size() - 1;
        var results = new ArrayList<ScenePairAnalysis>(totalPairs);

        for (int i = 0; i < totalPairs; i += BATCH_SIZE) {
            if (context.isCancelled()) {
                log.debug("Transition analysis cancelled after {} pairs", results.size());
                break;
            }
            int batchEnd = Math.min(i + BATCH_SIZE, totalPairs);
            var tasks = new ArrayList<Supplier<ScenePairAnalysis>>();
            for (int j = i; j < batchEnd; j++) {
                CompressedScene a = scenes.get(j);
                CompressedScene b = scenes.get(j + 1);
                int position = j;
                tasks.add(() -> analyzePair(a, b, position, context));
            }
            var settled = batchRunner.settleAll(tasks);
            for (int k = 0; k < settled.size(); k++) {
                var outcome = settled.get(k);
                if (outcome.isSuccess()) {
                    results.add(outcome.value());
                } else {
                    int position = i + k;
                    log.debug("Transition {} rejected: {}", position, outcome.error().getMessage());
                    results.add(fallbackAnalysis(scenes.get(position), scenes.get(position + 1), position));
                }
            }
            int progress = (int) Math.floor((double) batchEnd / totalPairs * 100);
            context.progress(Math.min(progress, 100), scenes.get(batchEnd).id());
        }
        return results;
    }

    ScenePairAnalysis analyzePair(CompressedScene a, CompressedScene b, int position, PassContext context) {
        try {
            var characters = new LinkedHashSet<String>(a.metadata().characters());
            characters.addAll(b.metadata().characters());
            var locations = new LinkedHashSet<String>(a.metadata().locations());
            locations.addAll(b.metadata().locations());

            Scene synthetic = new Scene(a.id() + "-" + b.id(), CoherencePrompts.transition(a, b), 400,
                    position, position, List.copyOf(characters), List.of(), List.copyOf(locations), false);
            AnalysisRequest request = new AnalysisRequest(
                    synthetic,
                    List.of(),
                    AnalysisType.SIMPLE,
                    new ReaderContext(List.copyOf(characters), List.copyOf(locations), List.of()),
                    new AnalysisOptions(List.of("transitions"), ModelTier.FAST, context.depth()));

            AnalysisResponse response = analyzer.analyze(request);
            context.modelUsage().record(response.modelUsed());
            return parseResponse(response, a, b, position);
        } catch (AiKeyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Transition {} -> {} failed, using heuristic: {}", a.id(), b.id(), e.getMessage());
            return fallbackAnalysis(a, b, position);
        }
    }

    ScenePairAnalysis parseResponse(AnalysisResponse response, CompressedScene a, CompressedScene b, int position) {
        JsonNode root = response.payload();
        JsonNode data = transitionData(root);

        var issues = new ArrayList<TransitionIssue>();
        for (JsonNode issue : ResponseDecoder.objects(data, "issues")) {
            issues.add(new TransitionIssue(
                    TransitionIssueType.normalize(ResponseDecoder.text(issue, "type", null)),
                    Severity.normalize(ResponseDecoder.text(issue, "severity", null)),
                    ResponseDecoder.text(issue, "description", "Transition issue detected"),
                    ResponseDecoder.text(issue, "suggestion", "")));
        }
        // With the payload at the root, its issues are the generic issues already read above
        if (data != root) {
            for (ContinuityIssue generic : response.issues()) {
                if (isTransitionRelated(generic)) {
                    issues.add(new TransitionIssue(
                            TransitionIssueType.JARRING_PACE_CHANGE,
                            generic.severity(),
                            generic.description().isEmpty() ? "Transition issue" : generic.description(),
                            generic.suggestedFix() != null ? generic.suggestedFix() : ""));
                }
            }
        }

        JsonNode flags = data != null ? data.get("flags") : null;
        return new ScenePairAnalysis(
                a.id(),
                b.id(),
                position,
                ResponseDecoder.score(data, "transitionScore", 0.5),
                issues,
                ResponseDecoder.strings(data, "strengths"),
                new TransitionFlags(
                        ResponseDecoder.flag(flags, "needsSceneBreak", false),
                        ResponseDecoder.flag(flags, "needsTransitionScene", false),
                        ResponseDecoder.flag(flags, "chapterBoundaryCandidate", false)));
    }

    /**
     * The transition payload: the root when it carries a score, else a known wrapper, else an empty node.
     */
    private static JsonNode transitionData(JsonNode root) {
        if (root == null || !root.isObject()) {
            return MissingNode.getInstance();
        }
        JsonNode data = ResponseDecoder.locate(root, "transitionScore", "transitionAnalysis", "analysis");
        if (data == root && !root.has("transitionScore")) {
            return MissingNode.getInstance();
        }
        return data;
    }

    /**
     * Heuristic analysis from tension and tone. Pure: equal inputs give equal outputs.
     */
    static ScenePairAnalysis fallbackAnalysis(CompressedScene a, CompressedScene b, int position) {
        var issues = new ArrayList<TransitionIssue>();
        int tensionA = a.metadata().tensionLevel();
        int tensionB = b.metadata().tensionLevel();
        int tensionDelta = Math.abs(tensionA - tensionB);
        if (tensionDelta > 5) {
            issues.add(new TransitionIssue(
                    TransitionIssueType.JARRING_PACE_CHANGE,
                    Severity.SHOULD_FIX,
                    "Large tension shift from " + tensionA + " to " + tensionB,
                    "Consider adding transitional narrative to smooth the tension change"));
        }
        EmotionalTone toneA = a.metadata().emotionalTone();
        EmotionalTone toneB = b.metadata().emotionalTone();
        if (areOpposite(toneA, toneB)) {
            issues.add(new TransitionIssue(
                    TransitionIssueType.EMOTIONAL_WHIPLASH,
                    Severity.SHOULD_FIX,
                    "Abrupt mood shift from " + toneA.wireName() + " to " + toneB.wireName(),
                    "Add emotional transition or scene break"));
        }
        return new ScenePairAnalysis(
                a.id(),
                b.id(),
                position,
                issues.isEmpty() ? 0.7 : 0.5,
                issues,
                List.of(),
                new TransitionFlags(tensionDelta > 7, issues.size() > 2, tensionDelta > 5));
    }

    static boolean areOpposite(EmotionalTone toneA, EmotionalTone toneB) {
        if (toneA == null || toneB == null || toneA == toneB) {
            return false;
        }
        return OPPOSITE_TONES.stream().anyMatch(pair -> pair.contains(toneA) && pair.contains(toneB));
    }

    private static boolean isTransitionRelated(ContinuityIssue issue) {
        String description = issue.description().toLowerCase(Locale.ROOT);
        return TRANSITION_KEYWORDS.stream().anyMatch(description::contains);
    }
}
