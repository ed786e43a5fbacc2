package com.plotline.core.passes;

import com.fasterxml.jackson.databind.JsonNode;
import com.plotline.core.llm.AiKeyException;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.ResponseDecoder;
import com.plotline.core.model.ActSummary;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.ChapterSummary;
import com.plotline.core.model.CharacterArc;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.ManuscriptAnalysis;
import com.plotline.core.model.ManuscriptSkeleton;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.PacingCurve;
import com.plotline.core.model.PacingSpan;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pass 4: validates the three-act structure and the arcs of the main characters with one
 * call to the deep model tier.
 * <p>
 * Only credential errors escape; any other failure yields a deterministic analysis derived
 * from scene counts.
 */
@Component
public class ArcValidator {

    private static final Logger log = LoggerFactory.getLogger(ArcValidator.class);

    static final int MAIN_CHARACTER_LIMIT = 5;
    static final double DEFAULT_SCORE = 0.6;
    private static final List<Double> DEFAULT_ACT_BALANCE = List.of(0.25, 0.5, 0.25);
    private static final String[] ACT_NAMES = {"Act I", "Act II", "Act III"};

    private final ContinuityAnalyzer analyzer;
    private final int chapterSize;

    @Autowired
    public ArcValidator(ContinuityAnalyzer analyzer) {
        this(analyzer, ChapterAnalyzer.MAX_SCENES_PER_CHAPTER);
    }

    ArcValidator(ContinuityAnalyzer analyzer, int chapterSize) {
        this.analyzer = analyzer;
        this.chapterSize = Math.max(1, chapterSize);
    }

    /**
     * @return the analysis, or empty when the run was cancelled before the AI call
     */
    public Optional<ManuscriptAnalysis> validateArc(ManuscriptSkeleton skeleton, PassContext context) {
        List<CompressedScene> scenes = skeleton.scenes();
        if (context.isCancelled()) {
            log.debug("Arc validation cancelled before the AI call");
            return Optional.empty();
        }
        ManuscriptAnalysis analysis;
        try {
            List<String> mainCharacters = mainCharacters(scenes);
            String theme = inferTheme(scenes);
            List<ActSummary> acts = inferActs(skeleton);
            Scene synthetic = new Scene("manuscript-arc",
                    CoherencePrompts.arc(acts, scenes.size(), mainCharacters, theme), -1,
                    0, 0, mainCharacters, List.of(), List.of(), false);
            AnalysisRequest request = new AnalysisRequest(
                    synthetic,
                    List.of(),
                    AnalysisType.FULL,
                    new ReaderContext(mainCharacters, List.of(), List.of()),
                    new AnalysisOptions(List.of("story-arc", "character-arcs"), ModelTier.DEEP, context.depth()));

            AnalysisResponse response = analyzer.analyze(request);
            context.modelUsage().record(response.modelUsed());
            analysis = parseResponse(response.payload());
        } catch (AiKeyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Arc validation failed, using heuristic: {}", e.getMessage());
            analysis = fallbackAnalysis(scenes.size());
        }
        context.progress(100, null);
        return Optional.of(analysis);
    }

    /**
     * The most frequent characters by number of scenes they appear in. Ties keep first-appearance order.
     */
    static List<String> mainCharacters(List<CompressedScene> scenes) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CompressedScene scene : scenes) {
            for (String character : scene.metadata().characters()) {
                counts.merge(character, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(MAIN_CHARACTER_LIMIT)
                .map(Map.Entry::getKey)
                .toList();
    }

    static String inferTheme(List<CompressedScene> scenes) {
        double average = scenes.stream().mapToInt(s -> s.metadata().tensionLevel()).average().orElse(0);
        if (average > 7) return "conflict and resolution";
        if (average < 3) return "character development";
        return "journey and transformation";
    }

    /**
     * Splits the scenes 25/50/25 and maps each act onto the chapters its scenes fall in.
     */
    List<ActSummary> inferActs(ManuscriptSkeleton skeleton) {
        int n = skeleton.scenes().size();
        int act1End = (int) Math.round(n * 0.25);
        int act2End = (int) Math.round(n * 0.75);
        int[][] sceneRanges = {{0, act1End}, {act1End, act2End}, {act2End, n}};
        List<ChapterSummary> chapters = skeleton.chapters();

        var acts = new ArrayList<ActSummary>();
        for (int a = 0; a < sceneRanges.length; a++) {
            int start = sceneRanges[a][0];
            int end = sceneRanges[a][1];
            if (end <= start) {
                int chapter = Math.min(start / chapterSize, Math.max(0, chapters.size() - 1));
                acts.add(new ActSummary(ACT_NAMES[a], ACT_NAMES[a] + ": (no content)", chapter, chapter));
                continue;
            }
            int firstChapter = start / chapterSize;
            int lastChapter = (end - 1) / chapterSize;
            var parts = new ArrayList<String>();
            for (int c = firstChapter; c <= lastChapter && c < chapters.size(); c++) {
                parts.add(chapters.get(c).summary());
            }
            acts.add(new ActSummary(ACT_NAMES[a], ACT_NAMES[a] + ": " + String.join(" ", parts), firstChapter, lastChapter));
        }
        return acts;
    }

    static ManuscriptAnalysis parseResponse(JsonNode root) {
        JsonNode data = ResponseDecoder.locate(root, "structuralIntegrity",
                "arcAnalysis", "analysis", "manuscriptAnalysis");

        Map<String, CharacterArc> arcs = new LinkedHashMap<>();
        JsonNode arcNode = data != null ? data.get("characterArcs") : null;
        if (arcNode != null && arcNode.isObject()) {
            arcNode.fields().forEachRemaining(entry -> {
                JsonNode arc = entry.getValue();
                if (!arc.isObject()) {
                    return;
                }
                var issues = new ArrayList<String>(ResponseDecoder.strings(arc, "keyMissingElements"));
                issues.addAll(ResponseDecoder.strings(arc, "issues"));
                arcs.put(entry.getKey(), new CharacterArc(
                        ResponseDecoder.score(arc, "completeness", DEFAULT_SCORE),
                        ResponseDecoder.score(arc, "consistency", DEFAULT_SCORE),
                        issues));
            });
        }

        JsonNode curve = data != null ? data.get("pacingCurve") : null;
        return new ManuscriptAnalysis(
                ResponseDecoder.score(data, "structuralIntegrity", DEFAULT_SCORE),
                actBalance(data != null ? data.get("actBalance") : null),
                arcs,
                ResponseDecoder.strings(data, "plotHoles"),
                ResponseDecoder.strings(data, "unresolvedElements"),
                new PacingCurve(spans(curve, "slowSpots"), spans(curve, "rushedSections")),
                ResponseDecoder.score(data, "thematicCoherence", DEFAULT_SCORE),
                ResponseDecoder.score(data, "openingEffectiveness", DEFAULT_SCORE),
                ResponseDecoder.score(data, "endingSatisfaction", DEFAULT_SCORE));
    }

    /**
     * Provider act balance may be percentages or fractions; either way it is normalized by its sum.
     */
    static List<Double> actBalance(JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 3) {
            return DEFAULT_ACT_BALANCE;
        }
        double[] values = new double[3];
        double sum = 0;
        for (int i = 0; i < 3; i++) {
            values[i] = ResponseDecoder.asNumber(node.get(i), Double.NaN);
            if (Double.isNaN(values[i]) || values[i] < 0) {
                return DEFAULT_ACT_BALANCE;
            }
            sum += values[i];
        }
        if (sum <= 0) {
            return DEFAULT_ACT_BALANCE;
        }
        return List.of(
                Math.min(1.0, values[0] / sum),
                Math.min(1.0, values[1] / sum),
                Math.min(1.0, values[2] / sum));
    }

    private static List<PacingSpan> spans(JsonNode curve, String field) {
        var spans = new ArrayList<PacingSpan>();
        for (JsonNode span : ResponseDecoder.objects(curve, field)) {
            spans.add(new PacingSpan(
                    ResponseDecoder.text(span, "start", ""),
                    ResponseDecoder.text(span, "end", ""),
                    ResponseDecoder.text(span, "reason", "")));
        }
        return spans;
    }

    /**
     * Deterministic analysis from the scene count alone.
     */
    static ManuscriptAnalysis fallbackAnalysis(int sceneCount) {
        List<Double> balance;
        if (sceneCount <= 0) {
            balance = DEFAULT_ACT_BALANCE;
        } else {
            int act1End = (int) Math.round(sceneCount * 0.25);
            int act2End = (int) Math.round(sceneCount * 0.75);
            balance = List.of(
                    (double) act1End / sceneCount,
                    (double) (act2End - act1End) / sceneCount,
                    (double) (sceneCount - act2End) / sceneCount);
        }
        return new ManuscriptAnalysis(
                DEFAULT_SCORE,
                balance,
                Map.of(),
                List.of(),
                List.of(),
                PacingCurve.empty(),
                DEFAULT_SCORE,
                DEFAULT_SCORE,
                DEFAULT_SCORE);
    }
}
