package com.plotline.core.passes;

import com.fasterxml.jackson.databind.JsonNode;
import com.plotline.core.llm.AiKeyException;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.ResponseDecoder;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.ChapterFlowAnalysis;
import com.plotline.core.model.ChapterHealth;
import com.plotline.core.model.ChapterRecommendations;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.Manuscript;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.PacingProfile;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pass 3: groups scenes into chapters and scores each chapter as a unit.
 * <p>
 * Chapters are analyzed one at a time. A chapter whose AI call fails gets a heuristic
 * analysis computed from scene count and tension.
 */
@Component
public class ChapterAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ChapterAnalyzer.class);

    static final int MAX_SCENES_PER_CHAPTER = 10;

    private static final Pattern CHAPTER_MARKER =
            Pattern.compile("chapter\\s+\\d+|chapter\\s+[ivxlcdm]+|\\[chapter|^chapter\\s");

    private final ContinuityAnalyzer analyzer;

    public ChapterAnalyzer(ContinuityAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public List<ChapterFlowAnalysis> analyzeChapters(Manuscript manuscript, List<CompressedScene> scenes,
                                                     PassContext context) {
        if (scenes == null || scenes.isEmpty()) {
            log.debug("No scenes to analyze for chapters");
            return List.of();
        }
        var chapters = identifyChapters(manuscript, scenes);
        var results = new ArrayList<ChapterFlowAnalysis>();
        int processed = 0;

        for (int c = 0; c < chapters.size(); c++) {
            if (context.isCancelled()) {
                log.debug("Chapter analysis cancelled after {} chapters", processed);
                break;
            }
            var chapterScenes = chapters.get(c);
            results.add(analyzeChapter(chapterScenes, c + 1, context));
            processed++;
            context.progress((int) Math.floor((double) processed / chapters.size() * 100),
                    chapterScenes.get(chapterScenes.size() - 1).id());
        }
        return results;
    }

    /**
     * Splits scenes at explicit chapter markers, or after {@value #MAX_SCENES_PER_CHAPTER}
     * scenes, whichever comes first.
     */
    static List<List<CompressedScene>> identifyChapters(Manuscript manuscript, List<CompressedScene> scenes) {
        Map<String, Scene> byId = new HashMap<>();
        if (manuscript != null) {
            for (Scene scene : manuscript.scenes()) {
                byId.put(scene.id(), scene);
            }
        }
        var chapters = new ArrayList<List<CompressedScene>>();
        var current = new ArrayList<CompressedScene>();
        for (int i = 0; i < scenes.size(); i++) {
            CompressedScene scene = scenes.get(i);
            boolean chapterStart = i == 0 || isChapterBoundary(byId.get(scene.id()));
            if (chapterStart && !current.isEmpty()) {
                chapters.add(current);
                current = new ArrayList<>();
            }
            current.add(scene);
            if (current.size() >= MAX_SCENES_PER_CHAPTER) {
                chapters.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            chapters.add(current);
        }
        return chapters;
    }

    static boolean isChapterBoundary(Scene scene) {
        if (scene == null || scene.text().isEmpty()) {
            return false;
        }
        String head = scene.text().toLowerCase(Locale.ROOT);
        head = head.substring(0, Math.min(200, head.length()));
        return CHAPTER_MARKER.matcher(head).find();
    }

    ChapterFlowAnalysis analyzeChapter(List<CompressedScene> scenes, int chapterNumber, PassContext context) {
        try {
            int totalWords = scenes.stream().mapToInt(s -> s.metadata().wordCount()).sum();
            Scene synthetic = new Scene("chapter-" + chapterNumber,
                    CoherencePrompts.chapter(scenes, chapterNumber, totalWords), totalWords,
                    scenes.get(0).position(), scenes.get(0).position(), List.of(), List.of(), List.of(), false);
            AnalysisRequest request = new AnalysisRequest(
                    synthetic,
                    List.of(),
                    AnalysisType.CONSISTENCY,
                    ReaderContext.empty(),
                    new AnalysisOptions(List.of("chapter-coherence"), ModelTier.STANDARD, context.depth()));

            AnalysisResponse response = analyzer.analyze(request);
            context.modelUsage().record(response.modelUsed());
            return parseResponse(response, scenes, chapterNumber);
        } catch (AiKeyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Chapter {} failed, using heuristic: {}", chapterNumber, e.getMessage());
            return fallbackAnalysis(scenes, chapterNumber);
        }
    }

    /**
     * Provider health flags report a problem when true; they are negated so the stored
     * flag reads true when the dimension is healthy. A missing flag counts as a problem.
     */
    ChapterFlowAnalysis parseResponse(AnalysisResponse response, List<CompressedScene> scenes, int chapterNumber) {
        JsonNode data = ResponseDecoder.locate(response.payload(), "coherenceScore", "chapterAnalysis", "analysis");
        JsonNode health = data != null ? data.get("issues") : null;
        JsonNode pacing = data != null ? data.get("pacingIssues") : null;
        return new ChapterFlowAnalysis(
                chapterNumber,
                scenes.stream().map(CompressedScene::id).toList(),
                ResponseDecoder.score(data, "coherenceScore", 0.5),
                new ChapterHealth(
                        !ResponseDecoder.flag(health, "unity", true),
                        !ResponseDecoder.flag(health, "completeness", true),
                        !ResponseDecoder.flag(health, "balancedPacing", true),
                        !ResponseDecoder.flag(health, "narrativePurpose", true)),
                new ChapterRecommendations(
                        ResponseDecoder.flag(data, "shouldSplit", false),
                        ResponseDecoder.flag(data, "shouldMergeWithNext", false),
                        ResponseDecoder.strings(data, "orphanedScenes"),
                        ResponseDecoder.strings(data, "missingElements")),
                new PacingProfile(
                        ResponseDecoder.flag(pacing, "frontLoaded", false),
                        ResponseDecoder.flag(pacing, "saggyMiddle", false),
                        ResponseDecoder.flag(pacing, "rushedEnding", false)));
    }

    /**
     * Heuristic analysis from scene count and tension thirds. Pure: equal inputs give equal outputs.
     */
    static ChapterFlowAnalysis fallbackAnalysis(List<CompressedScene> scenes, int chapterNumber) {
        int n = scenes.size();
        int[] tensions = scenes.stream().mapToInt(s -> s.metadata().tensionLevel()).toArray();
        int frontEnd = (int) Math.ceil(n / 3.0);
        int middleEnd = (int) Math.ceil(2 * n / 3.0);

        double average = average(tensions, 0, n);
        double front = average(tensions, 0, frontEnd);
        double middle = average(tensions, frontEnd, middleEnd);
        double end = average(tensions, middleEnd, n);

        return new ChapterFlowAnalysis(
                chapterNumber,
                scenes.stream().map(CompressedScene::id).toList(),
                0.6,
                new ChapterHealth(
                        !(n > 15),
                        !(n < 3),
                        !(Math.abs(front - end) > 3),
                        !(average < 3)),
                new ChapterRecommendations(
                        n > 15,
                        n < 3,
                        List.of(),
                        average < 3 ? List.of("Conflict or tension") : List.of()),
                new PacingProfile(
                        front > middle + 2 && front > end + 2,
                        middle < front - 2 && middle < end - 2,
                        end > middle + 3));
    }

    private static double average(int[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
