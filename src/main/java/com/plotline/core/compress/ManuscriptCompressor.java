package com.plotline.core.compress;

import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.ResponseDecoder;
import com.plotline.core.model.ActSummary;
import com.plotline.core.model.AnalysisDepth;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.ChapterSummary;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.EmotionalTone;
import com.plotline.core.model.Manuscript;
import com.plotline.core.model.ManuscriptSkeleton;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.Scene;
import com.plotline.core.model.SceneMetadata;
import com.plotline.core.passes.BatchRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns full scenes into token-bounded {@link CompressedScene}s and builds the hierarchical
 * {@link ManuscriptSkeleton} used by the arc pass.
 * <p>
 * Compression never fails: any per-scene error, including a failed AI summary, is replaced
 * by a heuristic compression of the same scene.
 */
@Service
public class ManuscriptCompressor {

    private static final Logger log = LoggerFactory.getLogger(ManuscriptCompressor.class);

    static final int BATCH_SIZE = 5;

    private static final Map<EmotionalTone, Pattern> TONE_PATTERNS = new LinkedHashMap<>();
    static {
        TONE_PATTERNS.put(EmotionalTone.TENSE, Pattern.compile("(?:fight|argument|conflict|anger|rage)\\b", Pattern.CASE_INSENSITIVE));
        TONE_PATTERNS.put(EmotionalTone.SAD, Pattern.compile("(?:cry|tears|sorrow|grief|mourn)\\b", Pattern.CASE_INSENSITIVE));
        TONE_PATTERNS.put(EmotionalTone.HAPPY, Pattern.compile("(?:laugh|joy|smile|celebrate|cheer)\\b", Pattern.CASE_INSENSITIVE));
        TONE_PATTERNS.put(EmotionalTone.SUSPENSE, Pattern.compile("(?:mystery|unknown|shadow|creep|sneak)\\b", Pattern.CASE_INSENSITIVE));
        TONE_PATTERNS.put(EmotionalTone.NEUTRAL, Pattern.compile("(?:said|walked|looked|went|was)\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final Pattern TENSION_WORDS = Pattern.compile(
            "\\b(fight|chase|escape|danger|threat|scream|attack|die|kill|blood)\\b", Pattern.CASE_INSENSITIVE);

    private static final String[] ACT_NAMES = {"Act I", "Act II", "Act III"};

    private final ContinuityAnalyzer analyzer;
    private final CompressorProperties properties;
    private final BatchRunner batchRunner;

    public ManuscriptCompressor(ContinuityAnalyzer analyzer, CompressorProperties properties, BatchRunner batchRunner) {
        this.analyzer = analyzer;
        this.properties = properties;
        this.batchRunner = batchRunner;
    }

    /**
     * Compresses one scene without prior-scene context.
     */
    public CompressedScene compressScene(Scene scene, int position) {
        try {
            return compressInternal(scene, position, List.of());
        } catch (RuntimeException e) {
            log.debug("Failed to compress scene {}: {}", scene != null ? scene.id() : null, e.getMessage());
            return fallbackCompression(scene, position);
        }
    }

    /**
     * Compresses every scene in batches of {@value #BATCH_SIZE}. Output order and size
     * always match the input.
     */
    public List<CompressedScene> prepareScenesForAnalysis(List<Scene> scenes) {
        if (scenes == null || scenes.isEmpty()) {
            return List.of();
        }
        var out = new ArrayList<CompressedScene>(scenes.size());
        for (int i = 0; i < scenes.size(); i += BATCH_SIZE) {
            int batchStart = i;
            var batch = scenes.subList(i, Math.min(i + BATCH_SIZE, scenes.size()));
            var tasks = new ArrayList<Supplier<CompressedScene>>(batch.size());
            for (int idx = 0; idx < batch.size(); idx++) {
                Scene scene = batch.get(idx);
                int position = batchStart + idx;
                int previousCount = properties.getAiPreviousContextScenes();
                List<Scene> previous = previousCount > 0
                        ? scenes.subList(Math.max(0, position - previousCount), position)
                        : List.of();
                tasks.add(() -> {
                    try {
                        return compressInternal(scene, position, previous);
                    } catch (RuntimeException e) {
                        log.debug("Failed to compress scene {}: {}", scene != null ? scene.id() : null, e.getMessage());
                        return fallbackCompression(scene, position);
                    }
                });
            }
            var settled = batchRunner.settleAll(tasks);
            for (int idx = 0; idx < settled.size(); idx++) {
                var result = settled.get(idx);
                out.add(result.isSuccess() ? result.value() : fallbackCompression(batch.get(idx), batchStart + idx));
            }

            if (scenes.size() > 50 && i % 20 == 0) {
                log.debug("Compressed {}/{} scenes", Math.min(i + batch.size(), scenes.size()), scenes.size());
            }

            if (properties.isUseAiSummaries() && properties.getDelayMsBetweenBatches() > 0
                    && i + BATCH_SIZE < scenes.size()) {
                sleep(properties.getDelayMsBetweenBatches());
            }
        }
        return out;
    }

    /**
     * Compresses the manuscript and groups it into chapters, acts and an overview.
     */
    public ManuscriptSkeleton createManuscriptSkeleton(Manuscript manuscript) {
        return createManuscriptSkeleton(prepareScenesForAnalysis(manuscript.scenes()));
    }

    /**
     * Builds the skeleton from scenes that were already compressed.
     */
    public ManuscriptSkeleton createManuscriptSkeleton(List<CompressedScene> scenes) {
        var chapters = summarizeChapters(scenes);
        var acts = summarizeActs(chapters);
        var overview = truncateWords(
                String.join(" ", acts.stream().map(ActSummary::summary).toList()),
                properties.getMaxSummaryWords() * 3);
        return new ManuscriptSkeleton(scenes, chapters, acts, overview);
    }

    private CompressedScene compressInternal(Scene scene, int position, List<Scene> previousScenes) {
        String text = scene.text();
        String summary = null;
        if (properties.isUseAiSummaries()) {
            summary = tryAiSummary(scene, previousScenes);
        }
        if (summary == null) {
            summary = truncateWords(text, properties.getMaxSummaryWords());
        }
        return new CompressedScene(
                scene.id(),
                position,
                extractOpening(text, properties.getMaxBoundaryWords()),
                extractClosing(text, properties.getMaxBoundaryWords()),
                summary,
                extractMetadata(scene));
    }

    CompressedScene fallbackCompression(Scene scene, int position) {
        String text = scene != null ? scene.text() : "";
        String id = scene != null && scene.id() != null ? scene.id() : "unknown-" + position;
        return new CompressedScene(
                id,
                position,
                extractOpening(text, properties.getMaxBoundaryWords()),
                extractClosing(text, properties.getMaxBoundaryWords()),
                truncateWords(text, properties.getMaxSummaryWords()),
                scene != null ? extractMetadata(scene) : new SceneMetadata(0, Set.of(), Set.of(), EmotionalTone.NEUTRAL, 1));
    }

    private String tryAiSummary(Scene scene, List<Scene> previousScenes) {
        try {
            AnalysisRequest request = new AnalysisRequest(
                    scene,
                    previousScenes,
                    AnalysisType.SIMPLE,
                    new ReaderContext(scene.characters(), List.of(), List.of()),
                    new AnalysisOptions(List.of("summary"), ModelTier.FAST, AnalysisDepth.QUICK));
            AnalysisResponse response = analyzer.analyze(request);
            String summary = ResponseDecoder.text(response.payload(), "summary", null);
            if (summary != null && !summary.isBlank()) {
                return truncateWords(summary, properties.getMaxSummaryWords());
            }
            return null;
        } catch (RuntimeException e) {
            log.debug("AI summarization failed for scene {}; using fallback: {}", scene.id(), e.getMessage());
            return null;
        }
    }

    static String extractOpening(String text, int wordCount) {
        if (text == null || text.isEmpty()) return "";
        String[] words = words(text);
        if (words.length <= wordCount) return text;
        return String.join(" ", Arrays.copyOfRange(words, 0, wordCount));
    }

    static String extractClosing(String text, int wordCount) {
        if (text == null || text.isEmpty()) return "";
        String[] words = words(text);
        if (words.length <= wordCount) return text;
        return String.join(" ", Arrays.copyOfRange(words, words.length - wordCount, words.length));
    }

    static SceneMetadata extractMetadata(Scene scene) {
        String text = scene.text();
        int wordCount = scene.wordCount() > 0
                ? scene.wordCount()
                : (text.isBlank() ? 0 : words(text).length);
        return new SceneMetadata(
                wordCount,
                new LinkedHashSet<>(scene.characters()),
                new LinkedHashSet<>(scene.locationMarkers()),
                detectEmotionalTone(text),
                calculateTensionLevel(text));
    }

    /**
     * First matching keyword class wins, in the order tense, sad, happy, suspense, neutral.
     */
    static EmotionalTone detectEmotionalTone(String text) {
        if (text == null) return EmotionalTone.NEUTRAL;
        for (var entry : TONE_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return EmotionalTone.NEUTRAL;
    }

    static int calculateTensionLevel(String text) {
        if (text == null || text.isEmpty()) return 1;
        Matcher matcher = TENSION_WORDS.matcher(text);
        int hits = 0;
        while (matcher.find()) {
            hits++;
        }
        return Math.min(10, Math.max(1, hits));
    }

    private List<ChapterSummary> summarizeChapters(List<CompressedScene> scenes) {
        var chapters = new ArrayList<ChapterSummary>();
        int size = Math.max(1, properties.getChapterSize());
        for (int i = 0; i < scenes.size(); i += size) {
            var chapterScenes = scenes.subList(i, Math.min(i + size, scenes.size()));
            var sceneIds = chapterScenes.stream().map(CompressedScene::id).toList();

            String combined = String.join(" ", chapterScenes.stream()
                    .map(s -> s.summary() == null ? "" : s.summary().trim())
                    .filter(s -> !s.isEmpty())
                    .limit(3)
                    .toList());

            var keyCharacters = new LinkedHashSet<String>();
            chapterScenes.forEach(s -> keyCharacters.addAll(s.metadata().characters()));

            String preface = "Chapter covering " + chapterScenes.size() + " scene(s).";
            String characterLine = keyCharacters.isEmpty() ? "" : " Key characters: " + String.join(", ", keyCharacters) + ".";
            String body = !combined.isEmpty()
                    ? combined
                    : String.join(" ", chapterScenes.stream().map(CompressedScene::opening).toList());
            String summary = truncateWords((preface + characterLine + " " + body).trim(), properties.getMaxSummaryWords());
            chapters.add(new ChapterSummary(summary, sceneIds));
        }
        return chapters;
    }

    private List<ActSummary> summarizeActs(List<ChapterSummary> chapters) {
        var acts = new ArrayList<ActSummary>();
        int n = chapters.size();
        if (n == 0) {
            return acts;
        }
        int act1End = Math.max(1, (int) Math.round(n * 0.3));
        int act2End = Math.max(act1End + 1, (int) Math.round(n * 0.8));
        int[][] ranges = {
                {0, Math.min(act1End, n) - 1},
                {Math.min(act1End, n), Math.min(act2End, n) - 1},
                {Math.min(act2End, n), n - 1}
        };
        for (int a = 0; a < ranges.length; a++) {
            int start = ranges[a][0];
            int end = ranges[a][1];
            if (start > end || start >= n || end < 0) {
                acts.add(new ActSummary(ACT_NAMES[a], ACT_NAMES[a] + ": (no content)", start, Math.max(end, start)));
                continue;
            }
            String combined = String.join(" ", chapters.subList(start, end + 1).stream().map(ChapterSummary::summary).toList());
            acts.add(new ActSummary(ACT_NAMES[a],
                    truncateWords(ACT_NAMES[a] + ": " + combined, properties.getMaxSummaryWords() * 2), start, end));
        }
        return acts;
    }

    static String truncateWords(String text, int maxWords) {
        if (text == null || text.isEmpty()) return "";
        String[] words = words(text);
        if (words.length <= maxWords) return text;
        return String.join(" ", Arrays.copyOfRange(words, 0, maxWords)) + "...";
    }

    private static String[] words(String text) {
        return text.trim().split("\\s+");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
