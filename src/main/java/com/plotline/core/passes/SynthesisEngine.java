package com.plotline.core.passes;

import com.fasterxml.jackson.databind.JsonNode;
import com.plotline.core.llm.AiKeyException;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.ResponseDecoder;
import com.plotline.core.metrics.PlotlineMetrics;
import com.plotline.core.model.AnalysisOptions;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.AnalysisType;
import com.plotline.core.model.ArcIssuePattern;
import com.plotline.core.model.ChapterFlowAnalysis;
import com.plotline.core.model.ChapterHealth;
import com.plotline.core.model.CharacterArc;
import com.plotline.core.model.CharacterArcIssue;
import com.plotline.core.model.CoherenceIssue;
import com.plotline.core.model.FlowPattern;
import com.plotline.core.model.Manuscript;
import com.plotline.core.model.ManuscriptAnalysis;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.NarrativeFlowIssue;
import com.plotline.core.model.PacingIssue;
import com.plotline.core.model.PacingPattern;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.Scene;
import com.plotline.core.model.ScenePairAnalysis;
import com.plotline.core.model.SequenceResults;
import com.plotline.core.model.Severity;
import com.plotline.core.model.SynthesisPriority;
import com.plotline.core.model.SynthesisReport;
import com.plotline.core.model.SynthesisResult;
import com.plotline.core.model.ThematicDiscontinuity;
import com.plotline.core.model.ThematicPattern;
import com.plotline.core.model.TransitionIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Pass 5: pulls typed issues out of passes 1-4 and, when there are enough of them, asks the
 * deep model tier to prioritize them.
 * <p>
 * Fewer than {@link #MIN_ISSUES_FOR_SYNTHESIS} extracted issues skip the AI call entirely.
 * A failed call returns the raw extraction with no report.
 */
@Component
public class SynthesisEngine {

    private static final Logger log = LoggerFactory.getLogger(SynthesisEngine.class);

    static final int MIN_ISSUES_FOR_SYNTHESIS = 3;
    static final double WEAK_TRANSITION = 0.5;
    static final double WEAK_ARC = 0.5;
    static final double DEFAULT_SCORE = 0.6;

    private final ContinuityAnalyzer analyzer;
    private final PlotlineMetrics metrics;

    /**
     * @param metrics may be null
     */
    public SynthesisEngine(ContinuityAnalyzer analyzer, PlotlineMetrics metrics) {
        this.analyzer = analyzer;
        this.metrics = metrics;
    }

    /**
     * @param manuscriptLevel arc pass output, null when the pass did not run
     */
    public SynthesisResult synthesizeFindings(List<ScenePairAnalysis> sceneLevel,
                                              SequenceResults sequences,
                                              List<ChapterFlowAnalysis> chapterLevel,
                                              ManuscriptAnalysis manuscriptLevel,
                                              Manuscript manuscript,
                                              PassContext context) {
        SequenceResults sequenceResults = sequences != null ? sequences : SequenceResults.empty();
        SynthesisResult extracted = extract(sceneLevel, sequenceResults, chapterLevel, manuscriptLevel, manuscript);

        if (extracted.issueCount() < MIN_ISSUES_FOR_SYNTHESIS) {
            log.debug("Only {} issues extracted, skipping synthesis call", extracted.issueCount());
            if (metrics != null) {
                metrics.recordSynthesisShortCircuit();
            }
            context.progress(100, null);
            return extracted;
        }
        if (context.isCancelled()) {
            log.debug("Synthesis cancelled before the AI call");
            return extracted;
        }

        SynthesisResult result;
        try {
            CoherencePrompts.SynthesisFindings findings = summarize(sceneLevel, extracted, chapterLevel,
                    manuscriptLevel, manuscript);
            Scene synthetic = new Scene("manuscript-synthesis", CoherencePrompts.synthesis(findings), -1,
                    0, 0, List.of(), List.of(), List.of(), false);
            AnalysisRequest request = new AnalysisRequest(
                    synthetic,
                    List.of(),
                    AnalysisType.FULL,
                    ReaderContext.empty(),
                    new AnalysisOptions(List.of("synthesis", "prioritization"), ModelTier.DEEP, context.depth()));

            AnalysisResponse response = analyzer.analyze(request);
            context.modelUsage().record(response.modelUsed());
            SynthesisReport report = parseReport(response.payload());
            result = applyPriorities(extracted, report);
        } catch (AiKeyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Synthesis call failed, keeping raw extraction: {}", e.getMessage());
            result = extracted;
        }
        context.progress(100, null);
        return result;
    }

    /**
     * Threshold-based extraction from passes 1-4. Pure function of its inputs.
     */
    static SynthesisResult extract(List<ScenePairAnalysis> sceneLevel,
                                   SequenceResults sequences,
                                   List<ChapterFlowAnalysis> chapterLevel,
                                   ManuscriptAnalysis manuscriptLevel,
                                   Manuscript manuscript) {
        var flow = new ArrayList<NarrativeFlowIssue>(sequences.flowIssues());
        var pacing = new ArrayList<PacingIssue>(sequences.pacingIssues());
        var themes = new ArrayList<ThematicDiscontinuity>(sequences.thematicIssues());
        var arcs = new ArrayList<CharacterArcIssue>();

        for (ScenePairAnalysis pair : sceneLevel != null ? sceneLevel : List.<ScenePairAnalysis>of()) {
            if (pair.transitionScore() >= WEAK_TRANSITION) {
                continue;
            }
            List<String> affected = List.of(pair.sceneAId(), pair.sceneBId());
            for (TransitionIssue issue : pair.issues()) {
                String description = "Transition " + pair.sceneAId() + " -> " + pair.sceneBId() + ": "
                        + issue.description();
                switch (issue.type()) {
                    case JARRING_PACE_CHANGE -> pacing.add(new PacingIssue(issue.severity(), description,
                            affected, PacingPattern.INCONSISTENT, 0));
                    case TIME_GAP, LOCATION_JUMP -> flow.add(new NarrativeFlowIssue(issue.severity(), description,
                            affected, FlowPattern.BROKEN_CAUSALITY));
                    case UNRESOLVED_TENSION -> flow.add(new NarrativeFlowIssue(issue.severity(), description,
                            affected, FlowPattern.INFO_GAP));
                    case EMOTIONAL_WHIPLASH -> themes.add(new ThematicDiscontinuity(issue.severity(), description,
                            affected, ThematicPattern.TONAL_SHIFT, "emotional tone",
                            pair.sceneAId(), pair.sceneBId()));
                }
            }
        }

        for (ChapterFlowAnalysis chapter : chapterLevel != null ? chapterLevel : List.<ChapterFlowAnalysis>of()) {
            if (chapter.pacingProfile() == null) {
                continue;
            }
            if (chapter.pacingProfile().saggyMiddle()) {
                pacing.add(new PacingIssue(Severity.SHOULD_FIX,
                        "Chapter " + chapter.chapterNumber() + " has a sagging middle",
                        chapter.sceneIds(), PacingPattern.TOO_SLOW, 0));
            }
            if (chapter.pacingProfile().rushedEnding()) {
                pacing.add(new PacingIssue(Severity.CONSIDER,
                        "Chapter " + chapter.chapterNumber() + " has a rushed ending",
                        chapter.sceneIds(), PacingPattern.TOO_FAST, 0));
            }
        }

        if (manuscriptLevel != null) {
            Map<String, CharacterArc> sorted = new TreeMap<>(manuscriptLevel.characterArcs());
            sorted.forEach((character, arc) -> {
                List<String> appearances = appearances(manuscript, character);
                if (arc.completeness() < WEAK_ARC) {
                    arcs.add(new CharacterArcIssue(Severity.SHOULD_FIX,
                            character + "'s arc is incomplete" + detail(arc),
                            appearances, ArcIssuePattern.INCOMPLETE, character));
                }
                if (arc.consistency() < WEAK_ARC) {
                    arcs.add(new CharacterArcIssue(Severity.SHOULD_FIX,
                            character + " behaves inconsistently across the manuscript" + detail(arc),
                            appearances, ArcIssuePattern.INCONSISTENT, character));
                }
            });
        }

        return new SynthesisResult(flow, pacing, themes, arcs, null);
    }

    static SynthesisReport parseReport(JsonNode root) {
        JsonNode data = ResponseDecoder.locate(root, "overallCoherenceScore", "synthesis", "analysis");
        var priorities = new ArrayList<SynthesisPriority>();
        for (JsonNode priority : ResponseDecoder.objects(data, "topPriorities")) {
            priorities.add(new SynthesisPriority(
                    ResponseDecoder.text(priority, "issuePattern", ""),
                    Math.max(0, ResponseDecoder.integer(priority, "affectedSceneCount", 0)),
                    ResponseDecoder.text(priority, "impact", "medium").toLowerCase(Locale.ROOT),
                    ResponseDecoder.text(priority, "rootCause", ""),
                    ResponseDecoder.text(priority, "recommendedFix", "")));
        }
        return new SynthesisReport(
                ResponseDecoder.score(data, "overallCoherenceScore", DEFAULT_SCORE),
                priorities,
                ResponseDecoder.strings(data, "actionPlan"));
    }

    /**
     * Escalates to must-fix every issue whose description contains the pattern of a high-impact priority.
     */
    static SynthesisResult applyPriorities(SynthesisResult extracted, SynthesisReport report) {
        List<String> patterns = report.topPriorities().stream()
                .filter(SynthesisPriority::isHighImpact)
                .map(SynthesisPriority::issuePattern)
                .filter(pattern -> pattern != null && !pattern.isBlank())
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .toList();

        return new SynthesisResult(
                escalate(extracted.flowIssues(), patterns),
                escalate(extracted.pacingProblems(), patterns),
                escalate(extracted.thematicBreaks(), patterns),
                escalate(extracted.characterArcDisruptions(), patterns),
                report);
    }

    @SuppressWarnings("unchecked")
    private static <T extends CoherenceIssue> List<T> escalate(List<T> issues, List<String> patterns) {
        if (patterns.isEmpty()) {
            return issues;
        }
        UnaryOperator<T> escalation = issue -> {
            String description = issue.description().toLowerCase(Locale.ROOT);
            boolean matches = patterns.stream().anyMatch(description::contains);
            return matches ? (T) issue.withSeverity(Severity.MUST_FIX) : issue;
        };
        return issues.stream().map(escalation).toList();
    }

    private static CoherencePrompts.SynthesisFindings summarize(List<ScenePairAnalysis> sceneLevel,
                                                                SynthesisResult extracted,
                                                                List<ChapterFlowAnalysis> chapterLevel,
                                                                ManuscriptAnalysis manuscriptLevel,
                                                                Manuscript manuscript) {
        int transitionIssues = sceneLevel == null ? 0
                : sceneLevel.stream().mapToInt(pair -> pair.issues().size()).sum();
        int chapterIssues = chapterLevel == null ? 0
                : (int) chapterLevel.stream().filter(c -> !healthy(c.issues())).count();
        int moved = manuscript == null ? 0
                : (int) manuscript.scenes().stream().filter(Scene::hasBeenMoved).count();
        int total = manuscript == null ? 0 : manuscript.scenes().size();

        var arcIssues = new ArrayList<String>();
        extracted.characterArcDisruptions().forEach(issue -> arcIssues.add(issue.description()));
        if (manuscriptLevel != null) {
            arcIssues.addAll(manuscriptLevel.plotHoles());
        }
        return new CoherencePrompts.SynthesisFindings(total, moved, transitionIssues,
                extracted.flowIssues().size(), extracted.pacingProblems().size(), chapterIssues, arcIssues);
    }

    private static boolean healthy(ChapterHealth health) {
        return health == null || (health.unity() && health.completeness()
                && health.balancedPacing() && health.narrativePurpose());
    }

    private static List<String> appearances(Manuscript manuscript, String character) {
        if (manuscript == null) {
            return List.of();
        }
        return manuscript.scenes().stream()
                .filter(scene -> scene.characters().contains(character))
                .map(Scene::id)
                .toList();
    }

    private static String detail(CharacterArc arc) {
        return arc.issues().isEmpty() ? "" : " (" + String.join("; ", arc.issues()) + ")";
    }
}
