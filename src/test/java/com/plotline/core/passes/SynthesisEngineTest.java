package com.plotline.core.passes;

import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.InvalidKeyException;
import com.plotline.core.metrics.PlotlineMetrics;
import com.plotline.core.model.ArcIssuePattern;
import com.plotline.core.model.ChapterFlowAnalysis;
import com.plotline.core.model.ChapterHealth;
import com.plotline.core.model.ChapterRecommendations;
import com.plotline.core.model.CharacterArc;
import com.plotline.core.model.CharacterArcIssue;
import com.plotline.core.model.FlowPattern;
import com.plotline.core.model.Manuscript;
import com.plotline.core.model.ManuscriptAnalysis;
import com.plotline.core.model.NarrativeFlowIssue;
import com.plotline.core.model.PacingCurve;
import com.plotline.core.model.PacingIssue;
import com.plotline.core.model.PacingPattern;
import com.plotline.core.model.PacingProfile;
import com.plotline.core.model.Scene;
import com.plotline.core.model.ScenePairAnalysis;
import com.plotline.core.model.SequenceResults;
import com.plotline.core.model.Severity;
import com.plotline.core.model.SynthesisResult;
import com.plotline.core.model.ThematicPattern;
import com.plotline.core.model.TransitionFlags;
import com.plotline.core.model.TransitionIssue;
import com.plotline.core.model.TransitionIssueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.plotline.core.passes.PassFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SynthesisEngine}.
 */
class SynthesisEngineTest {

    private ContinuityAnalyzer analyzer;
    private PlotlineMetrics metrics;
    private SynthesisEngine engine;

    @BeforeEach
    void setUp() {
        analyzer = mock(ContinuityAnalyzer.class);
        metrics = mock(PlotlineMetrics.class);
        engine = new SynthesisEngine(analyzer, metrics);
    }

    private static ScenePairAnalysis pair(String a, String b, double score, TransitionIssueType... types) {
        var issues = Arrays.stream(types)
                .map(type -> new TransitionIssue(type, Severity.SHOULD_FIX, type.wireName() + " detected", ""))
                .toList();
        return new ScenePairAnalysis(a, b, 0, score, issues, List.of(), TransitionFlags.none());
    }

    private static ChapterFlowAnalysis chapter(int number, boolean saggy, boolean rushed) {
        return new ChapterFlowAnalysis(number, List.of("s0", "s1"), 0.7,
                new ChapterHealth(true, true, true, true),
                new ChapterRecommendations(false, false, List.of(), List.of()),
                new PacingProfile(false, saggy, rushed));
    }

    private static ManuscriptAnalysis arcs(Map<String, CharacterArc> arcs) {
        return new ManuscriptAnalysis(0.7, List.of(0.25, 0.5, 0.25), arcs, List.of(), List.of(),
                PacingCurve.empty(), 0.7, 0.7, 0.7);
    }

    private static Manuscript manuscript() {
        return new Manuscript("m1", "Test", List.of(
                new Scene("s0", "Mara waits.", -1, 0, 0, List.of("Mara"), List.of(), List.of(), false),
                new Scene("s1", "Ivo runs.", -1, 1, 1, List.of("Ivo"), List.of(), List.of(), false),
                new Scene("s2", "Both meet.", -1, 2, 2, List.of("Mara", "Ivo"), List.of(), List.of(), false)));
    }

    @Nested
    @DisplayName("extract")
    class Extract {

        @Test
        @DisplayName("maps weak transition issues by type and ignores healthy transitions")
        void mapsTransitionIssues() {
            var sceneLevel = List.of(
                    pair("s0", "s1", 0.3, TransitionIssueType.JARRING_PACE_CHANGE, TransitionIssueType.TIME_GAP,
                            TransitionIssueType.UNRESOLVED_TENSION, TransitionIssueType.EMOTIONAL_WHIPLASH),
                    pair("s1", "s2", 0.5, TransitionIssueType.LOCATION_JUMP));

            SynthesisResult result = SynthesisEngine.extract(sceneLevel, SequenceResults.empty(), List.of(), null, null);

            assertEquals(PacingPattern.INCONSISTENT, result.pacingProblems().get(0).pattern());
            assertEquals(List.of(FlowPattern.BROKEN_CAUSALITY, FlowPattern.INFO_GAP),
                    result.flowIssues().stream().map(NarrativeFlowIssue::pattern).toList());
            assertEquals(ThematicPattern.TONAL_SHIFT, result.thematicBreaks().get(0).pattern());
            assertEquals("s0", result.thematicBreaks().get(0).lastSeenScene());
            assertEquals("s1", result.thematicBreaks().get(0).brokenAtScene());
            assertTrue(result.flowIssues().get(0).description().startsWith("Transition s0 -> s1: "));
            assertEquals(4, result.issueCount());
        }

        @Test
        @DisplayName("sagging middles and rushed endings become pacing problems")
        void chapterPacing() {
            SynthesisResult result = SynthesisEngine.extract(List.of(), SequenceResults.empty(),
                    List.of(chapter(1, true, false), chapter(2, false, true)), null, null);

            PacingIssue saggy = result.pacingProblems().get(0);
            assertEquals(PacingPattern.TOO_SLOW, saggy.pattern());
            assertEquals(Severity.SHOULD_FIX, saggy.severity());
            assertEquals("Chapter 1 has a sagging middle", saggy.description());
            assertEquals(PacingPattern.TOO_FAST, result.pacingProblems().get(1).pattern());
            assertEquals(Severity.CONSIDER, result.pacingProblems().get(1).severity());
        }

        @Test
        @DisplayName("weak arcs name the scenes the character appears in")
        void weakArcs() {
            var analysis = arcs(Map.of(
                    "Mara", new CharacterArc(0.3, 0.9, List.of()),
                    "Ivo", new CharacterArc(0.4, 0.2, List.of("motive unclear")),
                    "Pell", new CharacterArc(0.9, 0.9, List.of())));

            SynthesisResult result = SynthesisEngine.extract(List.of(), SequenceResults.empty(), List.of(),
                    analysis, manuscript());

            List<CharacterArcIssue> issues = result.characterArcDisruptions();
            assertEquals(3, issues.size());
            assertEquals("Ivo", issues.get(0).character());
            assertEquals(ArcIssuePattern.INCOMPLETE, issues.get(0).pattern());
            assertEquals(ArcIssuePattern.INCONSISTENT, issues.get(1).pattern());
            assertTrue(issues.get(0).description().contains("motive unclear"));
            assertEquals(List.of("s1", "s2"), issues.get(0).affectedScenes());
            assertEquals("Mara", issues.get(2).character());
            assertEquals(List.of("s0", "s2"), issues.get(2).affectedScenes());
        }
    }

    @Test
    @DisplayName("fewer than three issues skip the AI call")
    void shortCircuitsBelowThreshold() {
        var progress = new ArrayList<Integer>();
        var context = new PassContext(null, (p, s) -> progress.add(p), null, null);

        SynthesisResult result = engine.synthesizeFindings(List.of(), SequenceResults.empty(),
                List.of(chapter(1, true, true)), null, null, context);

        assertEquals(2, result.issueCount());
        assertNull(result.report());
        assertEquals(List.of(100), progress);
        verifyNoInteractions(analyzer);
        verify(metrics).recordSynthesisShortCircuit();
    }

    @Test
    @DisplayName("high-impact priorities escalate matching issues to must-fix")
    void escalatesHighImpactPatterns() {
        when(analyzer.analyze(any())).thenReturn(response("""
                {"synthesis": {
                   "overallCoherenceScore": 0.55,
                   "topPriorities": [
                     {"issuePattern": "Sagging Middle", "affectedSceneCount": 4, "impact": "HIGH",
                      "rootCause": "Subplot stalls", "recommendedFix": "Cut the detour"},
                     {"issuePattern": "rushed ending", "impact": "low"}],
                   "actionPlan": ["Tighten chapter 1"]}}
                """));

        SynthesisResult result = engine.synthesizeFindings(List.of(), SequenceResults.empty(),
                List.of(chapter(1, true, true), chapter(2, true, false)), null, null, PassContext.standalone());

        assertEquals(0.55, result.report().overallCoherenceScore(), 1e-9);
        assertEquals("high", result.report().topPriorities().get(0).impact());
        assertEquals(List.of("Tighten chapter 1"), result.report().actionPlan());
        assertEquals(List.of(Severity.MUST_FIX, Severity.CONSIDER, Severity.MUST_FIX),
                result.pacingProblems().stream().map(PacingIssue::severity).toList());
    }

    @Test
    @DisplayName("a failed call returns the raw extraction without a report")
    void failureKeepsExtraction() {
        when(analyzer.analyze(any())).thenThrow(new IllegalStateException("overloaded"));

        SynthesisResult result = engine.synthesizeFindings(List.of(), SequenceResults.empty(),
                List.of(chapter(1, true, true), chapter(2, true, false)), null, null, PassContext.standalone());

        assertEquals(3, result.issueCount());
        assertNull(result.report());
        assertEquals(Severity.SHOULD_FIX, result.pacingProblems().get(0).severity());
    }

    @Test
    @DisplayName("credential errors propagate")
    void keyErrorsPropagate() {
        when(analyzer.analyze(any())).thenThrow(new InvalidKeyException("openai", "401", null));

        assertThrows(InvalidKeyException.class, () -> engine.synthesizeFindings(List.of(), SequenceResults.empty(),
                List.of(chapter(1, true, true), chapter(2, true, false)), null, null, PassContext.standalone()));
    }
}
