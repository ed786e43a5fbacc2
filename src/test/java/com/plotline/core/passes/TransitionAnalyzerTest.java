package com.plotline.core.passes;

import com.plotline.core.engine.CancellationToken;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.InvalidKeyException;
import com.plotline.core.model.AnalysisDepth;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.CompressedScene;
import com.plotline.core.model.ContinuityIssue;
import com.plotline.core.model.ContinuityIssueType;
import com.plotline.core.model.EmotionalTone;
import com.plotline.core.model.ModelTier;
import com.plotline.core.model.ScenePairAnalysis;
import com.plotline.core.model.Severity;
import com.plotline.core.model.TransitionIssue;
import com.plotline.core.model.TransitionIssueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static com.plotline.core.passes.PassFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link TransitionAnalyzer}.
 */
class TransitionAnalyzerTest {

    private ContinuityAnalyzer analyzer;
    private TransitionAnalyzer transitionAnalyzer;

    @BeforeEach
    void setUp() {
        analyzer = mock(ContinuityAnalyzer.class);
        transitionAnalyzer = new TransitionAnalyzer(analyzer, directRunner());
    }

    @Test
    @DisplayName("N scenes yield N-1 analyses in position order")
    void yieldsOneAnalysisPerAdjacentPair() {
        when(analyzer.analyze(any())).thenReturn(response("{\"transitionScore\": 0.8}"));

        List<ScenePairAnalysis> results = transitionAnalyzer.analyzeTransitions(scenes(6), PassContext.standalone());

        assertEquals(5, results.size());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(i, results.get(i).position());
            assertEquals("s" + i, results.get(i).sceneAId());
            assertEquals("s" + (i + 1), results.get(i).sceneBId());
        }
    }

    @Test
    @DisplayName("fewer than two scenes make no AI calls")
    void tooFewScenes() {
        assertTrue(transitionAnalyzer.analyzeTransitions(scenes(1), PassContext.standalone()).isEmpty());
        verifyNoInteractions(analyzer);
    }

    @Test
    @DisplayName("requests go to the fast tier with the run depth")
    void requestsUseFastTier() {
        when(analyzer.analyze(any())).thenReturn(response("{\"transitionScore\": 0.8}"));
        var context = new PassContext(null, null, AnalysisDepth.THOROUGH, new ModelUsage());

        transitionAnalyzer.analyzeTransitions(scenes(2), context);

        ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(analyzer).analyze(captor.capture());
        assertEquals(ModelTier.FAST, captor.getValue().options().modelTier());
        assertEquals(AnalysisDepth.THOROUGH, captor.getValue().options().depth());
        assertEquals("test-model", context.modelUsage().first());
    }

    @Test
    @DisplayName("scores are clamped and issue types normalized")
    void parsesAndNormalizes() {
        when(analyzer.analyze(any())).thenReturn(response("""
                {"transitionScore": 1.4,
                 "issues": [{"type": "time gap", "severity": "critical", "description": "Three years vanish"}],
                 "strengths": ["Strong hook"],
                 "flags": {"needsSceneBreak": true}}
                """));

        ScenePairAnalysis pair = transitionAnalyzer.analyzeTransitions(scenes(2), PassContext.standalone()).get(0);

        assertEquals(1.0, pair.transitionScore());
        assertEquals(TransitionIssueType.TIME_GAP, pair.issues().get(0).type());
        assertEquals(Severity.MUST_FIX, pair.issues().get(0).severity());
        assertEquals(List.of("Strong hook"), pair.strengths());
        assertTrue(pair.flags().needsSceneBreak());
        assertFalse(pair.flags().chapterBoundaryCandidate());
    }

    @Test
    @DisplayName("a failed pair falls back to the heuristic and the pass continues")
    void failedPairFallsBack() {
        when(analyzer.analyze(any()))
                .thenReturn(response("{\"transitionScore\": 0.9}"))
                .thenThrow(new IllegalStateException("provider timeout"))
                .thenReturn(response("{\"transitionScore\": 0.9}"));

        List<ScenePairAnalysis> results = transitionAnalyzer.analyzeTransitions(scenes(4), PassContext.standalone());

        assertEquals(3, results.size());
        assertEquals(0.9, results.get(0).transitionScore());
        assertEquals(0.7, results.get(1).transitionScore());
        assertEquals(0.9, results.get(2).transitionScore());
    }

    @Test
    @DisplayName("credential errors abort the pass")
    void keyErrorsPropagate() {
        when(analyzer.analyze(any())).thenThrow(new InvalidKeyException("openai", "401", null));

        assertThrows(InvalidKeyException.class,
                () -> transitionAnalyzer.analyzeTransitions(scenes(3), PassContext.standalone()));
    }

    @Test
    @DisplayName("progress is reported after every batch")
    void reportsProgressPerBatch() {
        when(analyzer.analyze(any())).thenReturn(response("{\"transitionScore\": 0.8}"));
        var percents = new ArrayList<Integer>();
        var sceneIds = new ArrayList<String>();
        var context = new PassContext(null, (percent, scene) -> {
            percents.add(percent);
            sceneIds.add(scene);
        }, null, null);

        transitionAnalyzer.analyzeTransitions(scenes(12), context);

        assertEquals(List.of(45, 90, 100), percents);
        assertEquals(List.of("s5", "s10", "s11"), sceneIds);
    }

    @Test
    @DisplayName("cancellation between batches keeps the finished pairs")
    void cancellationKeepsPartialResults() {
        when(analyzer.analyze(any())).thenReturn(response("{\"transitionScore\": 0.8}"));
        var token = new CancellationToken();
        var context = new PassContext(token, (percent, scene) -> token.cancel(), null, null);

        List<ScenePairAnalysis> results = transitionAnalyzer.analyzeTransitions(scenes(12), context);

        assertEquals(TransitionAnalyzer.BATCH_SIZE, results.size());
    }

    @Nested
    @DisplayName("parseResponse")
    class ParseResponse {

        private final CompressedScene a = scene("a", 0, 4, EmotionalTone.NEUTRAL);
        private final CompressedScene b = scene("b", 1, 4, EmotionalTone.NEUTRAL);

        private ContinuityIssue generic(ContinuityIssueType type, String description) {
            return new ContinuityIssue(type, Severity.MUST_FIX, description, null, "Rework the opening");
        }

        @Test
        @DisplayName("a payload without score or wrapper contributes no transition issues")
        void unmarkedPayloadIssuesAreIgnored() {
            var response = response("""
                    {"issues": [{"type": "pronoun", "severity": "must-fix", "description": "Unclear pronoun he"}]}
                    """, List.of(generic(ContinuityIssueType.PRONOUN, "Unclear pronoun he")));

            ScenePairAnalysis pair = transitionAnalyzer.parseResponse(response, a, b, 0);

            assertTrue(pair.issues().isEmpty());
            assertEquals(0.5, pair.transitionScore());
        }

        @Test
        @DisplayName("without a transition payload only transition-related generic issues are kept")
        void unmarkedPayloadKeepsRelatedGenericIssues() {
            var response = response("{\"issues\": []}", List.of(
                    generic(ContinuityIssueType.CHARACTER, "Mara's eye colour changes"),
                    generic(ContinuityIssueType.CONTEXT, "Abrupt shift from the harbor to the desert")));

            ScenePairAnalysis pair = transitionAnalyzer.parseResponse(response, a, b, 3);

            assertEquals(1, pair.issues().size());
            assertEquals(TransitionIssueType.JARRING_PACE_CHANGE, pair.issues().get(0).type());
            assertEquals("Abrupt shift from the harbor to the desert", pair.issues().get(0).description());
            assertEquals("Rework the opening", pair.issues().get(0).suggestion());
        }

        @Test
        @DisplayName("a wrapped payload is read alongside related generic issues")
        void wrappedPayload() {
            var response = response("""
                    {"transitionAnalysis": {"transitionScore": 0.3,
                      "issues": [{"type": "location jump", "severity": "should-fix", "description": "New city"}]}}
                    """, List.of(generic(ContinuityIssueType.PLOT, "The flow stalls here"),
                    generic(ContinuityIssueType.PRONOUN, "Unclear pronoun she")));

            ScenePairAnalysis pair = transitionAnalyzer.parseResponse(response, a, b, 0);

            assertEquals(0.3, pair.transitionScore());
            assertEquals(List.of(TransitionIssueType.LOCATION_JUMP, TransitionIssueType.JARRING_PACE_CHANGE),
                    pair.issues().stream().map(TransitionIssue::type).toList());
        }
    }

    @Nested
    @DisplayName("fallbackAnalysis")
    class Fallback {

        @Test
        @DisplayName("flags tension jumps and opposite tones")
        void flagsTensionAndTone() {
            CompressedScene calm = scene("a", 0, 1, EmotionalTone.HAPPY);
            CompressedScene violent = scene("b", 1, 9, EmotionalTone.SAD);

            ScenePairAnalysis pair = TransitionAnalyzer.fallbackAnalysis(calm, violent, 0);

            assertEquals(0.5, pair.transitionScore());
            assertEquals(2, pair.issues().size());
            assertEquals(TransitionIssueType.JARRING_PACE_CHANGE, pair.issues().get(0).type());
            assertEquals(TransitionIssueType.EMOTIONAL_WHIPLASH, pair.issues().get(1).type());
            assertTrue(pair.flags().needsSceneBreak());
            assertTrue(pair.flags().chapterBoundaryCandidate());
            assertFalse(pair.flags().needsTransitionScene());
        }

        @Test
        @DisplayName("is deterministic")
        void isDeterministic() {
            CompressedScene a = scene("a", 0, 2, EmotionalTone.TENSE);
            CompressedScene b = scene("b", 1, 8, EmotionalTone.RELAXED);

            assertEquals(TransitionAnalyzer.fallbackAnalysis(a, b, 3), TransitionAnalyzer.fallbackAnalysis(a, b, 3));
        }

        @Test
        @DisplayName("same tone is never whiplash")
        void sameToneIsNotOpposite() {
            assertFalse(TransitionAnalyzer.areOpposite(EmotionalTone.SAD, EmotionalTone.SAD));
            assertTrue(TransitionAnalyzer.areOpposite(EmotionalTone.ANGRY, EmotionalTone.CALM));
            assertFalse(TransitionAnalyzer.areOpposite(EmotionalTone.HAPPY, EmotionalTone.TENSE));
        }
    }
}
