package com.plotline.core.passes;

import com.plotline.core.model.ActSummary;
import com.plotline.core.model.CompressedScene;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Provider-agnostic prompt builders for the five passes. Each prompt is XML-structured and
 * ends with the exact JSON shape the pass parses.
 */
public final class CoherencePrompts {

    private CoherencePrompts() {}

    public static String transition(CompressedScene sceneA, CompressedScene sceneB) {
        return """
                <analysis_task>
                <role>narrative_transition_specialist</role>
                <instructions>Rate how smoothly the story moves from scene A into scene B. Report anything that would pull a reader out of the story at this boundary.</instructions>

                <scene_a position="%d">
                  <summary>%s</summary>
                  <ending_text>%s</ending_text>
                %s
                </scene_a>

                <scene_b position="%d">
                  <summary>%s</summary>
                  <opening_text>%s</opening_text>
                %s
                </scene_b>

                <evaluation_criteria>
                - Time: does time move forward plausibly, or is there an unexplained jump?
                - Place: is a change of location signalled?
                - Emotion: do the characters' emotional states carry over believably?
                - Momentum: does the narrative energy survive the cut?
                - Hook: does the opening of B answer the ending of A?
                </evaluation_criteria>

                <output_instructions>
                Return ONLY a JSON object with this structure:
                {
                  "transitionScore": 0.0 to 1.0,
                  "issues": [
                    {
                      "type": "jarring_pace_change" | "emotional_whiplash" | "time_gap" | "location_jump" | "unresolved_tension",
                      "severity": "must-fix" | "should-fix" | "consider",
                      "description": "what is wrong",
                      "suggestion": "how to smooth the transition"
                    }
                  ],
                  "strengths": ["what works"],
                  "flags": {"needsSceneBreak": boolean, "needsTransitionScene": boolean, "chapterBoundaryCandidate": boolean}
                }
                </output_instructions>
                </analysis_task>
                """.formatted(
                sceneA.position(), sceneA.summary(), sceneA.closing(), metadataBlock(sceneA),
                sceneB.position(), sceneB.summary(), sceneB.opening(), metadataBlock(sceneB));
    }

    public static String sequence(List<CompressedScene> scenes) {
        String blocks = scenes.stream().map(scene -> """
                  <scene id="%s" position="%d">
                    <summary>%s</summary>
                    <characters>%s</characters>
                    <tension>%d/10</tension>
                    <tone>%s</tone>
                  </scene>""".formatted(
                scene.id(), scene.position(), scene.summary(),
                joinOr(scene.metadata().characters(), "none"),
                scene.metadata().tensionLevel(), scene.metadata().emotionalTone().wireName()))
                .collect(Collectors.joining("\n"));
        return """
                <analysis_task>
                <role>narrative_flow_analyst</role>
                <instructions>Assess narrative coherence across these %d consecutive scenes.</instructions>

                <scene_sequence>
                %s
                </scene_sequence>

                <analysis_dimensions>
                - Causality: each event should follow from what came before
                - Escalation: tension should build, release or hold on purpose
                - Information: plot facts should arrive neither too early nor too late
                - Agency: characters should drive events rather than watch them
                - Theme: motifs should develop without being dropped
                </analysis_dimensions>

                <output_instructions>
                Return ONLY a JSON object:
                {
                  "flowScore": 0.0 to 1.0,
                  "flowIssues": [{"pattern": "broken_causality" | "passive_sequence" | "info_dump" | "info_gap", "description": "...", "severity": "must-fix" | "should-fix" | "consider", "affectedScenes": ["scene ids"]}],
                  "pacingIssues": [{"pattern": "too_slow" | "too_fast" | "inconsistent", "description": "...", "severity": "must-fix" | "should-fix" | "consider", "tensionDelta": number, "affectedScenes": ["scene ids"]}],
                  "thematicIssues": [{"theme": "...", "description": "...", "severity": "must-fix" | "should-fix" | "consider", "lastSeenScene": "scene id", "brokenAtScene": "scene id"}],
                  "suggestions": ["..."]
                }
                </output_instructions>
                </analysis_task>
                """.formatted(scenes.size(), blocks);
    }

    public static String chapter(List<CompressedScene> scenes, int chapterNumber, int totalWordCount) {
        StringBuilder summaries = new StringBuilder();
        for (int i = 0; i < scenes.size(); i++) {
            summaries.append("Scene ").append(i + 1).append(" [").append(scenes.get(i).id()).append("]: ")
                    .append(scenes.get(i).summary()).append('\n');
        }
        String hook = scenes.isEmpty() ? "N/A" : head(scenes.get(0).opening(), 150);
        String closing = scenes.isEmpty() ? "N/A" : tail(scenes.get(scenes.size() - 1).closing(), 150);
        return """
                <analysis_task>
                <role>chapter_structure_analyst</role>
                <instructions>Decide whether these scenes work together as one chapter.</instructions>

                <chapter_data>
                  <number>%d</number>
                  <scene_count>%d</scene_count>
                  <word_count>%d</word_count>
                  <opening_hook>%s...</opening_hook>
                  <closing_line>...%s</closing_line>
                </chapter_data>

                <scene_summaries>
                %s</scene_summaries>

                <evaluation_criteria>
                - Unity: do the scenes share a thread or purpose?
                - Completeness: does the chapter stand on its own while feeding the larger story?
                - Pacing: is narrative energy spread sensibly across the chapter?
                - Purpose: does the chapter move plot, character or theme forward?
                </evaluation_criteria>

                <output_instructions>
                Return ONLY a JSON object. Each flag under "issues" is true when that PROBLEM is present:
                {
                  "coherenceScore": 0.0 to 1.0,
                  "issues": {"unity": boolean, "completeness": boolean, "balancedPacing": boolean, "narrativePurpose": boolean},
                  "shouldSplit": boolean,
                  "shouldMergeWithNext": boolean,
                  "orphanedScenes": ["ids of scenes that do not belong"],
                  "missingElements": ["what the chapter lacks"],
                  "pacingIssues": {"frontLoaded": boolean, "saggyMiddle": boolean, "rushedEnding": boolean},
                  "suggestions": ["..."]
                }
                </output_instructions>
                </analysis_task>
                """.formatted(chapterNumber, scenes.size(), totalWordCount, hook, closing, summaries);
    }

    public static String arc(List<ActSummary> acts, int totalScenes, List<String> mainCharacters, String primaryTheme) {
        StringBuilder actBlocks = new StringBuilder();
        for (int i = 0; i < acts.size(); i++) {
            ActSummary act = acts.get(i);
            actBlocks.append("<act number=\"").append(i + 1).append("\" chapters=\"")
                    .append(act.chapterStart()).append('-').append(act.chapterEnd()).append("\">\n  ")
                    .append(act.summary()).append("\n</act>\n");
        }
        return """
                <analysis_task>
                <role>story_structure_expert</role>
                <instructions>Validate the narrative arc and structural integrity of the complete manuscript.</instructions>

                <manuscript_overview>
                  <total_scenes>%d</total_scenes>
                  <main_characters>%s</main_characters>
                  <primary_theme>%s</primary_theme>
                </manuscript_overview>

                <three_act_structure>
                %s</three_act_structure>

                <validation_criteria>
                - Act balance: are the acts proportioned close to 25%%-50%%-25%%?
                - Protagonist arc: does the main character complete a transformation?
                - Opposition: is there pressure against the protagonist throughout?
                - Subplots: do they support the main line?
                - Theme: is the central theme explored and resolved?
                - Promise: does the ending deliver what the opening promised?
                </validation_criteria>

                <output_instructions>
                Return ONLY a JSON object:
                {
                  "structuralIntegrity": 0.0 to 1.0,
                  "actBalance": [25, 50, 25],
                  "characterArcs": {"<name>": {"completeness": 0.0 to 1.0, "consistency": 0.0 to 1.0, "keyMissingElements": ["..."]}},
                  "plotHoles": ["..."],
                  "unresolvedElements": ["..."],
                  "pacingCurve": {
                    "slowSpots": [{"start": "scene id", "end": "scene id", "reason": "..."}],
                    "rushedSections": [{"start": "scene id", "end": "scene id", "reason": "..."}]
                  },
                  "thematicCoherence": 0.0 to 1.0,
                  "openingEffectiveness": 0.0 to 1.0,
                  "endingSatisfaction": 0.0 to 1.0
                }
                </output_instructions>
                </analysis_task>
                """.formatted(totalScenes, joinOr(mainCharacters, "unknown"),
                primaryTheme == null ? "unspecified" : primaryTheme, actBlocks);
    }

    /**
     * Counts and arc labels summarizing what passes 1 to 4 found.
     */
    public record SynthesisFindings(
        int totalScenes,
        int movedScenes,
        int transitionIssueCount,
        int flowIssueCount,
        int pacingIssueCount,
        int chapterIssueCount,
        List<String> arcIssues
    ) {}

    public static String synthesis(SynthesisFindings findings) {
        String arcLine = findings.arcIssues().isEmpty()
                ? ""
                : "  <arc_issues>" + String.join(", ", findings.arcIssues()) + "</arc_issues>\n";
        return """
                <analysis_task>
                <role>manuscript_synthesis_expert</role>
                <instructions>Turn the findings below into a short, prioritized list of fixes.</instructions>

                <analysis_summary>
                  <total_scenes>%d</total_scenes>
                  <moved_scenes>%d</moved_scenes>
                  <transition_issues>%d</transition_issues>
                  <flow_issues>%d</flow_issues>
                  <pacing_issues>%d</pacing_issues>
                  <chapter_issues>%d</chapter_issues>
                %s</analysis_summary>

                <synthesis_goals>
                - Find patterns that cut across issue types
                - Separate root causes from symptoms
                - Rank by impact on the reader
                - Recommend the smallest set of changes with the largest effect
                </synthesis_goals>

                <output_instructions>
                Return ONLY a JSON object:
                {
                  "overallCoherenceScore": 0.0 to 1.0,
                  "topPriorities": [{"issuePattern": "text that appears in the matching issue descriptions", "affectedSceneCount": number, "impact": "high" | "medium" | "low", "rootCause": "...", "recommendedFix": "..."}],
                  "actionPlan": ["Step 1: ...", "Step 2: ..."]
                }
                </output_instructions>
                </analysis_task>
                """.formatted(findings.totalScenes(), findings.movedScenes(), findings.transitionIssueCount(),
                findings.flowIssueCount(), findings.pacingIssueCount(), findings.chapterIssueCount(), arcLine);
    }

    private static String metadataBlock(CompressedScene scene) {
        return """
                  <metadata>
                    <characters>%s</characters>
                    <locations>%s</locations>
                    <emotional_tone>%s</emotional_tone>
                    <tension_level>%d/10</tension_level>
                  </metadata>""".formatted(
                joinOr(scene.metadata().characters(), "none"),
                joinOr(scene.metadata().locations(), "unspecified"),
                scene.metadata().emotionalTone().wireName(),
                scene.metadata().tensionLevel());
    }

    private static String joinOr(Collection<String> values, String fallback) {
        return values.isEmpty() ? fallback : String.join(", ", values);
    }

    private static String head(String text, int chars) {
        return text.length() <= chars ? text : text.substring(0, chars);
    }

    private static String tail(String text, int chars) {
        return text.length() <= chars ? text : text.substring(text.length() - chars);
    }
}
