package com.plotline.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.plotline.core.model.AnalysisDepth;
import com.plotline.core.model.AnalysisRequest;
import com.plotline.core.model.AnalysisResponse;
import com.plotline.core.model.ReaderContext;
import com.plotline.core.model.ResponseMetadata;
import com.plotline.core.model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ContinuityAnalyzer} backed by {@link LlmService}.
 * <p>
 * Resolves the requested model tier to a concrete model, renders the request as a prompt,
 * and reports the model actually used in the response metadata.
 */
public class LlmContinuityAnalyzer implements ContinuityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LlmContinuityAnalyzer.class);

    static final String SYSTEM_PROMPT = """
            You are an expert manuscript editor specializing in narrative continuity and structure.
            You read scenes of fiction and report concrete, actionable problems a reader would notice.
            Always respond with a single JSON object and nothing else. Include an "issues" array of
            {"type", "severity", "description", "suggestedFix"} entries where type is one of
            pronoun, timeline, character, plot, context, engagement and severity is one of
            must-fix, should-fix, consider. When the request asks for additional fields, include them
            at the top level of the same object.
            """;

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmContinuityAnalyzer(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public AnalysisResponse analyze(AnalysisRequest request) {
        String model = properties.resolveModel(request.options().modelTier());
        long start = System.currentTimeMillis();
        JsonNode payload = llmService.jsonCall(systemPrompt(request.options().depth()), userPrompt(request), model);
        long duration = System.currentTimeMillis() - start;
        log.debug("Analysis of scene {} via {} took {}ms", request.scene().id(), model, duration);
        return new AnalysisResponse(
                ResponseDecoder.continuityIssues(payload),
                new ResponseMetadata(model, llmService.provider(), duration, false),
                payload);
    }

    static String systemPrompt(AnalysisDepth depth) {
        return SYSTEM_PROMPT + switch (depth) {
            case QUICK -> "Report only the most important findings, at most three per list.";
            case STANDARD -> "Report the findings a careful editor would raise.";
            case THOROUGH -> "Be exhaustive: report every finding, including minor ones.";
        };
    }

    static String userPrompt(AnalysisRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analysis type: ").append(request.analysisType().wireName()).append("\n");
        if (!request.options().focusAreas().isEmpty()) {
            sb.append("Focus areas: ").append(String.join(", ", request.options().focusAreas())).append("\n");
        }
        ReaderContext context = request.readerContext();
        if (!context.knownCharacters().isEmpty()) {
            sb.append("Characters the reader knows: ").append(String.join(", ", context.knownCharacters())).append("\n");
        }
        if (!context.establishedSettings().isEmpty()) {
            sb.append("Established settings: ").append(String.join(", ", context.establishedSettings())).append("\n");
        }
        if (!context.revealedPlotPoints().isEmpty()) {
            sb.append("Revealed plot points: ").append(String.join("; ", context.revealedPlotPoints())).append("\n");
        }
        for (Scene previous : request.previousScenes()) {
            sb.append("\n<previous_scene id=\"").append(previous.id()).append("\">\n")
              .append(previous.text()).append("\n</previous_scene>\n");
        }
        sb.append("\n<scene id=\"").append(request.scene().id()).append("\">\n")
          .append(request.scene().text()).append("\n</scene>\n");
        return sb.toString();
    }
}
