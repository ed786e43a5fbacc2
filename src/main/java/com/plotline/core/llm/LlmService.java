package com.plotline.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Wraps Spring AI's {@link ChatClient} to send a system + user prompt to a chosen model
 * and decode the reply as a JSON tree.
 * <p>
 * Credential problems surface as {@link AiKeyException}s; empty or non-JSON replies as
 * {@link LlmEmptyResponseException} / {@link LlmParseException}.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper mapper;

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        log.info("LlmService initialized - provider: {}", properties.getProvider());
    }

    public String provider() {
        return properties.getProvider();
    }

    /**
     * Sends the prompts to {@code model} and returns the reply parsed as JSON.
     *
     * @param systemPrompt instructions for the model's role
     * @param userPrompt   the material to analyze
     * @param model        concrete model name
     * @return the decoded JSON reply
     * @throws MissingKeyException       when the active provider has no key
     * @throws InvalidKeyException       when the provider rejects the key
     * @throws LlmEmptyResponseException when the reply is blank
     * @throws LlmParseException         when the reply is not JSON
     */
    public JsonNode jsonCall(String systemPrompt, String userPrompt, String model) {
        if (!properties.hasActiveProviderKey()) {
            throw new MissingKeyException(properties.getProvider());
        }
        log.debug("LLM call started -> {}", model);
        long start = System.currentTimeMillis();
        String response;
        try {
            response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .options(ChatOptions.builder().model(model).build())
                    .call()
                    .content();
        } catch (NonTransientAiException e) {
            if (isAuthenticationFailure(e)) {
                throw new InvalidKeyException(properties.getProvider(), e.getMessage(), e);
            }
            throw e;
        }
        long elapsed = System.currentTimeMillis() - start;
        log.debug("LLM call complete -> {} ({}s)", model, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content from " + model);
        }
        return parseJson(response);
    }

    JsonNode parseJson(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        // Models occasionally wrap the object in prose
        if (!cleaned.startsWith("{") && !cleaned.startsWith("[")) {
            int open = cleaned.indexOf('{');
            int close = cleaned.lastIndexOf('}');
            if (open >= 0 && close > open) {
                cleaned = cleaned.substring(open, close + 1);
            }
        }
        try {
            return mapper.readTree(cleaned);
        } catch (Exception e) {
            log.debug("Raw LLM response: {}", raw);
            throw new LlmParseException("Failed to parse LLM response as JSON: " + e.getMessage(), e);
        }
    }

    private static boolean isAuthenticationFailure(NonTransientAiException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("401")
                || message.contains("403")
                || message.contains("invalid api key")
                || message.contains("invalid_api_key")
                || message.contains("incorrect api key")
                || message.contains("unauthorized");
    }
}
