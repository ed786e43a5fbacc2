package com.plotline.core.llm;

import com.plotline.core.model.ModelTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "plotline.llm")
public class LlmProperties {

    private String provider = "openai";
    private String anthropicApiKey = "";
    private String openaiApiKey = "";
    private String googleApiKey = "";
    private String fastModel = "gpt-4o-mini";
    private String standardModel = "gpt-4o";
    private String deepModel = "gpt-4.1";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public void setAnthropicApiKey(String anthropicApiKey) {
        this.anthropicApiKey = anthropicApiKey;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public String getGoogleApiKey() {
        return googleApiKey;
    }

    public void setGoogleApiKey(String googleApiKey) {
        this.googleApiKey = googleApiKey;
    }

    public String getFastModel() {
        return fastModel;
    }

    public void setFastModel(String fastModel) {
        this.fastModel = fastModel;
    }

    public String getStandardModel() {
        return standardModel;
    }

    public void setStandardModel(String standardModel) {
        this.standardModel = standardModel;
    }

    public String getDeepModel() {
        return deepModel;
    }

    public void setDeepModel(String deepModel) {
        this.deepModel = deepModel;
    }

    public boolean hasAnthropicKey() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    public boolean hasOpenaiKey() {
        return openaiApiKey != null && !openaiApiKey.isBlank();
    }

    public boolean hasGoogleKey() {
        return googleApiKey != null && !googleApiKey.isBlank();
    }

    /**
     * Whether the active provider has a key configured. Unknown providers never do.
     */
    public boolean hasActiveProviderKey() {
        return switch (provider == null ? "" : provider.toLowerCase()) {
            case "openai" -> hasOpenaiKey();
            case "anthropic" -> hasAnthropicKey();
            case "google" -> hasGoogleKey();
            default -> false;
        };
    }

    public String resolveModel(ModelTier tier) {
        return switch (tier) {
            case FAST -> fastModel;
            case STANDARD -> standardModel;
            case DEEP -> deepModel;
        };
    }
}
