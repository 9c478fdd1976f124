package com.linlay.agentteam.config;

import com.linlay.agentteam.hierarchy.model.ModelProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.hierarchy")
public class HierarchyDefaultsProperties {

    public static final String DEFAULT_DELEGATOR_INSTRUCTIONS =
            "You are an intelligent router. Your job is to analyze the user's message "
                    + "and delegate the task to the most suitable specialist on your team. "
                    + "Reply only with the name of the specialist who should handle it.";

    private ModelProvider defaultProvider = ModelProvider.GEMINI;
    private String defaultModel = "gemini-1.5-flash";
    private ModelProvider delegatorProvider = ModelProvider.GEMINI;
    private String delegatorModel = "gemini-1.5-flash";
    private String defaultDelegatorInstructions = DEFAULT_DELEGATOR_INSTRUCTIONS;

    public ModelProvider getDefaultProvider() {
        return defaultProvider;
    }

    public void setDefaultProvider(ModelProvider defaultProvider) {
        this.defaultProvider = defaultProvider == null ? ModelProvider.GEMINI : defaultProvider;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public ModelProvider getDelegatorProvider() {
        return delegatorProvider;
    }

    public void setDelegatorProvider(ModelProvider delegatorProvider) {
        this.delegatorProvider = delegatorProvider == null ? ModelProvider.GEMINI : delegatorProvider;
    }

    public String getDelegatorModel() {
        return delegatorModel;
    }

    public void setDelegatorModel(String delegatorModel) {
        this.delegatorModel = delegatorModel;
    }

    public String getDefaultDelegatorInstructions() {
        return defaultDelegatorInstructions;
    }

    public void setDefaultDelegatorInstructions(String defaultDelegatorInstructions) {
        this.defaultDelegatorInstructions = defaultDelegatorInstructions;
    }
}
