package com.linlay.agentteam.model;

import com.linlay.agentteam.common.exception.ModelBindingException;
import com.linlay.agentteam.config.AgentProviderProperties;
import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.hierarchy.model.ModelProvider;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.Map;

/**
 * Spring AI chat model constructors per provider. Gemini and Groq are reached through their
 * OpenAI-compatible endpoints.
 */
@Configuration(proxyBeanMethods = false)
public class SpringAiModelConfiguration {

    static final String OPENAI_BASE_URL = "https://api.openai.com";
    static final String ANTHROPIC_BASE_URL = "https://api.anthropic.com";
    static final String GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai";
    static final String GEMINI_COMPLETIONS_PATH = "/chat/completions";
    static final String GROQ_BASE_URL = "https://api.groq.com/openai";
    private static final int ANTHROPIC_MAX_TOKENS = 4096;

    @Bean
    @ConditionalOnMissingBean
    public ModelBindingRegistry modelBindingRegistry(AgentProviderProperties providerProperties,
                                                     HierarchyDefaultsProperties defaults) {
        Map<ModelProvider, ModelBindingFactory> factories = new EnumMap<>(ModelProvider.class);
        factories.put(ModelProvider.OPENAI, openAiCompatible(ModelProvider.OPENAI, providerProperties, OPENAI_BASE_URL, null));
        factories.put(ModelProvider.GEMINI, openAiCompatible(ModelProvider.GEMINI, providerProperties, GEMINI_BASE_URL, GEMINI_COMPLETIONS_PATH));
        factories.put(ModelProvider.GROQ, openAiCompatible(ModelProvider.GROQ, providerProperties, GROQ_BASE_URL, null));
        factories.put(ModelProvider.CLAUDE, anthropic(providerProperties));
        return new ModelBindingRegistry(factories, defaults);
    }

    static ModelBindingFactory openAiCompatible(ModelProvider provider,
                                                AgentProviderProperties properties,
                                                String defaultBaseUrl,
                                                String defaultCompletionsPath) {
        return modelId -> {
            AgentProviderProperties.ProviderConfig config = properties.getProvider(provider);
            OpenAiApi.Builder api = OpenAiApi.builder()
                    .baseUrl(valueOr(config == null ? null : config.getBaseUrl(), defaultBaseUrl))
                    .apiKey(requireApiKey(provider, config));
            String completionsPath = valueOr(config == null ? null : config.getCompletionsPath(), defaultCompletionsPath);
            if (StringUtils.hasText(completionsPath)) {
                api.completionsPath(completionsPath);
            }
            return OpenAiChatModel.builder()
                    .openAiApi(api.build())
                    .defaultOptions(OpenAiChatOptions.builder().model(modelId).build())
                    .build();
        };
    }

    static ModelBindingFactory anthropic(AgentProviderProperties properties) {
        return modelId -> {
            AgentProviderProperties.ProviderConfig config = properties.getProvider(ModelProvider.CLAUDE);
            AnthropicApi api = AnthropicApi.builder()
                    .baseUrl(valueOr(config == null ? null : config.getBaseUrl(), ANTHROPIC_BASE_URL))
                    .apiKey(requireApiKey(ModelProvider.CLAUDE, config))
                    .build();
            return AnthropicChatModel.builder()
                    .anthropicApi(api)
                    .defaultOptions(AnthropicChatOptions.builder()
                            .model(modelId)
                            .maxTokens(ANTHROPIC_MAX_TOKENS)
                            .build())
                    .build();
        };
    }

    private static String requireApiKey(ModelProvider provider, AgentProviderProperties.ProviderConfig config) {
        String apiKey = config == null ? null : config.getApiKey();
        if (!StringUtils.hasText(apiKey)) {
            throw new ModelBindingException("Missing API key for provider: " + provider.wireName());
        }
        return apiKey.trim();
    }

    private static String valueOr(String value, String fallback) {
        return StringUtils.hasText(value) ? value.trim() : fallback;
    }
}
