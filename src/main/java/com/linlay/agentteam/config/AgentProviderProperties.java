package com.linlay.agentteam.config;

import com.linlay.agentteam.hierarchy.model.ModelProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Endpoint and credential settings per model provider, bound from
 * {@code agent.providers.<provider>.*}. Blank endpoints fall back to the public default of
 * the provider.
 */
@ConfigurationProperties(prefix = "agent")
public class AgentProviderProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        Map<String, ProviderConfig> normalized = new LinkedHashMap<>();
        if (providers != null) {
            providers.forEach((key, value) -> normalized.put(key.trim().toLowerCase(Locale.ROOT), value));
        }
        this.providers = normalized;
    }

    public ProviderConfig getProvider(ModelProvider provider) {
        if (provider == null) {
            return null;
        }
        return providers.get(provider.wireName());
    }

    public static class ProviderConfig {
        private String baseUrl;
        private String apiKey;
        private String completionsPath;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCompletionsPath() {
            return completionsPath;
        }

        public void setCompletionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
        }
    }
}
