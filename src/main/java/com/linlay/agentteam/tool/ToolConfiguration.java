package com.linlay.agentteam.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentteam.hierarchy.model.ToolKind;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.Map;

@Configuration(proxyBeanMethods = false)
public class ToolConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ToolBindingRegistry toolBindingRegistry(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        WebClient webClient = webClientBuilder.build();
        Map<ToolKind, ToolBindingFactory> factories = new EnumMap<>(ToolKind.class);
        factories.put(ToolKind.DUCKDUCKGO, new ToolBindingFactory() {
            @Override
            public Map<String, Object> defaultOptions() {
                return DuckDuckGoSearchTool.DEFAULT_OPTIONS;
            }

            @Override
            public BaseTool create(Map<String, Object> options) {
                return new DuckDuckGoSearchTool(webClient, objectMapper, options);
            }
        });
        factories.put(ToolKind.YFINANCE, new ToolBindingFactory() {
            @Override
            public Map<String, Object> defaultOptions() {
                return YFinanceTool.DEFAULT_OPTIONS;
            }

            @Override
            public BaseTool create(Map<String, Object> options) {
                return new YFinanceTool(webClient, objectMapper, options);
            }
        });
        return new ToolBindingRegistry(factories);
    }
}
