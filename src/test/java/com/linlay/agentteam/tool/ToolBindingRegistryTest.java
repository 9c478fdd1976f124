package com.linlay.agentteam.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentteam.common.exception.TeamAssemblyException;
import com.linlay.agentteam.common.exception.ToolBindingException;
import com.linlay.agentteam.hierarchy.model.ToolKind;
import com.linlay.agentteam.hierarchy.model.ToolSpec;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolBindingRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolBindingRegistry registry = new ToolConfiguration()
            .toolBindingRegistry(WebClient.builder(), objectMapper);

    @Test
    void yfinanceWithoutOptionsShouldEnableEveryAction() {
        BaseTool tool = registry.bind(ToolSpec.of(ToolKind.YFINANCE));

        assertThat(tool).isInstanceOf(YFinanceTool.class);
        assertThat(((YFinanceTool) tool).enabledActions()).containsExactlyInAnyOrder(
                YFinanceTool.OPTION_STOCK_PRICE,
                YFinanceTool.OPTION_ANALYST_RECOMMENDATIONS,
                YFinanceTool.OPTION_COMPANY_INFO,
                YFinanceTool.OPTION_COMPANY_NEWS
        );
    }

    @Test
    void callerOptionsShouldOverrideDefaultsKeyByKey() {
        ToolSpec spec = new ToolSpec(ToolKind.YFINANCE, Map.of(YFinanceTool.OPTION_COMPANY_NEWS, false));

        Map<String, Object> effective = registry.effectiveOptions(spec);
        YFinanceTool tool = (YFinanceTool) registry.bind(spec);

        assertThat(effective)
                .containsEntry(YFinanceTool.OPTION_COMPANY_NEWS, false)
                .containsEntry(YFinanceTool.OPTION_STOCK_PRICE, true);
        assertThat(tool.enabledActions()).doesNotContain(YFinanceTool.OPTION_COMPANY_NEWS).hasSize(3);
    }

    @Test
    void duckduckgoShouldUseDefaultResultLimitUnlessOverridden() {
        DuckDuckGoSearchTool defaults = (DuckDuckGoSearchTool) registry.bind(ToolSpec.of(ToolKind.DUCKDUCKGO));
        DuckDuckGoSearchTool limited = (DuckDuckGoSearchTool) registry.bind(
                new ToolSpec(ToolKind.DUCKDUCKGO, Map.of(DuckDuckGoSearchTool.OPTION_MAX_RESULTS, 2)));

        assertThat(defaults.maxResults()).isEqualTo(5);
        assertThat(limited.maxResults()).isEqualTo(2);
    }

    @Test
    void disabledActionShouldAnswerWithErrorInsteadOfCallingOut() {
        YFinanceTool tool = (YFinanceTool) registry.bind(
                new ToolSpec(ToolKind.YFINANCE, Map.of(YFinanceTool.OPTION_COMPANY_NEWS, false)));

        JsonNode result = tool.invoke(Map.of("symbol", "AAPL", "action", "company_news"));
        JsonNode missingSymbol = tool.invoke(Map.of("action", "stock_price"));

        assertThat(result.path("error").asText()).contains("not enabled");
        assertThat(missingSymbol.path("error").asText()).contains("symbol");
    }

    @Test
    void unregisteredKindShouldFailAsAssemblyError() {
        ToolBindingRegistry empty = new ToolBindingRegistry(Map.of());

        assertThatThrownBy(() -> empty.bind(ToolSpec.of(ToolKind.YFINANCE)))
                .isInstanceOf(ToolBindingException.class)
                .isInstanceOf(TeamAssemblyException.class);
    }

    @Test
    void factoryFailureShouldBeWrapped() {
        ToolBindingRegistry broken = new ToolBindingRegistry(Map.of(ToolKind.DUCKDUCKGO, options -> {
            throw new IllegalStateException("no network");
        }));

        assertThatThrownBy(() -> broken.bind(ToolSpec.of(ToolKind.DUCKDUCKGO)))
                .isInstanceOf(ToolBindingException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
