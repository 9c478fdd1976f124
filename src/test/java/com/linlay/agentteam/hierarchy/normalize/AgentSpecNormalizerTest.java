package com.linlay.agentteam.hierarchy.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.ModelProvider;
import com.linlay.agentteam.hierarchy.model.ToolKind;
import com.linlay.agentteam.hierarchy.model.ToolSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentSpecNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AgentSpecNormalizer normalizer = new AgentSpecNormalizer(new HierarchyDefaultsProperties());

    @Test
    void bareKindAndTypedRecordShouldNormalizeToSameTool() throws Exception {
        AgentSpec fromString = normalizer.normalize(json("""
                {"name":"Analyst","tools":["YFINANCE"]}
                """));
        AgentSpec fromRecord = normalizer.normalize(json("""
                {"name":"Analyst","tools":[{"type":"yfinance"}]}
                """));

        assertThat(fromString.tools()).containsExactly(ToolSpec.of(ToolKind.YFINANCE));
        assertThat(fromRecord.tools()).isEqualTo(fromString.tools());
    }

    @Test
    void unknownToolKindShouldBeDroppedAndAgentKept() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"name":"Researcher","tools":["FOOBAR","duckduckgo"]}
                """));

        assertThat(agent.name()).isEqualTo("Researcher");
        assertThat(agent.tools()).extracting(ToolSpec::kind).containsExactly(ToolKind.DUCKDUCKGO);
    }

    @Test
    void toolOptionsShouldBeKeptFromOptionsOrConfig() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"name":"Analyst","tools":[
                  {"type":"yfinance","config":{"company_news":false}},
                  {"kind":"duckduckgo","options":{"fixed_max_results":3}}
                ]}
                """));

        assertThat(agent.tools()).hasSize(2);
        assertThat(agent.tools().get(0).options()).containsEntry("company_news", false);
        assertThat(agent.tools().get(1).options()).containsEntry("fixed_max_results", 3);
    }

    @Test
    void repeatedToolKindShouldKeepLastEntryInFirstPosition() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"name":"Analyst","tools":[
                  "YFINANCE",
                  "duckduckgo",
                  {"type":"yfinance","options":{"company_news":false}}
                ]}
                """));

        assertThat(agent.tools()).extracting(ToolSpec::kind).containsExactly(ToolKind.YFINANCE, ToolKind.DUCKDUCKGO);
        assertThat(agent.tools().get(0).options()).containsExactly(Map.entry("company_news", false));

        AgentSpec typed = normalizer.normalize(new AgentSpec(null, "Analyst", null, null, null,
                List.of(ToolSpec.of(ToolKind.YFINANCE), ToolSpec.of(ToolKind.YFINANCE)), null));
        assertThat(typed.tools()).containsExactly(ToolSpec.of(ToolKind.YFINANCE));
    }

    @Test
    void nonScalarOptionShouldDropThatTool() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"name":"Analyst","tools":[{"type":"yfinance","options":{"symbols":["AAPL"]}}, "duckduckgo"]}
                """));

        assertThat(agent.tools()).extracting(ToolSpec::kind).containsExactly(ToolKind.DUCKDUCKGO);
    }

    @Test
    void missingFieldsShouldTakeDefaults() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"name":"  Writer "}
                """));

        assertThat(agent.name()).isEqualTo("Writer");
        assertThat(agent.id()).isNotBlank();
        assertThat(agent.role()).isEmpty();
        assertThat(agent.modelProvider()).isEqualTo(ModelProvider.GEMINI);
        assertThat(agent.modelId()).isEqualTo("gemini-1.5-flash");
        assertThat(agent.tools()).isEmpty();
        assertThat(agent.parentId()).isNull();
    }

    @Test
    void unknownProviderShouldFallBackToDefault() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"agent_id":"a-1","name":"Writer","model_provider":"mistral","model_id":"m-large"}
                """));

        assertThat(agent.id()).isEqualTo("a-1");
        assertThat(agent.modelProvider()).isEqualTo(ModelProvider.GEMINI);
        assertThat(agent.modelId()).isEqualTo("m-large");
    }

    @Test
    void providerShouldParseCaseInsensitively() throws Exception {
        AgentSpec agent = normalizer.normalize(json("""
                {"name":"Writer","modelProvider":"Claude","parent_id":"root"}
                """));

        assertThat(agent.modelProvider()).isEqualTo(ModelProvider.CLAUDE);
        assertThat(agent.parentId()).isEqualTo("root");
    }

    @Test
    void agentWithoutNameShouldBeRejected() throws Exception {
        assertThatThrownBy(() -> normalizer.normalize(json("""
                {"role":"nobody"}
                """)))
                .isInstanceOf(HierarchyValidationException.class);
    }

    @Test
    void normalizeAllShouldDropInvalidAgentsOnly() throws Exception {
        List<AgentSpec> agents = normalizer.normalizeAll(json("""
                [{"name":"A"}, {"role":"missing name"}, "garbage", {"name":"B","tools":["yfinance"]}]
                """));

        assertThat(agents).extracting(AgentSpec::name).containsExactly("A", "B");
    }

    @Test
    void normalizeAllShouldRejectNonArrayAndTreatNullAsEmpty() throws Exception {
        assertThat(normalizer.normalizeAll(null)).isEmpty();
        assertThat(normalizer.normalizeAll(json("null"))).isEmpty();
        assertThatThrownBy(() -> normalizer.normalizeAll(json("{\"name\":\"A\"}")))
                .isInstanceOf(HierarchyValidationException.class);
    }

    @Test
    void typedSpecShouldPassThroughWithDefaultsFilled() {
        AgentSpec typed = new AgentSpec(null, "Analyst", null, null, null,
                List.of(new ToolSpec(ToolKind.YFINANCE, Map.of("stock_price", true))), null);

        AgentSpec normalized = normalizer.normalize(typed);

        assertThat(normalized.id()).isNotBlank();
        assertThat(normalized.modelProvider()).isEqualTo(ModelProvider.GEMINI);
        assertThat(normalized.tools()).isEqualTo(typed.tools());
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }
}
