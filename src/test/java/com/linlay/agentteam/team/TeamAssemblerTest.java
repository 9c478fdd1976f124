package com.linlay.agentteam.team;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentteam.common.exception.ModelBindingException;
import com.linlay.agentteam.common.exception.ToolBindingException;
import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.engine.AgentRuntime;
import com.linlay.agentteam.engine.SpringAiExecutionEngine;
import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.ModelProvider;
import com.linlay.agentteam.hierarchy.model.ToolKind;
import com.linlay.agentteam.hierarchy.model.ToolSpec;
import com.linlay.agentteam.model.ModelBindingFactory;
import com.linlay.agentteam.model.ModelBindingRegistry;
import com.linlay.agentteam.tool.ToolBindingRegistry;
import com.linlay.agentteam.tool.ToolConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class TeamAssemblerTest {

    private final HierarchyDefaultsProperties defaults = new HierarchyDefaultsProperties();
    private final ModelBindingFactory mockFactory = modelId -> mock(ChatModel.class);
    private final ToolBindingRegistry tools = new ToolConfiguration().toolBindingRegistry(WebClient.builder(), new ObjectMapper());
    private final SpringAiExecutionEngine engine = new SpringAiExecutionEngine(new ObjectMapper(), null, null);

    @Test
    void assembleShouldBuildOneMemberPerAgentInOrder() {
        ModelBindingRegistry models = new ModelBindingRegistry(Map.of(
                ModelProvider.GEMINI, mockFactory,
                ModelProvider.OPENAI, mockFactory
        ), defaults);
        TeamAssembler assembler = new TeamAssembler(models, tools, engine);
        HierarchyConfig config = config(List.of(
                new AgentSpec("a1", "Analyst", "stocks", ModelProvider.OPENAI, "gpt-4o",
                        List.of(ToolSpec.of(ToolKind.YFINANCE)), null),
                new AgentSpec("a2", "Researcher", "web", ModelProvider.GEMINI, "gemini-1.5-flash",
                        List.of(ToolSpec.of(ToolKind.DUCKDUCKGO), ToolSpec.of(ToolKind.YFINANCE)), null)
        ));

        RuntimeTeam team = assembler.assemble(config);

        assertThat(team.key().toString()).isEqualTo("t1:i1");
        assertThat(team.members()).extracting(AgentRuntime::name).containsExactly("Analyst", "Researcher");
        assertThat(team.members().get(0).model().provider()).isEqualTo(ModelProvider.OPENAI);
        assertThat(team.members().get(1).tools()).extracting(tool -> tool.name())
                .containsExactly("duckduckgo_search", "yfinance");
        assertThat(team.delegator().instructions()).isEqualTo("route well");
        assertThat(team.delegator().historyEnabled()).isTrue();
        assertThat(team.delegator().model().modelId()).isEqualTo(defaults.getDelegatorModel());
        assertThat(team.configUpdatedAt()).isEqualTo(config.updatedAt());
    }

    @Test
    void emptyHierarchyShouldYieldDelegatorOnlyTeam() {
        ModelBindingRegistry models = new ModelBindingRegistry(Map.of(ModelProvider.GEMINI, mockFactory), defaults);
        TeamAssembler assembler = new TeamAssembler(models, tools, engine);

        RuntimeTeam team = assembler.assemble(config(List.of()));

        assertThat(team.members()).isEmpty();
        assertThat(team.delegator()).isNotNull();
    }

    @Test
    void modelBindingFailureShouldPropagate() {
        ModelBindingRegistry models = new ModelBindingRegistry(Map.of(ModelProvider.GEMINI, modelId -> {
            throw new ModelBindingException("Missing API key for provider: gemini");
        }), defaults);
        TeamAssembler assembler = new TeamAssembler(models, tools, engine);

        assertThatThrownBy(() -> assembler.assemble(config(List.of(agent("Analyst", List.of())))))
                .isInstanceOf(ModelBindingException.class);
    }

    @Test
    void toolBindingFailureShouldPropagate() {
        ModelBindingRegistry models = new ModelBindingRegistry(Map.of(ModelProvider.GEMINI, mockFactory), defaults);
        TeamAssembler assembler = new TeamAssembler(models, new ToolBindingRegistry(Map.of()), engine);

        assertThatThrownBy(() -> assembler.assemble(config(List.of(agent("Analyst", List.of(ToolSpec.of(ToolKind.YFINANCE)))))))
                .isInstanceOf(ToolBindingException.class);
    }

    private static AgentSpec agent(String name, List<ToolSpec> tools) {
        return new AgentSpec("id-" + name, name, "", ModelProvider.GEMINI, "gemini-1.5-flash", tools, null);
    }

    private static HierarchyConfig config(List<AgentSpec> agents) {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        return new HierarchyConfig("t1", "i1", "route well", agents, at, at);
    }
}
