package com.linlay.agentteam.team;

import com.linlay.agentteam.common.exception.ModelBindingException;
import com.linlay.agentteam.common.exception.ToolBindingException;
import com.linlay.agentteam.engine.AgentRuntime;
import com.linlay.agentteam.engine.DelegatorRuntime;
import com.linlay.agentteam.engine.ExecutionEngine;
import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.TeamKey;
import com.linlay.agentteam.hierarchy.model.ToolSpec;
import com.linlay.agentteam.model.ModelBinding;
import com.linlay.agentteam.model.ModelBindingRegistry;
import com.linlay.agentteam.tool.BaseTool;
import com.linlay.agentteam.tool.ToolBindingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link RuntimeTeam} from one hierarchy snapshot. Members keep the order of the
 * configured agents.
 */
@Component
public class TeamAssembler {

    private static final Logger log = LoggerFactory.getLogger(TeamAssembler.class);
    static final boolean DELEGATOR_HISTORY_ENABLED = true;

    private final ModelBindingRegistry modelRegistry;
    private final ToolBindingRegistry toolRegistry;
    private final ExecutionEngine executionEngine;
    private final Clock clock = Clock.systemUTC();

    public TeamAssembler(ModelBindingRegistry modelRegistry, ToolBindingRegistry toolRegistry, ExecutionEngine executionEngine) {
        this.modelRegistry = modelRegistry;
        this.toolRegistry = toolRegistry;
        this.executionEngine = executionEngine;
    }

    /**
     * @throws ModelBindingException when a member or the delegator model cannot be bound
     * @throws ToolBindingException  when a tool cannot be bound
     */
    public RuntimeTeam assemble(HierarchyConfig config) {
        TeamKey key = new TeamKey(config.tenantId(), config.instanceId());
        List<AgentRuntime> members = new ArrayList<>(config.agents().size());
        for (AgentSpec agent : config.agents()) {
            ModelBinding model = modelRegistry.bind(agent.modelProvider(), agent.modelId());
            List<BaseTool> tools = new ArrayList<>(agent.tools().size());
            for (ToolSpec tool : agent.tools()) {
                tools.add(toolRegistry.bind(tool));
            }
            members.add(executionEngine.buildAgent(model, agent.name(), agent.role(), tools));
        }
        DelegatorRuntime delegator = executionEngine.buildDelegator(
                modelRegistry.bindDelegator(),
                members,
                config.delegatorInstructions(),
                DELEGATOR_HISTORY_ENABLED
        );
        log.info("Assembled team {} with {} members", key, members.size());
        return new RuntimeTeam(key, delegator, config.updatedAt(), clock.instant());
    }
}
