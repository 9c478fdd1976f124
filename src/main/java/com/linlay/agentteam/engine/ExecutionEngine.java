package com.linlay.agentteam.engine;

import com.linlay.agentteam.model.ModelBinding;
import com.linlay.agentteam.tool.BaseTool;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ExecutionEngine {

    AgentRuntime buildAgent(ModelBinding model, String name, String role, List<BaseTool> tools);

    DelegatorRuntime buildDelegator(ModelBinding model, List<AgentRuntime> members, String instructions, boolean historyEnabled);

    Mono<RunResult> run(DelegatorRuntime delegator, RunContext context, String message);
}
