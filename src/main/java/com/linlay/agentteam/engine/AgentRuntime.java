package com.linlay.agentteam.engine;

import com.linlay.agentteam.model.ModelBinding;
import com.linlay.agentteam.tool.BaseTool;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;

public record AgentRuntime(
        String name,
        String role,
        ModelBinding model,
        List<BaseTool> tools,
        List<ToolCallback> toolCallbacks
) {
    public AgentRuntime {
        tools = tools == null ? List.of() : List.copyOf(tools);
        toolCallbacks = toolCallbacks == null ? List.of() : List.copyOf(toolCallbacks);
        if (role == null) {
            role = "";
        }
    }
}
