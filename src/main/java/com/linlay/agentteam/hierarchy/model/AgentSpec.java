package com.linlay.agentteam.hierarchy.model;

import java.util.List;

/**
 * One member agent of a hierarchy. {@code parentId} is a reporting reference to another
 * agent of the same hierarchy; it is stored but not enforced.
 */
public record AgentSpec(
        String id,
        String name,
        String role,
        ModelProvider modelProvider,
        String modelId,
        List<ToolSpec> tools,
        String parentId
) {
    public AgentSpec {
        if (tools == null) {
            tools = List.of();
        } else {
            tools = List.copyOf(tools);
        }
        if (role == null) {
            role = "";
        }
    }
}
