package com.linlay.agentteam.hierarchy.model;

import java.time.Instant;
import java.util.List;

/**
 * Full configuration of one tenant instance. {@code (tenantId, instanceId)} is unique.
 */
public record HierarchyConfig(
        String tenantId,
        String instanceId,
        String delegatorInstructions,
        List<AgentSpec> agents,
        Instant createdAt,
        Instant updatedAt
) {
    public HierarchyConfig {
        if (agents == null) {
            agents = List.of();
        } else {
            agents = List.copyOf(agents);
        }
    }

    public HierarchyConfig withUpdate(String delegatorInstructions, List<AgentSpec> agents, Instant updatedAt) {
        return new HierarchyConfig(tenantId, instanceId, delegatorInstructions, agents, createdAt, updatedAt);
    }
}
