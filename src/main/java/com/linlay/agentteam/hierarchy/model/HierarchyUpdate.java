package com.linlay.agentteam.hierarchy.model;

import java.util.List;

/**
 * Partial update of a hierarchy. A {@code null} field is unset and leaves the stored value
 * untouched; a present field replaces the stored value wholesale.
 */
public record HierarchyUpdate(
        String delegatorInstructions,
        List<AgentSpec> agents
) {
    public HierarchyUpdate {
        if (agents != null) {
            agents = List.copyOf(agents);
        }
    }

    public static HierarchyUpdate empty() {
        return new HierarchyUpdate(null, null);
    }

    public static HierarchyUpdate agents(List<AgentSpec> agents) {
        return new HierarchyUpdate(null, agents);
    }

    public static HierarchyUpdate delegatorInstructions(String delegatorInstructions) {
        return new HierarchyUpdate(delegatorInstructions, null);
    }

    public boolean hasDelegatorInstructions() {
        return delegatorInstructions != null;
    }

    public boolean hasAgents() {
        return agents != null;
    }
}
