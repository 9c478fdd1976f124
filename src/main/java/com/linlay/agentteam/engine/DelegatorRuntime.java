package com.linlay.agentteam.engine;

import com.linlay.agentteam.model.ModelBinding;

import java.util.List;

public record DelegatorRuntime(
        ModelBinding model,
        List<AgentRuntime> members,
        String instructions,
        boolean historyEnabled
) {
    public DelegatorRuntime {
        members = members == null ? List.of() : List.copyOf(members);
        if (instructions == null) {
            instructions = "";
        }
    }
}
