package com.linlay.agentteam.engine;

/**
 * Identity of the conversation a single run belongs to. Passed with every run so a shared
 * team never carries per-session state.
 */
public record RunContext(
        String tenantId,
        String instanceId,
        String sessionId
) {
    public RunContext {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }
}
