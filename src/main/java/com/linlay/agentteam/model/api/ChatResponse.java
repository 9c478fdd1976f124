package com.linlay.agentteam.model.api;

public record ChatResponse(
        String response,
        String sessionId,
        boolean success
) {
}
