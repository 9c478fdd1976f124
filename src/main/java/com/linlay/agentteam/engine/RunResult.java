package com.linlay.agentteam.engine;

public record RunResult(
        String content,
        String sessionId,
        String memberName
) {
}
