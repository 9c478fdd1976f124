package com.linlay.agentteam.session;

import java.time.Instant;

public record SessionSummary(
        String sessionId,
        int messageCount,
        Instant createdAt,
        Instant updatedAt
) {
}
