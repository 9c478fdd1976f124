package com.linlay.agentteam.model.api;

import java.time.Instant;

public record HierarchyUpdateResponse(
        String message,
        String tenantId,
        String instanceId,
        int agentCount,
        Instant updatedAt
) {
}
