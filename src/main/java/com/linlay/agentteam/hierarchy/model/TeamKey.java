package com.linlay.agentteam.hierarchy.model;

public record TeamKey(String tenantId, String instanceId) {

    public TeamKey {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be blank");
        }
        tenantId = tenantId.trim();
        instanceId = instanceId.trim();
    }

    @Override
    public String toString() {
        return tenantId + ":" + instanceId;
    }
}
