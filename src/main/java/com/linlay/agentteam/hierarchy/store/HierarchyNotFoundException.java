package com.linlay.agentteam.hierarchy.store;

public class HierarchyNotFoundException extends RuntimeException {

    public HierarchyNotFoundException(String tenantId, String instanceId) {
        super("Hierarchy not found: tenantId=" + tenantId + ", instanceId=" + instanceId);
    }
}
