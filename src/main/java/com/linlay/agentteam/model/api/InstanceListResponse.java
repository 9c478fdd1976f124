package com.linlay.agentteam.model.api;

import com.linlay.agentteam.hierarchy.model.HierarchyConfig;

import java.util.List;

public record InstanceListResponse(
        List<HierarchyConfig> instances
) {
}
