package com.linlay.agentteam.model.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code agents} stays raw so the normalizer can accept every tolerated entry shape.
 */
public record HierarchyUpdateRequest(
        @NotBlank @JsonAlias("user_id") String tenantId,
        @NotBlank @JsonAlias("instance_id") String instanceId,
        @JsonAlias({"router_instructions", "delegator_instructions"}) String delegatorInstructions,
        JsonNode agents
) {
    public boolean hasAgents() {
        return agents != null && !agents.isNull() && !agents.isMissingNode();
    }
}
