package com.linlay.agentteam.model.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record ChatRequest(
        @NotBlank @JsonAlias("user_id") String tenantId,
        @NotBlank @JsonAlias("instance_id") String instanceId,
        @NotBlank @JsonAlias("session_id") String sessionId,
        @NotBlank String message,
        @JsonAlias("customer_name") String customerName
) {
}
