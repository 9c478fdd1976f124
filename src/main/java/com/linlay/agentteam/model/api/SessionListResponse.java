package com.linlay.agentteam.model.api;

import com.linlay.agentteam.session.SessionSummary;

import java.util.List;

public record SessionListResponse(
        List<SessionSummary> sessions
) {
}
