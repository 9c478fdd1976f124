package com.linlay.agentteam.session;

import java.util.List;

public record SessionTranscript(
        String tenantId,
        String instanceId,
        SessionSummary summary,
        List<TranscriptMessage> messages
) {
    public SessionTranscript {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
