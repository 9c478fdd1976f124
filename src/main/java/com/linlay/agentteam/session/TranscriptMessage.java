package com.linlay.agentteam.session;

import java.time.Instant;

public record TranscriptMessage(
        String role,
        String agentName,
        String content,
        Instant createdAt
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public TranscriptMessage {
        if (content == null) {
            content = "";
        }
    }

    public static TranscriptMessage user(String content, Instant at) {
        return new TranscriptMessage(ROLE_USER, null, content, at);
    }

    public static TranscriptMessage assistant(String agentName, String content, Instant at) {
        return new TranscriptMessage(ROLE_ASSISTANT, agentName, content, at);
    }
}
