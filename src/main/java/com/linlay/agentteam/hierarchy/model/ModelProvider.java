package com.linlay.agentteam.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ModelProvider {
    OPENAI("openai"),
    CLAUDE("claude"),
    GEMINI("gemini"),
    GROQ("groq");

    private final String wireName;

    ModelProvider(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup. Blank and unrecognized values yield empty so callers can
     * substitute their own default.
     */
    public static Optional<ModelProvider> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ModelProvider provider : values()) {
            if (provider.wireName.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ModelProvider fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unsupported model provider: " + raw));
    }
}
