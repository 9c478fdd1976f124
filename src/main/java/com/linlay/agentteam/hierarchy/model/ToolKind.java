package com.linlay.agentteam.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ToolKind {
    DUCKDUCKGO("duckduckgo"),
    YFINANCE("yfinance");

    private final String wireName;

    ToolKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ToolKind> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ToolKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ToolKind fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unsupported tool kind: " + raw));
    }
}
