package com.linlay.agentteam.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolSpec(
        @JsonAlias("type")
        ToolKind kind,
        @JsonAlias("config")
        Map<String, Object> options
) {
    public ToolSpec {
        if (kind == null) {
            throw new IllegalArgumentException("tool kind must not be null");
        }
        if (options == null) {
            options = Map.of();
        } else {
            options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        }
    }

    public static ToolSpec of(ToolKind kind) {
        return new ToolSpec(kind, Map.of());
    }
}
