package com.linlay.agentteam.tool;

import java.util.Map;

public interface ToolBindingFactory {

    /**
     * Kind-specific defaults; caller supplied options are layered on top of these.
     */
    default Map<String, Object> defaultOptions() {
        return Map.of();
    }

    BaseTool create(Map<String, Object> options);
}
