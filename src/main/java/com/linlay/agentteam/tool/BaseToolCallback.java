package com.linlay.agentteam.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Exposes a {@link BaseTool} to Spring AI tool calling.
 */
public class BaseToolCallback implements ToolCallback {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final BaseTool tool;
    private final ObjectMapper objectMapper;
    private final ToolDefinition definition;

    public BaseToolCallback(BaseTool tool, ObjectMapper objectMapper) {
        this.tool = tool;
        this.objectMapper = objectMapper;
        this.definition = ToolDefinition.builder()
                .name(tool.name())
                .description(StringUtils.hasText(tool.description()) ? tool.description() : tool.name())
                .inputSchema(writeSchema(tool, objectMapper))
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        Map<String, Object> args;
        try {
            args = StringUtils.hasText(toolInput) ? objectMapper.readValue(toolInput, ARGS_TYPE) : Map.of();
        } catch (JsonProcessingException ex) {
            return "{\"tool\":\"" + tool.name() + "\",\"error\":\"invalid arguments\"}";
        }
        JsonNode result = tool.invoke(args == null ? Map.of() : args);
        return result == null ? "null" : result.toString();
    }

    private static String writeSchema(BaseTool tool, ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(tool.parametersSchema());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize parameter schema of tool " + tool.name(), ex);
        }
    }
}
