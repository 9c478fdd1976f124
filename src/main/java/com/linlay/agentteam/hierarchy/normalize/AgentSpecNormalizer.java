package com.linlay.agentteam.hierarchy.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.ModelProvider;
import com.linlay.agentteam.hierarchy.model.ToolKind;
import com.linlay.agentteam.hierarchy.model.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns loosely shaped agent payloads into {@link AgentSpec}s.
 * <p>
 * Tolerant by construction: unknown providers fall back to the configured default, unknown or
 * malformed tools are dropped one by one, and a malformed agent only drops that agent when a
 * whole list is normalized. Agent order and tool order are preserved.
 */
@Component
public class AgentSpecNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AgentSpecNormalizer.class);

    private final HierarchyDefaultsProperties defaults;

    public AgentSpecNormalizer(HierarchyDefaultsProperties defaults) {
        this.defaults = defaults;
    }

    public List<AgentSpec> normalizeAll(JsonNode rawAgents) {
        if (rawAgents == null || rawAgents.isNull() || rawAgents.isMissingNode()) {
            return List.of();
        }
        if (!rawAgents.isArray()) {
            throw new HierarchyValidationException("agents must be an array, got " + rawAgents.getNodeType());
        }
        List<AgentSpec> agents = new ArrayList<>();
        int index = 0;
        for (JsonNode rawAgent : rawAgents) {
            try {
                agents.add(normalize(rawAgent));
            } catch (HierarchyValidationException ex) {
                log.warn("Drop agent entry #{}: {}", index, ex.getMessage());
            }
            index++;
        }
        return List.copyOf(agents);
    }

    public AgentSpec normalize(JsonNode rawAgent) {
        if (rawAgent == null || !rawAgent.isObject()) {
            throw new HierarchyValidationException("agent entry must be an object");
        }
        String name = text(rawAgent, "name");
        if (!StringUtils.hasText(name)) {
            throw new HierarchyValidationException("agent name is required");
        }
        String id = firstText(rawAgent, "agent_id", "agentId", "id");
        String role = text(rawAgent, "role");
        String providerRaw = firstText(rawAgent, "model_provider", "modelProvider", "provider");
        String modelId = firstText(rawAgent, "model_id", "modelId", "model");
        String parentId = firstText(rawAgent, "parent_id", "parentId");

        List<RawToolEntry> rawTools = new ArrayList<>();
        JsonNode toolsNode = rawAgent.get("tools");
        if (toolsNode != null && !toolsNode.isNull()) {
            if (toolsNode.isArray()) {
                for (JsonNode toolNode : toolsNode) {
                    try {
                        rawTools.add(RawToolEntry.from(toolNode));
                    } catch (HierarchyValidationException ex) {
                        log.warn("Drop tool of agent '{}': {}", name.trim(), ex.getMessage());
                    }
                }
            } else {
                log.warn("Ignore non-array tools of agent '{}'", name.trim());
            }
        }

        return new AgentSpec(
                StringUtils.hasText(id) ? id.trim() : newId(),
                name.trim(),
                role == null ? "" : role,
                resolveProvider(providerRaw, name),
                StringUtils.hasText(modelId) ? modelId.trim() : defaults.getDefaultModel(),
                resolveTools(rawTools, name),
                StringUtils.hasText(parentId) ? parentId.trim() : null
        );
    }

    /**
     * Fills defaults on an already-typed spec; its tools pass through unchanged apart from repeated kinds.
     */
    public AgentSpec normalize(AgentSpec spec) {
        if (spec == null || !StringUtils.hasText(spec.name())) {
            throw new HierarchyValidationException("agent name is required");
        }
        List<RawToolEntry> typed = new ArrayList<>();
        for (ToolSpec tool : spec.tools()) {
            if (tool != null) {
                typed.add(new RawToolEntry.Typed(tool));
            }
        }
        return new AgentSpec(
                StringUtils.hasText(spec.id()) ? spec.id().trim() : newId(),
                spec.name().trim(),
                spec.role(),
                spec.modelProvider() == null ? defaults.getDefaultProvider() : spec.modelProvider(),
                StringUtils.hasText(spec.modelId()) ? spec.modelId().trim() : defaults.getDefaultModel(),
                resolveTools(typed, spec.name()),
                StringUtils.hasText(spec.parentId()) ? spec.parentId().trim() : null
        );
    }

    /**
     * One tool per kind: a repeated kind replaces the earlier entry and keeps its position.
     */
    List<ToolSpec> resolveTools(List<RawToolEntry> rawTools, String agentName) {
        Map<ToolKind, ToolSpec> tools = new LinkedHashMap<>();
        for (RawToolEntry entry : rawTools) {
            resolveTool(entry, agentName).ifPresent(tool -> {
                if (tools.put(tool.kind(), tool) != null) {
                    log.warn("Duplicate tool kind '{}' of agent '{}', keeping the last", tool.kind(), agentName);
                }
            });
        }
        return List.copyOf(tools.values());
    }

    private Optional<ToolSpec> resolveTool(RawToolEntry entry, String agentName) {
        if (entry instanceof RawToolEntry.Typed typed) {
            return Optional.of(typed.spec());
        }
        if (entry instanceof RawToolEntry.BareKind bare) {
            return kindOf(bare.kind(), agentName).map(ToolSpec::of);
        }
        if (entry instanceof RawToolEntry.ToolRecord record) {
            Optional<ToolKind> kind = kindOf(record.kind(), agentName);
            if (kind.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new ToolSpec(kind.get(), options(record.options())));
            } catch (HierarchyValidationException ex) {
                log.warn("Drop tool '{}' of agent '{}': {}", record.kind(), agentName, ex.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<ToolKind> kindOf(String raw, String agentName) {
        Optional<ToolKind> kind = ToolKind.parse(raw);
        if (kind.isEmpty()) {
            log.warn("Drop unknown tool kind '{}' of agent '{}'", raw, agentName);
        }
        return kind;
    }

    private Map<String, Object> options(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new HierarchyValidationException("tool options must be an object");
        }
        Map<String, Object> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isBoolean()) {
                options.put(field.getKey(), value.booleanValue());
            } else if (value.isNumber()) {
                options.put(field.getKey(), value.numberValue());
            } else if (value.isTextual()) {
                options.put(field.getKey(), value.textValue());
            } else {
                throw new HierarchyValidationException("option '" + field.getKey() + "' is not a scalar");
            }
        }
        return options;
    }

    private ModelProvider resolveProvider(String raw, String agentName) {
        Optional<ModelProvider> provider = ModelProvider.parse(raw);
        if (provider.isPresent()) {
            return provider.get();
        }
        if (StringUtils.hasText(raw)) {
            log.warn("Unknown model provider '{}' for agent '{}', using {}", raw, agentName, defaults.getDefaultProvider().wireName());
        }
        return defaults.getDefaultProvider();
    }

    private static String firstText(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            String value = text(node, fieldName);
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String fieldName) {
        JsonNode value = node.get(fieldName);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
