package com.linlay.agentteam.hierarchy.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentteam.hierarchy.model.ToolSpec;

/**
 * The shapes a client may use for one tool entry. Resolved once by
 * {@link AgentSpecNormalizer}; nothing downstream sees the raw shape.
 */
public sealed interface RawToolEntry permits RawToolEntry.BareKind, RawToolEntry.ToolRecord, RawToolEntry.Typed {

    /**
     * A bare string naming the tool kind, e.g. {@code "YFINANCE"}.
     */
    record BareKind(String kind) implements RawToolEntry {
    }

    /**
     * An object carrying {@code type} or {@code kind} and optional {@code options}/{@code config}.
     */
    record ToolRecord(String kind, JsonNode options) implements RawToolEntry {
    }

    record Typed(ToolSpec spec) implements RawToolEntry {
    }

    static RawToolEntry from(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new HierarchyValidationException("tool entry is null");
        }
        if (node.isTextual()) {
            return new BareKind(node.asText());
        }
        if (node.isObject()) {
            JsonNode kind = node.hasNonNull("type") ? node.get("type") : node.get("kind");
            if (kind == null || kind.isNull() || !kind.isTextual()) {
                throw new HierarchyValidationException("tool entry has no textual type/kind field: " + node);
            }
            JsonNode options = node.hasNonNull("options") ? node.get("options") : node.get("config");
            return new ToolRecord(kind.asText(), options);
        }
        throw new HierarchyValidationException("unsupported tool entry shape: " + node.getNodeType());
    }
}
