package com.linlay.agentteam.tool;

import com.linlay.agentteam.common.exception.ToolBindingException;
import com.linlay.agentteam.hierarchy.model.ToolKind;
import com.linlay.agentteam.hierarchy.model.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool kind → tool constructor table, fixed at startup.
 */
public class ToolBindingRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolBindingRegistry.class);

    private final Map<ToolKind, ToolBindingFactory> factories;

    public ToolBindingRegistry(Map<ToolKind, ToolBindingFactory> factories) {
        this.factories = factories == null || factories.isEmpty()
                ? new EnumMap<>(ToolKind.class)
                : new EnumMap<>(factories);
    }

    public BaseTool bind(ToolSpec spec) {
        if (spec == null) {
            throw new ToolBindingException("tool spec must not be null");
        }
        ToolBindingFactory factory = factories.get(spec.kind());
        if (factory == null) {
            throw new ToolBindingException("No tool factory registered for kind " + spec.kind().wireName());
        }
        Map<String, Object> options = effectiveOptions(factory, spec);
        BaseTool tool;
        try {
            tool = factory.create(options);
        } catch (ToolBindingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ToolBindingException("Cannot bind tool " + spec.kind().wireName(), ex);
        }
        if (tool == null) {
            throw new ToolBindingException("Tool factory returned nothing for " + spec.kind().wireName());
        }
        log.debug("Bound tool {} with options {}", spec.kind().wireName(), options);
        return tool;
    }

    public Map<String, Object> effectiveOptions(ToolSpec spec) {
        ToolBindingFactory factory = factories.get(spec.kind());
        return factory == null ? spec.options() : effectiveOptions(factory, spec);
    }

    private Map<String, Object> effectiveOptions(ToolBindingFactory factory, ToolSpec spec) {
        Map<String, Object> merged = new LinkedHashMap<>(factory.defaultOptions());
        merged.putAll(spec.options());
        return Collections.unmodifiableMap(merged);
    }
}
