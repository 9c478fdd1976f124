package com.linlay.agentteam.model;

import com.linlay.agentteam.common.exception.ModelBindingException;
import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.hierarchy.model.ModelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider → chat model constructor table, fixed at startup. Bindings are shared per
 * {@code provider:modelId}; chat models are stateless clients and safe to reuse across teams.
 */
public class ModelBindingRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelBindingRegistry.class);

    private final Map<ModelProvider, ModelBindingFactory> factories;
    private final HierarchyDefaultsProperties defaults;
    private final Map<String, ModelBinding> bindingCache = new ConcurrentHashMap<>();

    public ModelBindingRegistry(Map<ModelProvider, ModelBindingFactory> factories, HierarchyDefaultsProperties defaults) {
        this.factories = factories == null || factories.isEmpty()
                ? new EnumMap<>(ModelProvider.class)
                : new EnumMap<>(factories);
        this.defaults = defaults;
    }

    public ModelBinding bind(ModelProvider provider, String modelId) {
        ModelProvider effectiveProvider = provider;
        String effectiveModel = StringUtils.hasText(modelId) ? modelId.trim() : defaults.getDefaultModel();
        if (effectiveProvider == null || !factories.containsKey(effectiveProvider)) {
            log.warn("No model factory for provider {}, falling back to {}/{}",
                    provider, defaults.getDefaultProvider().wireName(), defaults.getDefaultModel());
            effectiveProvider = defaults.getDefaultProvider();
            effectiveModel = defaults.getDefaultModel();
        }
        ModelBindingFactory factory = factories.get(effectiveProvider);
        if (factory == null) {
            throw new ModelBindingException("No model factory registered for default provider " + effectiveProvider);
        }
        ModelProvider resolvedProvider = effectiveProvider;
        String resolvedModel = effectiveModel;
        String cacheKey = resolvedProvider.wireName() + ":" + resolvedModel;
        return bindingCache.computeIfAbsent(cacheKey, ignored -> create(resolvedProvider, resolvedModel, factory));
    }

    public ModelBinding bindDelegator() {
        return bind(defaults.getDelegatorProvider(), defaults.getDelegatorModel());
    }

    public Set<ModelProvider> providers() {
        return factories.keySet();
    }

    private ModelBinding create(ModelProvider provider, String modelId, ModelBindingFactory factory) {
        ChatModel chatModel;
        try {
            chatModel = factory.create(modelId);
        } catch (ModelBindingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ModelBindingException("Cannot bind model " + provider.wireName() + "/" + modelId, ex);
        }
        if (chatModel == null) {
            throw new ModelBindingException("Model factory returned nothing for " + provider.wireName() + "/" + modelId);
        }
        log.debug("Bound model {}/{}", provider.wireName(), modelId);
        return new ModelBinding(provider, modelId, chatModel);
    }
}
