package com.linlay.agentteam.model;

import com.linlay.agentteam.hierarchy.model.ModelProvider;
import org.springframework.ai.chat.model.ChatModel;

public record ModelBinding(
        ModelProvider provider,
        String modelId,
        ChatModel chatModel
) {
    public ModelBinding {
        if (provider == null || modelId == null || chatModel == null) {
            throw new IllegalArgumentException("provider, modelId and chatModel are required");
        }
    }
}
