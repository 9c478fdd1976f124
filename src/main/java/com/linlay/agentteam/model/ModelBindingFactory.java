package com.linlay.agentteam.model;

import org.springframework.ai.chat.model.ChatModel;

@FunctionalInterface
public interface ModelBindingFactory {

    ChatModel create(String modelId);
}
