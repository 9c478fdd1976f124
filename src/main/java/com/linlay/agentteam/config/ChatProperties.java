package com.linlay.agentteam.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.time.Duration;

@ConfigurationProperties(prefix = "agent.chat")
public record ChatProperties(
        Duration timeout,
        Integer historyWindow
) {

    @ConstructorBinding
    public ChatProperties {
        if (timeout == null) {
            timeout = Duration.ofSeconds(120);
        }
        if (historyWindow == null || historyWindow < 0) {
            historyWindow = 20;
        }
    }

    public ChatProperties() {
        this(null, null);
    }
}
