package com.linlay.agentteam.service;

import com.linlay.agentteam.config.ChatProperties;
import com.linlay.agentteam.engine.ExecutionEngine;
import com.linlay.agentteam.engine.RunContext;
import com.linlay.agentteam.model.api.ChatRequest;
import com.linlay.agentteam.model.api.ChatResponse;
import com.linlay.agentteam.team.TeamCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Routes one user message through the team of its instance. Assembly happens on first use;
 * a timed out or failed run leaves the cached team in place.
 */
@Service
public class AgentTeamService {

    private static final Logger log = LoggerFactory.getLogger(AgentTeamService.class);

    private final TeamCache teamCache;
    private final ExecutionEngine executionEngine;
    private final ChatProperties chatProperties;

    public AgentTeamService(TeamCache teamCache, ExecutionEngine executionEngine, ChatProperties chatProperties) {
        this.teamCache = teamCache;
        this.executionEngine = executionEngine;
        this.chatProperties = chatProperties;
    }

    public Mono<ChatResponse> chat(ChatRequest request) {
        String message = withCustomerContext(request.customerName(), request.message());
        return Mono.fromCallable(() -> teamCache.getOrCreate(request.tenantId(), request.instanceId()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(team -> {
                    // transcripts are keyed like the team, by trimmed ids
                    RunContext context = new RunContext(team.key().tenantId(), team.key().instanceId(), request.sessionId());
                    return executionEngine.run(team.delegator(), context, message)
                            .timeout(chatProperties.timeout());
                })
                .map(result -> new ChatResponse(result.content(), request.sessionId(), true))
                .doOnError(ex -> log.warn("Chat failed for {}/{} session {}: {}",
                        request.tenantId(), request.instanceId(), request.sessionId(), ex.toString()));
    }

    static String withCustomerContext(String customerName, String message) {
        if (!StringUtils.hasText(customerName)) {
            return message;
        }
        return "[Customer: " + customerName.trim() + "] " + message;
    }
}
