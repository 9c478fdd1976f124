package com.linlay.agentteam.controller;

import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.model.api.ChatRequest;
import com.linlay.agentteam.model.api.ChatResponse;
import com.linlay.agentteam.model.api.HierarchyUpdateRequest;
import com.linlay.agentteam.model.api.HierarchyUpdateResponse;
import com.linlay.agentteam.model.api.InstanceListResponse;
import com.linlay.agentteam.model.api.SessionListResponse;
import com.linlay.agentteam.service.AgentTeamService;
import com.linlay.agentteam.service.HierarchyService;
import com.linlay.agentteam.session.SessionTranscript;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/agent")
public class AgentController {

    private final AgentTeamService agentTeamService;
    private final HierarchyService hierarchyService;

    public AgentController(AgentTeamService agentTeamService, HierarchyService hierarchyService) {
        this.agentTeamService = agentTeamService;
        this.hierarchyService = hierarchyService;
    }

    @PostMapping("/chat")
    public Mono<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return agentTeamService.chat(request);
    }

    @PutMapping("/hierarchy")
    public Mono<HierarchyUpdateResponse> updateHierarchy(@Valid @RequestBody HierarchyUpdateRequest request) {
        return hierarchyService.update(request);
    }

    @GetMapping("/hierarchy/{tenantId}/{instanceId}")
    public Mono<HierarchyConfig> hierarchy(@PathVariable String tenantId, @PathVariable String instanceId) {
        return hierarchyService.get(tenantId, instanceId);
    }

    @GetMapping("/instances/{tenantId}")
    public Mono<InstanceListResponse> instances(@PathVariable String tenantId) {
        return hierarchyService.listInstances(tenantId).map(InstanceListResponse::new);
    }

    @GetMapping("/sessions/{tenantId}/{instanceId}")
    public Mono<SessionListResponse> sessions(@PathVariable String tenantId, @PathVariable String instanceId) {
        return hierarchyService.listSessions(tenantId, instanceId).map(SessionListResponse::new);
    }

    @GetMapping("/sessions/{tenantId}/{instanceId}/{sessionId}")
    public Mono<SessionTranscript> transcript(
            @PathVariable String tenantId,
            @PathVariable String instanceId,
            @PathVariable String sessionId
    ) {
        return hierarchyService.transcript(tenantId, instanceId, sessionId);
    }
}
