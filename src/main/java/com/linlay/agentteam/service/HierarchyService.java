package com.linlay.agentteam.service;

import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.HierarchyUpdate;
import com.linlay.agentteam.hierarchy.normalize.AgentSpecNormalizer;
import com.linlay.agentteam.hierarchy.store.HierarchyNotFoundException;
import com.linlay.agentteam.hierarchy.store.HierarchyStore;
import com.linlay.agentteam.model.api.HierarchyUpdateRequest;
import com.linlay.agentteam.model.api.HierarchyUpdateResponse;
import com.linlay.agentteam.session.SessionSummary;
import com.linlay.agentteam.session.SessionTranscript;
import com.linlay.agentteam.session.SessionTranscriptStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Service
public class HierarchyService {

    private final HierarchyStore hierarchyStore;
    private final AgentSpecNormalizer normalizer;
    private final SessionTranscriptStore transcriptStore;

    public HierarchyService(HierarchyStore hierarchyStore, AgentSpecNormalizer normalizer, SessionTranscriptStore transcriptStore) {
        this.hierarchyStore = hierarchyStore;
        this.normalizer = normalizer;
        this.transcriptStore = transcriptStore;
    }

    public Mono<HierarchyUpdateResponse> update(HierarchyUpdateRequest request) {
        return Mono.fromCallable(() -> {
            List<AgentSpec> agents = request.hasAgents() ? normalizer.normalizeAll(request.agents()) : null;
            HierarchyConfig saved = hierarchyStore.upsertHierarchy(
                    request.tenantId(),
                    request.instanceId(),
                    new HierarchyUpdate(request.delegatorInstructions(), agents)
            );
            return new HierarchyUpdateResponse(
                    "Hierarchy updated",
                    saved.tenantId(),
                    saved.instanceId(),
                    saved.agents().size(),
                    saved.updatedAt()
            );
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<HierarchyConfig> get(String tenantId, String instanceId) {
        return Mono.fromCallable(() -> hierarchyStore.find(tenantId, instanceId)
                        .orElseThrow(() -> new HierarchyNotFoundException(tenantId, instanceId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<HierarchyConfig>> listInstances(String tenantId) {
        return Mono.fromCallable(() -> hierarchyStore.listByTenant(tenantId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<SessionSummary>> listSessions(String tenantId, String instanceId) {
        return Mono.fromCallable(() -> transcriptStore.listSessions(tenantId, instanceId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<SessionTranscript> transcript(String tenantId, String instanceId, String sessionId) {
        return Mono.fromCallable(() -> transcriptStore.loadTranscript(tenantId, instanceId, sessionId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
