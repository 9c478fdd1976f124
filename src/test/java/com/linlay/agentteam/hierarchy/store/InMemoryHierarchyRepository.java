package com.linlay.agentteam.hierarchy.store;

import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.TeamKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryHierarchyRepository implements HierarchyRepository {

    private final Map<TeamKey, HierarchyConfig> records = new ConcurrentHashMap<>();
    private final AtomicBoolean failOnSave = new AtomicBoolean(false);
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public Optional<HierarchyConfig> findOne(String tenantId, String instanceId) {
        return Optional.ofNullable(records.get(new TeamKey(tenantId, instanceId)));
    }

    @Override
    public void save(HierarchyConfig config) {
        if (failOnSave.get()) {
            throw new HierarchyStorageException("store offline");
        }
        saves.incrementAndGet();
        records.put(new TeamKey(config.tenantId(), config.instanceId()), config);
    }

    @Override
    public List<HierarchyConfig> findByTenant(String tenantId) {
        List<HierarchyConfig> result = new ArrayList<>();
        for (HierarchyConfig config : records.values()) {
            if (config.tenantId().equals(tenantId)) {
                result.add(config);
            }
        }
        result.sort((left, right) -> left.instanceId().compareTo(right.instanceId()));
        return result;
    }

    public void failOnSave(boolean fail) {
        failOnSave.set(fail);
    }

    public int saveCount() {
        return saves.get();
    }
}
