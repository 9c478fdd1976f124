package com.linlay.agentteam.hierarchy.store;

import com.linlay.agentteam.hierarchy.model.HierarchyConfig;

import java.util.List;
import java.util.Optional;

/**
 * Document storage for hierarchy records, unique on {@code (tenantId, instanceId)}.
 * Implementations report failures as {@link HierarchyStorageException}.
 */
public interface HierarchyRepository {

    Optional<HierarchyConfig> findOne(String tenantId, String instanceId);

    void save(HierarchyConfig config);

    List<HierarchyConfig> findByTenant(String tenantId);
}
