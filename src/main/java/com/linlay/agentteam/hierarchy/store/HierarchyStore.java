package com.linlay.agentteam.hierarchy.store;

import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.HierarchyUpdate;
import com.linlay.agentteam.hierarchy.model.TeamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Load/save of hierarchy configurations with whole-field replace semantics.
 * <p>
 * An upsert either creates the record with defaults for unset fields or replaces exactly the
 * fields present in the update; the agent list is never merged per agent. Every successful
 * write notifies the registered {@link HierarchyChangeListener}s before returning, which is
 * what keeps assembled teams from outliving the configuration they were built from.
 */
@Service
public class HierarchyStore {

    private static final Logger log = LoggerFactory.getLogger(HierarchyStore.class);
    private static final int WRITE_LOCK_STRIPES = 64;

    private final HierarchyRepository repository;
    private final HierarchyDefaultsProperties defaults;
    private final Clock clock;
    private final List<HierarchyChangeListener> listeners = new CopyOnWriteArrayList<>();
    // keys sharing a stripe serialize their writes; the lock set stays fixed however many keys exist
    private final Object[] writeLocks = new Object[WRITE_LOCK_STRIPES];

    @Autowired
    public HierarchyStore(HierarchyRepository repository, HierarchyDefaultsProperties defaults) {
        this(repository, defaults, Clock.systemUTC());
    }

    HierarchyStore(HierarchyRepository repository, HierarchyDefaultsProperties defaults, Clock clock) {
        this.repository = repository;
        this.defaults = defaults;
        this.clock = clock;
        for (int i = 0; i < writeLocks.length; i++) {
            writeLocks[i] = new Object();
        }
    }

    public void addChangeListener(HierarchyChangeListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public HierarchyConfig upsertHierarchy(String tenantId, String instanceId, HierarchyUpdate update) {
        TeamKey key = new TeamKey(tenantId, instanceId);
        HierarchyUpdate effective = update == null ? HierarchyUpdate.empty() : update;
        HierarchyConfig saved;
        synchronized (writeLockOf(key)) {
            Optional<HierarchyConfig> existing = repository.findOne(key.tenantId(), key.instanceId());
            HierarchyConfig next = existing
                    .map(current -> applyUpdate(current, effective))
                    .orElseGet(() -> newConfig(key, effective));
            repository.save(next);
            saved = next;
            log.info("Upserted hierarchy {} ({}, agents={}, instructionsReplaced={}, agentsReplaced={})",
                    key,
                    existing.isPresent() ? "updated" : "created",
                    saved.agents().size(),
                    effective.hasDelegatorInstructions(),
                    effective.hasAgents());
            notifyListeners(saved);
        }
        return saved;
    }

    /**
     * Returns the stored configuration, creating a default empty one on first contact.
     */
    public HierarchyConfig loadOrProvision(String tenantId, String instanceId) {
        TeamKey key = new TeamKey(tenantId, instanceId);
        Optional<HierarchyConfig> existing = repository.findOne(key.tenantId(), key.instanceId());
        if (existing.isPresent()) {
            return existing.get();
        }
        synchronized (writeLockOf(key)) {
            Optional<HierarchyConfig> raced = repository.findOne(key.tenantId(), key.instanceId());
            if (raced.isPresent()) {
                return raced.get();
            }
            HierarchyConfig provisioned = newConfig(key, HierarchyUpdate.empty());
            repository.save(provisioned);
            log.info("Provisioned default hierarchy {}", key);
            return provisioned;
        }
    }

    public Optional<HierarchyConfig> find(String tenantId, String instanceId) {
        TeamKey key = new TeamKey(tenantId, instanceId);
        return repository.findOne(key.tenantId(), key.instanceId());
    }

    public List<HierarchyConfig> listByTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return List.of();
        }
        return repository.findByTenant(tenantId.trim());
    }

    private HierarchyConfig applyUpdate(HierarchyConfig current, HierarchyUpdate update) {
        String instructions = update.hasDelegatorInstructions()
                ? update.delegatorInstructions()
                : current.delegatorInstructions();
        return current.withUpdate(
                instructions,
                update.hasAgents() ? update.agents() : current.agents(),
                nextUpdatedAt(current.updatedAt())
        );
    }

    private HierarchyConfig newConfig(TeamKey key, HierarchyUpdate update) {
        Instant now = now();
        return new HierarchyConfig(
                key.tenantId(),
                key.instanceId(),
                update.hasDelegatorInstructions()
                        ? update.delegatorInstructions()
                        : defaults.getDefaultDelegatorInstructions(),
                update.hasAgents() ? update.agents() : List.of(),
                now,
                now
        );
    }

    private Instant nextUpdatedAt(Instant previous) {
        Instant now = now();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusMillis(1);
        }
        return now;
    }

    // stored with millisecond precision
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private void notifyListeners(HierarchyConfig saved) {
        for (HierarchyChangeListener listener : listeners) {
            listener.onHierarchyChanged(saved);
        }
    }

    private Object writeLockOf(TeamKey key) {
        return writeLocks[Math.floorMod(key.hashCode(), writeLocks.length)];
    }
}
