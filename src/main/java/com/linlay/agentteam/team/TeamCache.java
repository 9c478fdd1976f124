package com.linlay.agentteam.team;

import com.linlay.agentteam.config.TeamCacheProperties;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.TeamKey;
import com.linlay.agentteam.hierarchy.store.HierarchyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Assembled teams keyed by tenant and instance.
 * <p>
 * A miss registers a pending future under the map's bin lock and builds outside of it, so
 * concurrent callers for one key share a single assembly. Entries are evicted when the
 * hierarchy they came from is written, and optionally after an idle period.
 */
@Component
public class TeamCache {

    private static final Logger log = LoggerFactory.getLogger(TeamCache.class);

    private final ConcurrentMap<TeamKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final HierarchyStore hierarchyStore;
    private final TeamAssembler assembler;
    private final TeamCacheProperties properties;
    private final Clock clock;

    @Autowired
    public TeamCache(HierarchyStore hierarchyStore, TeamAssembler assembler, TeamCacheProperties properties) {
        this(hierarchyStore, assembler, properties, Clock.systemUTC());
    }

    TeamCache(HierarchyStore hierarchyStore, TeamAssembler assembler, TeamCacheProperties properties, Clock clock) {
        this.hierarchyStore = hierarchyStore;
        this.assembler = assembler;
        this.properties = properties == null ? new TeamCacheProperties() : properties;
        this.clock = clock;
        hierarchyStore.addChangeListener(this::onHierarchyChanged);
    }

    public RuntimeTeam getOrCreate(String tenantId, String instanceId) {
        TeamKey key = new TeamKey(tenantId, instanceId);
        long now = clock.millis();
        CacheEntry entry = entries.get(key);
        if (entry != null && isIdleExpired(entry, now)) {
            if (entries.remove(key, entry)) {
                log.info("Evicted idle team {}", key);
            }
            entry = null;
        }
        if (entry == null) {
            CacheEntry created = new CacheEntry(now);
            CacheEntry raced = entries.putIfAbsent(key, created);
            if (raced == null) {
                build(key, created);
                entry = created;
            } else {
                entry = raced;
            }
        } else {
            log.debug("Team cache hit {}", key);
        }
        entry.touch(now);
        return await(entry);
    }

    public void invalidate(String tenantId, String instanceId) {
        TeamKey key = new TeamKey(tenantId, instanceId);
        if (entries.remove(key) != null) {
            log.info("Invalidated team {}", key);
        }
    }

    public boolean contains(String tenantId, String instanceId) {
        return entries.containsKey(new TeamKey(tenantId, instanceId));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Drops completed entries idle for longer than the configured TTL.
     *
     * @return number of evicted entries
     */
    public int evictIdle() {
        if (!properties.idleExpiryEnabled()) {
            return 0;
        }
        long now = clock.millis();
        int evicted = 0;
        for (Map.Entry<TeamKey, CacheEntry> item : entries.entrySet()) {
            CacheEntry entry = item.getValue();
            if (entry.future.isDone() && isIdleExpired(entry, now) && entries.remove(item.getKey(), entry)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle teams", evicted);
        }
        return evicted;
    }

    @Scheduled(fixedDelayString = "${agent.team-cache.sweep-interval-ms:60000}")
    public void sweepIdle() {
        evictIdle();
    }

    private void onHierarchyChanged(HierarchyConfig saved) {
        invalidate(saved.tenantId(), saved.instanceId());
    }

    private void build(TeamKey key, CacheEntry entry) {
        try {
            HierarchyConfig config = hierarchyStore.loadOrProvision(key.tenantId(), key.instanceId());
            RuntimeTeam team = assembler.assemble(config);
            entry.future.complete(team);
        } catch (RuntimeException | Error ex) {
            // remove before completing so that waiters retrying start a fresh build
            entries.remove(key, entry);
            entry.future.completeExceptionally(ex);
            log.warn("Team build failed for {}: {}", key, ex.getMessage());
        }
    }

    private RuntimeTeam await(CacheEntry entry) {
        try {
            return entry.future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for team assembly", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    private boolean isIdleExpired(CacheEntry entry, long now) {
        if (!properties.idleExpiryEnabled()) {
            return false;
        }
        Duration ttl = properties.getIdleTtl();
        return entry.future.isDone() && now - entry.lastAccessMillis > ttl.toMillis();
    }

    private static final class CacheEntry {
        private final CompletableFuture<RuntimeTeam> future = new CompletableFuture<>();
        private volatile long lastAccessMillis;

        private CacheEntry(long createdAtMillis) {
            this.lastAccessMillis = createdAtMillis;
        }

        private void touch(long now) {
            if (now > lastAccessMillis) {
                lastAccessMillis = now;
            }
        }
    }
}
