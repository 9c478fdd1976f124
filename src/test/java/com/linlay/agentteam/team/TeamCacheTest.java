package com.linlay.agentteam.team;

import com.linlay.agentteam.common.exception.ModelBindingException;
import com.linlay.agentteam.config.HierarchyDefaultsProperties;
import com.linlay.agentteam.config.TeamCacheProperties;
import com.linlay.agentteam.engine.DelegatorRuntime;
import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import com.linlay.agentteam.hierarchy.model.HierarchyUpdate;
import com.linlay.agentteam.hierarchy.model.ModelProvider;
import com.linlay.agentteam.hierarchy.model.TeamKey;
import com.linlay.agentteam.hierarchy.store.HierarchyStore;
import com.linlay.agentteam.hierarchy.store.InMemoryHierarchyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TeamCacheTest {

    private HierarchyStore store;
    private TeamAssembler assembler;
    private AtomicInteger builds;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        store = new HierarchyStore(new InMemoryHierarchyRepository(), new HierarchyDefaultsProperties());
        assembler = mock(TeamAssembler.class);
        builds = new AtomicInteger();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        when(assembler.assemble(any(HierarchyConfig.class))).thenAnswer(invocation -> {
            builds.incrementAndGet();
            return team(invocation.getArgument(0));
        });
    }

    @Test
    void repeatedGetShouldReturnSameTeam() {
        TeamCache cache = new TeamCache(store, assembler, new TeamCacheProperties(), clock);

        RuntimeTeam first = cache.getOrCreate("t1", "i1");
        RuntimeTeam second = cache.getOrCreate(" t1 ", "i1");

        assertThat(second).isSameAs(first);
        assertThat(builds).hasValue(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void concurrentMissesShouldShareOneAssembly() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(assembler.assemble(any(HierarchyConfig.class))).thenAnswer(invocation -> {
            builds.incrementAndGet();
            release.await(5, TimeUnit.SECONDS);
            return team(invocation.getArgument(0));
        });
        TeamCache cache = new TeamCache(store, assembler, new TeamCacheProperties(), clock);
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        try {
            List<Future<RuntimeTeam>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    ready.countDown();
                    return cache.getOrCreate("t1", "i1");
                }));
            }
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            release.countDown();

            RuntimeTeam expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<RuntimeTeam> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(builds).hasValue(1);
    }

    @Test
    void upsertShouldInvalidateAndNextGetShouldSeeNewConfig() {
        TeamCache cache = new TeamCache(store, assembler, new TeamCacheProperties(), clock);
        RuntimeTeam before = cache.getOrCreate("t1", "i1");

        store.upsertHierarchy("t1", "i1", HierarchyUpdate.agents(List.of(
                new AgentSpec("a1", "Analyst", "", ModelProvider.GEMINI, "gemini-1.5-flash", List.of(), null))));

        assertThat(cache.contains("t1", "i1")).isFalse();
        RuntimeTeam after = cache.getOrCreate("t1", "i1");
        assertThat(after).isNotSameAs(before);
        assertThat(after.configUpdatedAt()).isAfter(before.configUpdatedAt());
        assertThat(builds).hasValue(2);
    }

    @Test
    void upsertDuringPendingBuildShouldNotLeaveStaleTeamCached() throws Exception {
        HierarchyConfig original = store.loadOrProvision("t1", "i1");
        CountDownLatch assembling = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(assembler.assemble(any(HierarchyConfig.class))).thenAnswer(invocation -> {
            if (builds.incrementAndGet() == 1) {
                assembling.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
            return team(invocation.getArgument(0));
        });
        TeamCache cache = new TeamCache(store, assembler, new TeamCacheProperties(), clock);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<RuntimeTeam> pending = executor.submit(() -> cache.getOrCreate("t1", "i1"));
            assertThat(assembling.await(5, TimeUnit.SECONDS)).isTrue();

            Future<HierarchyConfig> upsert = executor.submit(() -> store.upsertHierarchy("t1", "i1",
                    HierarchyUpdate.delegatorInstructions("route by sector")));
            HierarchyConfig updated = upsert.get(5, TimeUnit.SECONDS);
            release.countDown();
            RuntimeTeam stale = pending.get(5, TimeUnit.SECONDS);

            assertThat(stale.configUpdatedAt()).isEqualTo(original.updatedAt());
            RuntimeTeam next = cache.getOrCreate("t1", "i1");
            assertThat(next).isNotSameAs(stale);
            assertThat(next.configUpdatedAt()).isEqualTo(updated.updatedAt());
            assertThat(next.delegator().instructions()).isEqualTo("route by sector");
            assertThat(cache.getOrCreate("t1", "i1")).isSameAs(next);
        } finally {
            executor.shutdownNow();
        }
        assertThat(builds).hasValue(2);
    }

    @Test
    void upsertOfOtherInstanceShouldKeepEntry() {
        TeamCache cache = new TeamCache(store, assembler, new TeamCacheProperties(), clock);
        RuntimeTeam team = cache.getOrCreate("t1", "i1");

        store.upsertHierarchy("t1", "i2", HierarchyUpdate.empty());

        assertThat(cache.getOrCreate("t1", "i1")).isSameAs(team);
    }

    @Test
    void failedAssemblyShouldLeaveNoEntry() {
        when(assembler.assemble(any(HierarchyConfig.class)))
                .thenThrow(new ModelBindingException("Missing API key for provider: gemini"))
                .thenAnswer(invocation -> team(invocation.getArgument(0)));
        TeamCache cache = new TeamCache(store, assembler, new TeamCacheProperties(), clock);

        assertThatThrownBy(() -> cache.getOrCreate("t1", "i1")).isInstanceOf(ModelBindingException.class);
        assertThat(cache.size()).isZero();

        assertThat(cache.getOrCreate("t1", "i1")).isNotNull();
        verify(assembler, times(2)).assemble(any(HierarchyConfig.class));
    }

    @Test
    void idleEntriesShouldExpireOnlyWhenTtlConfigured() {
        TeamCacheProperties disabled = new TeamCacheProperties();
        TeamCache neverExpiring = new TeamCache(store, assembler, disabled, clock);
        neverExpiring.getOrCreate("t1", "i1");
        clock.advance(Duration.ofDays(30));
        assertThat(neverExpiring.evictIdle()).isZero();
        assertThat(neverExpiring.size()).isEqualTo(1);

        TeamCacheProperties properties = new TeamCacheProperties();
        properties.setIdleTtl(Duration.ofMinutes(10));
        TeamCache cache = new TeamCache(store, assembler, properties, clock);
        RuntimeTeam first = cache.getOrCreate("t1", "i1");
        cache.getOrCreate("t1", "i2");

        clock.advance(Duration.ofMinutes(5));
        cache.getOrCreate("t1", "i2");
        clock.advance(Duration.ofMinutes(6));

        assertThat(cache.evictIdle()).isEqualTo(1);
        assertThat(cache.contains("t1", "i1")).isFalse();
        assertThat(cache.contains("t1", "i2")).isTrue();
        assertThat(cache.getOrCreate("t1", "i1")).isNotSameAs(first);
    }

    @Test
    void expiredEntryShouldBeRebuiltLazilyOnAccess() {
        TeamCacheProperties properties = new TeamCacheProperties();
        properties.setIdleTtl(Duration.ofMinutes(1));
        TeamCache cache = new TeamCache(store, assembler, properties, clock);
        RuntimeTeam first = cache.getOrCreate("t1", "i1");

        clock.advance(Duration.ofMinutes(2));

        assertThat(cache.getOrCreate("t1", "i1")).isNotSameAs(first);
        assertThat(builds).hasValue(2);
    }

    private static RuntimeTeam team(HierarchyConfig config) {
        return new RuntimeTeam(
                new TeamKey(config.tenantId(), config.instanceId()),
                new DelegatorRuntime(null, List.of(), config.delegatorInstructions(), true),
                config.updatedAt(),
                Instant.now()
        );
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        private void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
