package com.linlay.agentteam.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code idleTtl} unset or non-positive disables idle expiry; entries then live until the
 * hierarchy they were assembled from changes. The sweep period is read straight from
 * {@code agent.team-cache.sweep-interval-ms} by the scheduler.
 */
@ConfigurationProperties(prefix = "agent.team-cache")
public class TeamCacheProperties {

    private Duration idleTtl;

    public Duration getIdleTtl() {
        return idleTtl;
    }

    public void setIdleTtl(Duration idleTtl) {
        this.idleTtl = idleTtl;
    }

    public boolean idleExpiryEnabled() {
        return idleTtl != null && !idleTtl.isZero() && !idleTtl.isNegative();
    }
}
