package com.linlay.agentteam.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.store")
public class StoreProperties {

    private String sqliteFile = "agent-team.db";

    public String getSqliteFile() {
        return sqliteFile;
    }

    public void setSqliteFile(String sqliteFile) {
        this.sqliteFile = sqliteFile;
    }
}
