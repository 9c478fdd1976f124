package com.linlay.agentteam.hierarchy.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentteam.common.SqliteDatabase;
import com.linlay.agentteam.hierarchy.model.AgentSpec;
import com.linlay.agentteam.hierarchy.model.HierarchyConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class SqliteHierarchyRepository implements HierarchyRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteHierarchyRepository.class);
    private static final TypeReference<List<AgentSpec>> AGENT_LIST = new TypeReference<>() {
    };

    private static final String CREATE_HIERARCHY_SQL = """
            CREATE TABLE IF NOT EXISTS HIERARCHY_CONFIG_ (
              TENANT_ID_ TEXT NOT NULL,
              INSTANCE_ID_ TEXT NOT NULL,
              DELEGATOR_INSTRUCTIONS_ TEXT NOT NULL,
              AGENTS_JSON_ TEXT NOT NULL DEFAULT '[]',
              CREATED_AT_ INTEGER NOT NULL,
              UPDATED_AT_ INTEGER NOT NULL,
              PRIMARY KEY (TENANT_ID_, INSTANCE_ID_)
            )
            """;
    private static final String CREATE_HIERARCHY_TENANT_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_HIERARCHY_CONFIG_TENANT_UPDATED_AT_
              ON HIERARCHY_CONFIG_(TENANT_ID_, UPDATED_AT_ DESC)
            """;
    private static final String UPSERT_SQL = """
            INSERT INTO HIERARCHY_CONFIG_ (
              TENANT_ID_, INSTANCE_ID_, DELEGATOR_INSTRUCTIONS_, AGENTS_JSON_, CREATED_AT_, UPDATED_AT_
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(TENANT_ID_, INSTANCE_ID_) DO UPDATE SET
              DELEGATOR_INSTRUCTIONS_ = excluded.DELEGATOR_INSTRUCTIONS_,
              AGENTS_JSON_ = excluded.AGENTS_JSON_,
              UPDATED_AT_ = excluded.UPDATED_AT_
            """;
    private static final String SELECT_COLUMNS = """
            SELECT TENANT_ID_, INSTANCE_ID_, DELEGATOR_INSTRUCTIONS_, AGENTS_JSON_, CREATED_AT_, UPDATED_AT_
            FROM HIERARCHY_CONFIG_
            """;

    private final SqliteDatabase database;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    public SqliteHierarchyRepository(SqliteDatabase database, ObjectMapper objectMapper) {
        this.database = database;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initializeSchema() {
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute(CREATE_HIERARCHY_SQL);
                statement.execute(CREATE_HIERARCHY_TENANT_INDEX_SQL);
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot initialize sqlite hierarchy store at " + database.path(), ex);
            }
        }
    }

    @Override
    public Optional<HierarchyConfig> findOne(String tenantId, String instanceId) {
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                         SELECT_COLUMNS + " WHERE TENANT_ID_ = ? AND INSTANCE_ID_ = ?")) {
                statement.setString(1, tenantId);
                statement.setString(2, instanceId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(toConfig(resultSet));
                }
            } catch (SQLException ex) {
                throw new HierarchyStorageException(
                        "Cannot load hierarchy tenantId=" + tenantId + ", instanceId=" + instanceId, ex);
            }
        }
    }

    @Override
    public void save(HierarchyConfig config) {
        String agentsJson;
        try {
            agentsJson = objectMapper.writeValueAsString(config.agents());
        } catch (JsonProcessingException ex) {
            throw new HierarchyStorageException("Cannot serialize agents of " + config.tenantId() + ":" + config.instanceId(), ex);
        }
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 PreparedStatement statement = connection.prepareStatement(UPSERT_SQL)) {
                statement.setString(1, config.tenantId());
                statement.setString(2, config.instanceId());
                statement.setString(3, config.delegatorInstructions() == null ? "" : config.delegatorInstructions());
                statement.setString(4, agentsJson);
                statement.setLong(5, config.createdAt().toEpochMilli());
                statement.setLong(6, config.updatedAt().toEpochMilli());
                statement.executeUpdate();
            } catch (SQLException ex) {
                throw new HierarchyStorageException(
                        "Cannot save hierarchy tenantId=" + config.tenantId() + ", instanceId=" + config.instanceId(), ex);
            }
        }
        log.debug("Saved hierarchy {}:{} with {} agents", config.tenantId(), config.instanceId(), config.agents().size());
    }

    @Override
    public List<HierarchyConfig> findByTenant(String tenantId) {
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                         SELECT_COLUMNS + " WHERE TENANT_ID_ = ? ORDER BY UPDATED_AT_ DESC")) {
                statement.setString(1, tenantId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    List<HierarchyConfig> configs = new ArrayList<>();
                    while (resultSet.next()) {
                        configs.add(toConfig(resultSet));
                    }
                    return configs;
                }
            } catch (SQLException ex) {
                throw new HierarchyStorageException("Cannot list hierarchies of tenantId=" + tenantId, ex);
            }
        }
    }

    private HierarchyConfig toConfig(ResultSet resultSet) throws SQLException {
        String tenantId = resultSet.getString("TENANT_ID_");
        String instanceId = resultSet.getString("INSTANCE_ID_");
        List<AgentSpec> agents;
        try {
            agents = objectMapper.readValue(resultSet.getString("AGENTS_JSON_"), AGENT_LIST);
        } catch (JsonProcessingException ex) {
            throw new HierarchyStorageException("Corrupted agents record of " + tenantId + ":" + instanceId, ex);
        }
        return new HierarchyConfig(
                tenantId,
                instanceId,
                resultSet.getString("DELEGATOR_INSTRUCTIONS_"),
                agents,
                Instant.ofEpochMilli(resultSet.getLong("CREATED_AT_")),
                Instant.ofEpochMilli(resultSet.getLong("UPDATED_AT_"))
        );
    }
}
