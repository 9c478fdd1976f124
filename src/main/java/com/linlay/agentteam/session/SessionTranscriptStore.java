package com.linlay.agentteam.session;

import com.linlay.agentteam.common.SqliteDatabase;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Conversation transcripts per {@code (tenantId, instanceId, sessionId)}.
 * <p>
 * Written by the execution engine once per turn; read back as history for routing and by the
 * session listing endpoints.
 */
@Service
public class SessionTranscriptStore {

    private static final Logger log = LoggerFactory.getLogger(SessionTranscriptStore.class);

    private static final String CREATE_SESSION_SQL = """
            CREATE TABLE IF NOT EXISTS SESSION_ (
              TENANT_ID_ TEXT NOT NULL,
              INSTANCE_ID_ TEXT NOT NULL,
              SESSION_ID_ TEXT NOT NULL,
              CREATED_AT_ INTEGER NOT NULL,
              UPDATED_AT_ INTEGER NOT NULL,
              MESSAGE_COUNT_ INTEGER NOT NULL DEFAULT 0,
              PRIMARY KEY (TENANT_ID_, INSTANCE_ID_, SESSION_ID_)
            )
            """;
    private static final String CREATE_SESSION_MESSAGE_SQL = """
            CREATE TABLE IF NOT EXISTS SESSION_MESSAGE_ (
              MESSAGE_ID_ INTEGER PRIMARY KEY AUTOINCREMENT,
              TENANT_ID_ TEXT NOT NULL,
              INSTANCE_ID_ TEXT NOT NULL,
              SESSION_ID_ TEXT NOT NULL,
              ROLE_ TEXT NOT NULL,
              AGENT_NAME_ TEXT,
              CONTENT_ TEXT NOT NULL DEFAULT '',
              CREATED_AT_ INTEGER NOT NULL
            )
            """;
    private static final String CREATE_SESSION_MESSAGE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_SESSION_MESSAGE_SESSION_
              ON SESSION_MESSAGE_(TENANT_ID_, INSTANCE_ID_, SESSION_ID_, MESSAGE_ID_)
            """;
    private static final String UPSERT_SESSION_SQL = """
            INSERT INTO SESSION_ (TENANT_ID_, INSTANCE_ID_, SESSION_ID_, CREATED_AT_, UPDATED_AT_, MESSAGE_COUNT_)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(TENANT_ID_, INSTANCE_ID_, SESSION_ID_) DO UPDATE SET
              UPDATED_AT_ = excluded.UPDATED_AT_,
              MESSAGE_COUNT_ = SESSION_.MESSAGE_COUNT_ + excluded.MESSAGE_COUNT_
            """;
    private static final String INSERT_MESSAGE_SQL = """
            INSERT INTO SESSION_MESSAGE_ (TENANT_ID_, INSTANCE_ID_, SESSION_ID_, ROLE_, AGENT_NAME_, CONTENT_, CREATED_AT_)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private final SqliteDatabase database;
    private final Object lock = new Object();

    public SessionTranscriptStore(SqliteDatabase database) {
        this.database = database;
    }

    @PostConstruct
    public void initializeSchema() {
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute(CREATE_SESSION_SQL);
                statement.execute(CREATE_SESSION_MESSAGE_SQL);
                statement.execute(CREATE_SESSION_MESSAGE_INDEX_SQL);
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot initialize sqlite session store at " + database.path(), ex);
            }
        }
    }

    public void appendTurn(String tenantId, String instanceId, String sessionId, List<TranscriptMessage> messages) {
        requireSessionKey(tenantId, instanceId, sessionId);
        if (messages == null || messages.isEmpty()) {
            return;
        }
        long now = System.currentTimeMillis();
        synchronized (lock) {
            try (Connection connection = database.openConnection()) {
                connection.setAutoCommit(false);
                try (PreparedStatement session = connection.prepareStatement(UPSERT_SESSION_SQL);
                     PreparedStatement insert = connection.prepareStatement(INSERT_MESSAGE_SQL)) {
                    session.setString(1, tenantId);
                    session.setString(2, instanceId);
                    session.setString(3, sessionId);
                    session.setLong(4, now);
                    session.setLong(5, now);
                    session.setInt(6, messages.size());
                    session.executeUpdate();

                    for (TranscriptMessage message : messages) {
                        insert.setString(1, tenantId);
                        insert.setString(2, instanceId);
                        insert.setString(3, sessionId);
                        insert.setString(4, message.role());
                        if (StringUtils.hasText(message.agentName())) {
                            insert.setString(5, message.agentName());
                        } else {
                            insert.setNull(5, Types.VARCHAR);
                        }
                        insert.setString(6, message.content());
                        insert.setLong(7, message.createdAt() == null ? now : message.createdAt().toEpochMilli());
                        insert.addBatch();
                    }
                    insert.executeBatch();
                    connection.commit();
                } catch (SQLException ex) {
                    connection.rollback();
                    throw ex;
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot append transcript of session " + sessionId, ex);
            }
        }
        log.debug("Appended {} messages to session {}:{}:{}", messages.size(), tenantId, instanceId, sessionId);
    }

    public List<TranscriptMessage> loadRecentMessages(String tenantId, String instanceId, String sessionId, int limit) {
        if (limit <= 0 || !StringUtils.hasText(sessionId)) {
            return List.of();
        }
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT ROLE_, AGENT_NAME_, CONTENT_, CREATED_AT_
                         FROM SESSION_MESSAGE_
                         WHERE TENANT_ID_ = ? AND INSTANCE_ID_ = ? AND SESSION_ID_ = ?
                         ORDER BY MESSAGE_ID_ DESC
                         LIMIT ?
                         """)) {
                statement.setString(1, tenantId);
                statement.setString(2, instanceId);
                statement.setString(3, sessionId);
                statement.setInt(4, limit);
                List<TranscriptMessage> messages = readMessages(statement);
                Collections.reverse(messages);
                return messages;
            } catch (SQLException ex) {
                log.warn("Cannot load history of session {}:{}:{}", tenantId, instanceId, sessionId, ex);
                return List.of();
            }
        }
    }

    public List<SessionSummary> listSessions(String tenantId, String instanceId) {
        synchronized (lock) {
            try (Connection connection = database.openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT SESSION_ID_, MESSAGE_COUNT_, CREATED_AT_, UPDATED_AT_
                         FROM SESSION_
                         WHERE TENANT_ID_ = ? AND INSTANCE_ID_ = ?
                         ORDER BY UPDATED_AT_ DESC
                         """)) {
                statement.setString(1, tenantId);
                statement.setString(2, instanceId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    List<SessionSummary> sessions = new ArrayList<>();
                    while (resultSet.next()) {
                        sessions.add(toSummary(resultSet));
                    }
                    return sessions;
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot list sessions of " + tenantId + ":" + instanceId, ex);
            }
        }
    }

    public SessionTranscript loadTranscript(String tenantId, String instanceId, String sessionId) {
        synchronized (lock) {
            try (Connection connection = database.openConnection()) {
                SessionSummary summary = findSummary(connection, tenantId, instanceId, sessionId)
                        .orElseThrow(() -> new SessionNotFoundException(tenantId, instanceId, sessionId));
                try (PreparedStatement statement = connection.prepareStatement("""
                        SELECT ROLE_, AGENT_NAME_, CONTENT_, CREATED_AT_
                        FROM SESSION_MESSAGE_
                        WHERE TENANT_ID_ = ? AND INSTANCE_ID_ = ? AND SESSION_ID_ = ?
                        ORDER BY MESSAGE_ID_ ASC
                        """)) {
                    statement.setString(1, tenantId);
                    statement.setString(2, instanceId);
                    statement.setString(3, sessionId);
                    return new SessionTranscript(tenantId, instanceId, summary, readMessages(statement));
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot load transcript of session " + sessionId, ex);
            }
        }
    }

    private Optional<SessionSummary> findSummary(Connection connection, String tenantId, String instanceId, String sessionId)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT SESSION_ID_, MESSAGE_COUNT_, CREATED_AT_, UPDATED_AT_
                FROM SESSION_
                WHERE TENANT_ID_ = ? AND INSTANCE_ID_ = ? AND SESSION_ID_ = ?
                """)) {
            statement.setString(1, tenantId);
            statement.setString(2, instanceId);
            statement.setString(3, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(toSummary(resultSet)) : Optional.empty();
            }
        }
    }

    private List<TranscriptMessage> readMessages(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            List<TranscriptMessage> messages = new ArrayList<>();
            while (resultSet.next()) {
                messages.add(new TranscriptMessage(
                        resultSet.getString("ROLE_"),
                        resultSet.getString("AGENT_NAME_"),
                        resultSet.getString("CONTENT_"),
                        Instant.ofEpochMilli(resultSet.getLong("CREATED_AT_"))
                ));
            }
            return messages;
        }
    }

    private SessionSummary toSummary(ResultSet resultSet) throws SQLException {
        return new SessionSummary(
                resultSet.getString("SESSION_ID_"),
                resultSet.getInt("MESSAGE_COUNT_"),
                Instant.ofEpochMilli(resultSet.getLong("CREATED_AT_")),
                Instant.ofEpochMilli(resultSet.getLong("UPDATED_AT_"))
        );
    }

    private static void requireSessionKey(String tenantId, String instanceId, String sessionId) {
        if (!StringUtils.hasText(tenantId) || !StringUtils.hasText(instanceId) || !StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("tenantId, instanceId and sessionId must not be blank");
        }
    }
}
