package com.linlay.agentteam.common;

import com.linlay.agentteam.config.StoreProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens connections to the sqlite file backing hierarchy and session records.
 */
@Component
public class SqliteDatabase {

    private final Path dbPath;

    public SqliteDatabase(StoreProperties properties) {
        this.dbPath = resolveSqlitePath(properties == null ? null : properties.getSqliteFile());
        Path parent = dbPath.getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot create sqlite directory for " + dbPath, ex);
        }
    }

    public Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA busy_timeout = 5000");
        } catch (SQLException ex) {
            connection.close();
            throw ex;
        }
        return connection;
    }

    public Path path() {
        return dbPath;
    }

    private static Path resolveSqlitePath(String configured) {
        if (!StringUtils.hasText(configured)) {
            configured = "agent-team.db";
        }
        Path path = Paths.get(configured.trim());
        if (!path.isAbsolute()) {
            path = Paths.get(System.getProperty("user.dir")).resolve(path);
        }
        return path.toAbsolutePath().normalize();
    }
}
