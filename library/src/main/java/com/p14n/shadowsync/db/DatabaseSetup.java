package com.p14n.shadowsync.db;

import com.p14n.shadowsync.data.ShadowSyncConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    public static final String SCHEMA = "shadowsync";

    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseSetup(ShadowSyncConfig cfg) {
        this(cfg.jdbcUrl(), cfg.dbUser(), cfg.dbPassword());
    }

    public DatabaseSetup(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createShadowsTableIfNotExists();
        createHistoryTableIfNotExists();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + SCHEMA);
            logger.atInfo().log("Schema creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema");
            throw new ShadowPersistenceException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createShadowsTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = """
                    CREATE TABLE IF NOT EXISTS shadowsync.shadows (
                        device_id VARCHAR(255) PRIMARY KEY,
                        reported JSONB NOT NULL,
                        desired JSONB NOT NULL,
                        version BIGINT NOT NULL,
                        last_modified BIGINT NOT NULL,
                        active BOOLEAN NOT NULL DEFAULT TRUE,
                        removed JSONB NOT NULL DEFAULT '{}'
                    )""";

            stmt.execute(sql);
            // tables created before removal tombstones were kept
            stmt.execute("ALTER TABLE shadowsync.shadows ADD COLUMN IF NOT EXISTS removed JSONB NOT NULL DEFAULT '{}'");
            logger.atInfo().log("Shadows table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating shadows table");
            throw new ShadowPersistenceException("Failed to create shadows table", e);
        }
        return this;
    }

    public DatabaseSetup createHistoryTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = """
                    CREATE TABLE IF NOT EXISTS shadowsync.shadow_history (
                        device_id VARCHAR(255) NOT NULL,
                        version BIGINT NOT NULL,
                        document JSONB NOT NULL,
                        PRIMARY KEY (device_id, version)
                    )""";

            stmt.execute(sql);
            logger.atInfo().log("Shadow history table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating shadow history table");
            throw new ShadowPersistenceException("Failed to create shadow history table", e);
        }
        return this;
    }

    private Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, username, password);
    }
}
