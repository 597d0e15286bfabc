package com.p14n.shadowsync.db;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.codec.JsonUtil;
import com.p14n.shadowsync.codec.ShadowDocumentCodec;
import com.p14n.shadowsync.shadow.ShadowDocument;
import com.p14n.shadowsync.shadow.ShadowRepository;

/**
 * Stores one row per device in {@code shadowsync.shadows}, with the reported
 * and desired sections as JSONB. A save never replaces a row holding a newer
 * version. Every accepted save is also written to
 * {@code shadowsync.shadow_history}, which keeps the latest
 * {@code historySize} versions per device.
 */
public class JdbcShadowRepository implements ShadowRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcShadowRepository.class);

    public static final int DEFAULT_HISTORY_SIZE = 100;

    private static final String SELECT_SQL = """
            SELECT device_id, reported, desired, version, last_modified, active, removed
            FROM shadowsync.shadows WHERE device_id = ?""";

    private static final String UPSERT_SQL = """
            INSERT INTO shadowsync.shadows (device_id, reported, desired, version, last_modified, active, removed)
            VALUES (?, CAST(? AS jsonb), CAST(? AS jsonb), ?, ?, ?, CAST(? AS jsonb))
            ON CONFLICT (device_id) DO UPDATE SET
                reported = EXCLUDED.reported,
                desired = EXCLUDED.desired,
                version = EXCLUDED.version,
                last_modified = EXCLUDED.last_modified,
                active = EXCLUDED.active,
                removed = EXCLUDED.removed
            WHERE shadowsync.shadows.version <= EXCLUDED.version""";

    private static final String HISTORY_UPSERT_SQL = """
            INSERT INTO shadowsync.shadow_history (device_id, version, document)
            VALUES (?, ?, CAST(? AS jsonb))
            ON CONFLICT (device_id, version) DO UPDATE SET document = EXCLUDED.document""";

    private static final String HISTORY_PRUNE_SQL = """
            DELETE FROM shadowsync.shadow_history
            WHERE device_id = ? AND version <= ?""";

    private static final String HISTORY_SELECT_SQL = """
            SELECT document FROM shadowsync.shadow_history
            WHERE device_id = ? ORDER BY version DESC LIMIT ?""";

    private final DataSource dataSource;
    private final int historySize;

    public JdbcShadowRepository(DataSource dataSource) {
        this(dataSource, DEFAULT_HISTORY_SIZE);
    }

    public JdbcShadowRepository(DataSource dataSource, int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("History size cannot be negative");
        }
        this.dataSource = dataSource;
        this.historySize = historySize;
    }

    @Override
    public Optional<ShadowDocument> loadShadow(String deviceId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, deviceId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                JsonNode removed = JsonUtil.parse(rs.getString("removed"));
                return Optional.of(new ShadowDocument(
                        rs.getString("device_id"),
                        ShadowDocumentCodec.reportedFromJson(JsonUtil.parse(rs.getString("reported"))),
                        ShadowDocumentCodec.desiredFromJson(JsonUtil.parse(rs.getString("desired"))),
                        rs.getLong("version"),
                        rs.getLong("last_modified"),
                        rs.getBoolean("active"),
                        ShadowDocumentCodec.removedFromJson(removed, "reported"),
                        ShadowDocumentCodec.removedFromJson(removed, "desired")));
            }
        } catch (SQLException e) {
            logger.atError().setCause(e).addArgument(deviceId).log("Error loading shadow for {}");
            throw new ShadowPersistenceException("Failed to load shadow for " + deviceId, e);
        } catch (IOException e) {
            throw new ShadowPersistenceException("Stored shadow for " + deviceId + " is not valid JSON", e);
        }
    }

    @Override
    public boolean saveShadow(ShadowDocument document) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                boolean saved = upsert(conn, document);
                if (saved && historySize > 0) {
                    recordHistory(conn, document);
                }
                conn.commit();
                if (!saved) {
                    logger.atDebug().addArgument(document.deviceId()).addArgument(document.version())
                            .log("Stored shadow for {} is newer than version {}, not overwritten");
                }
                return saved;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.atError().setCause(e).addArgument(document.deviceId()).log("Error saving shadow for {}");
            throw new ShadowPersistenceException("Failed to save shadow for " + document.deviceId(), e);
        }
    }

    @Override
    public List<ShadowDocument> history(String deviceId, int limit) {
        List<ShadowDocument> history = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(HISTORY_SELECT_SQL)) {
            stmt.setString(1, deviceId);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    history.add(ShadowDocumentCodec.fromJson(JsonUtil.parse(rs.getString("document"))));
                }
            }
            return history;
        } catch (SQLException e) {
            logger.atError().setCause(e).addArgument(deviceId).log("Error loading history for {}");
            throw new ShadowPersistenceException("Failed to load history for " + deviceId, e);
        } catch (IOException e) {
            throw new ShadowPersistenceException("Stored history for " + deviceId + " is not valid JSON", e);
        }
    }

    private boolean upsert(Connection conn, ShadowDocument document) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, document.deviceId());
            stmt.setString(2, ShadowDocumentCodec.reportedToJson(document.reported()).toString());
            stmt.setString(3, ShadowDocumentCodec.desiredToJson(document.desired()).toString());
            stmt.setLong(4, document.version());
            stmt.setLong(5, document.lastModified());
            stmt.setBoolean(6, document.active());
            stmt.setString(7, ShadowDocumentCodec
                    .removedToJson(document.reportedRemoved(), document.desiredRemoved()).toString());
            return stmt.executeUpdate() > 0;
        }
    }

    private void recordHistory(Connection conn, ShadowDocument document) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(HISTORY_UPSERT_SQL)) {
            stmt.setString(1, document.deviceId());
            stmt.setLong(2, document.version());
            stmt.setString(3, ShadowDocumentCodec.toJson(document).toString());
            stmt.executeUpdate();
        }
        try (PreparedStatement stmt = conn.prepareStatement(HISTORY_PRUNE_SQL)) {
            stmt.setString(1, document.deviceId());
            stmt.setLong(2, document.version() - historySize);
            stmt.executeUpdate();
        }
    }
}
