package com.p14n.shadowsync.db;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.p14n.shadowsync.shadow.DesiredProperty;
import com.p14n.shadowsync.shadow.InMemoryDeviceRegistry;
import com.p14n.shadowsync.shadow.ReportedProperty;
import com.p14n.shadowsync.shadow.ShadowDocument;
import com.p14n.shadowsync.shadow.ShadowDocumentStore;

import io.opentelemetry.api.OpenTelemetry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;

class JdbcShadowRepositoryTest {

    private EmbeddedPostgres postgres;
    private JdbcShadowRepository repository;

    @BeforeEach
    void setUp() throws IOException {
        postgres = EmbeddedPostgres.start();
        new DatabaseSetup(postgres.getJdbcUrl("postgres", "postgres"), "postgres", "postgres").setupAll();
        repository = new JdbcShadowRepository(postgres.getPostgresDatabase());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (postgres != null) {
            postgres.close();
        }
    }

    private static ShadowDocument document(long version) {
        return new ShadowDocument("wh-1",
                Map.of("temperature", new ReportedProperty(IntNode.valueOf(125), 100),
                        "mode", new ReportedProperty(TextNode.valueOf("eco"), 80)),
                Map.of("target_temperature", new DesiredProperty(IntNode.valueOf(130), 90, false)),
                version, 1_000 + version, true);
    }

    @Test
    void createsShadowsTable() throws SQLException {
        try (Connection conn = postgres.getPostgresDatabase().getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT column_name FROM information_schema.columns "
                        + "WHERE table_schema = 'shadowsync' AND table_name = 'shadows' ORDER BY ordinal_position")) {
            List<String> columns = new ArrayList<>();
            while (rs.next()) {
                columns.add(rs.getString("column_name"));
            }
            assertEquals(List.of("device_id", "reported", "desired", "version", "last_modified", "active", "removed"),
                    columns);
        }
    }

    @Test
    void missingShadowIsEmpty() {
        assertEquals(Optional.empty(), repository.loadShadow("wh-1"));
    }

    @Test
    void savesAndLoadsDocument() {
        repository.saveShadow(document(3));

        ShadowDocument loaded = repository.loadShadow("wh-1").orElseThrow();
        assertEquals(document(3), loaded);
    }

    @Test
    void keepsRemovalTimestamps() {
        ShadowDocument withRemovals = new ShadowDocument("wh-1", Map.of(), Map.of(), 2, 1_002, true,
                Map.of("mode", 150L), Map.of("target_temperature", 160L));
        repository.saveShadow(withRemovals);

        ShadowDocument loaded = repository.loadShadow("wh-1").orElseThrow();
        assertEquals(Map.of("mode", 150L), loaded.reportedRemoved());
        assertEquals(Map.of("target_temperature", 160L), loaded.desiredRemoved());
    }

    @Test
    void neverOverwritesNewerVersion() {
        assertTrue(repository.saveShadow(document(5)));
        assertFalse(repository.saveShadow(document(4)));

        assertEquals(5, repository.loadShadow("wh-1").orElseThrow().version());

        repository.saveShadow(document(5).deactivated(9_999));
        ShadowDocument loaded = repository.loadShadow("wh-1").orElseThrow();
        assertFalse(loaded.active());
        assertEquals(9_999, loaded.lastModified());
    }

    @Test
    void historyIsNewestFirstAndBounded() {
        JdbcShadowRepository bounded = new JdbcShadowRepository(postgres.getPostgresDatabase(), 3);
        for (long version = 1; version <= 5; version++) {
            bounded.saveShadow(document(version));
        }
        bounded.saveShadow(document(5).deactivated(9_999));

        List<ShadowDocument> history = bounded.history("wh-1", 10);
        assertEquals(List.of(5L, 4L, 3L), history.stream().map(ShadowDocument::version).toList());
        assertFalse(history.get(0).active());
        assertEquals(document(4), history.get(1));
        assertEquals(2, bounded.history("wh-1", 2).size());
        assertTrue(bounded.history("wh-2", 10).isEmpty());
    }

    @Test
    void refusedSaveIsNotRecordedInHistory() {
        repository.saveShadow(document(5));
        repository.saveShadow(document(4));

        assertEquals(List.of(5L), repository.history("wh-1", 10).stream().map(ShadowDocument::version).toList());
    }

    @Test
    void backsTheDocumentStore() {
        ShadowDocumentStore store = new ShadowDocumentStore(repository, new InMemoryDeviceRegistry(List.of("wh-1")),
                false, () -> 500L, OpenTelemetry.noop());

        store.applyReported("wh-1", Map.of("temperature", 125), 100);
        store.applyDesired("wh-1", Map.of("target_temperature", 130), 110);
        store.applyReported("wh-1", Map.of("temperature", 125), 120);

        ShadowDocument loaded = repository.loadShadow("wh-1").orElseThrow();
        assertEquals(2, loaded.version());
        assertEquals(120, loaded.reported().get("temperature").timestamp());
        assertFalse(loaded.desired().get("target_temperature").applied());
    }
}
