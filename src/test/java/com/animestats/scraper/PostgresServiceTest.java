package com.animestats.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.junit.jupiter.api.io.TempDir;

import java.net.ServerSocket;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against an embedded server; enable with {@code -DembeddedPostgres=true}.
 */
@EnabledIfSystemProperty(named = "embeddedPostgres", matches = "true")
class PostgresServiceTest {
    @TempDir
    Path dir;

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static int count(Connection conn, String table) throws Exception {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void testReplaceRunStoresStarSchema() throws Exception {
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(dir.resolve("pgdata"), freePort())) {
            PostgresService service = new PostgresService(postgres.getJdbcUrl("postgres", "postgres"), "postgres", "postgres");

            service.export(SampleRun.result());
            service.export(SampleRun.result());

            try (Connection conn = service.connect()) {
                assertEquals(2, count(conn, "anime_listing"));
                assertEquals(1, count(conn, "anime_facts"));
                assertEquals(2, count(conn, "anime_genres"));
                assertEquals(1, count(conn, "anime_studios"));
                assertEquals(1, count(conn, "anime_reviews"));
            }
        }
    }
}
