package com.animestats.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Date;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;

/**
 * Stores a run's listing and star-schema tables in PostgreSQL.
 * <p>
 * Every run is a full snapshot: the previous rows are deleted and the new ones batch
 * inserted inside one transaction. Edge tables reference {@code anime_facts(id)} with
 * {@code ON DELETE CASCADE}.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);

    static final List<String> DDL = List.of(
        "CREATE TABLE IF NOT EXISTS anime_listing (" +
            "id INTEGER NOT NULL, rank INTEGER, title TEXT, url TEXT, score DOUBLE PRECISION, " +
            "media_type TEXT, episodes INTEGER, members INTEGER)",
        "CREATE TABLE IF NOT EXISTS anime_facts (" +
            "id INTEGER PRIMARY KEY, title TEXT, score DOUBLE PRECISION, episodes INTEGER, status TEXT, " +
            "season TEXT, year INTEGER, members INTEGER, favorites INTEGER, minutes_per_episode INTEGER, " +
            "total_runtime_minutes INTEGER, start_date DATE, end_date DATE, airing_status TEXT, " +
            "broadcast_day TEXT, broadcast_time TEXT, url TEXT)",
        "CREATE TABLE IF NOT EXISTS anime_genres (" +
            "id INTEGER NOT NULL REFERENCES anime_facts(id) ON DELETE CASCADE, genre TEXT NOT NULL)",
        "CREATE TABLE IF NOT EXISTS anime_studios (" +
            "id INTEGER NOT NULL REFERENCES anime_facts(id) ON DELETE CASCADE, studio TEXT NOT NULL)",
        "CREATE TABLE IF NOT EXISTS anime_reviews (" +
            "id INTEGER NOT NULL REFERENCES anime_facts(id) ON DELETE CASCADE, reviewer TEXT, review_date DATE, " +
            "score INTEGER, content TEXT, helpful_count INTEGER)"
    );

    private final String url;
    private final String user;
    private final String password;

    /**
     * @param url JDBC URL
     * @param user database user
     * @param password database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public String name() {
        return "postgres:" + url;
    }

    @Override
    public void export(PipelineResult result) throws ExportException {
        try {
            replaceRun(result);
        } catch (SQLException e) {
            throw new ExportException("Postgres export failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void createTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) stmt.execute(ddl);
        }
        logger.info("Ensured star-schema tables exist");
    }

    @Override
    public void replaceRun(PipelineResult result) throws SQLException {
        try (Connection conn = connect()) {
            createTables(conn);
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("DELETE FROM anime_listing");
                    stmt.executeUpdate("DELETE FROM anime_facts");
                }
                insertListing(conn, result.listing());
                DimensionalTables tables = result.tables();
                insertFacts(conn, tables.facts());
                insertGenres(conn, tables.genreEdges());
                insertStudios(conn, tables.studioEdges());
                insertReviews(conn, tables.reviewEdges());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            logger.info("Stored {} listing rows and {} facts", result.listing().size(), result.tables().facts().size());
        }
    }

    private static void insertListing(Connection conn, List<ListingRecord> rows) throws SQLException {
        String sql = "INSERT INTO anime_listing (id, rank, title, url, score, media_type, episodes, members) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (ListingRecord l : rows) {
                ps.setInt(1, l.id());
                setInt(ps, 2, l.rank());
                ps.setString(3, l.title());
                ps.setString(4, l.url());
                setDouble(ps, 5, l.score());
                ps.setString(6, l.mediaType());
                setInt(ps, 7, l.episodeCount());
                setInt(ps, 8, l.memberCount());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void insertFacts(Connection conn, List<AnimeFact> facts) throws SQLException {
        String sql = "INSERT INTO anime_facts (id, title, score, episodes, status, season, year, members, favorites, " +
                "minutes_per_episode, total_runtime_minutes, start_date, end_date, airing_status, broadcast_day, " +
                "broadcast_time, url) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (AnimeFact f : facts) {
                ps.setInt(1, f.id());
                ps.setString(2, f.title());
                setDouble(ps, 3, f.score());
                setInt(ps, 4, f.episodes());
                ps.setString(5, f.status());
                ps.setString(6, f.season());
                setInt(ps, 7, f.year());
                setInt(ps, 8, f.members());
                setInt(ps, 9, f.favorites());
                setInt(ps, 10, f.minutesPerEpisode());
                setInt(ps, 11, f.totalRuntimeMinutes());
                setDate(ps, 12, f.startDate());
                setDate(ps, 13, f.endDate());
                ps.setString(14, f.airingStatus() == null ? null : f.airingStatus().label());
                ps.setString(15, f.broadcastDay());
                ps.setString(16, f.broadcastTime());
                ps.setString(17, f.url());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void insertGenres(Connection conn, List<GenreEdge> edges) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO anime_genres (id, genre) VALUES (?, ?)")) {
            for (GenreEdge e : edges) {
                ps.setInt(1, e.id());
                ps.setString(2, e.genre());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void insertStudios(Connection conn, List<StudioEdge> edges) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO anime_studios (id, studio) VALUES (?, ?)")) {
            for (StudioEdge e : edges) {
                ps.setInt(1, e.id());
                ps.setString(2, e.studio());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void insertReviews(Connection conn, List<ReviewEdge> edges) throws SQLException {
        String sql = "INSERT INTO anime_reviews (id, reviewer, review_date, score, content, helpful_count) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (ReviewEdge e : edges) {
                ps.setInt(1, e.id());
                ps.setString(2, e.reviewer());
                setDate(ps, 3, e.date());
                setInt(ps, 4, e.score());
                ps.setString(5, e.content());
                ps.setInt(6, e.helpfulCount());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void setInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) ps.setInt(index, value); else ps.setNull(index, Types.INTEGER);
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) ps.setDouble(index, value); else ps.setNull(index, Types.DOUBLE);
    }

    private static void setDate(PreparedStatement ps, int index, LocalDate value) throws SQLException {
        if (value != null) ps.setDate(index, Date.valueOf(value)); else ps.setNull(index, Types.DATE);
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use.
     * @param dataDir directory under which to store DB data
     * @param port port number for the server
     * @return running instance; the caller closes it
     * @throws IOException if the server cannot start
     */
    public static EmbeddedPostgres startEmbedded(Path dataDir, int port) throws IOException {
        EmbeddedPostgres postgres = EmbeddedPostgres.builder()
            .setDataDirectory(dataDir)
            .setCleanDataDirectory(false)
            .setPort(port)
            .start();
        logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
        return postgres;
    }
}
