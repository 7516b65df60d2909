package com.animestats.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Writes the listing table and the four star-schema tables as CSV files using OpenCSV.
 * <p>
 * Files written into the output directory:
 * <ul>
 *   <li>{@code top_anime.csv}: listing rows in listing order</li>
 *   <li>{@code anime_facts.csv}: one row per entity</li>
 *   <li>{@code anime_genres.csv}, {@code anime_studios.csv}: id/name edges</li>
 *   <li>{@code anime_reviews.csv}: review edges</li>
 * </ul>
 * Nulls are written as empty cells; dates as ISO-8601.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String LISTING_FILE = "top_anime.csv";
    static final String FACTS_FILE = "anime_facts.csv";
    static final String GENRES_FILE = "anime_genres.csv";
    static final String STUDIOS_FILE = "anime_studios.csv";
    static final String REVIEWS_FILE = "anime_reviews.csv";

    static final String[] LISTING_HEADER = {"id", "rank", "title", "url", "score", "media_type", "episodes", "members"};
    static final String[] FACTS_HEADER = {
        "id", "title", "score", "episodes", "status", "season", "year", "members", "favorites",
        "minutes_per_episode", "total_runtime_minutes", "start_date", "end_date", "airing_status",
        "broadcast_day", "broadcast_time", "url"
    };
    static final String[] GENRES_HEADER = {"id", "genre"};
    static final String[] STUDIOS_HEADER = {"id", "studio"};
    static final String[] REVIEWS_HEADER = {"id", "reviewer", "date", "score", "content", "helpful_count"};

    private final Path outputDirectory;

    public CsvService(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    @Override
    public String name() {
        return "csv:" + outputDirectory;
    }

    @Override
    public void export(PipelineResult result) throws ExportException {
        try {
            Files.createDirectories(outputDirectory);
            DimensionalTables tables = result.tables();
            write(LISTING_FILE, LISTING_HEADER, result.listing(), l -> new String[]{
                cell(l.id()), cell(l.rank()), l.title(), l.url(), cell(l.score()), l.mediaType(),
                cell(l.episodeCount()), cell(l.memberCount())
            });
            write(FACTS_FILE, FACTS_HEADER, tables.facts(), f -> new String[]{
                cell(f.id()), f.title(), cell(f.score()), cell(f.episodes()), f.status(), f.season(), cell(f.year()),
                cell(f.members()), cell(f.favorites()), cell(f.minutesPerEpisode()), cell(f.totalRuntimeMinutes()),
                cell(f.startDate()), cell(f.endDate()), f.airingStatus() == null ? "" : f.airingStatus().label(),
                f.broadcastDay(), f.broadcastTime(), f.url()
            });
            write(GENRES_FILE, GENRES_HEADER, tables.genreEdges(), g -> new String[]{cell(g.id()), g.genre()});
            write(STUDIOS_FILE, STUDIOS_HEADER, tables.studioEdges(), s -> new String[]{cell(s.id()), s.studio()});
            write(REVIEWS_FILE, REVIEWS_HEADER, tables.reviewEdges(), r -> new String[]{
                cell(r.id()), r.reviewer(), cell(r.date()), cell(r.score()), r.content(), cell(r.helpfulCount())
            });
        } catch (IOException e) {
            throw new ExportException("CSV export to " + outputDirectory + " failed", e);
        }
    }

    @Override
    public void writeTable(Path file, String[] header, List<String[]> rows) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(header);
            for (String[] row : rows) {
                String[] cleaned = new String[row.length];
                for (int i = 0; i < row.length; i++) cleaned[i] = safe(row[i]);
                writer.writeNext(cleaned);
            }
        }
    }

    private <T> void write(String filename, String[] header, List<T> records, Function<T, String[]> toRow) throws IOException {
        Path file = outputDirectory.resolve(filename);
        List<String[]> rows = new ArrayList<>(records.size());
        for (T record : records) rows.add(toRow.apply(record));
        writeTable(file, header, rows);
        if (rows.isEmpty()) {
            logger.warn("No rows for {}, wrote header only", file);
        } else {
            logger.info("Wrote {} rows to {}", rows.size(), file);
        }
    }

    private static String cell(Object value) {
        return value == null ? "" : value.toString();
    }

    /**
     * Null to empty, line breaks collapsed to a space.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
