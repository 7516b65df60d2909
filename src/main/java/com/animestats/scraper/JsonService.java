package com.animestats.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the raw detail records and a run report as pretty-printed JSON.
 * Dates are ISO-8601 strings.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class JsonService implements ExportServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(JsonService.class);

    static final String DETAILS_FILE = "anime_details_raw.json";
    static final String REPORT_FILE = "run_report.json";

    private final Path outputDirectory;
    private final ObjectMapper mapper;

    public JsonService(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        this.mapper = objectMapper();
    }

    /**
     * Mapper used for every JSON file this tool writes.
     */
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String name() {
        return "json:" + outputDirectory;
    }

    @Override
    public void export(PipelineResult result) throws ExportException {
        try {
            Files.createDirectories(outputDirectory);
            Path details = outputDirectory.resolve(DETAILS_FILE);
            mapper.writeValue(details.toFile(), result.details());
            logger.info("Wrote {} raw detail records to {}", result.details().size(), details);

            Path report = outputDirectory.resolve(REPORT_FILE);
            mapper.writeValue(report.toFile(), report(result));
            logger.info("Wrote run report to {}", report);
        } catch (IOException e) {
            throw new ExportException("JSON export to " + outputDirectory + " failed", e);
        }
    }

    static Map<String, Object> report(PipelineResult result) {
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("listing", result.listing().size());
        counts.put("details", result.details().size());
        counts.put("facts", result.tables().facts().size());
        counts.put("genreEdges", result.tables().genreEdges().size());
        counts.put("studioEdges", result.tables().studioEdges().size());
        counts.put("reviewEdges", result.tables().reviewEdges().size());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("cancelled", result.cancelled());
        report.put("exhausted", result.exhaustedStage());
        report.put("stages", result.stages());
        report.put("counts", counts);
        return report;
    }
}
