package com.animestats.scraper;

import com.animestats.scraper.document.DocumentParser;
import com.animestats.scraper.document.JsoupDocument;
import com.animestats.scraper.document.SelectorRegistry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point: collects the ranked anime listing, profiles and reviews, reshapes them
 * into a star schema and exports CSV, JSON and optionally PostgreSQL.
 * <p>
 * Exit status is 0 for every completed run, including runs that ended early because a
 * stage ran dry, and 2 for configuration errors detected before any network activity.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 2;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args != null && List.of(args).contains("--help")) {
            System.out.println(usage());
            return EXIT_OK;
        }
        CollectorConfig config;
        SelectorRegistry selectors;
        int embeddedPort;
        try {
            config = CollectorConfig.fromEnvironment(args);
            selectors = SelectorRegistry.load(config.selectorResource());
            JsoupDocument.validateSelectors(selectors);
            embeddedPort = embeddedPort();
            Files.createDirectories(config.outputDirectory());
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            System.err.println(e.getMessage());
            System.err.println("Run with --help for usage.");
            return EXIT_CONFIG;
        } catch (IOException e) {
            logger.error("Cannot create output directory: {}", e.getMessage());
            return EXIT_CONFIG;
        }
        logger.info("Starting run: listingLimit={}, detailsLimit={}, maxWorkers={}, transport={}, output={}",
                config.listingLimit(), config.detailsLimit(), config.maxWorkers(), config.transport(), config.outputDirectory());

        EmbeddedPostgres postgres = null;
        try (PageTransport transport = createTransport(config)) {
            List<ExportServiceInterface> sinks = new ArrayList<>();
            sinks.add(new CsvService(config.outputDirectory()));
            sinks.add(new JsonService(config.outputDirectory()));
            if (config.embeddedDb()) {
                postgres = PostgresService.startEmbedded(config.outputDirectory().resolve("pgdata"), embeddedPort);
                sinks.add(new PostgresService(postgres.getJdbcUrl("postgres", "postgres"), "postgres", "postgres"));
            } else if (config.databaseEnabled()) {
                sinks.add(new PostgresService(config.dbUrl(), config.dbUser(), config.dbPass()));
            }

            FieldExtractor extractor = new FieldExtractor(config.baseUrl());
            FetchService fetcher = new FetchService(config, transport, config.rateLimiter(), DocumentParser.jsoup(selectors));
            BatchOrchestrator orchestrator = new BatchOrchestrator(fetcher, extractor, config.reviewsPerEntity());
            PipelineCoordinator coordinator = new PipelineCoordinator(config, fetcher, extractor, orchestrator,
                    new DimensionalTransformer(), sinks);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                coordinator.cancel();
                try {
                    if (!coordinator.awaitCompletion(SHUTDOWN_GRACE)) {
                        logger.warn("Run did not finish within {} after shutdown request", SHUTDOWN_GRACE);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-cancel"));

            PipelineResult result = coordinator.run();
            logger.info("Run finished{}", result.cancelled() ? " (cancelled)" : "");
        } catch (IOException e) {
            logger.error("Failed to start embedded PostgreSQL: {}", e.getMessage(), e);
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
        return EXIT_OK;
    }

    private static PageTransport createTransport(CollectorConfig config) {
        if (CollectorConfig.TRANSPORT_BROWSER.equals(config.transport())) {
            logger.info("Using headless browser transport");
            return new PlaywrightTransport();
        }
        return new HttpClientTransport(config.requestTimeout());
    }

    private static int embeddedPort() {
        String portStr = System.getProperty("EMBEDDED_PG_PORT", System.getenv().getOrDefault("EMBEDDED_PG_PORT", "5432"));
        try {
            return Integer.parseInt(portStr.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("EMBEDDED_PG_PORT must be an integer, got '" + portStr + "'", e);
        }
    }

    static String usage() {
        StringBuilder sb = new StringBuilder("Usage: anime-stats-scraper [options]\n\nOptions (also read from the environment):\n");
        for (String flag : CollectorConfig.flagNames()) {
            sb.append("  ").append(flag).append("=VALUE\n");
        }
        sb.append("  --help\n");
        return sb.toString();
    }
}
