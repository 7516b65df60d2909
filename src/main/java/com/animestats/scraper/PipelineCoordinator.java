package com.animestats.scraper;

import com.animestats.scraper.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sequences one collection run: listing pages, id selection, the concurrent detail
 * batch, the star-schema transform and the hand-off to the configured sinks.
 * <p>
 * A stage that yields zero usable records ends the run early with a
 * {@link PipelineStageExhausted} warning attached to the result. Whatever earlier
 * stages produced is still handed to the sinks. A sink that fails is logged and does
 * not stop the others.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class PipelineCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinator.class);

    static final String LISTING_PATH = "/topanime.php";
    static final String LISTING_OFFSET_PARAM = "limit";

    private final CollectorConfig config;
    private final FetchServiceInterface fetcher;
    private final FieldExtractor extractor;
    private final BatchOrchestrator orchestrator;
    private final DimensionalTransformer transformer;
    private final List<ExportServiceInterface> sinks;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);

    public PipelineCoordinator(CollectorConfig config, FetchServiceInterface fetcher, FieldExtractor extractor,
                               BatchOrchestrator orchestrator, DimensionalTransformer transformer,
                               List<ExportServiceInterface> sinks) {
        this.config = config;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.orchestrator = orchestrator;
        this.transformer = transformer;
        this.sinks = List.copyOf(sinks);
    }

    /**
     * Runs the pipeline once and hands the result to every sink.
     * @return the run's result, possibly partial
     */
    public PipelineResult run() {
        try {
            PipelineResult result = collect();
            handOff(result);
            logSummary(result);
            return result;
        } finally {
            finished.countDown();
        }
    }

    /**
     * Runs every stage without touching the sinks.
     * @return the run's result, possibly partial
     */
    public PipelineResult collect() {
        List<StageReport> reports = new ArrayList<>();

        List<ListingRecord> listing = fetchListing();
        reports.add(report(PipelineStage.LISTING, listing.size(), config.listingLimit()));
        if (listing.isEmpty() && cancelled.get()) {
            for (PipelineStage later : List.of(PipelineStage.SELECTION, PipelineStage.DETAILS, PipelineStage.TRANSFORM)) {
                reports.add(StageReport.skipped(later, "cancelled"));
            }
            return new PipelineResult(listing, List.of(), DimensionalTables.EMPTY, reports, null, true);
        }
        if (listing.isEmpty()) {
            return stop(listing, List.of(), reports, PipelineStage.LISTING, "listing yielded no records");
        }

        List<Integer> ids = selectIds(listing, config.detailsLimit());
        if (config.detailsLimit() == 0) {
            reports.add(StageReport.skipped(PipelineStage.SELECTION, "detailsLimit is 0"));
            reports.add(StageReport.skipped(PipelineStage.DETAILS, "nothing selected"));
            reports.add(StageReport.skipped(PipelineStage.TRANSFORM, "no details"));
            return new PipelineResult(listing, List.of(), DimensionalTables.EMPTY, reports, null, cancelled.get());
        }
        reports.add(report(PipelineStage.SELECTION, ids.size(), config.detailsLimit()));
        if (ids.isEmpty()) {
            return stop(listing, List.of(), reports, PipelineStage.SELECTION, "no resolvable ids in listing");
        }

        if (cancelled.get()) {
            reports.add(new StageReport(PipelineStage.DETAILS, StageStatus.CANCELLED, 0, ids.size(), "cancelled before start"));
            reports.add(StageReport.skipped(PipelineStage.TRANSFORM, "no details"));
            return new PipelineResult(listing, List.of(), DimensionalTables.EMPTY, reports, null, true);
        }
        logger.info("Fetching details for {} ids with {} workers", ids.size(), config.maxWorkers());
        BatchResult batch = orchestrator.runBatch(ids, config.maxWorkers(), ProgressListener.NONE);
        reports.add(detailsReport(batch));
        if (batch.details().isEmpty()) {
            return stop(listing, batch.details(), reports, PipelineStage.DETAILS, "no detail record could be fetched");
        }

        DimensionalTables tables = transformer.transform(batch.details());
        reports.add(new StageReport(PipelineStage.TRANSFORM, StageStatus.SUCCEEDED, tables.facts().size(), batch.details().size(), ""));
        return new PipelineResult(listing, batch.details(), tables, reports, null, cancelled.get());
    }

    /**
     * Stops new listing pages and detail units from starting. In-flight work completes
     * and the run still transforms and hands off what it has.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.warn("Pipeline cancellation requested");
        }
        orchestrator.cancel();
    }

    /**
     * Waits for a running {@link #run()} to finish its hand-off.
     * @param timeout upper bound
     * @return true if the run finished in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    List<ListingRecord> fetchListing() {
        int limit = config.listingLimit();
        int pageSize = config.listingPageSize();
        int pages = (limit + pageSize - 1) / pageSize;
        List<ListingRecord> listing = new ArrayList<>();
        for (int page = 1; page <= pages && listing.size() < limit; page++) {
            if (cancelled.get()) {
                logger.warn("Listing stopped after {} pages: cancelled", page - 1);
                break;
            }
            int offset = (page - 1) * pageSize;
            logger.info("Fetching listing page {} (offset {})", page, offset);
            Outcome<Document, FetchError> fetched = fetcher.fetch(LISTING_PATH, Map.of(LISTING_OFFSET_PARAM, String.valueOf(offset)));
            if (fetched.isFailure()) {
                logger.warn("Failed to fetch listing page {}: {}", page, fetched.error().describe());
                continue;
            }
            List<ListingRecord> rows = extractor.extractListing(fetched.value());
            if (rows.isEmpty()) {
                logger.info("Listing page {} has no rows, end of listing", page);
                break;
            }
            int remaining = limit - listing.size();
            listing.addAll(rows.size() > remaining ? rows.subList(0, remaining) : rows);
        }
        logger.info("Collected {} listing records", listing.size());
        return listing;
    }

    /**
     * First {@code limit} distinct ids in listing order.
     */
    static List<Integer> selectIds(List<ListingRecord> listing, int limit) {
        Set<Integer> ids = new LinkedHashSet<>();
        for (ListingRecord record : listing) {
            if (ids.size() >= limit) break;
            ids.add(record.id());
        }
        return new ArrayList<>(ids);
    }

    private void handOff(PipelineResult result) {
        for (ExportServiceInterface sink : sinks) {
            try {
                sink.export(result);
                logger.info("Exported run to {}", sink.name());
            } catch (ExportException e) {
                logger.error("Export to {} failed: {}", sink.name(), e.getMessage(), e);
            } catch (RuntimeException e) {
                logger.error("Export to {} failed unexpectedly", sink.name(), e);
            }
        }
    }

    private PipelineResult stop(List<ListingRecord> listing, List<DetailRecord> details, List<StageReport> reports,
                                PipelineStage stage, String message) {
        PipelineStageExhausted exhausted = new PipelineStageExhausted(stage, message);
        logger.warn("Stage {} exhausted: {}", stage, message);
        for (PipelineStage later : PipelineStage.values()) {
            if (later.ordinal() > stage.ordinal()) {
                reports.add(StageReport.skipped(later, stage + " exhausted"));
            }
        }
        return new PipelineResult(listing, details, DimensionalTables.EMPTY, reports, exhausted, cancelled.get());
    }

    private StageReport report(PipelineStage stage, int produced, int expected) {
        StageStatus status;
        if (produced == 0) {
            status = cancelled.get() ? StageStatus.CANCELLED : StageStatus.EXHAUSTED;
        } else if (produced < expected) {
            status = StageStatus.PARTIAL;
        } else {
            status = StageStatus.SUCCEEDED;
        }
        return new StageReport(stage, status, produced, expected, "");
    }

    private StageReport detailsReport(BatchResult batch) {
        String note = batch.failures().size() + " failed, " + batch.skipped() + " skipped";
        StageStatus status;
        if (batch.details().isEmpty()) {
            status = batch.cancelled() ? StageStatus.CANCELLED : StageStatus.EXHAUSTED;
        } else if (batch.details().size() < batch.requested()) {
            status = StageStatus.PARTIAL;
        } else {
            status = StageStatus.SUCCEEDED;
        }
        return new StageReport(PipelineStage.DETAILS, status, batch.details().size(), batch.requested(), note);
    }

    private static void logSummary(PipelineResult result) {
        for (StageReport report : result.stages()) {
            logger.info("Stage {}: {} ({}/{}){}", report.stage(), report.status(), report.produced(), report.expected(),
                    report.note().isEmpty() ? "" : " - " + report.note());
        }
        result.exhausted().ifPresent(e -> logger.warn("Run ended early at {}: {}", e.stage(), e.message()));
        DimensionalTables tables = result.tables();
        logger.info("Run produced {} facts, {} genre edges, {} studio edges, {} review edges",
                tables.facts().size(), tables.genreEdges().size(), tables.studioEdges().size(), tables.reviewEdges().size());
    }
}
