package com.animestats.scraper;

import com.animestats.scraper.document.DocumentParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PipelineCoordinatorTest {
    private static final String EMPTY_PAGE = "<html><body><table></table></body></html>";

    private static String listingUrl(int offset) {
        return Fixtures.BASE_URL + "/topanime.php?limit=" + offset;
    }

    private static FakeTransport siteWithDetails(FakeTransport transport, int... ids) {
        for (int id : ids) {
            transport.page(Fixtures.BASE_URL + "/anime/" + id, Fixtures.html("detail.html"));
            transport.page(Fixtures.BASE_URL + "/anime/" + id + "/reviews", Fixtures.html("reviews.html"));
        }
        return transport;
    }

    private static PipelineCoordinator coordinator(CollectorConfig config, FakeTransport transport, ExportServiceInterface... sinks) {
        FetchService fetcher = new FetchService(config, transport, RateLimiter.none(), DocumentParser.jsoup(Fixtures.SELECTORS));
        FieldExtractor extractor = new FieldExtractor(config.baseUrl());
        BatchOrchestrator orchestrator = new BatchOrchestrator(fetcher, extractor, config.reviewsPerEntity());
        return new PipelineCoordinator(config, fetcher, extractor, orchestrator, new DimensionalTransformer(), List.of(sinks));
    }

    private static long detailRequests(FakeTransport transport) {
        return transport.requests.stream().map(URI::getPath).filter(p -> p.startsWith("/anime/")).count();
    }

    @Test
    void testEmptyListingExhaustsWithoutDetailStage() {
        FakeTransport transport = new FakeTransport().page(listingUrl(0), EMPTY_PAGE);
        RecordingSink sink = new RecordingSink(false);
        CollectorConfig config = Fixtures.config().listingLimit(55).detailsLimit(30).build();

        PipelineResult result = coordinator(config, transport, sink).run();

        assertTrue(result.tables().facts().isEmpty());
        assertEquals(PipelineStage.LISTING, result.exhausted().orElseThrow().stage());
        assertEquals(StageStatus.EXHAUSTED, result.stage(PipelineStage.LISTING).orElseThrow().status());
        assertEquals(StageStatus.SKIPPED, result.stage(PipelineStage.DETAILS).orElseThrow().status());
        assertEquals(0, detailRequests(transport));
        assertEquals(1, sink.received.size());
    }

    @Test
    void testFullRun() {
        FakeTransport transport = siteWithDetails(new FakeTransport().page(listingUrl(0), Fixtures.html("listing.html")), 5114, 52991);
        RecordingSink sink = new RecordingSink(false);
        CollectorConfig config = Fixtures.config().listingLimit(3).detailsLimit(2).reviewsPerEntity(1).build();

        PipelineResult result = coordinator(config, transport, sink).run();

        assertFalse(result.exhausted().isPresent());
        assertEquals(3, result.listing().size());
        assertEquals(2, result.details().size());
        assertEquals(List.of(5114, 52991), result.tables().facts().stream().map(AnimeFact::id).toList());
        assertEquals(6, result.tables().genreEdges().size());
        assertEquals(2, result.tables().reviewEdges().size());
        for (StageReport report : result.stages()) {
            assertEquals(StageStatus.SUCCEEDED, report.status(), report.stage().name());
        }
        assertSame(result, sink.received.get(0));
    }

    @Test
    void testListingStopsMidPageAtLimit() {
        FakeTransport transport = siteWithDetails(new FakeTransport().page(listingUrl(0), Fixtures.html("listing.html")), 5114);
        CollectorConfig config = Fixtures.config().listingLimit(1).detailsLimit(1).reviewsPerEntity(0).build();

        PipelineResult result = coordinator(config, transport).run();

        assertEquals(1, result.listing().size());
        assertEquals(5114, result.listing().get(0).id());
    }

    @Test
    void testListingPagesAdvanceByPageSize() {
        FakeTransport transport = new FakeTransport()
                .page(listingUrl(0), Fixtures.html("listing.html"))
                .page(listingUrl(2), Fixtures.html("listing.html"));
        CollectorConfig config = Fixtures.config().listingPageSize(2).listingLimit(5).detailsLimit(0).build();

        PipelineResult result = coordinator(config, transport).run();

        assertEquals(5, result.listing().size());
        assertEquals(List.of(URI.create(listingUrl(0)), URI.create(listingUrl(2))), transport.requests);
    }

    @Test
    void testFailedListingPageIsSkipped() {
        FakeTransport transport = siteWithDetails(new FakeTransport()
                .status(listingUrl(0), 503)
                .page(listingUrl(50), Fixtures.html("listing.html")), 5114);
        CollectorConfig config = Fixtures.config().listingLimit(55).detailsLimit(1).reviewsPerEntity(0).build();

        PipelineResult result = coordinator(config, transport).run();

        assertEquals(3, result.listing().size());
        assertEquals(StageStatus.PARTIAL, result.stage(PipelineStage.LISTING).orElseThrow().status());
        assertEquals(1, result.tables().facts().size());
    }

    @Test
    void testSelectionKeepsListingOrderAndDropsDuplicates() {
        ListingRecord a = new ListingRecord(9, 1, "A", "", null, "", null, null);
        ListingRecord b = new ListingRecord(3, 2, "B", "", null, "", null, null);
        ListingRecord c = new ListingRecord(5, 3, "C", "", null, "", null, null);

        assertEquals(List.of(9, 3), PipelineCoordinator.selectIds(List.of(a, b, a, c), 2));
        assertEquals(List.of(9, 3, 5), PipelineCoordinator.selectIds(List.of(a, b, a, c), 10));
    }

    @Test
    void testAllDetailsFailingExhaustsDetailStage() {
        FakeTransport transport = new FakeTransport().page(listingUrl(0), Fixtures.html("listing.html"));
        RecordingSink sink = new RecordingSink(false);
        CollectorConfig config = Fixtures.config().listingLimit(3).detailsLimit(3).build();

        PipelineResult result = coordinator(config, transport, sink).run();

        assertEquals(PipelineStage.DETAILS, result.exhausted().orElseThrow().stage());
        assertEquals(3, result.listing().size());
        assertEquals(StageStatus.SKIPPED, result.stage(PipelineStage.TRANSFORM).orElseThrow().status());
        assertEquals(3, sink.received.get(0).listing().size());
    }

    @Test
    void testPartialDetails() {
        FakeTransport transport = siteWithDetails(new FakeTransport().page(listingUrl(0), Fixtures.html("listing.html")), 5114);
        CollectorConfig config = Fixtures.config().listingLimit(3).detailsLimit(3).reviewsPerEntity(0).build();

        PipelineResult result = coordinator(config, transport).run();

        StageReport details = result.stage(PipelineStage.DETAILS).orElseThrow();
        assertEquals(StageStatus.PARTIAL, details.status());
        assertEquals(1, details.produced());
        assertEquals(3, details.expected());
        assertEquals(1, result.tables().facts().size());
    }

    @Test
    void testFailingSinkDoesNotStopOthers() {
        FakeTransport transport = new FakeTransport().page(listingUrl(0), EMPTY_PAGE);
        RecordingSink failing = new RecordingSink(true);
        RecordingSink healthy = new RecordingSink(false);
        CollectorConfig config = Fixtures.config().listingLimit(5).detailsLimit(5).build();

        coordinator(config, transport, failing, healthy).run();

        assertEquals(1, failing.received.size());
        assertEquals(1, healthy.received.size());
    }

    @Test
    void testZeroDetailsLimitSkipsDetailStage() {
        FakeTransport transport = new FakeTransport().page(listingUrl(0), Fixtures.html("listing.html"));
        CollectorConfig config = Fixtures.config().listingLimit(3).detailsLimit(0).build();

        PipelineResult result = coordinator(config, transport).run();

        assertFalse(result.exhausted().isPresent());
        assertEquals(StageStatus.SKIPPED, result.stage(PipelineStage.DETAILS).orElseThrow().status());
        assertEquals(0, detailRequests(transport));
    }

    @Test
    void testCancelledBeforeStartFetchesNothing() throws InterruptedException {
        FakeTransport transport = new FakeTransport().page(listingUrl(0), Fixtures.html("listing.html"));
        CollectorConfig config = Fixtures.config().listingLimit(3).detailsLimit(3).build();
        PipelineCoordinator coordinator = coordinator(config, transport);
        coordinator.cancel();

        PipelineResult result = coordinator.run();

        assertTrue(result.cancelled());
        assertFalse(result.exhausted().isPresent());
        assertTrue(transport.requests.isEmpty());
        assertTrue(coordinator.awaitCompletion(Duration.ofSeconds(1)));
    }

    @Test
    void testCancelDuringDetailsHandsOffCollectedRecords() throws InterruptedException {
        AtomicReference<PipelineCoordinator> self = new AtomicReference<>();
        FakeTransport transport = new FakeTransport() {
            @Override
            public TransportResponse get(URI uri, Map<String, String> requestHeaders, Duration timeout) throws IOException {
                if (uri.getPath().startsWith("/anime/")) self.get().cancel();
                return super.get(uri, requestHeaders, timeout);
            }
        };
        siteWithDetails(transport.page(listingUrl(0), Fixtures.html("listing.html")), 5114, 52991, 28977);
        RecordingSink sink = new RecordingSink(false);
        CollectorConfig config = Fixtures.config().listingLimit(3).detailsLimit(3).maxWorkers(1).reviewsPerEntity(2).build();
        PipelineCoordinator coordinator = coordinator(config, transport, sink);
        self.set(coordinator);

        PipelineResult result = coordinator.run();

        assertTrue(result.cancelled());
        assertFalse(result.exhausted().isPresent());
        assertEquals(List.of(5114), result.tables().facts().stream().map(AnimeFact::id).toList());
        StageReport details = result.stage(PipelineStage.DETAILS).orElseThrow();
        assertEquals(StageStatus.PARTIAL, details.status());
        assertEquals("0 failed, 2 skipped", details.note());
        assertEquals(1, detailRequests(transport));
        assertSame(result, sink.received.get(0));
        assertTrue(coordinator.awaitCompletion(Duration.ofSeconds(1)));
    }
}
