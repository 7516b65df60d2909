package com.animestats.scraper;

import com.animestats.scraper.document.Document;
import com.animestats.scraper.document.DocumentParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FetchServiceTest {
    private static final String LISTING_URL = Fixtures.BASE_URL + "/topanime.php?limit=50";

    private FetchService service(FakeTransport transport, CollectorConfig config) {
        return new FetchService(config, transport, RateLimiter.none(), DocumentParser.jsoup(Fixtures.SELECTORS), new Random(7));
    }

    @Test
    void testFetchParsesSuccessfulResponse() {
        FakeTransport transport = new FakeTransport().page(LISTING_URL, Fixtures.html("listing.html"));
        FetchService fetcher = service(transport, Fixtures.config().build());

        Outcome<Document, FetchError> result = fetcher.fetch("/topanime.php", Map.of("limit", "50"));

        assertTrue(result.isSuccess());
        assertEquals(LISTING_URL, result.value().location());
        assertEquals(1, transport.requests.size());
    }

    @Test
    void testFetchSendsRotatedIdentityAndFixedHeaders() {
        List<String> pool = List.of("agent-a", "agent-b");
        FakeTransport transport = new FakeTransport();
        FetchService fetcher = service(transport, Fixtures.config().identityPool(pool).build());

        for (int i = 0; i < 20; i++) fetcher.fetch("/anime/1");

        for (Map<String, String> headers : transport.headers) {
            assertTrue(pool.contains(headers.get("User-Agent")));
            assertEquals(FetchService.ACCEPT_LANGUAGE, headers.get("Accept-Language"));
            assertEquals(Fixtures.BASE_URL, headers.get("Referer"));
        }
        assertEquals(2, transport.headers.stream().map(h -> h.get("User-Agent")).distinct().count());
    }

    @Test
    void testNonSuccessStatusIsHttpStatusError() {
        FakeTransport transport = new FakeTransport().status(Fixtures.BASE_URL + "/anime/1", 503);
        Outcome<Document, FetchError> result = service(transport, Fixtures.config().build()).fetch("/anime/1");

        assertTrue(result.isFailure());
        assertEquals(FetchError.Kind.HTTP_STATUS, result.error().kind());
        assertEquals(503, result.error().statusCode());
    }

    @Test
    void testTimeoutIsReportedAsTimeout() {
        FakeTransport transport = new FakeTransport().timeout(Fixtures.BASE_URL + "/anime/2");
        Outcome<Document, FetchError> result = service(transport, Fixtures.config().build()).fetch("/anime/2");

        assertEquals(FetchError.Kind.TIMEOUT, result.error().kind());
    }

    @Test
    void testIoFailureIsReportedAsTransportError() {
        FakeTransport transport = new FakeTransport().broken(Fixtures.BASE_URL + "/anime/3");
        Outcome<Document, FetchError> result = service(transport, Fixtures.config().build()).fetch("/anime/3");

        assertEquals(FetchError.Kind.TRANSPORT, result.error().kind());
        assertTrue(result.error().cause().contains("connection reset"));
    }

    @Test
    void testBuildUrl() {
        FetchService fetcher = service(new FakeTransport(), Fixtures.config().baseUrl("https://example.org/").build());

        assertEquals("https://example.org/anime/5", fetcher.buildUrl("anime/5", Map.of()));
        assertEquals("https://example.org/topanime.php?limit=0", fetcher.buildUrl("/topanime.php", Map.of("limit", "0")));
        assertEquals("https://other.org/x?a=1&b=two+words", fetcher.buildUrl("https://other.org/x?a=1", Map.of("b", "two words")));
    }
}
