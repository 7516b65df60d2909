package com.animestats.scraper;

import com.animestats.scraper.document.Document;
import com.animestats.scraper.document.DocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.StringJoiner;

/**
 * Fetches one page per call through a {@link PageTransport}, after waiting on the
 * {@link RateLimiter}.
 * <p>
 * Each request carries a client identity picked pseudo-randomly from the configured
 * pool plus a fixed referer and locale header set. Failures come back as
 * {@link FetchError} values: timeouts, non-2xx statuses (429 included) and any other
 * transport fault. Retry policy belongs to the caller.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class FetchService implements FetchServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(FetchService.class);

    static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    private final PageTransport transport;
    private final RateLimiter rateLimiter;
    private final DocumentParser parser;
    private final CollectorConfig config;
    private final Random random;

    public FetchService(CollectorConfig config, PageTransport transport, RateLimiter rateLimiter, DocumentParser parser) {
        this(config, transport, rateLimiter, parser, new Random());
    }

    FetchService(CollectorConfig config, PageTransport transport, RateLimiter rateLimiter, DocumentParser parser, Random random) {
        this.config = config;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.parser = parser;
        this.random = random;
    }

    @Override
    public Outcome<Document, FetchError> fetch(String pathOrUrl, Map<String, String> queryParams) {
        String url = buildUrl(pathOrUrl, queryParams == null ? Map.of() : queryParams);
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return Outcome.failure(FetchError.transport(url, "invalid URL: " + e.getMessage()));
        }

        try {
            rateLimiter.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(FetchError.transport(url, "interrupted before request"));
        }

        TransportResponse response;
        try {
            logger.debug("Fetching URL: {}", url);
            response = transport.get(uri, headers(), config.requestTimeout());
        } catch (HttpTimeoutException | SocketTimeoutException e) {
            return Outcome.failure(FetchError.timeout(url, e.getMessage()));
        } catch (IOException e) {
            return Outcome.failure(FetchError.transport(url, e.getClass().getSimpleName() + ": " + e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(FetchError.transport(url, "interrupted during request"));
        } catch (RuntimeException e) {
            return Outcome.failure(FetchError.transport(url, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }

        if (!response.isSuccessful()) {
            return Outcome.failure(FetchError.httpStatus(url, response.statusCode()));
        }
        return Outcome.success(parser.parse(response.body(), response.finalUrl() == null ? url : response.finalUrl()));
    }

    /**
     * Request headers for one call: a rotated identity plus fixed referer and locale.
     */
    Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", nextIdentity());
        headers.put("Accept-Language", ACCEPT_LANGUAGE);
        headers.put("Referer", config.baseUrl());
        return headers;
    }

    String nextIdentity() {
        List<String> pool = config.identityPool();
        synchronized (random) {
            return pool.get(random.nextInt(pool.size()));
        }
    }

    String buildUrl(String pathOrUrl, Map<String, String> queryParams) {
        String url = pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")
                ? pathOrUrl
                : stripTrailingSlash(config.baseUrl()) + (pathOrUrl.startsWith("/") ? "" : "/") + pathOrUrl;
        if (queryParams.isEmpty()) return url;
        StringJoiner query = new StringJoiner("&");
        queryParams.forEach((k, v) -> query.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
