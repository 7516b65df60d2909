package com.animestats.scraper;

import com.animestats.scraper.document.Document;

import java.util.Map;

/**
 * Rate-limited single-page fetching.
 */
public interface FetchServiceInterface {
    /**
     * Waits one rate-limiter draw, then performs exactly one request and parses the body.
     * Never retries and never throws for network problems.
     * @param pathOrUrl absolute URL, or a path resolved against the configured base URL
     * @param queryParams optional query parameters, may be empty
     * @return parsed document, or a {@link FetchError}
     */
    Outcome<Document, FetchError> fetch(String pathOrUrl, Map<String, String> queryParams);

    default Outcome<Document, FetchError> fetch(String pathOrUrl) {
        return fetch(pathOrUrl, Map.of());
    }
}
