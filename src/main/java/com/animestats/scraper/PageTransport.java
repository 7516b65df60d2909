package com.animestats.scraper;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Performs one blocking GET. Implementations must be safe to call from several
 * worker threads at once.
 */
public interface PageTransport extends AutoCloseable {
    /**
     * Issues exactly one request.
     * @param uri target
     * @param headers request headers
     * @param timeout request timeout
     * @return status and body; non-2xx statuses are returned, not thrown
     * @throws java.net.http.HttpTimeoutException or another {@link IOException} subtype when the request times out
     * @throws IOException on any other transport failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    TransportResponse get(URI uri, Map<String, String> headers, Duration timeout) throws IOException, InterruptedException;

    @Override
    default void close() {
    }
}
