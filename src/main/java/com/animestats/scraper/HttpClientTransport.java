package com.animestats.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link PageTransport} backed by the JDK HTTP client. One client is shared by all workers.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class HttpClientTransport implements PageTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);

    private final HttpClient client;

    public HttpClientTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build());
    }

    public HttpClientTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public TransportResponse get(URI uri, Map<String, String> headers, Duration timeout) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).timeout(timeout).GET();
        headers.forEach(builder::header);
        HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        logger.debug("GET {} -> {}", uri, response.statusCode());
        return new TransportResponse(response.statusCode(), response.body(), response.uri().toString());
    }
}
