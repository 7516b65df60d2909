package com.animestats.scraper;

/**
 * Raw result of one transport call.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty when none
 * @param finalUrl   URL after redirects
 */
public record TransportResponse(int statusCode, String body, String finalUrl) {
    public TransportResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
