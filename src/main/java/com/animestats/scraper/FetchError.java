package com.animestats.scraper;

/**
 * Recoverable failure of a single network request. Never thrown; always carried
 * inside an {@link Outcome} and logged by the unit of work that produced it.
 *
 * @param kind       failure category
 * @param url        request URL
 * @param statusCode HTTP status for {@link Kind#HTTP_STATUS}, otherwise -1
 * @param cause      short description of the underlying cause
 */
public record FetchError(Kind kind, String url, int statusCode, String cause) {

    public enum Kind { TIMEOUT, HTTP_STATUS, TRANSPORT }

    public static FetchError timeout(String url, String cause) {
        return new FetchError(Kind.TIMEOUT, url, -1, cause);
    }

    public static FetchError httpStatus(String url, int statusCode) {
        return new FetchError(Kind.HTTP_STATUS, url, statusCode, "HTTP " + statusCode);
    }

    public static FetchError transport(String url, String cause) {
        return new FetchError(Kind.TRANSPORT, url, -1, cause);
    }

    public String describe() {
        return kind == Kind.HTTP_STATUS
                ? "HTTP status " + statusCode + " for " + url
                : kind.name().toLowerCase() + " for " + url + ": " + cause;
    }
}
