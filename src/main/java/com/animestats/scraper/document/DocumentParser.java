package com.animestats.scraper.document;

/**
 * Turns a fetched page body into a {@link Document}.
 */
@FunctionalInterface
public interface DocumentParser {
    Document parse(String html, String location);

    /**
     * Parser backed by Jsoup and the given selector set.
     */
    static DocumentParser jsoup(SelectorRegistry registry) {
        return (html, location) -> JsoupDocument.parse(html, location, registry);
    }
}
