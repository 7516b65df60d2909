package com.animestats.scraper;

import com.animestats.scraper.document.Document;
import com.animestats.scraper.document.JsoupDocument;
import com.animestats.scraper.document.SelectorRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads HTML fixtures from the test classpath.
 */
final class Fixtures {
    static final String BASE_URL = "https://myanimelist.net";
    static final SelectorRegistry SELECTORS = SelectorRegistry.defaults();

    private Fixtures() {}

    static String html(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalStateException("Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Document document(String name, String location) {
        return JsoupDocument.parse(html(name), location, SELECTORS);
    }

    static CollectorConfig.Builder config() {
        return CollectorConfig.builder().baseUrl(BASE_URL).rateLimitDelayRange(0, 0);
    }
}
