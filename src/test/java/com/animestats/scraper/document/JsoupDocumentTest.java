package com.animestats.scraper.document;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsoupDocumentTest {
    private static final String HTML = "<html><body>"
            + "<h1 class='title-name'> Old <b>Layout</b> </h1>"
            + "<div class='review-element'><div class='username'><a href='/profile/a'>a</a></div></div>"
            + "<div class='review-element'><div class='username'><a href='/profile/b'>b</a></div></div>"
            + "</body></html>";

    private static SelectorRegistry with(Field field, List<String> selectors) {
        Map<Field, List<String>> map = new EnumMap<>(SelectorRegistry.defaults().asMap());
        map.put(field, selectors);
        return new SelectorRegistry(map);
    }

    @Test
    void testFirstMatchingSelectorWins() {
        SelectorRegistry registry = with(Field.DETAIL_TITLE, List.of("h1.new-layout", "h1.title-name", "h1"));
        Document doc = JsoupDocument.parse(HTML, "https://example.org/anime/1", registry);

        assertEquals("Old Layout", doc.selectFirst(Field.DETAIL_TITLE).orElseThrow().text());
        assertEquals("Old", doc.selectFirst(Field.DETAIL_TITLE).orElseThrow().ownText());
    }

    @Test
    void testInvalidSelectorIsSkipped() {
        SelectorRegistry registry = with(Field.DETAIL_TITLE, List.of("h1:no-such-pseudo", "h1"));
        Document doc = JsoupDocument.parse(HTML, "https://example.org/anime/1", registry);

        assertEquals("Old Layout", doc.selectFirst(Field.DETAIL_TITLE).orElseThrow().text());
    }

    @Test
    void testNestedSelectionAndAbsoluteUrls() {
        Document doc = JsoupDocument.parse(HTML, "https://example.org/anime/1", SelectorRegistry.defaults());
        List<Node> reviews = doc.select(Field.REVIEW_ELEMENT);

        assertEquals(2, reviews.size());
        Node link = reviews.get(1).selectFirst(Field.REVIEW_USERNAME).orElseThrow();
        assertEquals("b", link.text());
        assertEquals("/profile/b", link.attr("href"));
        assertEquals("https://example.org/profile/b", link.absUrl("href"));
        assertEquals("https://example.org/anime/1", doc.location());
    }

    @Test
    void testMissingFieldIsEmpty() {
        Document doc = JsoupDocument.parse("<html></html>", "", SelectorRegistry.defaults());
        assertTrue(doc.select(Field.LISTING_ROW).isEmpty());
        assertTrue(doc.selectFirst(Field.DETAIL_SYNOPSIS).isEmpty());
    }
}
