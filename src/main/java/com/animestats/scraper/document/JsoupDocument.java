package com.animestats.scraper.document;

import com.animestats.scraper.ConfigurationException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Document} adapter over Jsoup. Field lookups are resolved through a
 * {@link SelectorRegistry}; the first configured selector that matches wins.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public final class JsoupDocument implements Document {
    private static final Logger logger = LoggerFactory.getLogger(JsoupDocument.class);

    private final org.jsoup.nodes.Document doc;
    private final JsoupNode root;

    private JsoupDocument(org.jsoup.nodes.Document doc, SelectorRegistry registry) {
        this.doc = doc;
        this.root = new JsoupNode(doc, registry);
    }

    /**
     * Parses HTML into a document.
     * @param html page body
     * @param location URL the page was loaded from, used to resolve relative links
     * @param registry selectors for the page layout
     * @return parsed document
     */
    public static JsoupDocument parse(String html, String location, SelectorRegistry registry) {
        return new JsoupDocument(Jsoup.parse(html == null ? "" : html, location == null ? "" : location), registry);
    }

    /**
     * Fails fast on selectors Jsoup cannot parse, before any page is fetched.
     * @param registry selectors to check
     * @throws ConfigurationException on the first invalid selector
     */
    public static void validateSelectors(SelectorRegistry registry) {
        for (Map.Entry<Field, List<String>> e : registry.asMap().entrySet()) {
            for (String selector : e.getValue()) {
                try {
                    QueryParser.parse(selector);
                } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
                    throw new ConfigurationException("Invalid selector for " + e.getKey() + ": '" + selector + "' (" + ex.getMessage() + ")", ex);
                }
            }
        }
    }

    @Override
    public String location() {
        return doc.location();
    }

    @Override
    public String text() {
        return root.text();
    }

    @Override
    public String ownText() {
        return root.ownText();
    }

    @Override
    public String attr(String name) {
        return root.attr(name);
    }

    @Override
    public String absUrl(String name) {
        return root.absUrl(name);
    }

    @Override
    public List<Node> select(Field field) {
        return root.select(field);
    }

    @Override
    public Optional<Node> selectFirst(Field field) {
        return root.selectFirst(field);
    }

    private static final class JsoupNode implements Node {
        private final Element element;
        private final SelectorRegistry registry;

        JsoupNode(Element element, SelectorRegistry registry) {
            this.element = element;
            this.registry = registry;
        }

        @Override
        public String text() {
            return element.text().trim();
        }

        @Override
        public String ownText() {
            return element.ownText().trim();
        }

        @Override
        public String attr(String name) {
            return element.attr(name);
        }

        @Override
        public String absUrl(String name) {
            String abs = element.absUrl(name);
            return abs.isEmpty() ? element.attr(name) : abs;
        }

        @Override
        public List<Node> select(Field field) {
            for (String selector : registry.selectors(field)) {
                Elements found;
                try {
                    found = element.select(selector);
                } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                    logger.warn("Skipping invalid selector '{}' for {}: {}", selector, field, e.getMessage());
                    continue;
                }
                if (!found.isEmpty()) {
                    List<Node> nodes = new ArrayList<>(found.size());
                    for (Element el : found) nodes.add(new JsoupNode(el, registry));
                    return nodes;
                }
            }
            return List.of();
        }

        @Override
        public Optional<Node> selectFirst(Field field) {
            List<Node> nodes = select(field);
            return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
        }
    }
}
