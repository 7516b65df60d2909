package com.animestats.scraper.document;

import com.animestats.scraper.ConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each logical {@link Field} to an ordered list of CSS selectors.
 * <p>
 * Selectors are tried in order and the first one producing a match wins, so older
 * and newer page layouts can be listed side by side. The registry is loaded from a
 * JSON classpath resource shaped as {@code {"FIELD_NAME": ["selector", ...]}}.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public final class SelectorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SelectorRegistry.class);

    public static final String DEFAULT_RESOURCE = "/selectors/myanimelist.json";

    private final Map<Field, List<String>> selectors;

    public SelectorRegistry(Map<Field, List<String>> selectors) {
        EnumMap<Field, List<String>> copy = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            List<String> list = selectors.get(field);
            if (list == null || list.isEmpty()) {
                throw new ConfigurationException("No selectors configured for field " + field);
            }
            copy.put(field, List.copyOf(list));
        }
        this.selectors = Collections.unmodifiableMap(copy);
    }

    /**
     * Loads the bundled selector set for the current site layout.
     */
    public static SelectorRegistry defaults() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a selector set from a classpath resource.
     * @param resource resource path, e.g. {@value #DEFAULT_RESOURCE}
     * @return registry covering every {@link Field}
     * @throws ConfigurationException if the resource is missing, malformed or incomplete
     */
    public static SelectorRegistry load(String resource) {
        try (InputStream in = SelectorRegistry.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Could not find selector resource: " + resource);
            }
            Map<String, List<String>> raw = new ObjectMapper().readValue(in, new TypeReference<Map<String, List<String>>>() {});
            EnumMap<Field, List<String>> parsed = new EnumMap<>(Field.class);
            for (Map.Entry<String, List<String>> e : raw.entrySet()) {
                try {
                    parsed.put(Field.valueOf(e.getKey()), e.getValue());
                } catch (IllegalArgumentException unknown) {
                    logger.warn("Ignoring unknown field '{}' in selector resource {}", e.getKey(), resource);
                }
            }
            SelectorRegistry registry = new SelectorRegistry(parsed);
            logger.debug("Loaded selectors for {} fields from {}", parsed.size(), resource);
            return registry;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read selector resource " + resource + ": " + e.getMessage(), e);
        }
    }

    public List<String> selectors(Field field) {
        return selectors.get(field);
    }

    public Map<Field, List<String>> asMap() {
        return selectors;
    }
}
