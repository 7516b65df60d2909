package com.animestats.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds detail records into a star schema: one {@link AnimeFact} per entity plus
 * genre, studio and review edge tables.
 * <p>
 * The transform is pure and deterministic. Input is ordered by entity id (the batch
 * stage delivers completion order) and a repeated id keeps its last record, so every
 * edge row references exactly one fact row. Each record is derived independently; a
 * malformed field in one entity only nulls that entity's derived column.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class DimensionalTransformer {
    private static final Logger logger = LoggerFactory.getLogger(DimensionalTransformer.class);

    /**
     * @param details detail records in any order
     * @return the four tables, rows ordered by entity id then source order
     */
    public DimensionalTables transform(List<DetailRecord> details) {
        Map<Integer, DetailRecord> byId = new LinkedHashMap<>();
        details.stream()
                .sorted(Comparator.comparingInt(DetailRecord::id))
                .forEach(d -> byId.put(d.id(), d));
        if (byId.size() < details.size()) {
            logger.warn("Collapsed {} duplicate detail records by id", details.size() - byId.size());
        }

        List<AnimeFact> facts = new ArrayList<>(byId.size());
        for (DetailRecord d : byId.values()) facts.add(toFact(d));

        List<GenreEdge> genres = new ArrayList<>();
        for (DetailRecord d : byId.values()) {
            for (String genre : d.genres()) genres.add(new GenreEdge(d.id(), genre));
        }

        List<StudioEdge> studios = new ArrayList<>();
        for (DetailRecord d : byId.values()) {
            for (String studio : d.studios()) studios.add(new StudioEdge(d.id(), studio));
        }

        List<ReviewEdge> reviews = new ArrayList<>();
        for (DetailRecord d : byId.values()) {
            for (ReviewRecord r : d.reviews()) {
                reviews.add(new ReviewEdge(d.id(), r.reviewer(), r.date(), r.score(), r.content(), r.helpfulCount()));
            }
        }

        logger.info("Transformed {} details into {} facts, {} genre edges, {} studio edges, {} review edges",
                details.size(), facts.size(), genres.size(), studios.size(), reviews.size());
        return new DimensionalTables(facts, genres, studios, reviews);
    }

    /**
     * Derives the fact row for one entity.
     */
    AnimeFact toFact(DetailRecord d) {
        Map<String, String> attrs = d.rawAttributes();
        Map<String, String> stats = d.rawStats();

        Integer episodes = NumericParser.parseInteger(attrs.get("episodes"));
        Integer minutesPerEpisode = NumericParser.parseMinutesPerEpisode(attrs.get("duration"));
        Season premiered = Season.of(attrs.get("premiered"));

        Double score = d.score() != null ? d.score() : NumericParser.parseScore(stats.get("score"));

        return new AnimeFact(
            d.id(),
            d.title(),
            score,
            episodes,
            attrs.getOrDefault("status", ""),
            premiered.name(),
            premiered.year(),
            NumericParser.parseInteger(statOrAttribute(d, "members")),
            NumericParser.parseInteger(statOrAttribute(d, "favorites")),
            minutesPerEpisode,
            NumericParser.multiplyOrNull(episodes, minutesPerEpisode),
            d.airingInfo().startDate(),
            d.airingInfo().endDate(),
            d.airingInfo().status(),
            d.broadcastInfo().day(),
            d.broadcastInfo().time(),
            d.url()
        );
    }

    private static String statOrAttribute(DetailRecord d, String key) {
        String value = d.rawStats().get(key);
        return value != null ? value : d.rawAttributes().get(key);
    }

    /**
     * Season name and year from a "premiered" value such as "Spring 2009". Both are
     * null unless the value has two tokens and the second is a year.
     */
    record Season(String name, Integer year) {
        static final Season UNKNOWN = new Season(null, null);

        static Season of(String premiered) {
            String[] parts = Utils.collapseWhitespace(premiered).split(" ");
            if (parts.length < 2) return UNKNOWN;
            Integer year = NumericParser.parseInteger(parts[1]);
            if (year == null || parts[1].length() != 4) return UNKNOWN;
            return new Season(parts[0], year);
        }
    }
}
