package com.animestats.scraper;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full profile of one entity as extracted from its detail and reviews pages.
 * <p>
 * Immutable: collections are defensively copied (attribute maps keep their page order),
 * and attaching reviews produces a new record via {@link #withReviews(List)}.
 *
 * @param id            entity id, matches a {@link ListingRecord#id()}
 * @param title         display title
 * @param score         header score in [0, 10], if present
 * @param genres        genres in page order
 * @param studios       studios in page order
 * @param synopsis      synopsis text, possibly empty
 * @param rawAttributes normalized label to raw value from the information panel
 * @param rawStats      normalized label to raw value from the statistics panel
 * @param airingInfo    parsed airing range
 * @param broadcastInfo parsed broadcast slot
 * @param reviews       bounded list of reviews
 * @param url           canonical detail-page URL
 * @param fetchedAt     time the profile was extracted
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public record DetailRecord(
    int id,
    String title,
    Double score,
    List<String> genres,
    List<String> studios,
    String synopsis,
    Map<String, String> rawAttributes,
    Map<String, String> rawStats,
    AiringInfo airingInfo,
    BroadcastInfo broadcastInfo,
    List<ReviewRecord> reviews,
    String url,
    Instant fetchedAt
) {
    public DetailRecord {
        if (id <= 0) throw new IllegalArgumentException("Detail id must be positive: " + id);
        title = title == null ? "" : title;
        genres = genres == null ? List.of() : List.copyOf(genres);
        studios = studios == null ? List.of() : List.copyOf(studios);
        synopsis = synopsis == null ? "" : synopsis;
        rawAttributes = rawAttributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawAttributes));
        rawStats = rawStats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawStats));
        airingInfo = airingInfo == null ? AiringInfo.UNKNOWN : airingInfo;
        broadcastInfo = broadcastInfo == null ? BroadcastInfo.UNKNOWN : broadcastInfo;
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
        url = url == null ? "" : url;
    }

    public DetailRecord withReviews(List<ReviewRecord> newReviews) {
        return new DetailRecord(id, title, score, genres, studios, synopsis, rawAttributes, rawStats,
                airingInfo, broadcastInfo, newReviews, url, fetchedAt);
    }
}
