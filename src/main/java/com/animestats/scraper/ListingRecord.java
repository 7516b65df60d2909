package com.animestats.scraper;

/**
 * One row of the ranked listing. {@code id} is always a positive integer; rows
 * without a resolvable id are never constructed.
 *
 * @param id           entity id taken from the detail-page URL path
 * @param rank         listing rank, if numeric
 * @param title        display title
 * @param url          absolute detail-page URL
 * @param score        score in [0, 10], if present
 * @param mediaType    media type such as "TV" or "Movie", possibly empty
 * @param episodeCount episode count, if known
 * @param memberCount  member count, if present
 */
public record ListingRecord(
    int id,
    Integer rank,
    String title,
    String url,
    Double score,
    String mediaType,
    Integer episodeCount,
    Integer memberCount
) {
    public ListingRecord {
        if (id <= 0) throw new IllegalArgumentException("Listing id must be positive: " + id);
        title = title == null ? "" : title;
        url = url == null ? "" : url;
        mediaType = mediaType == null ? "" : mediaType;
    }
}
