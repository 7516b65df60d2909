package com.animestats.scraper.document;

/**
 * Logical page elements the extractor asks for. The concrete selectors behind each
 * field live in a {@link SelectorRegistry} resource, so markup changes only touch
 * configuration.
 */
public enum Field {
    // ranked listing page
    LISTING_ROW,
    LISTING_RANK,
    LISTING_TITLE_LINK,
    LISTING_SCORE,
    LISTING_INFO,
    LISTING_MEMBERS,

    // profile page
    DETAIL_TITLE,
    DETAIL_SCORE,
    DETAIL_INFO_BLOCK,
    DETAIL_STATS_BLOCK,
    DETAIL_GENRE,
    DETAIL_STUDIO,
    DETAIL_SYNOPSIS,

    // reviews page
    REVIEW_ELEMENT,
    REVIEW_USERNAME,
    REVIEW_DATE,
    REVIEW_SCORE,
    REVIEW_TEXT,
    REVIEW_HELPFUL
}
