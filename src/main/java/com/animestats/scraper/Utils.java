package com.animestats.scraper;

import java.util.Locale;

/**
 * Utility class for common text helpers used in extraction and export.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public final class Utils {
    /** Maximum stored length of review content, ellipsis included. */
    public static final int REVIEW_CONTENT_LIMIT = 500;
    public static final String ELLIPSIS = "...";

    private Utils() {}

    /**
     * Collapses runs of whitespace (including non-breaking spaces) into single spaces and trims.
     * @param s input text, may be null
     * @return normalized text, never null
     */
    public static String collapseWhitespace(String s) {
        if (s == null) return "";
        return s.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    /**
     * Turns a free-text label such as "Total  Members" into a mapping key ("total_members").
     * @param label raw label
     * @return lower-cased, whitespace-normalized key
     */
    public static String normalizeLabel(String label) {
        return collapseWhitespace(label).toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Truncates review content longer than {@link #REVIEW_CONTENT_LIMIT} to
     * {@code REVIEW_CONTENT_LIMIT - 3} characters plus {@link #ELLIPSIS}.
     * @param content review text, may be null
     * @return content of length at most {@link #REVIEW_CONTENT_LIMIT}
     */
    public static String truncateReviewContent(String content) {
        if (content == null) return "";
        if (content.length() <= REVIEW_CONTENT_LIMIT) return content;
        return content.substring(0, REVIEW_CONTENT_LIMIT - ELLIPSIS.length()) + ELLIPSIS;
    }
}
