package com.animestats.scraper;

import java.time.LocalDate;

/**
 * A single user review. Content has already been truncated by the extractor.
 *
 * @param reviewer     reviewer name, "Anonymous" when absent
 * @param date         review date, if parseable
 * @param score        reviewer score, if parseable
 * @param content      review text, at most {@value Utils#REVIEW_CONTENT_LIMIT} characters
 * @param helpfulCount helpful votes, 0 when absent
 */
public record ReviewRecord(
    String reviewer,
    LocalDate date,
    Integer score,
    String content,
    int helpfulCount
) {
    public static final String ANONYMOUS = "Anonymous";

    public ReviewRecord {
        reviewer = reviewer == null || reviewer.isBlank() ? ANONYMOUS : reviewer;
        content = content == null ? "" : content;
    }
}
