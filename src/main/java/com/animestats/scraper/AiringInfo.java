package com.animestats.scraper;

import java.time.LocalDate;

/**
 * Parsed airing range. Either side may be null independently of the status.
 */
public record AiringInfo(LocalDate startDate, LocalDate endDate, AiringStatus status) {
    public static final AiringInfo UNKNOWN = new AiringInfo(null, null, AiringStatus.UNKNOWN);

    public AiringInfo {
        status = status == null ? AiringStatus.UNKNOWN : status;
    }
}
