package com.animestats.scraper;

import java.time.LocalDate;

/**
 * Fact-table row, one per entity id. {@code totalRuntimeMinutes} is non-null only
 * when both {@code episodes} and {@code minutesPerEpisode} are known.
 */
public record AnimeFact(
    int id,
    String title,
    Double score,
    Integer episodes,
    String status,
    String season,
    Integer year,
    Integer members,
    Integer favorites,
    Integer minutesPerEpisode,
    Integer totalRuntimeMinutes,
    LocalDate startDate,
    LocalDate endDate,
    AiringStatus airingStatus,
    String broadcastDay,
    String broadcastTime,
    String url
) {}
