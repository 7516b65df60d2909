package com.animestats.scraper;

import java.time.LocalDate;

/** One review row keyed by the owning entity id. */
public record ReviewEdge(int id, String reviewer, LocalDate date, Integer score, String content, int helpfulCount) {}
