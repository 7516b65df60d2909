package com.animestats.scraper;

/** How a pipeline stage ended. */
public enum StageStatus {
    SUCCEEDED,
    /** produced records, but fewer than requested */
    PARTIAL,
    /** produced zero usable records; later stages were skipped */
    EXHAUSTED,
    SKIPPED,
    CANCELLED
}
