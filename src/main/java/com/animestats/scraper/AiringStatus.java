package com.animestats.scraper;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Airing state derived from the free-text "Aired" attribute.
 */
public enum AiringStatus {
    UNKNOWN("Unknown"),
    AIRED("Aired"),
    CURRENTLY_AIRING("Currently Airing"),
    FINISHED_AIRING("Finished Airing");

    private final String label;

    AiringStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
