package com.animestats.scraper;

/**
 * Weekly broadcast slot, e.g. day "Saturdays" and time "17:00".
 */
public record BroadcastInfo(String day, String time) {
    public static final BroadcastInfo UNKNOWN = new BroadcastInfo(null, null);
}
