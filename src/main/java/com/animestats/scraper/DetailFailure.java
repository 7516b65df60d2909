package com.animestats.scraper;

/**
 * Why one detail work unit produced no record.
 *
 * @param id     entity id the unit worked on
 * @param reason human readable cause
 */
public record DetailFailure(int id, String reason) {}
