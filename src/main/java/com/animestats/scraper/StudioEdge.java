package com.animestats.scraper;

/** (entity, studio) edge row. */
public record StudioEdge(int id, String studio) {}
