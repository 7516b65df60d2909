package com.animestats.scraper;

/** (entity, genre) edge row. */
public record GenreEdge(int id, String genre) {}
