package com.animestats.scraper;

import java.util.List;

/**
 * The star-schema output of {@link DimensionalTransformer}: one fact table plus three edge tables.
 */
public record DimensionalTables(
    List<AnimeFact> facts,
    List<GenreEdge> genreEdges,
    List<StudioEdge> studioEdges,
    List<ReviewEdge> reviewEdges
) {
    public static final DimensionalTables EMPTY = new DimensionalTables(List.of(), List.of(), List.of(), List.of());

    public DimensionalTables {
        facts = List.copyOf(facts);
        genreEdges = List.copyOf(genreEdges);
        studioEdges = List.copyOf(studioEdges);
        reviewEdges = List.copyOf(reviewEdges);
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }
}
