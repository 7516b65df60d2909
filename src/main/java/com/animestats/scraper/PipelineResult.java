package com.animestats.scraper;

import java.util.List;
import java.util.Optional;

/**
 * Everything one run assembled, including partial output of stages that completed
 * before the run stopped.
 *
 * @param listing       listing table in page/row order
 * @param details       raw detail records in completion order
 * @param tables        star-schema tables, empty when the transform did not run
 * @param stages        one report per stage, in execution order
 * @param exhaustedStage set when a stage ran dry, otherwise null
 * @param cancelled     whether the run was cancelled
 */
public record PipelineResult(
    List<ListingRecord> listing,
    List<DetailRecord> details,
    DimensionalTables tables,
    List<StageReport> stages,
    PipelineStageExhausted exhaustedStage,
    boolean cancelled
) {
    public PipelineResult {
        listing = List.copyOf(listing);
        details = List.copyOf(details);
        tables = tables == null ? DimensionalTables.EMPTY : tables;
        stages = List.copyOf(stages);
    }

    public Optional<PipelineStageExhausted> exhausted() {
        return Optional.ofNullable(exhaustedStage);
    }

    public Optional<StageReport> stage(PipelineStage stage) {
        return stages.stream().filter(s -> s.stage() == stage).findFirst();
    }
}
