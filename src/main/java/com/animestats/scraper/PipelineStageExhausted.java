package com.animestats.scraper;

/**
 * Structured warning: a stage produced zero usable records and the run stopped there.
 * Carried in {@link PipelineResult}, never thrown.
 *
 * @param stage   the stage that ran dry
 * @param message explanation
 */
public record PipelineStageExhausted(PipelineStage stage, String message) {}
