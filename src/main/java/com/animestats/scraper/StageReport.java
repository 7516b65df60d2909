package com.animestats.scraper;

/**
 * Result line for one stage of a run.
 *
 * @param stage    stage
 * @param status   how it ended
 * @param produced records the stage produced
 * @param expected records the stage was asked for
 * @param note     short explanation, empty when none
 */
public record StageReport(PipelineStage stage, StageStatus status, int produced, int expected, String note) {
    public StageReport {
        note = note == null ? "" : note;
    }

    public static StageReport skipped(PipelineStage stage, String note) {
        return new StageReport(stage, StageStatus.SKIPPED, 0, 0, note);
    }
}
