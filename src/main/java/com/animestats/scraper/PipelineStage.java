package com.animestats.scraper;

/** Pipeline stages in execution order. */
public enum PipelineStage {
    LISTING,
    SELECTION,
    DETAILS,
    TRANSFORM
}
