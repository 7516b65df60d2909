package com.animestats.scraper;

/**
 * Persistence boundary. Receives the listing table, raw detail records and the
 * star-schema tables of a run; the pipeline itself performs no I/O.
 */
public interface ExportServiceInterface {
    /**
     * Stores one run's output.
     * @param result run output, possibly partial
     * @throws ExportException if the sink cannot store it
     */
    void export(PipelineResult result) throws ExportException;

    /**
     * @return short sink name for logging
     */
    String name();
}
