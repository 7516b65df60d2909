package com.animestats.scraper;

/**
 * Receives batch progress after every finished unit of work. Called from the
 * collecting thread only.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total) -> { };

    void onProgress(int completed, int total);
}
