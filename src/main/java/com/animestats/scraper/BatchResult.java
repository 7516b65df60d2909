package com.animestats.scraper;

import java.util.List;

/**
 * Outcome of one detail batch. {@code details} is in completion order.
 *
 * @param requested distinct ids handed to the batch
 * @param details   records of the units that succeeded
 * @param failures  units that failed, one entry per id
 * @param skipped   units never started because the batch was cancelled
 * @param cancelled whether cancellation was requested while the batch ran
 */
public record BatchResult(int requested, List<DetailRecord> details, List<DetailFailure> failures, int skipped, boolean cancelled) {
    public BatchResult {
        details = List.copyOf(details);
        failures = List.copyOf(failures);
    }
}
