package com.animestats.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs detail fetch+extract work units concurrently under a worker cap.
 * <p>
 * Each unit fetches the profile page, extracts a {@link DetailRecord}, then fetches and
 * attaches up to {@code reviewsPerEntity} reviews. A unit that fails for any reason
 * (network, extraction, unexpected fault) is logged once as a warning for its id and
 * left out of the result; siblings are unaffected.
 * <p>
 * Workers hand their outcome to a completion queue; the calling thread is the single
 * collector and the only owner of the result lists. Results come back in completion
 * order.
 * <p>
 * {@link #cancel()} stops units that have not started yet; units already in flight
 * finish naturally and their results are kept, without requesting their reviews page
 * if the profile came back after the cancel.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class BatchOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final FetchServiceInterface fetcher;
    private final FieldExtractor extractor;
    private final int reviewsPerEntity;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger completed = new AtomicInteger();

    public BatchOrchestrator(FetchServiceInterface fetcher, FieldExtractor extractor, int reviewsPerEntity) {
        if (reviewsPerEntity < 0) throw new IllegalArgumentException("reviewsPerEntity must be >= 0");
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.reviewsPerEntity = reviewsPerEntity;
    }

    /**
     * Fetches details for every id, silently omitting ids that failed.
     * @param ids entity ids; duplicates are fetched once
     * @param maxWorkers concurrent units, at least 1
     * @return successful records in completion order
     */
    public List<DetailRecord> fetchAllDetails(List<Integer> ids, int maxWorkers) {
        return runBatch(ids, maxWorkers, ProgressListener.NONE).details();
    }

    /**
     * Fetches details for every id and reports successes, failures and skipped units.
     * @param ids entity ids; duplicates are fetched once
     * @param maxWorkers concurrent units, at least 1
     * @param progress notified after each finished unit
     * @return batch result
     */
    public BatchResult runBatch(List<Integer> ids, int maxWorkers, ProgressListener progress) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        List<Integer> unique = new ArrayList<>(new LinkedHashSet<>(ids));
        completed.set(0);

        List<DetailRecord> details = new ArrayList<>();
        List<DetailFailure> failures = new ArrayList<>();
        int skipped = 0;
        if (unique.isEmpty()) {
            return new BatchResult(0, details, failures, 0, cancelled.get());
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxWorkers, unique.size()), workerThreads());
        CompletionService<UnitResult> completion = new ExecutorCompletionService<>(executor);
        Map<Future<UnitResult>, Integer> owners = new IdentityHashMap<>();
        boolean interrupted = false;
        try {
            for (Integer id : unique) {
                owners.put(completion.submit(() -> runUnit(id)), id);
            }
            for (int received = 0; received < unique.size(); ) {
                Future<UnitResult> future;
                try {
                    future = completion.take();
                } catch (InterruptedException e) {
                    // keep draining: queued units see the flag and skip, in-flight ones finish
                    interrupted = true;
                    cancel();
                    continue;
                }
                received++;
                UnitResult result = resultOf(future, owners.get(future));
                if (result.skipped()) {
                    skipped++;
                } else if (result.outcome().isSuccess()) {
                    details.add(result.outcome().value());
                } else {
                    DetailFailure failure = result.outcome().error();
                    failures.add(failure);
                    logger.warn("Failed to fetch details for id {}: {}", failure.id(), failure.reason());
                }
                int done = completed.incrementAndGet();
                progress.onProgress(done, unique.size());
                if (!result.skipped()) {
                    logger.info("Fetched details {}/{} (id {})", done, unique.size(), result.id());
                }
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Detail workers did not stop within 5 seconds");
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
            if (interrupted) Thread.currentThread().interrupt();
        }

        if (skipped > 0) {
            logger.warn("Batch cancelled: {} of {} detail units were not started", skipped, unique.size());
        }
        logger.info("Detail batch finished: {} succeeded, {} failed, {} skipped", details.size(), failures.size(), skipped);
        return new BatchResult(unique.size(), details, failures, skipped, cancelled.get());
    }

    /**
     * One fetch+extract unit for a single id. Never throws.
     * @param id entity id
     * @return the record or the reason it could not be produced
     */
    public Outcome<DetailRecord, DetailFailure> fetchDetail(int id) {
        return fetcher.fetch(extractor.detailUrl(id))
                .mapError(error -> new DetailFailure(id, error.describe()))
                .flatMap(page -> extractor.extractDetail(page)
                        .mapError(error -> new DetailFailure(id, error.kind() + ": " + error.message())))
                .map(detail -> attachReviews(id, detail));
    }

    private DetailRecord attachReviews(int id, DetailRecord detail) {
        if (detail.id() != id) {
            logger.debug("Requested id {} resolved to id {} (redirect)", id, detail.id());
        }
        if (reviewsPerEntity == 0) {
            return detail;
        }
        if (cancelled.get()) {
            logger.debug("Skipping reviews for id {}: cancelled", id);
            return detail;
        }
        return fetcher.fetch(extractor.reviewsUrl(id)).fold(
                page -> detail.withReviews(extractor.extractReviews(page, reviewsPerEntity)),
                error -> {
                    logger.warn("Reviews unavailable for id {}, keeping profile without reviews: {}", id, error.describe());
                    return detail;
                });
    }

    /**
     * Stops units that have not started yet. Safe to call from any thread.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.warn("Cancellation requested; in-flight detail requests will finish, queued ones are skipped");
        }
    }

    /**
     * @return units finished in the current or last batch
     */
    public int completedCount() {
        return completed.get();
    }

    private UnitResult runUnit(int id) {
        if (cancelled.get()) {
            return UnitResult.skipped(id);
        }
        try {
            return new UnitResult(id, fetchDetail(id), false);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            return UnitResult.failed(id, e);
        }
    }

    private static UnitResult resultOf(Future<UnitResult> future, int id) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // a VirtualMachineError escaped runUnit; the unit fails, the batch goes on
            return UnitResult.failed(id, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted reading a completed future", e);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "detail-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record UnitResult(int id, Outcome<DetailRecord, DetailFailure> outcome, boolean skipped) {
        static UnitResult skipped(int id) {
            return new UnitResult(id, null, true);
        }

        static UnitResult failed(int id, Throwable cause) {
            String reason = "unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
            return new UnitResult(id, Outcome.failure(new DetailFailure(id, reason)), false);
        }
    }
}
