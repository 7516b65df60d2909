package com.animestats.scraper;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Memoryless jittered delay source. Each call draws a delay uniformly from
 * {@code [min, max]}; callers sleep for it before their next request.
 * <p>
 * There is no shared budget: every worker draws independently, so the aggregate
 * request rate grows with the worker count. Strict global rate enforcement across
 * workers is not a goal of this class.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class RateLimiter {
    private final Duration min;
    private final Duration max;
    private final DoubleSupplier random;

    public RateLimiter(Duration min, Duration max) {
        this(min, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1), injectable for deterministic tests
     */
    RateLimiter(Duration min, Duration max, DoubleSupplier random) {
        if (min == null || max == null || min.isNegative() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Rate limit bounds must satisfy 0 <= min <= max, got [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
        this.random = random;
    }

    /**
     * Builds a limiter from bounds expressed in seconds.
     */
    public static RateLimiter ofSeconds(double minSeconds, double maxSeconds) {
        return new RateLimiter(Duration.ofMillis(Math.round(minSeconds * 1000)), Duration.ofMillis(Math.round(maxSeconds * 1000)));
    }

    /**
     * A limiter that never waits, for tests and local fixtures.
     */
    public static RateLimiter none() {
        return new RateLimiter(Duration.ZERO, Duration.ZERO);
    }

    /**
     * @return a delay within {@code [min, max]}
     */
    public Duration nextDelay() {
        long spanNanos = max.minus(min).toNanos();
        if (spanNanos == 0) return min;
        double r = Math.min(Math.max(random.getAsDouble(), 0.0), 1.0);
        return min.plusNanos(Math.round(r * spanNanos));
    }

    /**
     * Draws a delay and sleeps for it.
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void await() throws InterruptedException {
        Duration delay = nextDelay();
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis(), (int) (delay.toNanos() % 1_000_000));
        }
    }

    public Duration min() {
        return min;
    }

    public Duration max() {
        return max;
    }
}
