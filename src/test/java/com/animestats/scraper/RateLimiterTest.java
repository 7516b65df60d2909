package com.animestats.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void testDelayStaysWithinBounds() {
        Duration min = Duration.ofMillis(2000);
        Duration max = Duration.ofMillis(4000);
        assertEquals(min, new RateLimiter(min, max, () -> 0.0).nextDelay());
        assertEquals(max, new RateLimiter(min, max, () -> 1.0).nextDelay());
        assertEquals(Duration.ofMillis(3000), new RateLimiter(min, max, () -> 0.5).nextDelay());

        RateLimiter real = RateLimiter.ofSeconds(2.0, 4.0);
        for (int i = 0; i < 100; i++) {
            Duration d = real.nextDelay();
            assertTrue(d.compareTo(min) >= 0 && d.compareTo(max) <= 0, "delay out of range: " + d);
        }
    }

    @Test
    void testRejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> RateLimiter.ofSeconds(3.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> RateLimiter.ofSeconds(-1.0, 1.0));
    }

    @Test
    void testNoneNeverWaits() throws InterruptedException {
        RateLimiter none = RateLimiter.none();
        assertEquals(Duration.ZERO, none.nextDelay());
        long start = System.nanoTime();
        none.await();
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(1).toNanos());
    }
}
