package com.animestats.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void testSuccessAndFailureAccessors() {
        Outcome<Integer, String> ok = Outcome.success(4);
        Outcome<Integer, String> bad = Outcome.failure("boom");

        assertTrue(ok.isSuccess());
        assertEquals(4, ok.value());
        assertThrows(IllegalStateException.class, ok::error);
        assertTrue(bad.isFailure());
        assertEquals("boom", bad.error());
        assertThrows(IllegalStateException.class, bad::value);
    }

    @Test
    void testMapAndFlatMapSkipFailures() {
        Outcome<Integer, String> ok = Outcome.success(4);
        Outcome<Integer, String> bad = Outcome.failure("boom");

        assertEquals(8, ok.map(v -> v * 2).value());
        assertEquals("boom", bad.map(v -> v * 2).error());
        assertEquals("odd", ok.flatMap(v -> v % 2 == 0 ? Outcome.<Integer, String>failure("odd") : Outcome.success(v)).error());
        assertEquals("BOOM", bad.mapError(String::toUpperCase).error());
        assertEquals("boom!", bad.fold(v -> "value", e -> e + "!"));
    }
}
