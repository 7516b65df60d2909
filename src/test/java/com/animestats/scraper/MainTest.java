package com.animestats.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testHelpExitsCleanly() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"--help"}));
    }

    @Test
    void testUsageListsOptions() {
        String usage = Main.usage();
        assertTrue(usage.contains("--listing-limit=VALUE"));
        assertTrue(usage.contains("--help"));
    }

    @Test
    void testConfigurationErrorExitsWithTwo() {
        assertEquals(Main.EXIT_CONFIG, Main.run(new String[]{"--max-workers=0"}));
        assertEquals(Main.EXIT_CONFIG, Main.run(new String[]{"--listing-limit=5", "--details-limit=6"}));
        assertEquals(Main.EXIT_CONFIG, Main.run(new String[]{"--selectors=/selectors/missing.json"}));
    }
}
