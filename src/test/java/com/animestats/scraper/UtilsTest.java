package com.animestats.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void testCollapseWhitespaceHandlesNonBreakingSpace() {
        assertEquals("Spring 2009", Utils.collapseWhitespace("  Spring\u00A0\n 2009 "));
        assertEquals("", Utils.collapseWhitespace(null));
    }

    @Test
    void testNormalizeLabel() {
        assertEquals("total_members", Utils.normalizeLabel(" Total  Members "));
        assertEquals("aired", Utils.normalizeLabel("Aired"));
    }

    @Test
    void testTruncateReviewContent() {
        String exact = "x".repeat(Utils.REVIEW_CONTENT_LIMIT);
        assertEquals(exact, Utils.truncateReviewContent(exact));

        String longer = "y".repeat(Utils.REVIEW_CONTENT_LIMIT + 1);
        String truncated = Utils.truncateReviewContent(longer);
        assertEquals(Utils.REVIEW_CONTENT_LIMIT, truncated.length());
        assertTrue(truncated.endsWith(Utils.ELLIPSIS));
        assertEquals("y".repeat(497), truncated.substring(0, 497));
    }
}
