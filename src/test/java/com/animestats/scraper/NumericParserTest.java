package com.animestats.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NumericParserTest {

    @Test
    void testParseIntegerStripsSeparatorsAndUnits() {
        assertEquals(1234567, NumericParser.parseInteger("1,234,567 members"));
        assertEquals(24, NumericParser.parseInteger("24 eps"));
        assertEquals(64, NumericParser.parseInteger(" 64 "));
    }

    @Test
    void testParseIntegerRejectsNonNumeric() {
        assertNull(NumericParser.parseInteger("Unknown"));
        assertNull(NumericParser.parseInteger("?"));
        assertNull(NumericParser.parseInteger("#12"));
        assertNull(NumericParser.parseInteger(null));
        assertNull(NumericParser.parseInteger("99999999999"));
    }

    @Test
    void testParseScoreTakesLeadingDecimalInRange() {
        assertEquals(8.78, NumericParser.parseScore("8.78"));
        assertEquals(9.1, NumericParser.parseScore("9.10 (scored by 1,234 users)"));
        assertNull(NumericParser.parseScore("N/A"));
        assertNull(NumericParser.parseScore("11.5"));
        assertNull(NumericParser.parseScore(""));
    }

    @Test
    void testParseMinutesPerEpisode() {
        assertEquals(24, NumericParser.parseMinutesPerEpisode("24 min. per ep."));
        assertEquals(24, NumericParser.parseMinutesPerEpisode("23-24 min"));
        assertEquals(55, NumericParser.parseMinutesPerEpisode("1 hr. 55 min."));
        assertNull(NumericParser.parseMinutesPerEpisode("2 hr."));
        assertNull(NumericParser.parseMinutesPerEpisode("Unknown"));
        assertNull(NumericParser.parseMinutesPerEpisode(null));
    }

    @Test
    void testMultiplyOrNullNeedsBothOperands() {
        assertEquals(1536, NumericParser.multiplyOrNull(64, 24));
        assertNull(NumericParser.multiplyOrNull(null, 24));
        assertNull(NumericParser.multiplyOrNull(64, null));
        assertNull(NumericParser.multiplyOrNull(Integer.MAX_VALUE, 2));
    }
}
