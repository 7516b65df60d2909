package com.animestats.scraper;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Defensive numeric parsing for scraped text. Every method returns null instead of
 * throwing when the input does not hold a usable number.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public final class NumericParser {
    private static final List<String> UNIT_SUFFIXES = List.of("members", "member", "episodes", "eps", "ep", "users", "user");
    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern LEADING_DECIMAL = Pattern.compile("^(\\d+(?:\\.\\d+)?)(?!\\d)");
    private static final Pattern MINUTES = Pattern.compile("(\\d+(?:\\s*-\\s*\\d+)?)\\s*min", Pattern.CASE_INSENSITIVE);

    private NumericParser() {}

    /**
     * Parses an integer after stripping thousands separators and known unit suffixes
     * ("1,234 members", "24 eps").
     * @param text raw text
     * @return parsed value or null
     */
    public static Integer parseInteger(String text) {
        String s = Utils.collapseWhitespace(text).replace(",", "").toLowerCase(Locale.ROOT);
        for (String suffix : UNIT_SUFFIXES) {
            if (s.endsWith(suffix)) {
                s = s.substring(0, s.length() - suffix.length()).trim();
                break;
            }
        }
        if (!INTEGER.matcher(s).matches()) return null;
        try {
            return Integer.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses the leading decimal of a score text ("8.78", "9.10 (scored by 1,234 users)").
     * @param text raw text
     * @return score in [0, 10], or null when absent, unparsable or out of range
     */
    public static Double parseScore(String text) {
        Matcher m = LEADING_DECIMAL.matcher(Utils.collapseWhitespace(text));
        if (!m.find()) return null;
        double value;
        try {
            value = Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        return value >= 0.0 && value <= 10.0 ? value : null;
    }

    /**
     * Minutes per episode from a duration text: the number immediately preceding "min",
     * taking the upper bound when it is a range ("23-24 min." gives 24).
     * @param duration raw duration text
     * @return minutes or null
     */
    public static Integer parseMinutesPerEpisode(String duration) {
        if (duration == null) return null;
        Matcher m = MINUTES.matcher(duration);
        if (!m.find()) return null;
        String token = m.group(1);
        int dash = token.lastIndexOf('-');
        if (dash >= 0) token = token.substring(dash + 1);
        return parseInteger(token);
    }

    /**
     * Product of two optional operands; null unless both are known.
     */
    public static Integer multiplyOrNull(Integer a, Integer b) {
        if (a == null || b == null) return null;
        long product = (long) a * b;
        return product > Integer.MAX_VALUE ? null : (int) product;
    }
}
