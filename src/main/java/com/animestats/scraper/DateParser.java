package com.animestats.scraper;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date parsing for the formats the site prints ("Jan 5, 2023", "2023").
 * <p>
 * Two tiers are tried in order: full month-day-year, then year-only. A year-only
 * value is upgraded to January 1st of that year. Anything else yields null.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public final class DateParser {
    private static final List<DateTimeFormatter> MONTH_DAY_YEAR = List.of(
            formatter("MMM d, uuuu"),
            formatter("MMMM d, uuuu")
    );
    private static final Pattern YEAR_ONLY = Pattern.compile("^\\d{4}$");
    private static final Pattern EMBEDDED_DATE = Pattern.compile("([A-Za-z]+\\.? \\d{1,2}, \\d{4})");

    private static final String OPEN_ENDED_MARKER = "to ?";
    private static final String RANGE_SEPARATOR = " to ";
    private static final String UNKNOWN_END = "?";
    private static final String NOT_AVAILABLE = "Not available";

    private DateParser() {}

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    /**
     * Parses one date using the two-tier strategy.
     * @param text raw date text
     * @return parsed date or null
     */
    public static LocalDate parseDate(String text) {
        String s = Utils.collapseWhitespace(text).replace(".", "");
        if (s.isEmpty()) return null;
        for (DateTimeFormatter f : MONTH_DAY_YEAR) {
            try {
                return LocalDate.parse(s, f);
            } catch (DateTimeParseException ignored) {
                // next tier
            }
        }
        if (YEAR_ONLY.matcher(s).matches()) {
            return LocalDate.of(Integer.parseInt(s), 1, 1);
        }
        return null;
    }

    /**
     * Finds and parses the first "Mon D, YYYY" date inside a longer text.
     * @param text text such as "Mar 15, 2021 12:01 AM"
     * @return parsed date or null
     */
    public static LocalDate findDate(String text) {
        if (text == null) return null;
        Matcher m = EMBEDDED_DATE.matcher(text);
        return m.find() ? parseDate(m.group(1)) : null;
    }

    /**
     * Classifies and parses an "Aired" attribute.
     * <ul>
     *   <li>"Jan 5, 2023 to ?" gives Currently Airing with an open end</li>
     *   <li>"Apr 3, 2009 to Jul 4, 2010" gives Finished Airing</li>
     *   <li>"Aug 10, 2019" gives Aired with start and end on the same day</li>
     * </ul>
     * Each side of a range is parsed independently; an unparsable side is null.
     * @param airedText raw aired text
     * @return airing info, {@link AiringInfo#UNKNOWN} when blank or "Not available"
     */
    public static AiringInfo parseAiring(String airedText) {
        String text = Utils.collapseWhitespace(airedText);
        if (text.isEmpty() || text.equalsIgnoreCase(NOT_AVAILABLE)) return AiringInfo.UNKNOWN;

        AiringStatus status;
        if (text.contains(OPEN_ENDED_MARKER)) {
            status = AiringStatus.CURRENTLY_AIRING;
        } else if (text.contains(RANGE_SEPARATOR)) {
            status = AiringStatus.FINISHED_AIRING;
        } else {
            status = AiringStatus.AIRED;
        }

        int sep = text.indexOf(RANGE_SEPARATOR);
        if (sep < 0) {
            LocalDate single = parseDate(text);
            return new AiringInfo(single, single, status);
        }
        String startText = text.substring(0, sep).trim();
        String endText = text.substring(sep + RANGE_SEPARATOR.length()).trim();
        LocalDate start = parseDate(startText);
        LocalDate end = UNKNOWN_END.equals(endText) ? null : parseDate(endText);
        return new AiringInfo(start, end, status);
    }
}
