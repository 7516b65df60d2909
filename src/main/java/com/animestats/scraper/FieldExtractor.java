package com.animestats.scraper;

import com.animestats.scraper.document.Document;
import com.animestats.scraper.document.Field;
import com.animestats.scraper.document.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Side-effect-free extraction of typed records from parsed pages.
 * <p>
 * Extraction is defensive: a missing or malformed element degrades only the affected
 * field to null (or its documented default). The one hard failure is a missing entity
 * id on a listing row or profile page, reported as {@link ExtractError.Kind#MISSING_IDENTITY}
 * so the caller drops the whole record.
 * <p>
 * Page structure is reached only through logical {@link Field}s; selector strings are
 * configuration of the {@link Document} adapter.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class FieldExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FieldExtractor.class);

    private static final Pattern ANIME_PATH_ID = Pattern.compile("/anime/(\\d+)(?:/|$)");
    private static final Pattern EPISODES = Pattern.compile("\\(\\s*([\\d,]+|\\?)\\s*eps?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEMBERS = Pattern.compile("([\\d,]+)\\s*members", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEKDAY = Pattern.compile("([A-Za-z]+day)");
    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d{1,2}):(\\d{2})");

    private final String baseUrl;
    private final Clock clock;

    public FieldExtractor(String baseUrl) {
        this(baseUrl, Clock.systemUTC());
    }

    public FieldExtractor(String baseUrl, Clock clock) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clock = clock;
    }

    // --- Listing ---

    /**
     * Extracts every listing row that has a resolvable id, in page order.
     * @param page ranked listing page
     * @return listing records, rows without an id are dropped
     */
    public List<ListingRecord> extractListing(Document page) {
        List<ListingRecord> out = new ArrayList<>();
        int dropped = 0;
        for (Node row : page.select(Field.LISTING_ROW)) {
            Outcome<ListingRecord, ExtractError> result = extractListingRow(row);
            if (result.isSuccess()) {
                out.add(result.value());
            } else {
                dropped++;
                logger.debug("Dropping listing row: {}", result.error().message());
            }
        }
        if (dropped > 0) {
            logger.info("Dropped {} listing rows without a resolvable id on {}", dropped, page.location());
        }
        return out;
    }

    /**
     * Extracts one listing row.
     * @param row a {@link Field#LISTING_ROW} node
     * @return the record, or {@link ExtractError.Kind#MISSING_IDENTITY}
     */
    public Outcome<ListingRecord, ExtractError> extractListingRow(Node row) {
        Optional<Node> link = row.selectFirst(Field.LISTING_TITLE_LINK);
        String url = link.map(n -> n.absUrl("href")).orElse("");
        Integer id = identityFromUrl(url);
        if (id == null) {
            return Outcome.failure(ExtractError.missingIdentity("no entity id in listing link '" + url + "'"));
        }

        String title = link.map(Node::text).orElse("");
        Integer rank = row.selectFirst(Field.LISTING_RANK).map(Node::text).map(NumericParser::parseInteger).orElse(null);
        Double score = row.selectFirst(Field.LISTING_SCORE).map(Node::text).map(NumericParser::parseScore).orElse(null);

        String info = row.selectFirst(Field.LISTING_INFO).map(Node::text).orElse("");
        String mediaType = mediaTypeOf(info);
        Integer episodes = episodeCountOf(info);
        Integer members = row.selectFirst(Field.LISTING_MEMBERS)
                .map(Node::text)
                .map(NumericParser::parseInteger)
                .orElseGet(() -> membersOf(info));

        return Outcome.success(new ListingRecord(id, rank, title, url, score, mediaType, episodes, members));
    }

    // --- Detail ---

    /**
     * Extracts a profile page. Reviews are attached separately with
     * {@link DetailRecord#withReviews(List)}.
     * @param page profile page; its location must carry the entity id
     * @return the record, or {@link ExtractError.Kind#MISSING_IDENTITY}
     */
    public Outcome<DetailRecord, ExtractError> extractDetail(Document page) {
        Integer id = identityFromUrl(page.location());
        if (id == null) {
            return Outcome.failure(ExtractError.missingIdentity("no entity id in page location '" + page.location() + "'"));
        }

        String title = page.selectFirst(Field.DETAIL_TITLE).map(Node::text).orElse("");
        Map<String, String> attributes = labeledBlocks(page.select(Field.DETAIL_INFO_BLOCK));
        Map<String, String> stats = labeledBlocks(page.select(Field.DETAIL_STATS_BLOCK));

        Double score = page.selectFirst(Field.DETAIL_SCORE).map(Node::text).map(NumericParser::parseScore).orElse(null);
        if (score == null && stats.containsKey("score")) {
            score = NumericParser.parseScore(stats.get("score"));
        }
        if (score == null) {
            reportMalformed(id, ExtractError.malformedField("score", "no score in [0, 10] on page"));
        }

        List<String> genres = texts(page.select(Field.DETAIL_GENRE));
        List<String> studios = texts(page.select(Field.DETAIL_STUDIO));
        String synopsis = page.selectFirst(Field.DETAIL_SYNOPSIS).map(Node::text).orElse("");

        AiringInfo airing = DateParser.parseAiring(attributes.get("aired"));
        if (attributes.containsKey("aired") && airing.startDate() == null) {
            reportMalformed(id, ExtractError.malformedField("aired", "unparsable start date in '" + attributes.get("aired") + "'"));
        }
        BroadcastInfo broadcast = parseBroadcast(attributes.get("broadcast"));

        return Outcome.success(new DetailRecord(id, title, score, genres, studios, synopsis, attributes, stats,
                airing, broadcast, List.of(), detailUrl(id), Instant.now(clock)));
    }

    // --- Reviews ---

    /**
     * Extracts up to {@code limit} reviews in page order.
     * @param page reviews page
     * @param limit maximum number of reviews
     * @return reviews, possibly empty
     */
    public List<ReviewRecord> extractReviews(Document page, int limit) {
        List<ReviewRecord> out = new ArrayList<>();
        for (Node element : page.select(Field.REVIEW_ELEMENT)) {
            if (out.size() >= limit) break;
            out.add(extractReview(element));
        }
        return out;
    }

    /**
     * Extracts one review; every field has a default so this never fails.
     * @param element a {@link Field#REVIEW_ELEMENT} node
     * @return the review
     */
    public ReviewRecord extractReview(Node element) {
        String reviewer = element.selectFirst(Field.REVIEW_USERNAME).map(Node::text).orElse(ReviewRecord.ANONYMOUS);
        var date = element.selectFirst(Field.REVIEW_DATE).map(Node::text).map(DateParser::findDate).orElse(null);
        Integer score = element.selectFirst(Field.REVIEW_SCORE).map(Node::text).map(NumericParser::parseInteger).orElse(null);
        String content = element.selectFirst(Field.REVIEW_TEXT).map(Node::text).map(Utils::truncateReviewContent).orElse("");
        Integer helpful = element.selectFirst(Field.REVIEW_HELPFUL).map(Node::text).map(NumericParser::parseInteger).orElse(null);
        return new ReviewRecord(reviewer, date, score, content, helpful == null ? 0 : helpful);
    }

    // --- Shared sub-rules ---

    /**
     * Canonical profile URL for an id.
     */
    public String detailUrl(int id) {
        return baseUrl + "/anime/" + id;
    }

    /**
     * Canonical reviews URL for an id.
     */
    public String reviewsUrl(int id) {
        return detailUrl(id) + "/reviews";
    }

    /**
     * Extracts the entity id from a detail-page URL such as
     * {@code https://myanimelist.net/anime/5114/Fullmetal_Alchemist}.
     * @param url absolute or relative URL
     * @return positive id, or null
     */
    public static Integer identityFromUrl(String url) {
        if (url == null || url.isBlank()) return null;
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        if (path == null) return null;
        Matcher m = ANIME_PATH_ID.matcher(path);
        String candidate = null;
        if (m.find()) {
            candidate = m.group(1);
        } else {
            String[] parts = path.replaceAll("^/+|/+$", "").split("/");
            if (parts.length >= 2 && parts[parts.length - 2].matches("\\d+")) candidate = parts[parts.length - 2];
        }
        Integer id = candidate == null ? null : NumericParser.parseInteger(candidate);
        return id != null && id > 0 ? id : null;
    }

    /**
     * Splits "Label: value" blocks on the first colon. Labels become lower-cased,
     * whitespace-normalized keys; a repeated label overwrites the earlier value.
     * Blocks without a colon are ignored.
     * @param blocks block nodes
     * @return key to raw value, in first-seen order
     */
    public static Map<String, String> labeledBlocks(List<Node> blocks) {
        List<String> texts = new ArrayList<>(blocks.size());
        for (Node block : blocks) texts.add(block.text());
        return labeledTexts(texts);
    }

    static Map<String, String> labeledTexts(List<String> texts) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String text : texts) {
            int colon = text.indexOf(':');
            if (colon < 0) continue;
            String key = Utils.normalizeLabel(text.substring(0, colon));
            if (key.isEmpty()) continue;
            out.put(key, Utils.collapseWhitespace(text.substring(colon + 1)));
        }
        return out;
    }

    /**
     * Mines a broadcast text such as "Saturdays at 17:00 (JST)" for a weekday and an
     * HH:MM time independently.
     * @param text raw broadcast text
     * @return broadcast info; either part may be null
     */
    public static BroadcastInfo parseBroadcast(String text) {
        String s = Utils.collapseWhitespace(text);
        if (s.isEmpty() || s.equalsIgnoreCase("Unknown")) return BroadcastInfo.UNKNOWN;
        Matcher day = WEEKDAY.matcher(s);
        Matcher time = CLOCK_TIME.matcher(s);
        String dayValue = day.find() ? day.group(1) : null;
        String timeValue = null;
        if (time.find()) {
            int hour = Integer.parseInt(time.group(1));
            int minute = Integer.parseInt(time.group(2));
            if (hour < 24 && minute < 60) timeValue = String.format("%02d:%02d", hour, minute);
        }
        return new BroadcastInfo(dayValue, timeValue);
    }

    static String mediaTypeOf(String info) {
        String s = Utils.collapseWhitespace(info);
        int paren = s.indexOf('(');
        return paren < 0 ? "" : s.substring(0, paren).trim();
    }

    static Integer episodeCountOf(String info) {
        Matcher m = EPISODES.matcher(info == null ? "" : info);
        return m.find() ? NumericParser.parseInteger(m.group(1)) : null;
    }

    static Integer membersOf(String info) {
        Matcher m = MEMBERS.matcher(info == null ? "" : info);
        return m.find() ? NumericParser.parseInteger(m.group(1)) : null;
    }

    private static List<String> texts(List<Node> nodes) {
        List<String> out = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            String t = n.text();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static void reportMalformed(int id, ExtractError error) {
        logger.debug("Entity {}: field '{}' degraded to null ({})", id, error.field(), error.message());
    }
}
