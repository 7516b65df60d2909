package com.animestats.scraper;

import com.animestats.scraper.document.SelectorRegistry;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable collector configuration, validated before any network activity.
 * <p>
 * Values are resolved from command-line flags ({@code --listing-limit=30}), then
 * environment variables, then Java system properties, then defaults.
 *
 * @param baseUrl             request origin, also sent as referer
 * @param rateLimitMinSeconds lower bound of the jittered inter-request delay
 * @param rateLimitMaxSeconds upper bound of the jittered inter-request delay
 * @param listingLimit        number of listing rows to collect
 * @param detailsLimit        number of listed ids to fetch profiles for
 * @param maxWorkers          concurrent detail workers
 * @param reviewsPerEntity    maximum reviews kept per entity
 * @param listingPageSize     rows per listing page, used for the page offset
 * @param requestTimeout      per-request timeout
 * @param identityPool        client identity strings rotated per request
 * @param outputDirectory     directory the file sinks write to
 * @param transport           {@code http} or {@code browser}
 * @param dbUrl               JDBC URL for the database sink, null to disable it
 * @param dbUser              database user
 * @param dbPass              database password
 * @param embeddedDb          start an embedded PostgreSQL for the database sink
 * @param selectorResource    classpath resource holding the selector set
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public record CollectorConfig(
    String baseUrl,
    double rateLimitMinSeconds,
    double rateLimitMaxSeconds,
    int listingLimit,
    int detailsLimit,
    int maxWorkers,
    int reviewsPerEntity,
    int listingPageSize,
    Duration requestTimeout,
    List<String> identityPool,
    Path outputDirectory,
    String transport,
    String dbUrl,
    String dbUser,
    String dbPass,
    boolean embeddedDb,
    String selectorResource
) {
    public static final String TRANSPORT_HTTP = "http";
    public static final String TRANSPORT_BROWSER = "browser";

    public static final List<String> DEFAULT_IDENTITY_POOL = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/109.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/16.2 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/108.0.0.0 Safari/537.36"
    );

    private static final Map<String, String> FLAG_TO_KEY = Map.ofEntries(
        Map.entry("base-url", "SCRAPER_BASE_URL"),
        Map.entry("delay-min", "SCRAPER_DELAY_MIN"),
        Map.entry("delay-max", "SCRAPER_DELAY_MAX"),
        Map.entry("listing-limit", "SCRAPER_LISTING_LIMIT"),
        Map.entry("details-limit", "SCRAPER_DETAILS_LIMIT"),
        Map.entry("max-workers", "SCRAPER_MAX_WORKERS"),
        Map.entry("reviews-per-entity", "SCRAPER_REVIEWS_PER_ENTITY"),
        Map.entry("page-size", "SCRAPER_LISTING_PAGE_SIZE"),
        Map.entry("timeout", "SCRAPER_TIMEOUT"),
        Map.entry("user-agents", "SCRAPER_USER_AGENTS"),
        Map.entry("output-dir", "SCRAPER_OUTPUT_DIR"),
        Map.entry("transport", "SCRAPER_TRANSPORT"),
        Map.entry("db-url", "DB_URL"),
        Map.entry("db-user", "DB_USER"),
        Map.entry("db-pass", "DB_PASS"),
        Map.entry("embedded-db", "SCRAPER_EMBEDDED_DB"),
        Map.entry("selectors", "SCRAPER_SELECTORS")
    );

    public CollectorConfig {
        identityPool = identityPool == null ? List.of() : List.copyOf(identityPool);
        validate(baseUrl, rateLimitMinSeconds, rateLimitMaxSeconds, listingLimit, detailsLimit, maxWorkers,
                reviewsPerEntity, listingPageSize, requestTimeout, identityPool, outputDirectory, transport, selectorResource);
    }

    private static void validate(String baseUrl, double min, double max, int listingLimit, int detailsLimit, int maxWorkers,
                                 int reviewsPerEntity, int listingPageSize, Duration requestTimeout, List<String> identityPool,
                                 Path outputDirectory, String transport, String selectorResource) {
        List<String> problems = new ArrayList<>();
        if (baseUrl == null || baseUrl.isBlank()) {
            problems.add("baseUrl must be set");
        } else {
            try {
                URI uri = URI.create(baseUrl);
                if (uri.getScheme() == null || uri.getHost() == null) problems.add("baseUrl must be an absolute http(s) URL: " + baseUrl);
            } catch (IllegalArgumentException e) {
                problems.add("baseUrl is not a valid URL: " + baseUrl);
            }
        }
        if (Double.isNaN(min) || Double.isNaN(max) || min < 0 || max < min) {
            problems.add("rate limit delay range must satisfy 0 <= min <= max, got [" + min + ", " + max + "]");
        }
        if (listingLimit < 1) problems.add("listingLimit must be >= 1, got " + listingLimit);
        if (detailsLimit < 0) problems.add("detailsLimit must be >= 0, got " + detailsLimit);
        if (detailsLimit > listingLimit) problems.add("detailsLimit (" + detailsLimit + ") must not exceed listingLimit (" + listingLimit + ")");
        if (maxWorkers < 1) problems.add("maxWorkers must be >= 1, got " + maxWorkers);
        if (reviewsPerEntity < 0) problems.add("reviewsPerEntity must be >= 0, got " + reviewsPerEntity);
        if (listingPageSize < 1) problems.add("listingPageSize must be >= 1, got " + listingPageSize);
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) problems.add("requestTimeout must be positive");
        if (identityPool.isEmpty() || identityPool.stream().anyMatch(String::isBlank)) problems.add("identityPool must contain non-blank entries");
        if (outputDirectory == null) problems.add("outputDirectory must be set");
        if (!TRANSPORT_HTTP.equals(transport) && !TRANSPORT_BROWSER.equals(transport)) {
            problems.add("transport must be '" + TRANSPORT_HTTP + "' or '" + TRANSPORT_BROWSER + "', got " + transport);
        }
        if (selectorResource == null || selectorResource.isBlank()) problems.add("selectorResource must be set");
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    public RateLimiter rateLimiter() {
        return RateLimiter.ofSeconds(rateLimitMinSeconds, rateLimitMaxSeconds);
    }

    public boolean databaseEnabled() {
        return embeddedDb || (dbUrl != null && !dbUrl.isBlank());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves configuration from command-line flags, the process environment and system properties.
     * @param args flags of the form {@code --name=value}
     * @return validated configuration
     * @throws ConfigurationException on unknown flags or invalid values
     */
    public static CollectorConfig fromEnvironment(String[] args) {
        return resolve(args, System::getenv, System::getProperty);
    }

    static CollectorConfig resolve(String[] args, Function<String, String> env, Function<String, String> props) {
        Map<String, String> flags = parseFlags(args);
        Function<String, String> lookup = key -> {
            if (flags.containsKey(key)) return flags.get(key);
            String ev = env.apply(key);
            if (ev != null) return ev;
            return props.apply(key);
        };

        Builder b = builder();
        ifSet(lookup, "SCRAPER_BASE_URL", b::baseUrl);
        ifSet(lookup, "SCRAPER_DELAY_MIN", v -> b.rateLimitMinSeconds(parseDouble("SCRAPER_DELAY_MIN", v)));
        ifSet(lookup, "SCRAPER_DELAY_MAX", v -> b.rateLimitMaxSeconds(parseDouble("SCRAPER_DELAY_MAX", v)));
        ifSet(lookup, "SCRAPER_LISTING_LIMIT", v -> b.listingLimit(parseInt("SCRAPER_LISTING_LIMIT", v)));
        ifSet(lookup, "SCRAPER_DETAILS_LIMIT", v -> b.detailsLimit(parseInt("SCRAPER_DETAILS_LIMIT", v)));
        ifSet(lookup, "SCRAPER_MAX_WORKERS", v -> b.maxWorkers(parseInt("SCRAPER_MAX_WORKERS", v)));
        ifSet(lookup, "SCRAPER_REVIEWS_PER_ENTITY", v -> b.reviewsPerEntity(parseInt("SCRAPER_REVIEWS_PER_ENTITY", v)));
        ifSet(lookup, "SCRAPER_LISTING_PAGE_SIZE", v -> b.listingPageSize(parseInt("SCRAPER_LISTING_PAGE_SIZE", v)));
        ifSet(lookup, "SCRAPER_TIMEOUT", v -> b.requestTimeout(Duration.ofMillis(Math.round(parseDouble("SCRAPER_TIMEOUT", v) * 1000))));
        ifSet(lookup, "SCRAPER_USER_AGENTS", v -> b.identityPool(Arrays.stream(v.split("\\|")).map(String::trim).filter(s -> !s.isEmpty()).toList()));
        ifSet(lookup, "SCRAPER_OUTPUT_DIR", v -> b.outputDirectory(Paths.get(v)));
        ifSet(lookup, "SCRAPER_TRANSPORT", v -> b.transport(v.trim().toLowerCase(Locale.ROOT)));
        ifSet(lookup, "DB_URL", b::dbUrl);
        ifSet(lookup, "DB_USER", b::dbUser);
        ifSet(lookup, "DB_PASS", b::dbPass);
        ifSet(lookup, "SCRAPER_EMBEDDED_DB", v -> b.embeddedDb(Boolean.parseBoolean(v.trim())));
        ifSet(lookup, "SCRAPER_SELECTORS", b::selectorResource);
        return b.build();
    }

    private static Map<String, String> parseFlags(String[] args) {
        Map<String, String> flags = new HashMap<>();
        if (args == null) return flags;
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                throw new ConfigurationException("Unexpected argument: " + arg);
            }
            String body = arg.substring(2);
            int eq = body.indexOf('=');
            String name = eq < 0 ? body : body.substring(0, eq);
            String value = eq < 0 ? "true" : body.substring(eq + 1);
            String key = FLAG_TO_KEY.get(name);
            if (key == null) {
                throw new ConfigurationException("Unknown option: --" + name);
            }
            flags.put(key, value);
        }
        return flags;
    }

    private static void ifSet(Function<String, String> lookup, String key, java.util.function.Consumer<String> setter) {
        String value = lookup.apply(key);
        if (value != null && !value.isBlank()) setter.accept(value);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got '" + value + "'", e);
        }
    }

    /**
     * Option names accepted on the command line.
     */
    public static List<String> flagNames() {
        return FLAG_TO_KEY.keySet().stream().sorted().map(n -> "--" + n).toList();
    }

    public static final class Builder {
        private String baseUrl = "https://myanimelist.net";
        private double rateLimitMinSeconds = 2.0;
        private double rateLimitMaxSeconds = 4.0;
        private int listingLimit = 55;
        private int detailsLimit = 30;
        private int maxWorkers = 5;
        private int reviewsPerEntity = 5;
        private int listingPageSize = 50;
        private Duration requestTimeout = Duration.ofSeconds(10);
        private List<String> identityPool = DEFAULT_IDENTITY_POOL;
        private Path outputDirectory = Paths.get("anime_data");
        private String transport = TRANSPORT_HTTP;
        private String dbUrl;
        private String dbUser = "postgres";
        private String dbPass = "";
        private boolean embeddedDb;
        private String selectorResource = SelectorRegistry.DEFAULT_RESOURCE;

        private Builder() {}

        public Builder baseUrl(String v) { this.baseUrl = v; return this; }
        public Builder rateLimitMinSeconds(double v) { this.rateLimitMinSeconds = v; return this; }
        public Builder rateLimitMaxSeconds(double v) { this.rateLimitMaxSeconds = v; return this; }
        public Builder rateLimitDelayRange(double min, double max) { this.rateLimitMinSeconds = min; this.rateLimitMaxSeconds = max; return this; }
        public Builder listingLimit(int v) { this.listingLimit = v; return this; }
        public Builder detailsLimit(int v) { this.detailsLimit = v; return this; }
        public Builder maxWorkers(int v) { this.maxWorkers = v; return this; }
        public Builder reviewsPerEntity(int v) { this.reviewsPerEntity = v; return this; }
        public Builder listingPageSize(int v) { this.listingPageSize = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder identityPool(List<String> v) { this.identityPool = v; return this; }
        public Builder outputDirectory(Path v) { this.outputDirectory = v; return this; }
        public Builder transport(String v) { this.transport = v; return this; }
        public Builder dbUrl(String v) { this.dbUrl = v; return this; }
        public Builder dbUser(String v) { this.dbUser = v; return this; }
        public Builder dbPass(String v) { this.dbPass = v; return this; }
        public Builder embeddedDb(boolean v) { this.embeddedDb = v; return this; }
        public Builder selectorResource(String v) { this.selectorResource = v; return this; }

        public CollectorConfig build() {
            return new CollectorConfig(baseUrl, rateLimitMinSeconds, rateLimitMaxSeconds, listingLimit, detailsLimit,
                    maxWorkers, reviewsPerEntity, listingPageSize, requestTimeout, identityPool, outputDirectory,
                    transport, dbUrl, dbUser, dbPass, embeddedDb, selectorResource);
        }
    }
}
