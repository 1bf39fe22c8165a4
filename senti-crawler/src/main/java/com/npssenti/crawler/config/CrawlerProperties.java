package com.npssenti.crawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "crawler")
@Data
public class CrawlerProperties {

    private List<String> keywords = new ArrayList<>();
    private List<String> languages = new ArrayList<>(List.of("ko"));
    private String userAgent = "nps-senti-crawler/1.0 (contact: set CRAWLER_USER_AGENT)";

    /** Fixed run id; generated from the start time when blank */
    private String runId;

    private TimeWindow timeWindow = new TimeWindow();
    private Output output = new Output();
    private Limits limits = new Limits();
    private Retry retry = new Retry();
    private Quality quality = new Quality();
    private Gdelt gdelt = new Gdelt();
    private YouTube youtube = new YouTube();
    private Forums forums = new Forums();
    private Autocrawl autocrawl = new Autocrawl();

    @Data
    public static class TimeWindow {
        /** ISO date or date-time; required for plain runs */
        private String start;
        /** ISO date or date-time; defaults to now */
        private String end;
    }

    @Data
    public static class Output {
        private String dataDir = "data_crawl";
        private OutputMode mode = OutputMode.PER_SOURCE;
        private String unifiedFile = "crawl";
        private String indexFile = "_index.json";
        private String stateFile = "_auto_state.json";

        public enum OutputMode {
            PER_SOURCE, UNIFIED
        }
    }

    @Data
    public static class Limits {
        private int maxCandidatesPerSource = 500;
        /** Cap on fetch attempts per run; null or <= 0 means unlimited */
        private Integer maxFetch;
        private int requestTimeoutSec = 30;
        private int fetchConcurrency = 4;
        private int perDomainConcurrency = 2;
        private long minDelayMs = 500;
        private long maxCrawlDelayMs = 10_000;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private double multiplier = 2.0;
        /** Randomization factor applied to each backoff interval, 0..1 */
        private double jitter = 0.5;
    }

    @Data
    public static class Quality {
        private double minScore = 0.4;
        private int minKeywordHits = 1;
        private int minLength = 50;
        private int targetLength = 400;
        private double lengthWeight = 0.3;
        private double langWeight = 0.3;
        private double keywordWeight = 0.4;
    }

    @Data
    public static class Gdelt {
        private boolean enabled = true;
        private String baseUrl = "https://api.gdeltproject.org/api/v2/doc/doc";
        private int maxRecords = 100;
        private int chunkDays = 30;
        private int overlapDays = 2;
        private long pauseMs = 1000;
        private Integer maxDaysBack;
    }

    @Data
    public static class YouTube {
        private String apiKey;
        private String baseUrl = "https://www.googleapis.com/youtube/v3";
        private String captionBaseUrl = "https://www.youtube.com/api/timedtext";
        private int maxResultsPerKeyword = 25;
        /** search.list (100) + videos.list (1) */
        private int costPerKeyword = 101;
        private int commentsPages = 0;
        private String commentsOrder = "relevance";
        private String commentsTextFormat = "plainText";
        private boolean commentsIncludeReplies = false;
        private List<String> captionLangs = new ArrayList<>();
    }

    @Data
    public static class Forums {
        /** Cap on comments appended to a thread's text */
        private int commentsMax = 200;
        private Map<String, ForumSite> sites = new LinkedHashMap<>();

        @Data
        public static class ForumSite {
            private boolean enabled = false;
            private List<String> boards = new ArrayList<>();
            private int maxPages = 1;
            private int perBoardLimit = 50;
            private long pauseMs = 500;
            private boolean obeyRobots = true;
        }
    }

    @Data
    public static class Autocrawl {
        private int monthsBack = 12;
        private int monthlyTarget = 60;
        private boolean includeForums = true;
        private int maxGdeltWindows = 1;
        private int maxYoutubeWindows = 1;
        private int maxForumsWindows = 1;
        private int maxYoutubeKeywords = 2;
        private Integer roundMaxFetch;
        private int dailyQuota = 10_000;
        private int reserveQuota = 200;
        private int rounds = 1;
        private long sleepSec = 0;
        private Schedule schedule = new Schedule();

        @Data
        public static class Schedule {
            /** Spring cron expression; "-" disables the scheduled trigger */
            private String cron = "-";
            private boolean runOnStartup = false;
        }
    }

    // ── Derived values ────────────────────────────────────────────────────────

    public Path dataDir() {
        return Paths.get(output.getDataDir());
    }

    public Path indexPath() {
        return dataDir().resolve(output.getIndexFile());
    }

    public Path statePath() {
        return dataDir().resolve(output.getStateFile());
    }

    public boolean hasYouTubeKey() {
        return youtube.getApiKey() != null && !youtube.getApiKey().isBlank();
    }

    /**
     * Resolve the configured crawl window against the given clock.
     *
     * @throws CrawlConfigException if the start is missing or the bounds are inverted
     */
    public com.npssenti.crawler.model.TimeWindow resolveTimeWindow(Clock clock) {
        Instant start = parseInstant(timeWindow.getStart(), "crawler.time-window.start");
        if (start == null) {
            throw new CrawlConfigException("crawler.time-window.start must be set");
        }
        Instant end = parseInstant(timeWindow.getEnd(), "crawler.time-window.end");
        if (end == null) {
            end = clock.instant();
        }
        if (!end.isAfter(start)) {
            throw new CrawlConfigException("crawler.time-window: end " + end + " is not after start " + start);
        }
        return new com.npssenti.crawler.model.TimeWindow(start, end);
    }

    /**
     * Setup-time checks. Runs before any network activity; every failure is fatal.
     */
    public void validate() {
        if (keywords.stream().allMatch(String::isBlank)) {
            throw new CrawlConfigException("crawler.keywords must contain at least one keyword");
        }
        if (gdelt.getChunkDays() < 1 || gdelt.getChunkDays() > 30) {
            throw new CrawlConfigException("crawler.gdelt.chunk-days must be within 1..30, got " + gdelt.getChunkDays());
        }
        if (gdelt.getOverlapDays() < 0 || gdelt.getOverlapDays() >= gdelt.getChunkDays()) {
            throw new CrawlConfigException("crawler.gdelt.overlap-days must be >= 0 and < chunk-days");
        }
        if (retry.getMaxAttempts() < 1) {
            throw new CrawlConfigException("crawler.retry.max-attempts must be >= 1");
        }
        if (retry.getJitter() < 0 || retry.getJitter() >= 1) {
            throw new CrawlConfigException("crawler.retry.jitter must be within [0, 1)");
        }
        if (autocrawl.getReserveQuota() < 0 || autocrawl.getReserveQuota() > autocrawl.getDailyQuota()) {
            throw new CrawlConfigException("crawler.autocrawl.reserve-quota must be within 0..daily-quota");
        }
        if (autocrawl.getMonthsBack() < 1) {
            throw new CrawlConfigException("crawler.autocrawl.months-back must be >= 1");
        }
        ensureDataDir();
    }

    private void ensureDataDir() {
        Path dir = dataDir();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CrawlConfigException("Cannot create output directory: " + dir, e);
        }
        if (!Files.isWritable(dir)) {
            throw new CrawlConfigException("Output directory is not writable: " + dir);
        }
    }

    private static Instant parseInstant(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        try {
            if (v.length() == 10) {
                return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (v.endsWith("Z") || v.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(v).toInstant();
            }
            return java.time.LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new CrawlConfigException("Invalid ISO-8601 value for " + name + ": " + value, e);
        }
    }
}
