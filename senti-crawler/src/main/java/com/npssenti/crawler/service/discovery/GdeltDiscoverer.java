package com.npssenti.crawler.service.discovery;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.CrawlTarget;
import com.npssenti.crawler.model.GdeltArticle;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.model.TimeWindow;
import com.npssenti.crawler.service.fetch.RetryPolicy;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * News-index discovery over the GDELT DOC 2.0 ArtList API.
 *
 * The target window is split into chunks of at most 30 days that overlap by a few days
 * (GDELT only returns the newest N hits per query, so shorter windows reach further back).
 * One query per (keyword, chunk); URLs are de-duplicated across chunks.
 *
 * Rate limiting: a configurable pause between calls. A 429 honours Retry-After,
 * then goes through the shared retry policy like 5xx and network errors.
 */
@Service
@Slf4j
public class GdeltDiscoverer implements Discoverer {

    public static final String SOURCE = "gdelt";

    /** ArtList hard cap */
    private static final int API_MAX_RECORDS = 250;
    private static final int MAX_CHUNK_DAYS = 30;
    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final long MAX_RETRY_AFTER_MS = 60_000;

    private static final DateTimeFormatter QUERY_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter SEEN_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final DateTimeFormatter SEEN_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final RestTemplate restTemplate;
    private final CrawlerProperties properties;
    private final Retry retry;

    public GdeltDiscoverer(RestTemplate restTemplate, CrawlerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.retry = RetryPolicy.from(properties.getRetry())
                .toRetry("gdelt", RetryPolicy::isTransientApiError);
    }

    @Override
    public SourceType sourceType() {
        return SourceType.NEWS_INDEX;
    }

    @Override
    public List<Candidate> discover(CrawlTarget target, DiscoveryLimits limits) {
        CrawlerProperties.Gdelt cfg = properties.getGdelt();
        List<TimeWindow> windows = splitWindows(clampWindow(target.window(), cfg.getMaxDaysBack()),
                cfg.getChunkDays(), cfg.getOverlapDays());

        Set<String> seenUrls = new LinkedHashSet<>();
        List<Candidate> candidates = new ArrayList<>();
        boolean firstCall = true;

        outer:
        for (String keyword : target.keywords()) {
            if (keyword == null || keyword.trim().codePointCount(0, keyword.trim().length()) < MIN_KEYWORD_LENGTH) {
                log.debug("Skipping GDELT keyword shorter than {} chars: '{}'", MIN_KEYWORD_LENGTH, keyword);
                continue;
            }
            for (TimeWindow window : windows) {
                if (candidates.size() >= limits.maxCandidates()) {
                    break outer;
                }
                if (!firstCall) {
                    sleepMs(cfg.getPauseMs());
                }
                firstCall = false;

                List<GdeltArticle> articles;
                try {
                    articles = fetchArticles(keyword.trim(), window,
                            Math.min(limits.maxCandidates() - candidates.size(), cfg.getMaxRecords()));
                } catch (RestClientException e) {
                    log.warn("GDELT query failed for '{}' {}..{}: {}", keyword, window.start(), window.end(), e.getMessage());
                    continue;
                }

                int added = 0;
                for (GdeltArticle article : articles) {
                    if (article.getUrl() == null || article.getUrl().isBlank() || !seenUrls.add(article.getUrl())) {
                        continue;
                    }
                    candidates.add(toCandidate(article, keyword, window));
                    added++;
                    if (candidates.size() >= limits.maxCandidates()) {
                        break;
                    }
                }
                log.debug("GDELT '{}' {}..{}: {} articles, {} new", keyword, window.start(), window.end(),
                        articles.size(), added);
            }
        }

        log.info("GDELT discovery: {} candidates from {} window(s) x {} keyword(s)",
                candidates.size(), windows.size(), target.keywords().size());
        return candidates;
    }

    // ── Windows ──────────────────────────────────────────────────────────────

    /**
     * Split [start, end) into chunks of at most {@code chunkDays} days, each starting
     * {@code overlapDays} before the previous chunk's end.
     */
    public static List<TimeWindow> splitWindows(TimeWindow window, int chunkDays, int overlapDays) {
        Duration chunk = Duration.ofDays(Math.max(1, Math.min(chunkDays, MAX_CHUNK_DAYS)));
        Duration overlap = Duration.ofDays(Math.max(0, overlapDays));

        List<TimeWindow> windows = new ArrayList<>();
        Instant current = window.start();
        while (current.isBefore(window.end())) {
            Instant windowEnd = current.plus(chunk);
            if (windowEnd.isAfter(window.end())) {
                windowEnd = window.end();
            }
            windows.add(new TimeWindow(current, windowEnd));
            if (windowEnd.equals(window.end())) {
                break;
            }
            Instant next = windowEnd.minus(overlap);
            current = next.isAfter(current) ? next : windowEnd;
        }
        return windows;
    }

    private static TimeWindow clampWindow(TimeWindow window, Integer maxDaysBack) {
        if (maxDaysBack == null || maxDaysBack <= 0) {
            return window;
        }
        Instant clampStart = window.end().minus(Duration.ofDays(maxDaysBack));
        return clampStart.isAfter(window.start()) ? new TimeWindow(clampStart, window.end()) : window;
    }

    // ── Query ────────────────────────────────────────────────────────────────

    String buildQuery(String keyword) {
        String term = keyword.contains(" ") ? "\"" + keyword + "\"" : keyword;
        List<String> clauses = new ArrayList<>();
        for (String lang : properties.getLanguages()) {
            String l = lang.toLowerCase(Locale.ROOT);
            if (l.equals("ko")) {
                clauses.add("sourcelang:KOREAN");
            } else if (l.equals("en")) {
                clauses.add("sourcelang:ENGLISH");
            } else if (!l.isBlank()) {
                clauses.add("lang:" + l.toUpperCase(Locale.ROOT));
            }
        }
        if (clauses.isEmpty()) {
            return term;
        }
        return term + " " + (clauses.size() == 1 ? clauses.get(0) : "(" + String.join(" OR ", clauses) + ")");
    }

    private List<GdeltArticle> fetchArticles(String keyword, TimeWindow window, int maxRecords) {
        Instant inclusiveEnd = window.end().minusSeconds(1);
        if (inclusiveEnd.isBefore(window.start())) {
            inclusiveEnd = window.start();
        }
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getGdelt().getBaseUrl())
                .queryParam("query", buildQuery(keyword))
                .queryParam("mode", "ArtList")
                .queryParam("format", "json")
                .queryParam("sort", "DateDesc")
                .queryParam("maxrecords", Math.max(1, Math.min(maxRecords, API_MAX_RECORDS)))
                .queryParam("startdatetime", QUERY_TIME.format(window.start()))
                .queryParam("enddatetime", QUERY_TIME.format(inclusiveEnd))
                .build()
                .encode()
                .toUri();

        log.debug("Calling GDELT: {}", uri);
        GdeltArticle.Response response = retry.executeSupplier(() -> call(uri));
        if (response == null || response.getArticles() == null) {
            return List.of();
        }
        return response.getArticles();
    }

    private GdeltArticle.Response call(URI uri) {
        try {
            return restTemplate.getForObject(uri, GdeltArticle.Response.class);
        } catch (HttpClientErrorException.TooManyRequests e) {
            long waitMs = retryAfterMs(e);
            log.warn("Rate limited (429) by GDELT, waiting {}ms", waitMs);
            sleepMs(waitMs);
            throw e;
        }
    }

    private long retryAfterMs(HttpClientErrorException e) {
        String header = e.getResponseHeaders() == null ? null : e.getResponseHeaders().getFirst("Retry-After");
        if (header != null) {
            try {
                return Math.min(MAX_RETRY_AFTER_MS, (long) (Double.parseDouble(header.trim()) * 1000));
            } catch (NumberFormatException ignored) {
                log.debug("Unparseable Retry-After header: {}", header);
            }
        }
        return properties.getRetry().getBaseDelayMs();
    }

    private Candidate toCandidate(GdeltArticle article, String keyword, TimeWindow window) {
        Map<String, Object> via = new LinkedHashMap<>();
        via.put("type", "gdelt");
        via.put("keyword", keyword);
        via.put("window_start", window.start().toString());
        via.put("window_end", window.end().toString());
        if (article.getDomain() != null) {
            via.put("domain", article.getDomain());
        }
        if (article.getLanguage() != null) {
            via.put("language", article.getLanguage());
        }
        if (article.getSeendate() != null) {
            via.put("seendate", article.getSeendate());
        }

        return Candidate.builder()
                .source(SOURCE)
                .sourceType(SourceType.NEWS_INDEX)
                .url(article.getUrl())
                .title(article.getTitle())
                .publishedHint(parseSeenDate(article.getSeendate()))
                .discoveredVia(via)
                .build();
    }

    static Instant parseSeenDate(String seendate) {
        if (seendate == null || seendate.isBlank()) {
            return null;
        }
        String v = seendate.trim();
        try {
            if (v.length() == 8) {
                return LocalDate.parse(v, SEEN_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return LocalDateTime.parse(v, SEEN_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable GDELT seendate: {}", seendate);
            return null;
        }
    }

    private void sleepMs(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
