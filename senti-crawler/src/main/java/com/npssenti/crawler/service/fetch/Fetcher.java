package com.npssenti.crawler.service.fetch;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.RawPayload;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retrieves one candidate page over HTTP.
 *
 * Order of checks per attempt: robots.txt, per-host throttle, GET. Transient failures
 * (timeouts, 429, 5xx, unreachable robots.txt) are retried with exponential random backoff;
 * permanent ones (robots disallow, 404/410, other 4xx, malformed URL) fail immediately.
 *
 * Safe to call from several fetch threads at once.
 */
@Service
@Slf4j
public class Fetcher {

    public static final String FETCHED_FROM_LIVE = "live";

    private final HttpClient httpClient;
    private final RobotsPolicy robotsPolicy;
    private final DomainThrottle throttle;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final Retry retry;

    public Fetcher(HttpClient crawlHttpClient, RobotsPolicy robotsPolicy, DomainThrottle throttle,
                   CrawlerProperties properties, Clock clock) {
        this.httpClient = crawlHttpClient;
        this.robotsPolicy = robotsPolicy;
        this.throttle = throttle;
        this.properties = properties;
        this.clock = clock;
        this.retry = RetryPolicy.from(properties.getRetry())
                .toRetry("fetch", TransientFetchException.class, PermanentFetchException.class);
    }

    public RawPayload fetch(Candidate candidate) throws FetchException, InterruptedException {
        String url = candidate.getUrl();
        URI uri = parse(url);
        AtomicInteger attempts = new AtomicInteger();

        try {
            return retry.executeCallable(() -> attempt(uri, candidate, attempts.incrementAndGet()));
        } catch (FetchException e) {
            e.setAttempts(attempts.get());
            throw e;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            TransientFetchException wrapped = new TransientFetchException(url, e.getMessage(), e);
            wrapped.setAttempts(attempts.get());
            throw wrapped;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RawPayload attempt(URI uri, Candidate candidate, int attempt)
            throws FetchException, InterruptedException {
        String url = uri.toString();
        if (attempt > 1) {
            log.debug("Retrying {} (attempt {})", url, attempt);
        }

        if (!candidate.isRobotsOverride() && !robotsPolicy.isAllowed(uri)) {
            throw new PermanentFetchException(url, PermanentFetchException.Reason.ROBOTS_DISALLOWED,
                    "Disallowed by robots.txt");
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(properties.getLimits().getRequestTimeoutSec()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "ko-KR,ko;q=0.9,en;q=0.7")
                .GET()
                .build();

        HttpResponse<byte[]> response;
        try (DomainThrottle.Permit ignored = throttle.acquire(uri.getHost(), robotsPolicy.crawlDelayMs(uri))) {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new TransientFetchException(url, "Timed out after "
                    + properties.getLimits().getRequestTimeoutSec() + "s", e);
        } catch (IOException e) {
            throw new TransientFetchException(url, "I/O error: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientFetchException(url, status, "HTTP " + status);
        }
        if (status == 404 || status == 410) {
            throw new PermanentFetchException(url, PermanentFetchException.Reason.NOT_FOUND, "HTTP " + status);
        }
        if (status >= 400) {
            throw new PermanentFetchException(url, PermanentFetchException.Reason.CLIENT_ERROR, "HTTP " + status);
        }

        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        return new RawPayload(response.uri().toString(), status, contentType, response.body(),
                clock.instant(), FETCHED_FROM_LIVE, attempt);
    }

    private static URI parse(String url) throws PermanentFetchException {
        if (url == null || url.isBlank()) {
            throw new PermanentFetchException(url, PermanentFetchException.Reason.MALFORMED_URL, "Empty URL");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                throw new PermanentFetchException(url, PermanentFetchException.Reason.MALFORMED_URL,
                        "Not an absolute http(s) URL");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new PermanentFetchException(url, PermanentFetchException.Reason.MALFORMED_URL, e.getMessage());
        }
    }
}
