package com.npssenti.crawler.service.fetch;

import com.npssenti.crawler.config.CrawlerProperties;
import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * robots.txt compliance, one parsed rule set cached per scheme+host+port.
 *
 * A missing robots.txt (any 4xx) allows everything. A 5xx or network failure is transient:
 * nothing is cached and the caller's retry decides.
 */
@Component
@Slf4j
public class RobotsPolicy {

    private final HttpClient httpClient;
    private final DomainThrottle throttle;
    private final CrawlerProperties properties;
    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
    private final Map<String, BaseRobotRules> cache = new ConcurrentHashMap<>();

    public RobotsPolicy(HttpClient crawlHttpClient, DomainThrottle throttle, CrawlerProperties properties) {
        this.httpClient = crawlHttpClient;
        this.throttle = throttle;
        this.properties = properties;
    }

    public boolean isAllowed(URI uri) throws TransientFetchException, InterruptedException {
        return rulesFor(uri).isAllowed(uri.toString());
    }

    /**
     * Crawl-delay declared for the host in milliseconds, 0 when none.
     * Only meaningful after {@link #isAllowed(URI)} has loaded the rules.
     */
    public long crawlDelayMs(URI uri) {
        BaseRobotRules rules = cache.get(originOf(uri));
        if (rules == null || rules.getCrawlDelay() <= 0) {
            return 0;
        }
        return rules.getCrawlDelay();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private BaseRobotRules rulesFor(URI uri) throws TransientFetchException, InterruptedException {
        String origin = originOf(uri);
        BaseRobotRules cached = cache.get(origin);
        if (cached != null) {
            return cached;
        }
        BaseRobotRules rules = download(origin);
        cache.put(origin, rules);
        return rules;
    }

    private BaseRobotRules download(String origin) throws TransientFetchException, InterruptedException {
        String robotsUrl = origin + "/robots.txt";
        URI robotsUri = URI.create(robotsUrl);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(robotsUri)
                .timeout(Duration.ofSeconds(properties.getLimits().getRequestTimeoutSec()))
                .header("User-Agent", properties.getUserAgent())
                .GET()
                .build();

        HttpResponse<byte[]> response;
        // the robots.txt request counts against the host like any page request
        try (DomainThrottle.Permit ignored = throttle.acquire(robotsUri.getHost(), 0)) {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new TransientFetchException(robotsUrl, "robots.txt unreachable: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status >= 500) {
            throw new TransientFetchException(robotsUrl, status, "robots.txt returned HTTP " + status);
        }
        if (status >= 400) {
            log.debug("No robots.txt at {} (HTTP {}), allowing all", origin, status);
            return parser.failedFetch(status);
        }

        String contentType = response.headers().firstValue("Content-Type").orElse("text/plain");
        BaseRobotRules rules = parser.parseContent(robotsUrl, response.body(), contentType,
                List.of(robotName()));
        log.debug("Loaded robots.txt for {} (crawl-delay {}ms)", origin, rules.getCrawlDelay());
        return rules;
    }

    /** First token of the User-Agent, lower-cased, as robots.txt matching expects */
    private String robotName() {
        String agent = properties.getUserAgent();
        int cut = agent.indexOf('/');
        if (cut < 0) {
            cut = agent.indexOf(' ');
        }
        return (cut < 0 ? agent : agent.substring(0, cut)).trim().toLowerCase(Locale.ROOT);
    }

    private static String originOf(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() == -1 ? scheme + "://" + host : scheme + "://" + host + ":" + uri.getPort();
    }
}
