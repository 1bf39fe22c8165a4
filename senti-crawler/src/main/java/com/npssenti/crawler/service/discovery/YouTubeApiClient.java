package com.npssenti.crawler.service.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.TimeWindow;
import com.npssenti.crawler.service.fetch.RetryPolicy;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Thin client over the YouTube Data API v3 and the public timed-text caption endpoint.
 *
 * Quota: search.list costs 100 units, videos.list and commentThreads.list 1 unit each.
 * A 403 whose reason is quotaExceeded or dailyLimitExceeded becomes {@link QuotaExceededException};
 * 429/5xx/network errors go through the shared retry policy.
 */
@Service
@Slf4j
public class YouTubeApiClient {

    private final RestTemplate restTemplate;
    private final CrawlerProperties properties;
    private final Retry retry;

    public YouTubeApiClient(RestTemplate restTemplate, CrawlerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.retry = RetryPolicy.from(properties.getRetry())
                .toRetry("youtube", RetryPolicy::isTransientApiError);
    }

    /**
     * search.list for videos published inside the window (any time when the window is null).
     *
     * @return the raw response; {@code items[].id.videoId} holds the ids
     */
    public JsonNode search(String keyword, TimeWindow window, int maxResults) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(properties.getYoutube().getBaseUrl() + "/search")
                .queryParam("part", "snippet")
                .queryParam("type", "video")
                .queryParam("q", keyword)
                .queryParam("order", "date")
                .queryParam("maxResults", Math.min(50, Math.max(1, maxResults)))
                .queryParam("relevanceLanguage", "ko")
                .queryParam("key", properties.getYoutube().getApiKey());
        if (window != null) {
            builder.queryParam("publishedAfter", window.start().toString())
                    .queryParam("publishedBefore", window.end().toString());
        }
        return call(builder.build().encode().toUri(), "search.list q=" + keyword);
    }

    /** videos.list with snippet and statistics for up to 50 ids. */
    public JsonNode videos(List<String> videoIds) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getYoutube().getBaseUrl() + "/videos")
                .queryParam("part", "snippet,statistics")
                .queryParam("id", String.join(",", videoIds))
                .queryParam("maxResults", 50)
                .queryParam("key", properties.getYoutube().getApiKey())
                .build()
                .encode()
                .toUri();
        return call(uri, "videos.list");
    }

    /** One page of commentThreads.list; pass null for the first page. */
    public JsonNode commentThreads(String videoId, String pageToken) {
        CrawlerProperties.YouTube cfg = properties.getYoutube();
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(cfg.getBaseUrl() + "/commentThreads")
                .queryParam("part", cfg.isCommentsIncludeReplies() ? "snippet,replies" : "snippet")
                .queryParam("videoId", videoId)
                .queryParam("maxResults", 100)
                .queryParam("order", cfg.getCommentsOrder())
                .queryParam("textFormat", cfg.getCommentsTextFormat())
                .queryParam("key", cfg.getApiKey());
        if (pageToken != null) {
            builder.queryParam("pageToken", pageToken);
        }
        return call(builder.build().encode().toUri(), "commentThreads.list " + videoId);
    }

    /**
     * Timed-text caption track as XML, or null when the video has no track in that language.
     */
    public String captionTrack(String videoId, String lang) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getYoutube().getCaptionBaseUrl())
                .queryParam("lang", lang)
                .queryParam("v", videoId)
                .build()
                .encode()
                .toUri();
        try {
            String xml = retry.executeSupplier(() -> restTemplate.getForObject(uri, String.class));
            return xml == null || xml.isBlank() ? null : xml;
        } catch (HttpClientErrorException e) {
            log.debug("No {} captions for {} (HTTP {})", lang, videoId, e.getStatusCode().value());
            return null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode call(URI uri, String what) {
        log.debug("Calling YouTube API: {}", what);
        try {
            return retry.executeSupplier(() -> restTemplate.getForObject(uri, JsonNode.class));
        } catch (HttpClientErrorException.Forbidden e) {
            String body = e.getResponseBodyAsString();
            if (body.contains("quotaExceeded") || body.contains("dailyLimitExceeded")) {
                throw new QuotaExceededException("YouTube quota exhausted during " + what, e);
            }
            throw e;
        }
    }
}
