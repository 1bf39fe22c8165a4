package com.npssenti.crawler.service.discovery;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.CrawlTarget;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.model.TimeWindow;
import com.npssenti.crawler.service.extract.PublishDateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Video discovery over the YouTube Data API.
 *
 * Each keyword costs one search.list (100 units) plus one videos.list (1 unit). Before a keyword is
 * queried its estimated cost must still fit in {@link DiscoveryLimits#quotaBudget()}; the first
 * keyword that does not fit ends discovery for the call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class YouTubeDiscoverer implements Discoverer {

    public static final String SOURCE = "youtube";
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";

    private final YouTubeApiClient apiClient;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;

    @Override
    public SourceType sourceType() {
        return SourceType.VIDEO;
    }

    @Override
    public List<Candidate> discover(CrawlTarget target, DiscoveryLimits limits) {
        if (!properties.hasYouTubeKey()) {
            log.info("YOUTUBE_API_KEY not set, skipping video discovery");
            return List.of();
        }

        int cost = properties.getYoutube().getCostPerKeyword();
        long spent = 0;
        Set<String> seenIds = new LinkedHashSet<>();
        List<Candidate> candidates = new ArrayList<>();

        for (String keyword : target.keywords()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            if (candidates.size() >= limits.maxCandidates()) {
                break;
            }
            if (spent + cost > limits.quotaBudget()) {
                log.info("YouTube budget reached ({} of {} units), deferring remaining keywords",
                        spent, limits.quotaBudget());
                break;
            }
            spent += cost;

            try {
                candidates.addAll(discoverKeyword(keyword.trim(), target.window(), seenIds,
                        limits.maxCandidates() - candidates.size()));
            } catch (QuotaExceededException e) {
                throw e;
            } catch (RestClientException e) {
                log.warn("YouTube discovery failed for '{}': {}", keyword, e.getMessage());
            }
        }

        log.info("YouTube discovery: {} candidates, ~{} units spent", candidates.size(), spent);
        return candidates;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Candidate> discoverKeyword(String keyword, TimeWindow window, Set<String> seenIds, int room) {
        JsonNode search = apiClient.search(keyword, window, properties.getYoutube().getMaxResultsPerKeyword());
        List<String> ids = new ArrayList<>();
        if (search != null) {
            for (JsonNode item : search.path("items")) {
                String id = item.path("id").path("videoId").asText(null);
                if (id != null && !seenIds.contains(id)) {
                    ids.add(id);
                }
            }
        }
        if (ids.isEmpty()) {
            return List.of();
        }

        JsonNode videos = apiClient.videos(ids);
        List<Candidate> out = new ArrayList<>();
        if (videos == null) {
            return out;
        }
        for (JsonNode video : videos.path("items")) {
            String id = video.path("id").asText(null);
            if (id == null || !seenIds.add(id)) {
                continue;
            }
            out.add(toCandidate(video, id, keyword, window));
            if (out.size() >= room) {
                break;
            }
        }
        return out;
    }

    private Candidate toCandidate(JsonNode video, String id, String keyword, TimeWindow window) {
        Map<String, Object> via = new LinkedHashMap<>();
        via.put("type", "youtube");
        via.put("keyword", keyword);
        if (window != null) {
            via.put("window_start", window.start().toString());
            via.put("window_end", window.end().toString());
        }

        JsonNode snippet = video.path("snippet");
        Map<String, Object> resource = objectMapper.convertValue(video, new TypeReference<Map<String, Object>>() {});
        return Candidate.builder()
                .source(SOURCE)
                .sourceType(SourceType.VIDEO)
                .url(WATCH_URL + id)
                .videoId(id)
                .title(snippet.path("title").asText(null))
                .author(snippet.path("channelTitle").asText(null))
                .publishedHint(PublishDateResolver.parse(snippet.path("publishedAt").asText(null)))
                .discoveredVia(via)
                .extra(new LinkedHashMap<>(resource))
                .build();
    }
}
