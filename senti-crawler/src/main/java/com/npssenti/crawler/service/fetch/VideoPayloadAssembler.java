package com.npssenti.crawler.service.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.RawPayload;
import com.npssenti.crawler.service.discovery.YouTubeApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.StringJoiner;

/**
 * Builds the payload of a video candidate from API data instead of an HTTP page fetch:
 * the video resource found at discovery, optional comment pages and optional caption tracks.
 *
 * Payload shape: {"video": {...}, "comments": ["..."], "captions": [{"lang": "ko", "text": "..."}]}
 * A quota error on the comment calls propagates; other API failures leave the part empty.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VideoPayloadAssembler {

    public static final String FETCHED_FROM_API = "youtube-api";
    public static final String CONTENT_TYPE = "application/json; charset=utf-8";

    private final YouTubeApiClient apiClient;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;
    private final Clock clock;

    public RawPayload assemble(Candidate candidate) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("video", objectMapper.valueToTree(candidate.getExtra()));
        payload.set("comments", comments(candidate.getVideoId()));
        payload.set("captions", captions(candidate.getVideoId()));

        try {
            return new RawPayload(candidate.getUrl(), 200, CONTENT_TYPE,
                    objectMapper.writeValueAsBytes(payload), clock.instant(), FETCHED_FROM_API, 1);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise video payload for " + candidate.getVideoId(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ArrayNode comments(String videoId) {
        ArrayNode out = objectMapper.createArrayNode();
        int pages = properties.getYoutube().getCommentsPages();
        int max = properties.getForums().getCommentsMax();
        String pageToken = null;

        for (int page = 0; page < pages && out.size() < max; page++) {
            JsonNode response;
            try {
                response = apiClient.commentThreads(videoId, pageToken);
            } catch (RestClientException e) {
                // comments disabled or removed video
                log.debug("Comments unavailable for {}: {}", videoId, e.getMessage());
                break;
            }
            if (response == null) {
                break;
            }
            for (JsonNode thread : response.path("items")) {
                addComment(out, thread.path("snippet").path("topLevelComment"), max);
                if (properties.getYoutube().isCommentsIncludeReplies()) {
                    for (JsonNode reply : thread.path("replies").path("comments")) {
                        addComment(out, reply, max);
                    }
                }
            }
            pageToken = response.path("nextPageToken").asText(null);
            if (pageToken == null) {
                break;
            }
        }
        return out;
    }

    private static void addComment(ArrayNode out, JsonNode comment, int max) {
        String text = comment.path("snippet").path("textDisplay").asText("").trim();
        if (!text.isEmpty() && out.size() < max) {
            out.add(text);
        }
    }

    private ArrayNode captions(String videoId) {
        ArrayNode out = objectMapper.createArrayNode();
        for (String lang : properties.getYoutube().getCaptionLangs()) {
            if (lang.isBlank()) {
                continue;
            }
            String xml;
            try {
                xml = apiClient.captionTrack(videoId, lang.trim());
            } catch (RestClientException e) {
                log.debug("Caption fetch failed for {} [{}]: {}", videoId, lang, e.getMessage());
                continue;
            }
            String text = captionText(xml);
            if (!text.isEmpty()) {
                out.addObject().put("lang", lang.trim()).put("text", text);
            }
        }
        return out;
    }

    /** Joins the {@code <text>} cues of a timed-text document. */
    static String captionText(String xml) {
        if (xml == null) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(" ");
        for (Element cue : Jsoup.parse(xml, "", Parser.xmlParser()).select("text")) {
            String line = cue.text().trim();
            if (!line.isEmpty()) {
                joiner.add(line);
            }
        }
        return joiner.toString();
    }
}
