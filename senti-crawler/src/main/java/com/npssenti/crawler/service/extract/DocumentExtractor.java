package com.npssenti.crawler.service.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.Caption;
import com.npssenti.crawler.model.CrawlMeta;
import com.npssenti.crawler.model.Document;
import com.npssenti.crawler.model.RawPayload;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.model.VideoStats;
import com.npssenti.crawler.service.DocumentIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns a fetched payload into a document with text, title, authors, language and publish time.
 * Quality and dedup are decided later; the id is set here because it depends only on URL and text.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentExtractor {

    private final TextDecoder decoder;
    private final HtmlContentExtractor htmlExtractor;
    private final PublishDateResolver dateResolver;
    private final LanguageIdentifier languageIdentifier;
    private final DocumentIds documentIds;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;

    public Document extract(RawPayload payload, Candidate candidate, String runId) throws ExtractException {
        Document doc = candidate.getSourceType() == SourceType.VIDEO
                ? fromVideo(payload, candidate)
                : fromHtml(payload, candidate);

        if (isBlank(doc.getText()) && isBlank(doc.getTitle())) {
            throw new ExtractException("No text or title extracted from " + candidate.getUrl());
        }
        if (doc.getText() == null) {
            doc.setText("");
        }

        LanguageIdentifier.Detection detection = languageIdentifier.detect(
                isBlank(doc.getText()) ? doc.getTitle() : doc.getText());

        doc.setId(documentIds.documentId(candidate.getUrl(), doc.getText()));
        doc.setSource(candidate.getSource());
        doc.setSourceType(candidate.getSourceType());
        doc.setUrl(candidate.getUrl());
        if (payload.url() != null && !payload.url().equals(candidate.getUrl())) {
            doc.setSnapshotUrl(payload.url());
        }
        doc.setLang(detection.lang());
        doc.setLangConfidence(detection.confidence());
        doc.setDiscoveredVia(new LinkedHashMap<>(candidate.getDiscoveredVia()));
        doc.setDup(new LinkedHashMap<>());
        doc.setCrawl(new CrawlMeta(runId, PublishDateResolver.toIso(payload.fetchedAt()),
                payload.fetchedFrom(), payload.attempts()));
        return doc;
    }

    // ── HTML pages (news, forums) ────────────────────────────────────────────

    private Document fromHtml(RawPayload payload, Candidate candidate) throws ExtractException {
        String html = decoder.decode(payload.body(), payload.contentType());
        if (html.isBlank()) {
            throw new ExtractException("Empty body from " + payload.url());
        }

        int commentMax = candidate.getSourceType() == SourceType.FORUM
                ? properties.getForums().getCommentsMax() : 0;
        HtmlContentExtractor.HtmlContent content = htmlExtractor.extract(html, payload.url(), commentMax);

        String title = !isBlank(content.title()) ? content.title() : candidate.getTitle();
        List<String> authors = new ArrayList<>(content.authors());
        if (!isBlank(candidate.getAuthor()) && !authors.contains(candidate.getAuthor())) {
            authors.add(candidate.getAuthor());
        }

        Instant published = dateResolver.resolve(content.page(), candidate.getPublishedHint(), content.text());

        return Document.builder()
                .title(title)
                .text(content.text())
                .authors(authors)
                .publishedAt(PublishDateResolver.toIso(published))
                .build();
    }

    // ── Assembled video payloads ─────────────────────────────────────────────

    private Document fromVideo(RawPayload payload, Candidate candidate) throws ExtractException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.body());
        } catch (IOException e) {
            throw new ExtractException("Malformed video payload for " + candidate.getVideoId(), e);
        }
        if (root == null || !root.hasNonNull("video")) {
            throw new ExtractException("Video payload without a video resource: " + candidate.getVideoId());
        }

        JsonNode video = root.get("video");
        JsonNode snippet = video.path("snippet");
        JsonNode statistics = video.path("statistics");

        List<Caption> captions = new ArrayList<>();
        for (JsonNode c : root.path("captions")) {
            captions.add(new Caption(c.path("lang").asText(), c.path("text").asText()));
        }
        List<String> comments = new ArrayList<>();
        for (JsonNode c : root.path("comments")) {
            comments.add(c.asText());
        }

        String title = textOrNull(snippet, "title");
        if (title == null) {
            title = candidate.getTitle();
        }
        StringJoiner text = new StringJoiner("\n\n");
        addIfPresent(text, title);
        addIfPresent(text, textOrNull(snippet, "description"));
        captions.forEach(c -> addIfPresent(text, c.text()));
        if (!comments.isEmpty()) {
            text.add(String.join("\n", comments));
        }

        Instant published = PublishDateResolver.parse(textOrNull(snippet, "publishedAt"));
        if (published == null) {
            published = candidate.getPublishedHint();
        }

        String channelTitle = textOrNull(snippet, "channelTitle");
        return Document.builder()
                .title(title)
                .text(text.toString())
                .authors(channelTitle == null ? new ArrayList<>() : new ArrayList<>(List.of(channelTitle)))
                .publishedAt(PublishDateResolver.toIso(published))
                .videoId(candidate.getVideoId() != null ? candidate.getVideoId() : video.path("id").asText(null))
                .channelId(textOrNull(snippet, "channelId"))
                .channelTitle(channelTitle)
                .captions(captions)
                .stats(new VideoStats(longOrNull(statistics, "viewCount"),
                        longOrNull(statistics, "likeCount"),
                        longOrNull(statistics, "commentCount")))
                .build();
    }

    private static void addIfPresent(StringJoiner joiner, String value) {
        if (!isBlank(value)) {
            joiner.add(value.trim());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }

    /** Statistics arrive as strings; hidden counts are simply absent */
    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return Long.parseLong(value.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
