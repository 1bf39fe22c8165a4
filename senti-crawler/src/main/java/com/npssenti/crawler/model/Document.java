package com.npssenti.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One crawled unit, serialised as one JSONL line.
 *
 * Schema notes:
 *  - id is a SHA-1 over the canonical URL and the canonical text hash, so it can be recomputed
 *  - published_at is ISO-8601 UTC or null, never omitted
 *  - the video block (video_id .. stats) is only present for YouTube records
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "source", "url", "snapshot_url", "title", "text", "lang", "published_at",
        "authors", "discovered_via", "quality", "dup", "crawl",
        "video_id", "channel_id", "channel_title", "captions", "stats"})
public class Document {

    // ── Identity ────────────────────────────────────────────────────────────
    private String id;

    private String source;

    private String url;

    @JsonProperty("snapshot_url")
    private String snapshotUrl;

    // ── Content ─────────────────────────────────────────────────────────────
    private String title;

    private String text;

    private String lang;

    @JsonProperty("published_at")
    private String publishedAt;

    @Builder.Default
    private List<String> authors = new ArrayList<>();

    // ── Provenance / bookkeeping ────────────────────────────────────────────
    @JsonProperty("discovered_via")
    @Builder.Default
    private Map<String, Object> discoveredVia = new LinkedHashMap<>();

    private Quality quality;

    @Builder.Default
    private Map<String, Object> dup = new LinkedHashMap<>();

    private CrawlMeta crawl;

    // ── Video only ──────────────────────────────────────────────────────────
    @JsonProperty("video_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String videoId;

    @JsonProperty("channel_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String channelId;

    @JsonProperty("channel_title")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String channelTitle;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<Caption> captions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private VideoStats stats;

    // ── Pipeline-internal, never written ────────────────────────────────────
    @JsonIgnore
    private SourceType sourceType;

    /** Detector confidence for {@link #lang}, consumed by the scorer */
    @JsonIgnore
    private double langConfidence;
}
