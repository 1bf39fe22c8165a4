package com.npssenti.crawler.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something a discoverer found and the fetcher may retrieve.
 * Video candidates carry the API video resource in {@code extra} instead of needing a page fetch.
 */
@Data
@Builder
public class Candidate {

    /** Concrete source key: gdelt, youtube, dcinside, ... */
    private String source;

    private SourceType sourceType;

    private String url;

    /** Only set for video candidates */
    private String videoId;

    /** Title as seen at discovery time (listing row, API result) */
    private String title;

    /** Author as seen at discovery time, forums only */
    private String author;

    /** Best publish-time guess from discovery, may be null */
    private Instant publishedHint;

    /** Provenance written to the document's discovered_via field */
    @Builder.Default
    private Map<String, Object> discoveredVia = new LinkedHashMap<>();

    /** Raw discovery payload (e.g. the YouTube video resource) */
    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    /** Site configured with obey-robots: false */
    private boolean robotsOverride;
}
