package com.npssenti.crawler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CrawlMeta(
        @JsonProperty("run_id") String runId,
        @JsonProperty("fetched_at") String fetchedAt,
        @JsonProperty("fetched_from") String fetchedFrom,
        int attempts) {}
