package com.npssenti.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the GDELT DOC 2.0 ArtList JSON structure.
 * Kept separate from Candidate to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GdeltArticle {

    private String url;

    @JsonProperty("url_mobile")
    private String urlMobile;

    private String title;

    /** yyyyMMdd'T'HHmmss'Z', occasionally just yyyyMMdd */
    private String seendate;

    private String socialimage;

    private String domain;

    private String language;

    private String sourcecountry;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Response {
        private List<GdeltArticle> articles;
    }
}
