package com.npssenti.crawler.model;

import java.time.Instant;

/**
 * Undecoded response body plus what the fetcher learned while getting it.
 *
 * @param fetchedFrom "live" for page fetches, "youtube-api" for assembled video payloads
 * @param attempts    number of HTTP attempts it took, 1 when nothing was retried
 */
public record RawPayload(
        String url,
        int statusCode,
        String contentType,
        byte[] body,
        Instant fetchedAt,
        String fetchedFrom,
        int attempts) {

    public boolean isJson() {
        return contentType != null && contentType.toLowerCase().contains("json");
    }
}
