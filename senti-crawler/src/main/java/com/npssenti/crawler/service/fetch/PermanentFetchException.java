package com.npssenti.crawler.service.fetch;

/** Robots-disallowed, 404/410 or other 4xx, malformed URL. Never retried. */
public class PermanentFetchException extends FetchException {

    public enum Reason {
        MALFORMED_URL, ROBOTS_DISALLOWED, NOT_FOUND, CLIENT_ERROR
    }

    private final Reason reason;

    public PermanentFetchException(String url, Reason reason, String message) {
        super(url, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
