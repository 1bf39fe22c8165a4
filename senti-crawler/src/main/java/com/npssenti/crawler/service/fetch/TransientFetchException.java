package com.npssenti.crawler.service.fetch;

/** Timeout, connection failure, 429 or 5xx. Retried with backoff. */
public class TransientFetchException extends FetchException {

    private final int statusCode;

    public TransientFetchException(String url, int statusCode, String message) {
        super(url, message);
        this.statusCode = statusCode;
    }

    public TransientFetchException(String url, String message, Throwable cause) {
        super(url, message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received */
    public int getStatusCode() {
        return statusCode;
    }
}
