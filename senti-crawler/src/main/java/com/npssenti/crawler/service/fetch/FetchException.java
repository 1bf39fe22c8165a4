package com.npssenti.crawler.service.fetch;

/**
 * Base of the fetch failure taxonomy. Carries the number of HTTP attempts made before giving up.
 */
public abstract class FetchException extends Exception {

    private final String url;
    private int attempts = 1;

    protected FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    protected FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }

    void setAttempts(int attempts) {
        this.attempts = attempts;
    }
}
