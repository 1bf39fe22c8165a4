package com.npssenti.crawler.service.discovery;

/**
 * The video API reported its daily quota as spent (403 quotaExceeded / dailyLimitExceeded).
 * Stops further quota-consuming calls for the rest of the UTC day; other sources carry on.
 */
public class QuotaExceededException extends RuntimeException {

    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
