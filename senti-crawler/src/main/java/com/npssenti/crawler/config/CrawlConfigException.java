package com.npssenti.crawler.config;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Setup-time configuration problem: unreadable or inconsistent settings, missing credentials,
 * unusable output directory. Always fatal, always raised before any network call.
 */
public class CrawlConfigException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public CrawlConfigException(String message) {
        super(message);
    }

    public CrawlConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
