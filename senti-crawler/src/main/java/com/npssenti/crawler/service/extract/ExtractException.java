package com.npssenti.crawler.service.extract;

/** Malformed payload, undecodable bytes or nothing usable on the page. The item is skipped. */
public class ExtractException extends Exception {

    public ExtractException(String message) {
        super(message);
    }

    public ExtractException(String message, Throwable cause) {
        super(message, cause);
    }
}
