package com.npssenti.crawler.model;

import java.time.Instant;

/** Half-open interval [start, end). */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("window bounds must not be null");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("window end " + end + " is not after start " + start);
        }
    }
}
