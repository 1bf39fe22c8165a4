package com.npssenti.crawler.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tracks one pipeline run for logging and for the scheduler's bookkeeping.
 * Never persisted; only its run id survives, stamped onto each stored document.
 */
@Data
@Builder
public class CrawlRun {

    private String runId;
    private Instant startedAt;
    private Instant completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED

    @Builder.Default
    private Map<String, SourceCounters> counters = new TreeMap<>();

    /** One entry per document written during this run, in write order */
    @Builder.Default
    private List<StoredRef> stored = new ArrayList<>();

    /** Set when the video API reported its daily quota as spent */
    private boolean quotaExhausted;

    public SourceCounters counters(String source) {
        return counters.computeIfAbsent(source, s -> new SourceCounters());
    }

    public int totalStored() {
        return counters.values().stream().mapToInt(SourceCounters::getStored).sum();
    }

    public int totalAttempted() {
        return counters.values().stream().mapToInt(SourceCounters::getAttempted).sum();
    }

    /**
     * Minimal record of a stored document.
     *
     * @param month YYYY-MM bucket the document counts towards
     */
    public record StoredRef(String id, String source, SourceType sourceType, String month) {}

    @Data
    public static class SourceCounters {
        private int discovered;
        private int attempted;
        private int skippedIndexed;
        private int fetched;
        private int retried;
        private int fetchFailed;
        private int fetchExhausted;
        private int extractFailed;
        private int rejected;
        private int duplicates;
        private int stored;

        public void add(SourceCounters other) {
            discovered += other.discovered;
            attempted += other.attempted;
            skippedIndexed += other.skippedIndexed;
            fetched += other.fetched;
            retried += other.retried;
            fetchFailed += other.fetchFailed;
            fetchExhausted += other.fetchExhausted;
            extractFailed += other.extractFailed;
            rejected += other.rejected;
            duplicates += other.duplicates;
            stored += other.stored;
        }
    }
}
