package com.npssenti.crawler.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

/**
 * Persistent autocrawl state ({@code _auto_state.json}).
 *
 * counts: {"YYYY-MM": {"gdelt": n, "youtube": n, "forums": n}} of documents stored per month
 * and source group. Only {@link AutoCrawler} mutates it.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutoState {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;

    private Map<String, Map<String, Integer>> counts = new TreeMap<>();

    /** Cumulative stored documents per concrete source key (gdelt, youtube, dcinside, ...) */
    @JsonProperty("stored_by_source")
    private Map<String, Long> storedBySource = new TreeMap<>();

    private QuotaLedger youtube = new QuotaLedger();

    @JsonProperty("youtube_keyword_cursor")
    private int youtubeKeywordCursor;

    @JsonProperty("rounds_completed")
    private long roundsCompleted;

    @JsonProperty("last_updated")
    private String lastUpdated;

    public int count(String month, String group) {
        Map<String, Integer> perGroup = counts.get(month);
        return perGroup == null ? 0 : perGroup.getOrDefault(group, 0);
    }

    public void addCount(String month, String group, int delta) {
        counts.computeIfAbsent(month, m -> new TreeMap<>()).merge(group, delta, Integer::sum);
    }

    public void addStored(String source, long delta) {
        storedBySource.merge(source, delta, Long::sum);
    }
}
