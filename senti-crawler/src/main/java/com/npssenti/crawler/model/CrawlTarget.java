package com.npssenti.crawler.model;

import java.util.List;
import java.util.Set;

/**
 * One unit of work picked by the scheduler (or assembled from the run command).
 *
 * @param window     null for forums, which always read the most recent listing pages
 * @param month      YYYY-MM bucket this target was picked for, null for ad-hoc runs
 * @param forumSites restricts forum discovery to these site keys; empty means every enabled site
 */
public record CrawlTarget(
        SourceType sourceType,
        TimeWindow window,
        List<String> keywords,
        String month,
        Set<String> forumSites) {

    public static CrawlTarget newsIndex(TimeWindow window, List<String> keywords, String month) {
        return new CrawlTarget(SourceType.NEWS_INDEX, window, List.copyOf(keywords), month, Set.of());
    }

    public static CrawlTarget video(TimeWindow window, List<String> keywords, String month) {
        return new CrawlTarget(SourceType.VIDEO, window, List.copyOf(keywords), month, Set.of());
    }

    public static CrawlTarget forums(Set<String> sites) {
        return new CrawlTarget(SourceType.FORUM, null, List.of(), null, Set.copyOf(sites));
    }
}
