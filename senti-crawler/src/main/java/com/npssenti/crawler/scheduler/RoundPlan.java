package com.npssenti.crawler.scheduler;

import com.npssenti.crawler.model.CrawlTarget;

import java.util.List;

/**
 * What one autocrawl round will do.
 *
 * @param deferredVideoMonths months picked for video whose keywords did not fit today's quota
 * @param quotaCharged        units taken from the ledger for the admitted video keywords
 */
public record RoundPlan(List<CrawlTarget> targets, List<String> deferredVideoMonths, int quotaCharged) {

    public boolean isEmpty() {
        return targets.isEmpty();
    }
}
