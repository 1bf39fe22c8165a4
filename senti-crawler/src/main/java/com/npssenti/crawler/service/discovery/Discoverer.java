package com.npssenti.crawler.service.discovery;

import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.CrawlTarget;
import com.npssenti.crawler.model.SourceType;

import java.util.List;

/**
 * Enumerates candidates for one source type. One bean per source type.
 *
 * Implementations log and skip a failed window, page or keyword; only
 * {@link QuotaExceededException} escapes.
 */
public interface Discoverer {

    SourceType sourceType();

    List<Candidate> discover(CrawlTarget target, DiscoveryLimits limits);
}
