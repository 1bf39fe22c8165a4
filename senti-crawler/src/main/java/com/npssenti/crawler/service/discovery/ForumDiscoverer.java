package com.npssenti.crawler.service.discovery;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.CrawlTarget;
import com.npssenti.crawler.model.RawPayload;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.service.UrlNormalizer;
import com.npssenti.crawler.service.extract.ExtractException;
import com.npssenti.crawler.service.extract.TextDecoder;
import com.npssenti.crawler.service.fetch.FetchException;
import com.npssenti.crawler.service.fetch.Fetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Community board discovery. Reads the most recent listing pages of each configured board;
 * boards cannot be windowed by time, so the target's window is ignored.
 *
 * Listing pages go through the regular {@link Fetcher}, so robots, throttling and retries
 * apply to them as to thread pages. A listing page that fails ends that board.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForumDiscoverer implements Discoverer {

    private final Fetcher fetcher;
    private final TextDecoder decoder;
    private final ForumListingParser parser;
    private final UrlNormalizer urlNormalizer;
    private final CrawlerProperties properties;

    @Override
    public SourceType sourceType() {
        return SourceType.FORUM;
    }

    @Override
    public List<Candidate> discover(CrawlTarget target, DiscoveryLimits limits) {
        List<Candidate> candidates = new ArrayList<>();

        for (Map.Entry<String, CrawlerProperties.Forums.ForumSite> e : properties.getForums().getSites().entrySet()) {
            String site = e.getKey();
            CrawlerProperties.Forums.ForumSite cfg = e.getValue();
            if (cfg == null || !cfg.isEnabled()) {
                continue;
            }
            if (!target.forumSites().isEmpty() && !target.forumSites().contains(site)) {
                continue;
            }
            if (!parser.supports(site)) {
                log.warn("No listing parser for forum site '{}', skipping", site);
                continue;
            }

            int before = candidates.size();
            for (String board : cfg.getBoards()) {
                if (board == null || board.isBlank()) {
                    continue;
                }
                if (candidates.size() >= limits.maxCandidates()) {
                    break;
                }
                discoverBoard(site, cfg, board.trim(), candidates, limits.maxCandidates());
            }
            log.info("Forum discovery site={} discovered={}", site, candidates.size() - before);
        }
        return candidates;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void discoverBoard(String site, CrawlerProperties.Forums.ForumSite cfg, String board,
                               List<Candidate> out, int maxCandidates) {
        Set<String> seen = new HashSet<>();
        int found = 0;
        int maxPages = Math.max(1, cfg.getMaxPages());

        for (int page = 1; page <= maxPages; page++) {
            String pageUrl = withPage(board, parser.pageParameter(site), page);
            Candidate listing = Candidate.builder()
                    .source(site)
                    .sourceType(SourceType.FORUM)
                    .url(pageUrl)
                    .robotsOverride(!cfg.isObeyRobots())
                    .build();

            List<ForumListingParser.ListingEntry> entries;
            try {
                RawPayload payload = fetcher.fetch(listing);
                entries = parser.parse(site, payload.url(), decoder.decode(payload.body(), payload.contentType()));
            } catch (FetchException | ExtractException ex) {
                log.warn("Listing page failed, ending board {} at page {}: {}", board, page, ex.getMessage());
                return;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }

            for (ForumListingParser.ListingEntry entry : entries) {
                if (entry.url() == null || entry.url().isBlank() || !seen.add(urlNormalizer.normalize(entry.url()))) {
                    continue;
                }
                out.add(toCandidate(site, board, page, entry, cfg.isObeyRobots()));
                found++;
                if (found >= cfg.getPerBoardLimit() || out.size() >= maxCandidates) {
                    return;
                }
            }
            log.debug("Forum {} board {} page {}: {} entries", site, board, page, entries.size());

            if (page < maxPages) {
                sleepMs(cfg.getPauseMs());
            }
        }
    }

    private Candidate toCandidate(String site, String board, int page,
                                  ForumListingParser.ListingEntry entry, boolean obeyRobots) {
        Map<String, Object> via = new LinkedHashMap<>();
        via.put("type", "forum");
        via.put("site", site);
        via.put("board", board);
        via.put("page", page);

        return Candidate.builder()
                .source(site)
                .sourceType(SourceType.FORUM)
                .url(entry.url())
                .title(entry.title())
                .author(entry.author())
                .publishedHint(entry.publishedHint())
                .discoveredVia(via)
                .robotsOverride(!obeyRobots)
                .build();
    }

    /** Sets or replaces the page parameter; page 1 is the board URL as configured. */
    static String withPage(String url, String key, int page) {
        if (page <= 1) {
            return url;
        }
        Pattern existing = Pattern.compile("([?&])" + Pattern.quote(key) + "=[^&#]*");
        Matcher m = existing.matcher(url);
        if (m.find()) {
            return m.replaceFirst(Matcher.quoteReplacement(m.group(1) + key + "=" + page));
        }
        int hash = url.indexOf('#');
        String base = hash < 0 ? url : url.substring(0, hash);
        String fragment = hash < 0 ? "" : url.substring(hash);
        return base + (base.contains("?") ? "&" : "?") + key + "=" + page + fragment;
    }

    private void sleepMs(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
