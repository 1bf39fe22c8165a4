package com.npssenti.crawler.scheduler;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.CrawlRun;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.service.CrawlPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The autocrawl controller: plans a round from the monthly deficits, runs the pipeline for it,
 * then folds what was stored back into the persisted state.
 *
 * Rounds are serialised; the state file is only written after the pipeline has closed its
 * output files and flushed the index.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AutoCrawler {

    private static final List<String> GROUPS = List.of(
            SourceType.NEWS_INDEX.group(), SourceType.VIDEO.group(), SourceType.FORUM.group());

    private final RoundPlanner planner;
    private final CrawlPipeline pipeline;
    private final AutoStateStore stateStore;
    private final CrawlerProperties properties;
    private final Clock clock;

    /**
     * One round against {@code state}; the updated state is persisted before returning.
     */
    public synchronized RoundReport runRound(AutoState state, PlanSettings settings) {
        Instant now = clock.instant();
        RoundPlan plan = planner.plan(state, properties.getKeywords(), settings, now);
        long round = state.getRoundsCompleted() + 1;
        log.info("Autocrawl round {}: {} target(s), {} quota unit(s) charged, deferred video months {}",
                round, plan.targets().size(), plan.quotaCharged(), plan.deferredVideoMonths());

        CrawlRun run = null;
        if (!plan.isEmpty()) {
            run = pipeline.run(plan.targets(), settings.getRoundMaxFetch());
            for (CrawlRun.StoredRef ref : run.getStored()) {
                state.addCount(ref.month(), ref.sourceType().group(), 1);
                state.addStored(ref.source(), 1);
            }
            if (run.isQuotaExhausted()) {
                log.warn("Video quota reported exhausted, closing the ledger until the next UTC day");
                state.getYoutube().exhaust();
            }
        } else {
            log.info("Nothing to do this round: all months at target or quota spent");
        }

        state.setRoundsCompleted(round);
        state.setLastUpdated(clock.instant().toString());
        stateStore.save(state);

        return new RoundReport(round, plan, run == null ? 0 : run.totalStored(), run);
    }

    /**
     * Load the state and run {@code rounds} rounds, sleeping {@code sleepSec} between them.
     */
    public synchronized List<RoundReport> runRounds(int rounds, long sleepSec, PlanSettings settings) {
        AutoState state = stateStore.load();
        List<RoundReport> reports = new ArrayList<>();
        for (int i = 0; i < rounds; i++) {
            reports.add(runRound(state, settings));
            if (i < rounds - 1 && sleepSec > 0) {
                log.info("Sleeping {}s before next round", sleepSec);
                if (!sleep(sleepSec * 1000)) {
                    break;
                }
            }
        }
        return reports;
    }

    public AutoStatus status(PlanSettings settings) {
        AutoState state = stateStore.load();
        Instant now = clock.instant();
        state.getYoutube().rollover(LocalDate.ofInstant(now, ZoneOffset.UTC));

        List<MonthStatus> months = new ArrayList<>();
        for (YearMonth month : RoundPlanner.trailingMonths(now, settings.getMonthsBack())) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            Map<String, Integer> deficits = new LinkedHashMap<>();
            for (String group : GROUPS) {
                counts.put(group, state.count(month.toString(), group));
                deficits.put(group, RoundPlanner.deficit(state, month, group, settings.getMonthlyTarget()));
            }
            months.add(new MonthStatus(month.toString(), counts, deficits));
        }
        return new AutoStatus(months, state.getYoutube(), state.getYoutube().available(),
                state.getYoutubeKeywordCursor(), state.getRoundsCompleted(), state.getLastUpdated(),
                state.getStoredBySource());
    }

    /** @return false when interrupted */
    protected boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted between rounds, stopping");
            return false;
        }
    }

    // ── Reports ──────────────────────────────────────────────────────────────

    /**
     * @param run null when the plan was empty
     */
    public record RoundReport(long round, RoundPlan plan, int stored, CrawlRun run) {}

    public record MonthStatus(String month, Map<String, Integer> counts, Map<String, Integer> deficits) {}

    public record AutoStatus(List<MonthStatus> months, QuotaLedger quota, int quotaAvailable,
                             int youtubeKeywordCursor, long roundsCompleted, String lastUpdated,
                             Map<String, Long> storedBySource) {}
}
