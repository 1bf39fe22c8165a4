package com.npssenti.crawler.scheduler;

import com.npssenti.crawler.model.CrawlTarget;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Picks the targets of one autocrawl round from the monthly deficits.
 *
 * <ol>
 *   <li>Months are the trailing {@code months-back} calendar months (UTC), current month included.</li>
 *   <li>deficit(month, group) = max(0, monthly-target - counts[month][group]).</li>
 *   <li>Per group, months rank by deficit descending, ties going to the more recent month;
 *       up to max-&lt;group&gt;-windows months with a positive deficit are taken.</li>
 *   <li>Video keywords come round-robin from the persisted cursor and are admitted while their
 *       estimated cost fits the ledger; the rest are deferred to a later round.</li>
 *   <li>Forums get one target per round when any month has a forum deficit.</li>
 * </ol>
 *
 * Mutates only the state's quota ledger and keyword cursor.
 */
@Component
@Slf4j
public class RoundPlanner {

    public RoundPlan plan(AutoState state, List<String> keywords, PlanSettings settings, Instant now) {
        List<YearMonth> months = trailingMonths(now, settings.getMonthsBack());
        List<CrawlTarget> targets = new ArrayList<>();
        List<String> deferred = new ArrayList<>();
        int charged = 0;

        if (settings.isGdeltEnabled()) {
            for (YearMonth month : pick(state, months, SourceType.NEWS_INDEX.group(), settings.getMonthlyTarget(),
                    settings.getMaxGdeltWindows())) {
                targets.add(CrawlTarget.newsIndex(window(month, now), keywords, month.toString()));
            }
        }

        if (settings.isYoutubeEnabled() && !keywords.isEmpty()) {
            QuotaLedger ledger = state.getYoutube();
            ledger.setDailyQuota(settings.getDailyQuota());
            ledger.setReserveQuota(settings.getReserveQuota());
            ledger.rollover(LocalDate.ofInstant(now, ZoneOffset.UTC));

            int cursor = Math.floorMod(state.getYoutubeKeywordCursor(), keywords.size());
            int available = ledger.available();
            int cost = settings.getCostPerKeyword();
            boolean budgetSpent = false;

            for (YearMonth month : pick(state, months, SourceType.VIDEO.group(), settings.getMonthlyTarget(),
                    settings.getMaxYoutubeWindows())) {
                List<String> admitted = new ArrayList<>();
                int perWindow = Math.min(settings.getMaxYoutubeKeywords(), keywords.size());
                for (int k = 0; k < perWindow && !budgetSpent; k++) {
                    if (charged + cost > available) {
                        budgetSpent = true;
                        break;
                    }
                    admitted.add(keywords.get(cursor));
                    cursor = (cursor + 1) % keywords.size();
                    charged += cost;
                }
                if (admitted.isEmpty()) {
                    deferred.add(month.toString());
                } else {
                    targets.add(CrawlTarget.video(window(month, now), admitted, month.toString()));
                }
            }

            ledger.consume(charged);
            state.setYoutubeKeywordCursor(cursor);
            if (!deferred.isEmpty()) {
                log.info("Deferred video months {} (available {} units, {} per keyword)", deferred, available, cost);
            }
        }

        if (settings.isIncludeForums() && settings.getMaxForumsWindows() > 0
                && !pick(state, months, SourceType.FORUM.group(), settings.getMonthlyTarget(), 1).isEmpty()) {
            targets.add(CrawlTarget.forums(Set.of()));
        }

        return new RoundPlan(targets, deferred, charged);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Oldest first, ending with the month containing {@code now}. */
    static List<YearMonth> trailingMonths(Instant now, int monthsBack) {
        YearMonth current = YearMonth.from(now.atZone(ZoneOffset.UTC));
        List<YearMonth> months = new ArrayList<>();
        for (int i = Math.max(1, monthsBack) - 1; i >= 0; i--) {
            months.add(current.minusMonths(i));
        }
        return months;
    }

    static int deficit(AutoState state, YearMonth month, String group, int monthlyTarget) {
        return Math.max(0, monthlyTarget - state.count(month.toString(), group));
    }

    static List<YearMonth> pick(AutoState state, List<YearMonth> months, String group, int monthlyTarget, int max) {
        return months.stream()
                .filter(m -> deficit(state, m, group, monthlyTarget) > 0)
                .sorted(Comparator.comparingInt((YearMonth m) -> deficit(state, m, group, monthlyTarget))
                        .reversed()
                        .thenComparing(Comparator.<YearMonth>reverseOrder()))
                .limit(Math.max(0, max))
                .toList();
    }

    /** [month start, min(next month start, now)) */
    static TimeWindow window(YearMonth month, Instant now) {
        Instant start = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        if (now.isBefore(end)) {
            end = now;
        }
        if (!end.isAfter(start)) {
            end = start.plusSeconds(1);
        }
        return new TimeWindow(start, end);
    }
}
