package com.npssenti.crawler.scheduler;

import com.npssenti.crawler.config.CrawlerProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Effective autocrawl knobs for one invocation: configuration plus command-line overrides.
 */
@Value
@Builder(toBuilder = true)
public class PlanSettings {

    int monthsBack;
    int monthlyTarget;
    boolean includeForums;
    boolean gdeltEnabled;
    boolean youtubeEnabled;
    int maxGdeltWindows;
    int maxYoutubeWindows;
    int maxForumsWindows;
    int maxYoutubeKeywords;
    int costPerKeyword;
    int dailyQuota;
    int reserveQuota;
    Integer roundMaxFetch;

    public static PlanSettings from(CrawlerProperties properties) {
        CrawlerProperties.Autocrawl auto = properties.getAutocrawl();
        return PlanSettings.builder()
                .monthsBack(auto.getMonthsBack())
                .monthlyTarget(auto.getMonthlyTarget())
                .includeForums(auto.isIncludeForums())
                .gdeltEnabled(properties.getGdelt().isEnabled())
                .youtubeEnabled(properties.hasYouTubeKey())
                .maxGdeltWindows(auto.getMaxGdeltWindows())
                .maxYoutubeWindows(auto.getMaxYoutubeWindows())
                .maxForumsWindows(auto.getMaxForumsWindows())
                .maxYoutubeKeywords(auto.getMaxYoutubeKeywords())
                .costPerKeyword(properties.getYoutube().getCostPerKeyword())
                .dailyQuota(auto.getDailyQuota())
                .reserveQuota(auto.getReserveQuota())
                .roundMaxFetch(auto.getRoundMaxFetch())
                .build();
    }
}
