package com.npssenti.crawler.scheduler;

import com.npssenti.crawler.config.CrawlerProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs autocrawl rounds on a cron and/or once at startup.
 *
 * Both are off by default: the cron is "-" (disabled) and run-on-startup is false, so the CLI
 * commands stay in control. Enable with crawler.autocrawl.schedule.cron, e.g. "0 0 * * * *" for hourly.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AutoCrawlScheduler {

    private final AutoCrawler autoCrawler;
    private final CrawlerProperties properties;

    @PostConstruct
    public void onStartup() {
        CrawlerProperties.Autocrawl.Schedule schedule = properties.getAutocrawl().getSchedule();
        if (schedule.isRunOnStartup()) {
            log.info("run-on-startup=true, running {} autocrawl round(s)", properties.getAutocrawl().getRounds());
            try {
                properties.validate();
                autoCrawler.runRounds(properties.getAutocrawl().getRounds(), properties.getAutocrawl().getSleepSec(),
                        PlanSettings.from(properties));
            } catch (Exception e) {
                log.error("Startup autocrawl failed: {}", e.getMessage(), e);
            }
        } else if (!"-".equals(schedule.getCron())) {
            log.info("Autocrawl scheduled with cron '{}' (UTC)", schedule.getCron());
        }
    }

    @Scheduled(cron = "${crawler.autocrawl.schedule.cron:-}", zone = "UTC")
    public void scheduledRound() {
        log.info("Scheduled autocrawl round triggered");
        try {
            autoCrawler.runRounds(1, 0, PlanSettings.from(properties));
        } catch (Exception e) {
            log.error("Scheduled autocrawl round failed: {}", e.getMessage(), e);
        }
    }
}
