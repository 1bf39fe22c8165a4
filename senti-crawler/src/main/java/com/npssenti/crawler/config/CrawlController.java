package com.npssenti.crawler.config;

import com.npssenti.crawler.model.CrawlRun;
import com.npssenti.crawler.scheduler.AutoCrawler;
import com.npssenti.crawler.scheduler.PlanSettings;
import com.npssenti.crawler.service.CrawlPipeline;
import com.npssenti.crawler.service.RunSelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP triggers for the server profile. Runs are started on a background thread and
 * answered with 202; progress shows up in the logs and in the status endpoints.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class CrawlController {

    private final CrawlPipeline pipeline;
    private final AutoCrawler autoCrawler;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final AtomicReference<CrawlRun> lastRun = new AtomicReference<>();

    // ── Crawl triggers ───────────────────────────────────────────────────────

    @PostMapping("/crawl/run")
    public ResponseEntity<Map<String, String>> triggerRun(
            @RequestParam(required = false) String only,
            @RequestParam(required = false) String forumSites,
            @RequestParam(required = false) Integer maxFetch) {
        if (pipeline.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a crawl run is already in progress"));
        }
        RunSelection selection;
        try {
            selection = RunSelection.parse(only, forumSites, false, maxFetch);
            properties.validate();
            properties.resolveTimeWindow(clock);
        } catch (IllegalArgumentException | CrawlConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        new Thread(() -> lastRun.set(pipeline.runConfigured(selection)), "manual-crawl-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "run"));
    }

    @PostMapping("/autocrawl/round")
    public ResponseEntity<Map<String, String>> triggerRound(@RequestParam(defaultValue = "1") int rounds) {
        if (rounds < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "rounds must be >= 1"));
        }
        if (pipeline.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a crawl run is already in progress"));
        }
        new Thread(() -> {
            try {
                autoCrawler.runRounds(rounds, 0, PlanSettings.from(properties)).stream()
                        .map(AutoCrawler.RoundReport::run)
                        .filter(Objects::nonNull)
                        .reduce((a, b) -> b)
                        .ifPresent(lastRun::set);
            } catch (Exception e) {
                log.error("Manual autocrawl failed: {}", e.getMessage(), e);
            }
        }, "manual-autocrawl").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "rounds", String.valueOf(rounds)));
    }

    // ── Status ───────────────────────────────────────────────────────────────

    @GetMapping("/autocrawl/status")
    public ResponseEntity<AutoCrawler.AutoStatus> autocrawlStatus() {
        return ResponseEntity.ok(autoCrawler.status(PlanSettings.from(properties)));
    }

    @GetMapping("/crawl/status")
    public ResponseEntity<Map<String, Object>> crawlStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "senti-crawler");
        body.put("dataDir", properties.getOutput().getDataDir());
        body.put("lastRun", lastRun.get());
        return ResponseEntity.ok(body);
    }
}
