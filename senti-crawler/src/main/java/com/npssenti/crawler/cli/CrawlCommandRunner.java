package com.npssenti.crawler.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.npssenti.crawler.config.CrawlConfigException;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.output.JsonlDeduplicator;
import com.npssenti.crawler.output.JsonlMerger;
import com.npssenti.crawler.scheduler.AutoCrawler;
import com.npssenti.crawler.scheduler.PlanSettings;
import com.npssenti.crawler.service.CrawlPipeline;
import com.npssenti.crawler.service.RunSelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 *   run [--max-fetch=N] [--only=gdelt,youtube,forums] [--forum-sites=a,b] [--no-gdelt]
 *   autocrawl status
 *   autocrawl run [--rounds=N] [--sleep-sec=S] [--months-back=N] [--monthly-target=N]
 *                 [--max-gdelt-windows=N] [--max-youtube-windows=N] [--max-forums-windows=N]
 *                 [--max-youtube-keywords=N] [--include-forums=true|false] [--max-fetch=N]
 *   dedup IN.jsonl [OUT.jsonl]
 *   merge EXISTING.jsonl BATCH.jsonl [OUT.jsonl]
 * </pre>
 *
 * Global flags: --config=FILE, --data-dir=DIR, --log-level=LEVEL.
 * Exit codes: 0 done (per-item failures included), 1 unknown command, 2 configuration error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrawlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_USAGE = 1;

    private final CrawlPipeline pipeline;
    private final AutoCrawler autoCrawler;
    private final JsonlDeduplicator deduplicator;
    private final JsonlMerger merger;
    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;
    private final ApplicationContext context;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        if (command.isEmpty()) {
            if (!(context instanceof WebServerApplicationContext)) {
                log.error("No command given. Commands: run | autocrawl status | autocrawl run | dedup | merge");
                exitCode = EXIT_USAGE;
            }
            return;
        }

        switch (command.get(0)) {
            case "run" -> runCommand(args);
            case "autocrawl" -> autocrawl(command, args);
            case "dedup" -> dedup(command);
            case "merge" -> merge(command);
            default -> usage("Unknown command: " + command.get(0));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ── Commands ─────────────────────────────────────────────────────────────

    private void runCommand(ApplicationArguments args) {
        RunSelection selection;
        try {
            selection = RunSelection.parse(option(args, "only"), option(args, "forum-sites"),
                    args.containsOption("no-gdelt"), intOption(args, "max-fetch"));
        } catch (IllegalArgumentException e) {
            throw new CrawlConfigException("--only: " + e.getMessage(), e);
        }
        properties.validate();
        pipeline.runConfigured(selection);
    }

    private void autocrawl(List<String> command, ApplicationArguments args) {
        String sub = command.size() > 1 ? command.get(1) : "";
        PlanSettings settings = overrides(PlanSettings.from(properties), args);
        switch (sub) {
            case "status" -> print(autoCrawler.status(settings));
            case "run" -> {
                properties.validate();
                Integer rounds = intOption(args, "rounds");
                Integer sleepSec = intOption(args, "sleep-sec");
                List<AutoCrawler.RoundReport> reports = autoCrawler.runRounds(
                        rounds != null ? rounds : properties.getAutocrawl().getRounds(),
                        sleepSec != null ? sleepSec : properties.getAutocrawl().getSleepSec(),
                        settings);
                int stored = reports.stream().mapToInt(AutoCrawler.RoundReport::stored).sum();
                log.info("Autocrawl finished: {} round(s), {} document(s) stored", reports.size(), stored);
            }
            default -> usage("Unknown autocrawl subcommand: '" + sub + "' (expected status | run)");
        }
    }

    private void dedup(List<String> command) {
        if (command.size() < 2) {
            usage("dedup needs an input file");
            return;
        }
        Path in = Paths.get(command.get(1));
        Path out = command.size() > 2 ? Paths.get(command.get(2)) : siblingWithSuffix(in, ".dedup.jsonl");
        try {
            print(deduplicator.dedup(in, out));
        } catch (IOException e) {
            throw new UncheckedIOException("dedup failed for " + in, e);
        }
    }

    private void merge(List<String> command) {
        if (command.size() < 3) {
            usage("merge needs an existing file and a batch file");
            return;
        }
        Path existing = Paths.get(command.get(1));
        Path batch = Paths.get(command.get(2));
        Path out = command.size() > 3 ? Paths.get(command.get(3)) : existing;
        try {
            print(merger.merge(existing, batch, out));
        } catch (IOException e) {
            throw new UncheckedIOException("merge failed for " + batch, e);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private PlanSettings overrides(PlanSettings base, ApplicationArguments args) {
        PlanSettings.PlanSettingsBuilder b = base.toBuilder();
        Integer v;
        if ((v = intOption(args, "months-back")) != null) {
            b.monthsBack(v);
        }
        if ((v = intOption(args, "monthly-target")) != null) {
            b.monthlyTarget(v);
        }
        if ((v = intOption(args, "max-gdelt-windows")) != null) {
            b.maxGdeltWindows(v);
        }
        if ((v = intOption(args, "max-youtube-windows")) != null) {
            b.maxYoutubeWindows(v);
        }
        if ((v = intOption(args, "max-forums-windows")) != null) {
            b.maxForumsWindows(v);
        }
        if ((v = intOption(args, "max-youtube-keywords")) != null) {
            b.maxYoutubeKeywords(v);
        }
        if ((v = intOption(args, "max-fetch")) != null) {
            b.roundMaxFetch(v);
        }
        String includeForums = option(args, "include-forums");
        if (includeForums != null) {
            b.includeForums(Boolean.parseBoolean(includeForums));
        }
        return b.build();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static Integer intOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new CrawlConfigException("--" + name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Path siblingWithSuffix(Path in, String suffix) {
        String name = in.getFileName().toString();
        String base = name.endsWith(".jsonl") ? name.substring(0, name.length() - ".jsonl".length()) : name;
        return in.resolveSibling(base + suffix);
    }

    private void usage(String message) {
        log.error(message);
        exitCode = EXIT_USAGE;
    }

    private void print(Object value) {
        try {
            System.out.println(objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value));
        } catch (JsonProcessingException e) {
            log.warn("Cannot render result: {}", e.getMessage());
        }
    }
}
