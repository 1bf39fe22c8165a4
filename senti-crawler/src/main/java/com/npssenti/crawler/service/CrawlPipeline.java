package com.npssenti.crawler.service;

import com.npssenti.crawler.config.CrawlConfigException;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.CrawlRun;
import com.npssenti.crawler.model.CrawlTarget;
import com.npssenti.crawler.model.Document;
import com.npssenti.crawler.model.Quality;
import com.npssenti.crawler.model.RawPayload;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.model.TimeWindow;
import com.npssenti.crawler.output.OutputRouter;
import com.npssenti.crawler.output.StoreOutcome;
import com.npssenti.crawler.service.discovery.Discoverer;
import com.npssenti.crawler.service.discovery.DiscoveryLimits;
import com.npssenti.crawler.service.discovery.QuotaExceededException;
import com.npssenti.crawler.service.extract.DocumentExtractor;
import com.npssenti.crawler.service.extract.ExtractException;
import com.npssenti.crawler.service.extract.PublishDateResolver;
import com.npssenti.crawler.service.fetch.FetchException;
import com.npssenti.crawler.service.fetch.Fetcher;
import com.npssenti.crawler.service.fetch.PermanentFetchException;
import com.npssenti.crawler.service.fetch.TransientFetchException;
import com.npssenti.crawler.service.fetch.VideoPayloadAssembler;
import com.npssenti.crawler.service.score.QualityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates Discover → Fetch → Extract → Score → Dedupe → Store for a list of targets.
 *
 * Fetch and extract run on a small worker pool; everything that touches the index, the output
 * files or the run counters happens on the calling thread as results complete. Per-item failures
 * are counted and logged, never rethrown.
 */
@Service
@Slf4j
public class CrawlPipeline {

    private static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private final Map<SourceType, Discoverer> discoverers = new EnumMap<>(SourceType.class);
    private final Fetcher fetcher;
    private final VideoPayloadAssembler videoAssembler;
    private final DocumentExtractor extractor;
    private final QualityScorer scorer;
    private final OutputRouter outputRouter;
    private final DocumentIds documentIds;
    private final CrawlerProperties properties;
    private final Clock clock;

    /** One run at a time: the output files and the index have a single writer. */
    private final ReentrantLock runLock = new ReentrantLock();

    public CrawlPipeline(List<Discoverer> discoverers, Fetcher fetcher, VideoPayloadAssembler videoAssembler,
                         DocumentExtractor extractor, QualityScorer scorer, OutputRouter outputRouter,
                         DocumentIds documentIds, CrawlerProperties properties, Clock clock) {
        discoverers.forEach(d -> this.discoverers.put(d.sourceType(), d));
        this.fetcher = fetcher;
        this.videoAssembler = videoAssembler;
        this.extractor = extractor;
        this.scorer = scorer;
        this.outputRouter = outputRouter;
        this.documentIds = documentIds;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Plain run over the configured time window and keywords.
     *
     * @throws CrawlConfigException for a bad window, or when a source that needs credentials was
     *                              explicitly requested without them
     */
    public CrawlRun runConfigured(RunSelection selection) {
        TimeWindow window = properties.resolveTimeWindow(clock);
        List<CrawlTarget> targets = new ArrayList<>();

        if (selection.includes(SourceType.NEWS_INDEX) && properties.getGdelt().isEnabled()) {
            targets.add(CrawlTarget.newsIndex(window, properties.getKeywords(), null));
        }
        if (selection.includes(SourceType.VIDEO)) {
            if (properties.hasYouTubeKey()) {
                targets.add(CrawlTarget.video(window, properties.getKeywords(), null));
            } else if (selection.explicitlyRequested(SourceType.VIDEO)) {
                throw new CrawlConfigException("youtube requested but YOUTUBE_API_KEY is not set");
            } else {
                log.info("YOUTUBE_API_KEY not set, video source disabled for this run");
            }
        }
        if (selection.includes(SourceType.FORUM)) {
            targets.add(CrawlTarget.forums(selection.forumSites()));
        }

        Integer maxFetch = selection.maxFetch() != null ? selection.maxFetch() : properties.getLimits().getMaxFetch();
        return run(targets, maxFetch);
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Run the full pipeline for the given targets. Blocks while another run is in progress.
     *
     * @param maxFetch cap on fetch attempts across all targets; null or <= 0 means unlimited
     */
    public CrawlRun run(List<CrawlTarget> targets, Integer maxFetch) {
        runLock.lock();
        try {
            return runLocked(targets, maxFetch);
        } finally {
            runLock.unlock();
        }
    }

    private CrawlRun runLocked(List<CrawlTarget> targets, Integer maxFetch) {
        Instant startedAt = clock.instant();
        String runId = properties.getRunId() != null && !properties.getRunId().isBlank()
                ? properties.getRunId()
                : RUN_ID.format(startedAt);

        CrawlRun run = CrawlRun.builder()
                .runId(runId)
                .startedAt(startedAt)
                .status("RUNNING")
                .build();
        log.info("Run {} starting: {} target(s), max-fetch={}", runId, targets.size(),
                maxFetch == null || maxFetch <= 0 ? "unlimited" : maxFetch);

        outputRouter.open();
        try {
            List<Candidate> candidates = discoverAll(targets, run);
            process(candidates, run, maxFetch);
            run.setStatus(Thread.currentThread().isInterrupted() ? "INTERRUPTED" : "SUCCESS");
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            run.setStatus("FAILED");
        } finally {
            outputRouter.close();
            run.setCompletedAt(clock.instant());
            logSummary(run);
        }
        return run;
    }

    // ── Discover ─────────────────────────────────────────────────────────────

    private List<Candidate> discoverAll(List<CrawlTarget> targets, CrawlRun run) {
        List<Candidate> all = new ArrayList<>();
        int perSource = properties.getLimits().getMaxCandidatesPerSource();

        for (CrawlTarget target : targets) {
            Discoverer discoverer = discoverers.get(target.sourceType());
            if (discoverer == null) {
                log.warn("No discoverer registered for {}", target.sourceType());
                continue;
            }
            if (target.sourceType() == SourceType.VIDEO && run.isQuotaExhausted()) {
                log.info("Skipping video target {}: quota exhausted", target.month());
                continue;
            }

            DiscoveryLimits limits = target.sourceType() == SourceType.VIDEO
                    ? new DiscoveryLimits(perSource,
                            target.keywords().size() * properties.getYoutube().getCostPerKeyword())
                    : DiscoveryLimits.unmetered(perSource);

            List<Candidate> found;
            try {
                found = discoverer.discover(target, limits);
            } catch (QuotaExceededException e) {
                log.warn("Video quota exhausted during discovery: {}", e.getMessage());
                run.setQuotaExhausted(true);
                continue;
            } catch (RuntimeException e) {
                log.error("Discovery failed for {} target {}: {}", target.sourceType(), target.month(), e.getMessage(), e);
                continue;
            }

            for (Candidate c : found) {
                run.counters(c.getSource()).setDiscovered(run.counters(c.getSource()).getDiscovered() + 1);
                all.add(c);
            }
        }
        return all;
    }

    // ── Fetch / extract / score / store ─────────────────────────────────────

    private void process(List<Candidate> candidates, CrawlRun run, Integer maxFetch) {
        int poolSize = Math.max(1, properties.getLimits().getFetchConcurrency());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<ItemResult> completion = new ExecutorCompletionService<>(pool);

        try {
            Set<String> submittedUrls = new HashSet<>();
            int submitted = 0;

            for (int i = 0; i < candidates.size(); i++) {
                Candidate candidate = candidates.get(i);
                CrawlRun.SourceCounters counters = run.counters(candidate.getSource());
                String fingerprint = documentIds.urlFingerprint(candidate.getUrl());
                if (outputRouter.isIndexedUrl(fingerprint) || !submittedUrls.add(fingerprint)) {
                    counters.setSkippedIndexed(counters.getSkippedIndexed() + 1);
                    continue;
                }
                if (maxFetch != null && maxFetch > 0 && submitted >= maxFetch) {
                    log.info("max-fetch {} reached, {} candidate(s) left unfetched", maxFetch,
                            candidates.size() - i);
                    break;
                }
                if (candidate.getSourceType() == SourceType.VIDEO && run.isQuotaExhausted()) {
                    continue;
                }
                counters.setAttempted(counters.getAttempted() + 1);
                completion.submit(() -> fetchAndExtract(candidate, run.getRunId()));
                submitted++;
            }

            for (int i = 0; i < submitted; i++) {
                ItemResult result;
                try {
                    result = completion.take().get();
                } catch (ExecutionException e) {
                    log.error("Fetch task crashed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage(), e);
                    continue;
                }
                handle(result, run);
            }
        } catch (InterruptedException e) {
            log.warn("Run {} interrupted, stopping", run.getRunId());
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdownNow();
        }
    }

    private ItemResult fetchAndExtract(Candidate candidate, String runId) {
        RawPayload payload;
        try {
            payload = candidate.getSourceType() == SourceType.VIDEO
                    ? videoAssembler.assemble(candidate)
                    : fetcher.fetch(candidate);
        } catch (FetchException e) {
            return ItemResult.failed(candidate, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ItemResult.failed(candidate, e);
        } catch (RuntimeException e) {
            return ItemResult.failed(candidate, e);
        }

        try {
            Document doc = extractor.extract(payload, candidate, runId);
            return new ItemResult(candidate, payload, doc, null);
        } catch (ExtractException | RuntimeException e) {
            return new ItemResult(candidate, payload, null, e);
        }
    }

    private void handle(ItemResult result, CrawlRun run) {
        Candidate candidate = result.candidate();
        CrawlRun.SourceCounters counters = run.counters(candidate.getSource());

        if (result.payload() == null) {
            Exception error = result.error();
            if (error instanceof QuotaExceededException) {
                run.setQuotaExhausted(true);
                counters.setFetchFailed(counters.getFetchFailed() + 1);
                log.warn("Video quota exhausted while assembling {}", candidate.getVideoId());
            } else if (error instanceof TransientFetchException) {
                counters.setFetchExhausted(counters.getFetchExhausted() + 1);
                log.warn("Gave up on {} after {} attempt(s): {}", candidate.getUrl(),
                        ((TransientFetchException) error).getAttempts(), error.getMessage());
            } else if (error instanceof PermanentFetchException) {
                counters.setFetchFailed(counters.getFetchFailed() + 1);
                log.debug("Skipping {}: {} ({})", candidate.getUrl(), error.getMessage(),
                        ((PermanentFetchException) error).getReason());
            } else {
                counters.setFetchFailed(counters.getFetchFailed() + 1);
                log.warn("Fetch failed for {}: {}", candidate.getUrl(), error == null ? "unknown" : error.getMessage());
            }
            return;
        }

        counters.setFetched(counters.getFetched() + 1);
        if (result.payload().attempts() > 1) {
            counters.setRetried(counters.getRetried() + 1);
        }

        if (result.document() == null) {
            counters.setExtractFailed(counters.getExtractFailed() + 1);
            log.debug("Extraction failed for {}: {}", candidate.getUrl(),
                    result.error() == null ? "unknown" : result.error().getMessage());
            return;
        }

        Document doc = result.document();
        Quality quality = scorer.score(doc);
        doc.setQuality(quality);
        if (!scorer.isAccepted(quality)) {
            counters.setRejected(counters.getRejected() + 1);
            log.debug("Rejected {} (score {} {})", candidate.getUrl(), quality.getScore(), quality.getReasons());
            return;
        }

        StoreOutcome outcome = outputRouter.store(doc);
        if (outcome == StoreOutcome.WRITTEN) {
            counters.setStored(counters.getStored() + 1);
            run.getStored().add(new CrawlRun.StoredRef(doc.getId(), doc.getSource(), doc.getSourceType(),
                    monthOf(doc, candidate, result.payload())));
        } else {
            counters.setDuplicates(counters.getDuplicates() + 1);
        }
    }

    /** Month bucket: published_at, else the discovery hint, else the fetch time. */
    static String monthOf(Document doc, Candidate candidate, RawPayload payload) {
        Instant when = PublishDateResolver.parse(doc.getPublishedAt());
        if (when == null) {
            when = candidate.getPublishedHint();
        }
        if (when == null) {
            when = payload.fetchedAt();
        }
        return MONTH.format(when);
    }

    private void logSummary(CrawlRun run) {
        run.getCounters().forEach((source, c) -> log.info(
                "Run {} [{}] discovered={} attempted={} skippedIndexed={} fetched={} retried={} "
                        + "fetchFailed={} exhausted={} extractFailed={} rejected={} duplicates={} stored={}",
                run.getRunId(), source, c.getDiscovered(), c.getAttempted(), c.getSkippedIndexed(),
                c.getFetched(), c.getRetried(), c.getFetchFailed(), c.getFetchExhausted(),
                c.getExtractFailed(), c.getRejected(), c.getDuplicates(), c.getStored()));
        log.info("Run {} {}: stored {} of {} attempted", run.getRunId(), run.getStatus(),
                run.totalStored(), run.totalAttempted());
    }

    private record ItemResult(Candidate candidate, RawPayload payload, Document document, Exception error) {
        static ItemResult failed(Candidate candidate, Exception error) {
            return new ItemResult(candidate, null, null, error);
        }
    }
}
