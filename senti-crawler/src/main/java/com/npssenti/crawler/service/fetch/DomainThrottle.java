package com.npssenti.crawler.service.fetch;

import com.npssenti.crawler.config.CrawlerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Per-host politeness: at most {@code per-domain-concurrency} requests in flight per host and a
 * minimum spacing between request starts on the same host.
 */
@Component
@RequiredArgsConstructor
public class DomainThrottle {

    private final CrawlerProperties properties;
    private final Map<String, HostSlot> slots = new ConcurrentHashMap<>();

    /**
     * Block until a request to {@code host} may start.
     *
     * @param crawlDelayMs robots crawl-delay for the host, 0 when none; capped at max-crawl-delay-ms
     */
    public Permit acquire(String host, long crawlDelayMs) throws InterruptedException {
        HostSlot slot = slots.computeIfAbsent(host,
                h -> new HostSlot(new Semaphore(Math.max(1, properties.getLimits().getPerDomainConcurrency()))));
        slot.semaphore.acquire();
        try {
            long spacing = Math.max(properties.getLimits().getMinDelayMs(),
                    Math.min(crawlDelayMs, properties.getLimits().getMaxCrawlDelayMs()));
            long waitNanos = slot.reserve(TimeUnit.MILLISECONDS.toNanos(spacing));
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        } catch (InterruptedException e) {
            slot.semaphore.release();
            throw e;
        }
        return slot.semaphore::release;
    }

    /** Held for the duration of one request. */
    @FunctionalInterface
    public interface Permit extends AutoCloseable {
        @Override
        void close();
    }

    private static final class HostSlot {
        private final Semaphore semaphore;
        private long nextStartNanos = Long.MIN_VALUE;

        private HostSlot(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        /** Claim the next start slot; returns how long the caller must wait for it. */
        private synchronized long reserve(long spacingNanos) {
            long now = System.nanoTime();
            long start = nextStartNanos == Long.MIN_VALUE ? now : Math.max(now, nextStartNanos);
            nextStartNanos = start + spacingNanos;
            return start - now;
        }
    }
}
