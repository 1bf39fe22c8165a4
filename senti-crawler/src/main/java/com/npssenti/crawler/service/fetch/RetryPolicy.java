package com.npssenti.crawler.service.fetch;

import com.npssenti.crawler.config.CrawlerProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.function.Predicate;

/**
 * Retry settings shared by every network call site.
 * Backoff is exponential with randomization: base, base*multiplier, base*multiplier^2 ... each +/- jitter.
 *
 * @param jitter randomization factor in [0, 1)
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, double multiplier, double jitter) {

    // resilience4j rejects intervals below 10ms
    private static final long MIN_DELAY_MS = 10;

    public static RetryPolicy from(CrawlerProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(),
                retry.getMultiplier(), retry.getJitter());
    }

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1)");
        }
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    /**
     * Build a Resilience4j retry that retries {@code retryOn} and stops at once on {@code ignore}.
     */
    @SafeVarargs
    public final Retry toRetry(String name, Class<? extends Throwable> retryOn,
                               Class<? extends Throwable>... ignore) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Math.max(MIN_DELAY_MS, baseDelayMs), multiplier, jitter))
                .retryExceptions(retryOn)
                .ignoreExceptions(ignore)
                .build();
        return Retry.of(name, config);
    }

    /** Variant for RestTemplate call sites, retrying whatever {@code retryOn} accepts. */
    public Retry toRetry(String name, Predicate<Throwable> retryOn) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Math.max(MIN_DELAY_MS, baseDelayMs), multiplier, jitter))
                .retryOnException(retryOn)
                .build();
        return Retry.of(name, config);
    }

    /** 429, 5xx and I/O failures from RestTemplate */
    public static boolean isTransientApiError(Throwable e) {
        return e instanceof HttpServerErrorException
                || e instanceof HttpClientErrorException.TooManyRequests
                || e instanceof ResourceAccessException;
    }
}
