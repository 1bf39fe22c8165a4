package com.npssenti.crawler.service.fetch;

import com.npssenti.crawler.config.CrawlerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DomainThrottleTest {

    @Test
    @DisplayName("같은 호스트의 요청 시작 간격은 최소 지연 이상이다")
    void spacesStartsOnSameHost() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getLimits().setMinDelayMs(80);
        DomainThrottle throttle = new DomainThrottle(properties);

        long start = System.nanoTime();
        try (DomainThrottle.Permit p = throttle.acquire("a.example", 0)) {
            assertThat(p).isNotNull();
        }
        try (DomainThrottle.Permit p = throttle.acquire("a.example", 0)) {
            assertThat(p).isNotNull();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(75);
    }

    @Test
    @DisplayName("다른 호스트는 서로 기다리지 않고, crawl-delay는 상한으로 잘린다")
    void hostsAreIndependentAndCrawlDelayCapped() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getLimits().setMinDelayMs(0);
        properties.getLimits().setMaxCrawlDelayMs(50);
        DomainThrottle throttle = new DomainThrottle(properties);

        long start = System.nanoTime();
        throttle.acquire("a.example", 60_000).close();
        throttle.acquire("b.example", 60_000).close();
        throttle.acquire("a.example", 60_000).close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isBetween(45L, 5_000L);
    }
}
