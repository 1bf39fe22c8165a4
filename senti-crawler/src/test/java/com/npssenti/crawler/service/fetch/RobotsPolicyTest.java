package com.npssenti.crawler.service.fetch;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.npssenti.crawler.config.CrawlerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WireMockTest
class RobotsPolicyTest {

    private RobotsPolicy robotsPolicy;
    private DomainThrottle throttle;
    private DomainThrottle.Permit permit;
    private String baseUrl;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wm) throws Exception {
        baseUrl = wm.getHttpBaseUrl();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("nps-senti-crawler/1.0 (test)");
        properties.getLimits().setRequestTimeoutSec(5);

        throttle = mock(DomainThrottle.class);
        permit = mock(DomainThrottle.Permit.class);
        when(throttle.acquire(anyString(), anyLong())).thenReturn(permit);

        robotsPolicy = new RobotsPolicy(HttpClient.newHttpClient(), throttle, properties);
    }

    @Test
    @DisplayName("robots.txt 요청도 호스트별 제한을 거치고, 규칙은 한 번만 내려받는다")
    void robotsDownloadTakesThrottlePermit() throws Exception {
        // given
        stubFor(get(urlEqualTo("/robots.txt")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/plain")
                .withBody("User-agent: *\nDisallow: /private\nCrawl-delay: 2\n")));

        // when
        boolean open = robotsPolicy.isAllowed(URI.create(baseUrl + "/news/1"));
        boolean closed = robotsPolicy.isAllowed(URI.create(baseUrl + "/private/2"));

        // then
        assertThat(open).isTrue();
        assertThat(closed).isFalse();
        assertThat(robotsPolicy.crawlDelayMs(URI.create(baseUrl + "/news/1"))).isEqualTo(2000);
        verify(throttle, times(1)).acquire(eq("localhost"), eq(0L));
        verify(permit, times(1)).close();
    }

    @Test
    @DisplayName("robots.txt가 없으면(404) 모두 허용한다")
    void missingRobotsAllowsAll() throws Exception {
        stubFor(get(urlEqualTo("/robots.txt")).willReturn(aResponse().withStatus(404)));

        assertThat(robotsPolicy.isAllowed(URI.create(baseUrl + "/private/2"))).isTrue();
        verify(permit, times(1)).close();
    }
}
