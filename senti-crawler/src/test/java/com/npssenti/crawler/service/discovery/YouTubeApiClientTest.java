package com.npssenti.crawler.service.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class YouTubeApiClientTest {

    private YouTubeApiClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wm) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getYoutube().setApiKey("k");
        properties.getYoutube().setBaseUrl(wm.getHttpBaseUrl() + "/youtube/v3");
        properties.getYoutube().setCaptionBaseUrl(wm.getHttpBaseUrl() + "/api/timedtext");
        properties.getRetry().setBaseDelayMs(10);
        properties.getRetry().setJitter(0);
        client = new YouTubeApiClient(new RestTemplate(), properties);
    }

    @Test
    @DisplayName("검색 창은 publishedAfter/publishedBefore로 전달된다")
    void searchSendsWindow() {
        stubFor(get(urlPathEqualTo("/youtube/v3/search")).willReturn(okJson("{\"items\":[]}")));
        TimeWindow window = new TimeWindow(Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-06-01T00:00:00Z"));

        JsonNode result = client.search("국민연금", window, 25);

        assertThat(result.path("items").isArray()).isTrue();
        verify(getRequestedFor(urlPathEqualTo("/youtube/v3/search"))
                .withQueryParam("q", equalTo("국민연금"))
                .withQueryParam("type", equalTo("video"))
                .withQueryParam("maxResults", equalTo("25"))
                .withQueryParam("publishedAfter", equalTo("2024-05-01T00:00:00Z"))
                .withQueryParam("publishedBefore", equalTo("2024-06-01T00:00:00Z"))
                .withQueryParam("key", equalTo("k")));
    }

    @Test
    @DisplayName("quotaExceeded 사유의 403은 쿼터 소진 예외로 바뀌고 재시도하지 않는다")
    void quotaExceededIsMapped() {
        stubFor(get(urlPathEqualTo("/youtube/v3/search")).willReturn(aResponse()
                .withStatus(403)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"error\":{\"code\":403,\"errors\":[{\"reason\":\"quotaExceeded\"}]}}")));

        assertThatThrownBy(() -> client.search("국민연금", null, 10)).isInstanceOf(QuotaExceededException.class);
        verify(1, getRequestedFor(urlPathEqualTo("/youtube/v3/search")));
    }

    @Test
    @DisplayName("다른 사유의 403은 그대로 전달된다")
    void otherForbiddenPropagates() {
        stubFor(get(urlPathEqualTo("/youtube/v3/videos")).willReturn(aResponse()
                .withStatus(403)
                .withBody("{\"error\":{\"errors\":[{\"reason\":\"forbidden\"}]}}")));

        assertThatThrownBy(() -> client.videos(List.of("v1")))
                .isInstanceOf(HttpClientErrorException.Forbidden.class);
    }

    @Test
    @DisplayName("5xx는 재시도 후 성공할 수 있다")
    void retriesServerErrors() {
        stubFor(get(urlPathEqualTo("/youtube/v3/videos")).inScenario("s")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(500))
                .willSetStateTo("ok"));
        stubFor(get(urlPathEqualTo("/youtube/v3/videos")).inScenario("s")
                .whenScenarioStateIs("ok")
                .willReturn(okJson("{\"items\":[{\"id\":\"v1\"}]}")));

        JsonNode result = client.videos(List.of("v1"));

        assertThat(result.path("items").get(0).path("id").asText()).isEqualTo("v1");
        verify(2, getRequestedFor(urlPathEqualTo("/youtube/v3/videos")));
    }

    @Test
    @DisplayName("자막 트랙이 없으면(4xx) null을 돌려준다")
    void missingCaptionTrack() {
        stubFor(get(urlPathEqualTo("/api/timedtext")).willReturn(aResponse().withStatus(404)));

        assertThat(client.captionTrack("v1", "ko")).isNull();
    }
}
