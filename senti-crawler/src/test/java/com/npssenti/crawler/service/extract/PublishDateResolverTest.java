package com.npssenti.crawler.service.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PublishDateResolverTest {

    private static final Instant HINT = Instant.parse("2024-04-01T00:00:00Z");

    private final PublishDateResolver resolver = new PublishDateResolver(new ObjectMapper());

    @Test
    @DisplayName("페이지 메타데이터가 발견 단계의 힌트보다 우선한다")
    void metadataWinsOverHint() {
        Document page = Jsoup.parse("<html><head>"
                + "<meta property=\"article:published_time\" content=\"2024-05-03T09:00:00+09:00\">"
                + "</head><body></body></html>");

        Instant resolved = resolver.resolve(page, HINT, "2020-01-01");

        assertThat(resolved).isEqualTo(Instant.parse("2024-05-03T00:00:00Z"));
    }

    @Test
    @DisplayName("JSON-LD의 datePublished를 읽고 시간대가 없으면 서울 시간으로 본다")
    void readsJsonLdInSeoulTime() {
        Document page = Jsoup.parse("<html><head><script type=\"application/ld+json\">"
                + "{\"@type\":\"NewsArticle\",\"datePublished\":\"2024-05-03 09:00:00\"}"
                + "</script></head><body></body></html>");

        assertThat(resolver.resolve(page, null, null)).isEqualTo(Instant.parse("2024-05-03T00:00:00Z"));
    }

    @Test
    @DisplayName("깨진 JSON-LD는 무시하고 time 태그로 넘어간다")
    void skipsMalformedJsonLd() {
        Document page = Jsoup.parse("<html><head><script type=\"application/ld+json\">{not json"
                + "</script></head><body><time datetime=\"2024-05-03T12:00:00Z\">어제</time></body></html>");

        assertThat(resolver.resolve(page, HINT, null)).isEqualTo(Instant.parse("2024-05-03T12:00:00Z"));
    }

    @Test
    @DisplayName("메타데이터가 없으면 힌트를, 힌트도 없으면 본문의 날짜를 쓴다")
    void fallsBackToHintThenText() {
        Document page = Jsoup.parse("<html><body><p>본문</p></body></html>");

        assertThat(resolver.resolve(page, HINT, "2024.05.03 14:30 작성")).isEqualTo(HINT);
        assertThat(resolver.resolve(page, null, "작성 2024.05.03 14:30"))
                .isEqualTo(Instant.parse("2024-05-03T05:30:00Z"));
        assertThat(resolver.resolve(page, null, "날짜 없는 글")).isNull();
    }

    @Test
    @DisplayName("한국어 날짜 표기를 인식한다")
    void readsKoreanDate() {
        assertThat(PublishDateResolver.fromText("등록 2024년 5월 3일 14시 30분"))
                .isEqualTo(Instant.parse("2024-05-03T05:30:00Z"));
        assertThat(PublishDateResolver.fromText("2024년 12월 1일 발표"))
                .isEqualTo(Instant.parse("2024-11-30T15:00:00Z"));
    }

    @Test
    @DisplayName("범위를 벗어난 연도와 존재하지 않는 날짜는 건너뛴다")
    void skipsImplausibleDates() {
        assertThat(PublishDateResolver.fromText("1899-01-01 이후 2024-02-30 그리고 2023-12-31"))
                .isEqualTo(Instant.parse("2023-12-30T15:00:00Z"));
    }

    @Test
    @DisplayName("여러 날짜 형식을 파싱한다")
    void parsesCommonFormats() {
        assertThat(PublishDateResolver.parse("2024-05-03T00:00:00Z")).isEqualTo(Instant.parse("2024-05-03T00:00:00Z"));
        assertThat(PublishDateResolver.parse("2024-05-03")).isEqualTo(Instant.parse("2024-05-02T15:00:00Z"));
        assertThat(PublishDateResolver.parse("2024.05.03 09:00")).isEqualTo(Instant.parse("2024-05-03T00:00:00Z"));
        assertThat(PublishDateResolver.parse("어제")).isNull();
        assertThat(PublishDateResolver.parse(" ")).isNull();
        assertThat(PublishDateResolver.toIso(Instant.parse("2024-05-03T00:00:00Z"))).isEqualTo("2024-05-03T00:00:00Z");
    }
}
