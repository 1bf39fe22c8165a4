package com.npssenti.crawler.service.score;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Document;
import com.npssenti.crawler.model.Quality;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityScorerTest {

    private QualityScorer scorer;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setKeywords(List.of("국민연금", "연금개혁", " "));
        properties.setLanguages(List.of("ko"));
        scorer = new QualityScorer(properties);
    }

    @Test
    @DisplayName("충분히 길고 한국어이며 키워드가 있는 문서는 통과한다")
    void acceptsRelevantKoreanText() {
        Document doc = Document.builder()
                .text("가".repeat(400) + " 국민연금")
                .lang("ko")
                .langConfidence(0.9)
                .build();

        Quality quality = scorer.score(doc);

        assertThat(quality.getScore()).isCloseTo(0.87, within(1e-9));
        assertThat(quality.getLength()).isEqualTo(405);
        assertThat(quality.getKeywordHits()).isEqualTo(1);
        assertThat(quality.getKeywordCoverage()).isEqualTo(0.5);
        assertThat(quality.getReasons()).containsExactly("length+0.30", "lang:ko+0.27", "keywords:1/2+0.30");
        assertThat(scorer.isAccepted(quality)).isTrue();
    }

    @Test
    @DisplayName("허용되지 않은 언어와 키워드 없는 문서는 점수가 낮아 탈락한다")
    void rejectsForeignTextWithoutKeywords() {
        Document doc = Document.builder()
                .text("x".repeat(200))
                .lang("en")
                .langConfidence(0.99)
                .build();

        Quality quality = scorer.score(doc);

        assertThat(quality.getScore()).isCloseTo(0.15, within(1e-9));
        assertThat(quality.getReasons()).contains("lang=en", "keyword_hits=0");
        assertThat(scorer.isAccepted(quality)).isFalse();
    }

    @Test
    @DisplayName("제목의 키워드도 집계하고 짧은 본문은 사유에 남긴다")
    void countsTitleKeywordsAndFlagsShortText() {
        Document doc = Document.builder()
                .title("국민연금 토론")
                .text("연금개혁 반대")
                .lang("KO")
                .langConfidence(1.0)
                .build();

        Quality quality = scorer.score(doc);

        assertThat(quality.getKeywordHits()).isEqualTo(2);
        assertThat(quality.getKeywordCoverage()).isEqualTo(1.0);
        assertThat(quality.getReasons()).contains("short_text(7)");
        assertThat(quality.getScore()).isCloseTo(0.705, within(0.001));
        assertThat(scorer.isAccepted(quality)).isTrue();
    }
}
