package com.npssenti.crawler.service.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Candidate;
import com.npssenti.crawler.model.Caption;
import com.npssenti.crawler.model.Document;
import com.npssenti.crawler.model.RawPayload;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.model.VideoStats;
import com.npssenti.crawler.service.DocumentIds;
import com.npssenti.crawler.service.UrlNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentExtractorTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-06-15T09:30:00Z");
    private static final String RUN_ID = "20240615T093000Z";

    @Mock
    private LanguageIdentifier languageIdentifier;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DocumentIds documentIds = new DocumentIds(new UrlNormalizer());
    private DocumentExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new DocumentExtractor(new TextDecoder(), new HtmlContentExtractor(),
                new PublishDateResolver(objectMapper), languageIdentifier, documentIds, objectMapper,
                new CrawlerProperties());
    }

    @Test
    @DisplayName("게시글 HTML에서 본문, 작성자, 발견 정보와 수집 메타를 채운다")
    void extractsForumThread() throws Exception {
        // given
        when(languageIdentifier.detect(anyString())).thenReturn(new LanguageIdentifier.Detection("ko", 0.97));
        String html = "<html><head><title>국민연금 개혁 어떻게 생각하세요</title></head><body>"
                + "<div class=\"write_div\">" + "보험료율 인상과 소득대체율 조정이 함께 논의되고 있습니다. ".repeat(4) + "</div>"
                + "<p class=\"cmt_txt\">저는 반대입니다</p>"
                + "</body></html>";
        Map<String, Object> via = new LinkedHashMap<>();
        via.put("board", "pension");
        Candidate candidate = Candidate.builder()
                .source("dcinside")
                .sourceType(SourceType.FORUM)
                .url("https://gall.dcinside.com/board/view/?id=pension&no=1&page=2")
                .author("연금러")
                .publishedHint(Instant.parse("2024-05-10T04:20:00Z"))
                .discoveredVia(via)
                .build();
        RawPayload payload = new RawPayload("https://gall.dcinside.com/board/view/?id=pension&no=1", 200,
                "text/html; charset=UTF-8", html.getBytes(StandardCharsets.UTF_8), FETCHED_AT, "live", 2);

        // when
        Document doc = extractor.extract(payload, candidate, RUN_ID);

        // then
        assertThat(doc.getTitle()).isEqualTo("국민연금 개혁 어떻게 생각하세요");
        assertThat(doc.getText()).startsWith("보험료율 인상과").endsWith("\n\n저는 반대입니다");
        assertThat(doc.getAuthors()).containsExactly("연금러");
        assertThat(doc.getPublishedAt()).isEqualTo("2024-05-10T04:20:00Z");
        assertThat(doc.getSource()).isEqualTo("dcinside");
        assertThat(doc.getSnapshotUrl()).isEqualTo("https://gall.dcinside.com/board/view/?id=pension&no=1");
        assertThat(doc.getLang()).isEqualTo("ko");
        assertThat(doc.getLangConfidence()).isEqualTo(0.97);
        assertThat(doc.getDiscoveredVia()).containsEntry("board", "pension");
        assertThat(doc.getId()).isEqualTo(documentIds.documentId(candidate.getUrl(), doc.getText()));
        assertThat(doc.getCrawl().runId()).isEqualTo(RUN_ID);
        assertThat(doc.getCrawl().fetchedAt()).isEqualTo("2024-06-15T09:30:00Z");
        assertThat(doc.getCrawl().fetchedFrom()).isEqualTo("live");
        assertThat(doc.getCrawl().attempts()).isEqualTo(2);
        assertThat(doc.getDup()).isEmpty();
        assertThat(doc.getVideoId()).isNull();
    }

    @Test
    @DisplayName("영상 페이로드는 제목, 설명, 자막, 댓글 순으로 본문을 만든다")
    void extractsVideoPayload() throws Exception {
        // given
        when(languageIdentifier.detect(anyString())).thenReturn(new LanguageIdentifier.Detection("ko", 0.9));
        String json = "{\"video\":{\"id\":\"abc123\",\"snippet\":{"
                + "\"title\":\"국민연금 개혁안 해설\",\"description\":\"개혁안의 핵심을 정리합니다\","
                + "\"publishedAt\":\"2024-05-03T10:00:00Z\",\"channelId\":\"UC1\",\"channelTitle\":\"연금채널\"},"
                + "\"statistics\":{\"viewCount\":\"1200\",\"commentCount\":\"3\"}},"
                + "\"comments\":[\"좋은 설명\",\"반대합니다\"],"
                + "\"captions\":[{\"lang\":\"ko\",\"text\":\"안녕하세요 오늘은 연금 이야기\"}]}";
        Candidate candidate = Candidate.builder()
                .source("youtube")
                .sourceType(SourceType.VIDEO)
                .url("https://www.youtube.com/watch?v=abc123")
                .videoId("abc123")
                .build();
        RawPayload payload = new RawPayload(candidate.getUrl(), 200, "application/json",
                json.getBytes(StandardCharsets.UTF_8), FETCHED_AT, "youtube-api", 1);

        // when
        Document doc = extractor.extract(payload, candidate, RUN_ID);

        // then
        assertThat(doc.getText()).isEqualTo("국민연금 개혁안 해설\n\n개혁안의 핵심을 정리합니다\n\n"
                + "안녕하세요 오늘은 연금 이야기\n\n좋은 설명\n반대합니다");
        assertThat(doc.getPublishedAt()).isEqualTo("2024-05-03T10:00:00Z");
        assertThat(doc.getAuthors()).containsExactly("연금채널");
        assertThat(doc.getVideoId()).isEqualTo("abc123");
        assertThat(doc.getChannelId()).isEqualTo("UC1");
        assertThat(doc.getCaptions()).containsExactly(new Caption("ko", "안녕하세요 오늘은 연금 이야기"));
        assertThat(doc.getStats()).isEqualTo(new VideoStats(1200L, null, 3L));
        assertThat(doc.getSnapshotUrl()).isNull();
        assertThat(doc.getCrawl().fetchedFrom()).isEqualTo("youtube-api");
    }

    @Test
    @DisplayName("본문과 제목이 모두 없으면 추출 실패다")
    void failsWithoutTextOrTitle() {
        Candidate candidate = Candidate.builder()
                .source("gdelt")
                .sourceType(SourceType.NEWS_INDEX)
                .url("https://news.example.com/empty")
                .build();
        RawPayload payload = new RawPayload(candidate.getUrl(), 200, "text/html",
                "<html><body><script>var a = 1;</script></body></html>".getBytes(StandardCharsets.UTF_8),
                FETCHED_AT, "live", 1);

        assertThatThrownBy(() -> extractor.extract(payload, candidate, RUN_ID))
                .isInstanceOf(ExtractException.class)
                .hasMessageContaining("news.example.com/empty");
        verifyNoInteractions(languageIdentifier);
    }

    @Test
    @DisplayName("영상 리소스가 없는 페이로드는 거부한다")
    void rejectsVideoPayloadWithoutResource() {
        Candidate candidate = Candidate.builder()
                .source("youtube")
                .sourceType(SourceType.VIDEO)
                .url("https://www.youtube.com/watch?v=zzz")
                .videoId("zzz")
                .build();
        RawPayload payload = new RawPayload(candidate.getUrl(), 200, "application/json",
                "{\"comments\":[]}".getBytes(StandardCharsets.UTF_8), FETCHED_AT, "youtube-api", 1);

        assertThatThrownBy(() -> extractor.extract(payload, candidate, RUN_ID))
                .isInstanceOf(ExtractException.class)
                .hasMessageContaining("zzz");
    }
}
