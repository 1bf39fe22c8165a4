package com.npssenti.crawler.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    private final UrlNormalizer normalizer = new UrlNormalizer();

    @Test
    @DisplayName("스킴과 호스트를 소문자로, 기본 포트와 프래그먼트와 추적 파라미터를 제거하고 파라미터를 정렬한다")
    void canonicalizesGenericUrl() {
        String url = "HTTPS://News.Example.com:443/a/b?utm_source=x&b=2&fbclid=zz&a=1#comments";

        assertThat(normalizer.normalize(url)).isEqualTo("https://news.example.com/a/b?a=1&b=2");
    }

    @Test
    @DisplayName("빈 경로는 /가 되고 기본이 아닌 포트는 유지된다")
    void keepsNonDefaultPort() {
        assertThat(normalizer.normalize("http://example.com")).isEqualTo("http://example.com/");
        assertThat(normalizer.normalize("http://example.com:8080/x")).isEqualTo("http://example.com:8080/x");
    }

    @Test
    @DisplayName("게시판 호스트는 글을 식별하는 파라미터만 남긴다")
    void keepsOnlyThreadParametersOnForums() {
        String url = "https://gall.dcinside.com/board/view/?no=1&id=pension&page=2&exception_mode=recommend";

        assertThat(normalizer.normalize(url)).isEqualTo("https://gall.dcinside.com/board/view/?id=pension&no=1");
    }

    @Test
    @DisplayName("절대 URL이 아니면 입력을 다듬어 그대로 돌려준다")
    void returnsUnparseableInputTrimmed() {
        assertThat(normalizer.normalize("  /relative/path ")).isEqualTo("/relative/path");
        assertThat(normalizer.normalize("not a url")).isEqualTo("not a url");
        assertThat(normalizer.normalize(null)).isNull();
    }

    @Test
    @DisplayName("호스트는 소문자로 돌려준다")
    void hostOf() {
        assertThat(UrlNormalizer.hostOf("https://M.Ppomppu.co.kr/zboard/view.php?id=freeboard")).isEqualTo("m.ppomppu.co.kr");
        assertThat(UrlNormalizer.hostOf("mailto:someone")).isNull();
    }
}
