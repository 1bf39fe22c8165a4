package com.npssenti.crawler.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.config.CrawlerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AutoStateStoreTest {

    @TempDir
    Path dir;

    private CrawlerProperties properties;
    private AutoStateStore store;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getOutput().setDataDir(dir.toString());
        properties.getAutocrawl().setDailyQuota(5_000);
        properties.getAutocrawl().setReserveQuota(100);
        store = new AutoStateStore(properties, new ObjectMapper());
    }

    @Test
    @DisplayName("상태 파일이 없으면 모든 집계가 0이고 한 번도 쓰지 않은 원장으로 시작한다")
    void freshStateWhenMissing() {
        AutoState state = store.load();

        assertThat(state.getCounts()).isEmpty();
        assertThat(state.getRoundsCompleted()).isZero();
        assertThat(state.getYoutube().getPeriodStartUtc()).isEmpty();
        assertThat(state.getYoutube().getDailyQuota()).isEqualTo(5_000);
        assertThat(state.getYoutube().getReserveQuota()).isEqualTo(100);
    }

    @Test
    @DisplayName("저장한 상태를 다시 읽으면 같은 값이며 파일은 snake_case 키를 쓴다")
    void saveThenLoad() throws Exception {
        // given
        AutoState state = new AutoState();
        state.addCount("2024-05", "gdelt", 12);
        state.addCount("2024-05", "forums", 3);
        state.addStored("dcinside", 3);
        state.setYoutubeKeywordCursor(4);
        state.setRoundsCompleted(7);
        state.getYoutube().setUsedToday(303);
        state.getYoutube().setPeriodStartUtc("2024-06-15");

        // when
        store.save(state);
        AutoState loaded = store.load();

        // then
        assertThat(loaded).isEqualTo(state);
        String json = Files.readString(dir.resolve("_auto_state.json"), StandardCharsets.UTF_8);
        assertThat(json).contains("\"youtube_keyword_cursor\"", "\"used_today\"", "\"period_start_utc\"",
                "\"rounds_completed\"", "\"stored_by_source\"");
    }

    @Test
    @DisplayName("알 수 없는 필드가 있어도 읽을 수 있다")
    void ignoresUnknownFields() throws Exception {
        Files.writeString(dir.resolve("_auto_state.json"),
                "{\"version\":1,\"counts\":{\"2024-01\":{\"youtube\":5}},\"legacy\":true}", StandardCharsets.UTF_8);

        AutoState state = store.load();

        assertThat(state.count("2024-01", "youtube")).isEqualTo(5);
        assertThat(state.getYoutube()).isNotNull();
    }
}
