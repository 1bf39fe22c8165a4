package com.npssenti.crawler.config;

import com.npssenti.crawler.scheduler.AutoCrawler;
import com.npssenti.crawler.service.CrawlPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CrawlControllerTest {

    @TempDir
    Path dataDir;

    @Mock
    private CrawlPipeline pipeline;
    @Mock
    private AutoCrawler autoCrawler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setKeywords(List.of("국민연금"));
        properties.getOutput().setDataDir(dataDir.toString());
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T09:30:00Z"), ZoneOffset.UTC);
        mockMvc = MockMvcBuilders.standaloneSetup(new CrawlController(pipeline, autoCrawler, properties, clock)).build();
    }

    @Test
    @DisplayName("수집 기간이 설정되지 않으면 실행 요청은 400이다")
    void runWithoutWindowIsBadRequest() throws Exception {
        mockMvc.perform(post("/crawl/run"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("crawler.time-window.start must be set"));
        verify(pipeline, never()).runConfigured(any());
    }

    @Test
    @DisplayName("알 수 없는 출처를 요청하면 400이다")
    void unknownSourceIsBadRequest() throws Exception {
        mockMvc.perform(post("/crawl/run").param("only", "blogs"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("라운드 수가 1보다 작으면 400이다")
    void roundsMustBePositive() throws Exception {
        mockMvc.perform(post("/autocrawl/round").param("rounds", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("rounds must be >= 1"));
        verifyNoInteractions(autoCrawler);
    }

    @Test
    @DisplayName("이미 수집이 진행 중이면 실행 요청과 라운드 요청은 409이다")
    void rejectsOverlappingRuns() throws Exception {
        when(pipeline.isRunning()).thenReturn(true);

        mockMvc.perform(post("/crawl/run").param("only", "gdelt"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("a crawl run is already in progress"));
        mockMvc.perform(post("/autocrawl/round"))
                .andExpect(status().isConflict());
        verify(pipeline, never()).runConfigured(any());
        verifyNoInteractions(autoCrawler);
    }

    @Test
    @DisplayName("상태 조회는 출력 디렉터리를 알려 준다")
    void crawlStatus() throws Exception {
        mockMvc.perform(get("/crawl/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("senti-crawler"))
                .andExpect(jsonPath("$.dataDir").value(dataDir.toString()));
    }
}
