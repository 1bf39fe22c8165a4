package com.npssenti.crawler.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.config.CrawlConfigException;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.output.JsonlDeduplicator;
import com.npssenti.crawler.output.JsonlMerger;
import com.npssenti.crawler.scheduler.AutoCrawler;
import com.npssenti.crawler.scheduler.PlanSettings;
import com.npssenti.crawler.service.CrawlPipeline;
import com.npssenti.crawler.service.RunSelection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationContext;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CrawlCommandRunnerTest {

    @TempDir
    Path dataDir;

    @Mock
    private CrawlPipeline pipeline;
    @Mock
    private AutoCrawler autoCrawler;
    @Mock
    private JsonlDeduplicator deduplicator;
    @Mock
    private JsonlMerger merger;
    @Mock
    private ApplicationContext context;

    private CrawlCommandRunner runner;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setKeywords(List.of("국민연금"));
        properties.getOutput().setDataDir(dataDir.toString());
        properties.getAutocrawl().setRounds(1);
        runner = new CrawlCommandRunner(pipeline, autoCrawler, deduplicator, merger, properties,
                new ObjectMapper(), context);
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    @Test
    @DisplayName("run 명령은 --only와 --max-fetch를 실행 선택으로 넘긴다")
    void runPassesSelection() {
        run("run", "--only=forums", "--forum-sites=dcinside,ppomppu", "--max-fetch=5");

        ArgumentCaptor<RunSelection> captor = ArgumentCaptor.forClass(RunSelection.class);
        verify(pipeline).runConfigured(captor.capture());
        RunSelection selection = captor.getValue();
        assertThat(selection.includes(SourceType.FORUM)).isTrue();
        assertThat(selection.includes(SourceType.NEWS_INDEX)).isFalse();
        assertThat(selection.forumSites()).containsExactly("dcinside", "ppomppu");
        assertThat(selection.maxFetch()).isEqualTo(5);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("알 수 없는 출처나 숫자가 아닌 값은 설정 오류다")
    void rejectsBadOptions() {
        assertThatThrownBy(() -> run("run", "--only=blogs"))
                .isInstanceOf(CrawlConfigException.class)
                .hasMessageContaining("--only");
        assertThatThrownBy(() -> run("run", "--max-fetch=many"))
                .isInstanceOf(CrawlConfigException.class)
                .hasMessageContaining("--max-fetch");
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("autocrawl run은 라운드 수와 계획 설정 덮어쓰기를 전달한다")
    void autocrawlRunAppliesOverrides() {
        run("autocrawl", "run", "--rounds=3", "--sleep-sec=0", "--monthly-target=10",
                "--include-forums=false", "--max-fetch=40");

        ArgumentCaptor<PlanSettings> captor = ArgumentCaptor.forClass(PlanSettings.class);
        verify(autoCrawler).runRounds(eq(3), eq(0L), captor.capture());
        PlanSettings settings = captor.getValue();
        assertThat(settings.getMonthlyTarget()).isEqualTo(10);
        assertThat(settings.isIncludeForums()).isFalse();
        assertThat(settings.getRoundMaxFetch()).isEqualTo(40);
        assertThat(settings.getMonthsBack()).isEqualTo(12);
    }

    @Test
    @DisplayName("autocrawl status는 상태만 조회한다")
    void autocrawlStatus() {
        run("autocrawl", "status", "--months-back=3");

        verify(autoCrawler).status(argThat(s -> s.getMonthsBack() == 3));
        verify(autoCrawler, never()).runRounds(anyInt(), anyLong(), any());
    }

    @Test
    @DisplayName("dedup은 출력 경로가 없으면 입력 옆에 .dedup.jsonl을 쓴다")
    void dedupDefaultsToSiblingOutput() throws Exception {
        Path in = dataDir.resolve("gdelt.jsonl");

        run("dedup", in.toString());

        verify(deduplicator).dedup(in, dataDir.resolve("gdelt.dedup.jsonl"));
    }

    @Test
    @DisplayName("merge는 출력 경로가 없으면 기존 파일을 덮어쓴다")
    void mergeDefaultsToExisting() throws Exception {
        Path existing = dataDir.resolve("gdelt.jsonl");
        Path batch = dataDir.resolve("batch.jsonl");

        run("merge", existing.toString(), batch.toString());

        verify(merger).merge(existing, batch, existing);
    }

    @Test
    @DisplayName("명령이 없거나 알 수 없으면 종료 코드 1이다")
    void usageErrors() {
        run("crawl-everything");
        assertThat(runner.getExitCode()).isEqualTo(CrawlCommandRunner.EXIT_USAGE);

        CrawlCommandRunner fresh = new CrawlCommandRunner(pipeline, autoCrawler, deduplicator, merger,
                new CrawlerProperties(), new ObjectMapper(), context);
        fresh.run(new DefaultApplicationArguments());
        assertThat(fresh.getExitCode()).isEqualTo(1);

        CrawlCommandRunner partial = new CrawlCommandRunner(pipeline, autoCrawler, deduplicator, merger,
                new CrawlerProperties(), new ObjectMapper(), context);
        partial.run(new DefaultApplicationArguments("merge", "only-one.jsonl"));
        assertThat(partial.getExitCode()).isEqualTo(1);
        verifyNoInteractions(merger);
    }
}
