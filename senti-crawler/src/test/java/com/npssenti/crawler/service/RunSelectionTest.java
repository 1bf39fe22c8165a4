package com.npssenti.crawler.service;

import com.npssenti.crawler.model.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunSelectionTest {

    @Test
    @DisplayName("선택이 비어 있으면 모든 출처를 포함한다")
    void emptySelectionIncludesAll() {
        RunSelection all = RunSelection.all();

        assertThat(all.includes(SourceType.NEWS_INDEX)).isTrue();
        assertThat(all.includes(SourceType.VIDEO)).isTrue();
        assertThat(all.includes(SourceType.FORUM)).isTrue();
        assertThat(all.explicitlyRequested(SourceType.VIDEO)).isFalse();
    }

    @Test
    @DisplayName("--no-gdelt는 명시적으로 고른 gdelt보다 우선한다")
    void noGdeltWins() {
        RunSelection selection = RunSelection.parse("gdelt, youtube", "", true, null);

        assertThat(selection.includes(SourceType.NEWS_INDEX)).isFalse();
        assertThat(selection.includes(SourceType.VIDEO)).isTrue();
        assertThat(selection.includes(SourceType.FORUM)).isFalse();
        assertThat(selection.explicitlyRequested(SourceType.VIDEO)).isTrue();
    }

    @Test
    @DisplayName("알 수 없는 출처 그룹은 거부한다")
    void rejectsUnknownGroup() {
        assertThatThrownBy(() -> RunSelection.parse("news", null, false, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("news");
    }
}
