package com.tenacy.logradar.feature;

import com.tenacy.logradar.domain.Feature;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.LogEvent;
import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.domain.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private static final Instant END = Instant.parse("2024-05-01T00:01:00Z");
    private static final Instant START = END.minusSeconds(60);

    private final FeatureExtractor extractor = new FeatureExtractor();

    private LogEvent event(Severity severity, long secondsAfterStart, String message) {
        return LogEvent.builder()
                .service("auth")
                .severity(severity)
                .message(message)
                .timestamp(START.plusSeconds(secondsAfterStart))
                .build();
    }

    @Test
    @DisplayName("빈 윈도우는 0 벡터")
    void extract_EmptyWindow_ShouldReturnZeroVector() {
        Window window = extractor.window("auth", START, END, List.of());

        FeatureVector vector = extractor.extract(window);

        assertThat(vector.isZero()).isTrue();
        assertThat(vector.dimension()).isEqualTo(Feature.DIMENSION);
    }

    @Test
    @DisplayName("심각도 비율, 이벤트율, 간격 통계 계산")
    void extract_ShouldComputeRatiosAndGaps() {
        // given
        List<LogEvent> events = List.of(
                event(Severity.INFO, 0, "aa"),
                event(Severity.INFO, 10, "aaaa"),
                event(Severity.ERROR, 20, "aa"),
                event(Severity.CRITICAL, 30, "aaaa"),
                event(Severity.WARN, 40, "aa")
        );

        // when
        Window window = extractor.window("auth", START, END, events);
        FeatureVector vector = extractor.extract(window);

        // then
        assertThat(window.getTotalCount()).isEqualTo(5);
        assertThat(vector.get(Feature.EVENT_RATE)).isCloseTo(5.0 / 60.0, within(1e-9));
        assertThat(vector.get(Feature.ERROR_RATIO)).isCloseTo(0.2, within(1e-9));
        assertThat(vector.get(Feature.CRITICAL_RATIO)).isCloseTo(0.2, within(1e-9));
        assertThat(vector.get(Feature.WARN_RATIO)).isCloseTo(0.2, within(1e-9));
        assertThat(vector.get(Feature.MEAN_INTER_ARRIVAL)).isCloseTo(10.0, within(1e-9));
        assertThat(vector.get(Feature.INTER_ARRIVAL_STDDEV)).isCloseTo(0.0, within(1e-9));
        assertThat(vector.get(Feature.MESSAGE_LENGTH_MEAN)).isCloseTo(2.8, within(1e-9));
        assertThat(vector.get(Feature.MESSAGE_LENGTH_STDDEV)).isCloseTo(Math.sqrt(0.96), within(1e-9));
    }

    @Test
    @DisplayName("구간 밖이나 다른 서비스의 이벤트는 무시")
    void window_ShouldIgnoreEventsOutsideIntervalOrService() {
        List<LogEvent> events = List.of(
                event(Severity.INFO, -5, "before"),
                event(Severity.INFO, 60, "at end"),
                LogEvent.builder().service("billing").severity(Severity.ERROR)
                        .message("other").timestamp(START.plusSeconds(5)).build()
        );

        Window window = extractor.window("auth", START, END, events);

        assertThat(window.getTotalCount()).isEqualTo(1);
        assertThat(window.count(Severity.ERROR)).isZero();
    }

    @Test
    @DisplayName("같은 입력이면 같은 벡터")
    void extract_ShouldBeDeterministic() {
        List<LogEvent> events = List.of(event(Severity.INFO, 1, "x"), event(Severity.ERROR, 7, "yyy"));

        FeatureVector first = extractor.extract(extractor.window("auth", START, END, events));
        FeatureVector second = extractor.extract(extractor.window("auth", START, END, events));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("요약에는 심각도가 높은 메시지가 먼저 들어감")
    void summarize_ShouldPreferSevereMessages() {
        List<LogEvent> events = List.of(
                event(Severity.INFO, 1, "login ok"),
                event(Severity.CRITICAL, 2, "db down"),
                event(Severity.ERROR, 3, "timeout")
        );
        Window window = extractor.window("auth", START, END, events);

        WindowSummary summary = extractor.summarize(window, extractor.extract(window), events);

        assertThat(summary.getSampleMessages()).containsExactly(
                "[CRITICAL] db down", "[ERROR] timeout", "[INFO] login ok");
        assertThat(summary.getTotalCount()).isEqualTo(3);
    }
}
