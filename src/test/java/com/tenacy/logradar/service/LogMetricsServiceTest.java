package com.tenacy.logradar.service;

import com.tenacy.logradar.alert.AlertManager;
import com.tenacy.logradar.api.dto.DashboardSnapshotResponse;
import com.tenacy.logradar.api.dto.LogEventRequest;
import com.tenacy.logradar.buffer.EventBuffer;
import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.config.MetricsConfig;
import com.tenacy.logradar.engine.DetectionOrchestrator;
import com.tenacy.logradar.engine.DetectionSnapshot;
import com.tenacy.logradar.exception.DataQualityException;
import com.tenacy.logradar.health.ServiceHealthAggregator;
import com.tenacy.logradar.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LogMetricsServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private SimpleMeterRegistry registry;
    private LogMetricsService logMetricsService;
    private EventBuffer eventBuffer;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MetricsConfig metrics = new MetricsConfig();
        logMetricsService = new LogMetricsService(
                metrics.ingestedEventsCounter(registry),
                metrics.rejectedEventsCounter(registry),
                metrics.debugLogsCounter(registry),
                metrics.infoLogsCounter(registry),
                metrics.warnLogsCounter(registry),
                metrics.errorLogsCounter(registry),
                metrics.criticalLogsCounter(registry));

        MutableClock clock = new MutableClock(NOW);
        DetectionProperties properties = new DetectionProperties();
        eventBuffer = new EventBuffer(properties, clock, registry);
        ingestionService = new IngestionService(eventBuffer, logMetricsService, clock);
    }

    private LogEventRequest request(String severity, Instant timestamp) {
        return LogEventRequest.builder()
                .service("auth")
                .severity(severity)
                .message("token refresh failed")
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("파싱 단계 거부와 버퍼 단계 거부가 한 카운터에 모두 집계됨")
    void rejectedCount_ShouldIncludeParseAndBufferRejects() {
        // given - 알 수 없는 심각도(파싱 거부), 먼 미래 시각(버퍼 거부)
        assertThatThrownBy(() -> ingestionService.ingest(request("FATALISH", NOW)))
                .isInstanceOf(DataQualityException.class);
        assertThatThrownBy(() -> ingestionService.ingest(request("ERROR", NOW.plus(Duration.ofHours(1)))))
                .isInstanceOf(DataQualityException.class);
        ingestionService.ingest(request("ERROR", NOW.minusSeconds(1)));

        // then
        assertThat(logMetricsService.rejectedCount()).isEqualTo(2L);
        assertThat(registry.counter("logradar.events.rejected").count()).isEqualTo(2.0);
        assertThat(registry.counter("logradar.events.ingested").count()).isEqualTo(1.0);
        assertThat(registry.counter("logradar.logs.error").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("대시보드 거부 수는 알 수 없는 심각도 거부도 포함")
    void dashboardRejectedEvents_ShouldCountUnknownSeverity() {
        // given
        DetectionOrchestrator orchestrator = mock(DetectionOrchestrator.class);
        when(orchestrator.getSnapshot()).thenReturn(DetectionSnapshot.empty(NOW));
        DashboardService dashboardService = new DashboardService(orchestrator, mock(AlertManager.class),
                mock(ServiceHealthAggregator.class), eventBuffer, logMetricsService);

        assertThatThrownBy(() -> ingestionService.ingest(request("LOUD", NOW)))
                .isInstanceOf(DataQualityException.class);

        // when
        DashboardSnapshotResponse response = dashboardService.getSnapshot();

        // then
        assertThat(response.getRejectedEvents()).isEqualTo(1L);
        assertThat(response.getBufferedEvents()).isZero();
    }
}
