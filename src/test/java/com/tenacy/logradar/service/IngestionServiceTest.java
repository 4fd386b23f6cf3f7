package com.tenacy.logradar.service;

import com.tenacy.logradar.api.dto.IngestionResponse;
import com.tenacy.logradar.api.dto.LogEventRequest;
import com.tenacy.logradar.buffer.EventBuffer;
import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.domain.LogEvent;
import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.exception.DataQualityException;
import com.tenacy.logradar.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private LogMetricsService logMetricsService;

    private EventBuffer eventBuffer;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        DetectionProperties properties = new DetectionProperties();
        properties.setWindowSize(Duration.ofMinutes(1));
        eventBuffer = new EventBuffer(properties, clock, new SimpleMeterRegistry());
        ingestionService = new IngestionService(eventBuffer, logMetricsService, clock);
    }

    private LogEventRequest request(String service, String severity, Instant timestamp) {
        return LogEventRequest.builder()
                .service(service)
                .severity(severity)
                .message("user login failed")
                .timestamp(timestamp)
                .metadata(Map.of("host", "auth-1"))
                .build();
    }

    @Test
    @DisplayName("정상 요청은 버퍼에 적재되고 수집 지표가 기록됨")
    void ingest_ValidRequest_ShouldBufferEvent() {
        // when
        ingestionService.ingest(request("auth", "error", NOW.minusSeconds(1)));

        // then
        List<LogEvent> window = eventBuffer.drainWindow("auth", Duration.ofMinutes(1));
        assertThat(window).hasSize(1);
        assertThat(window.get(0).getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(window.get(0).getMetadata()).containsEntry("host", "auth-1");

        ArgumentCaptor<LogEvent> captor = ArgumentCaptor.forClass(LogEvent.class);
        verify(logMetricsService).recordAccepted(captor.capture());
        assertThat(captor.getValue().getService()).isEqualTo("auth");
    }

    @Test
    @DisplayName("타임스탬프가 없으면 수신 시각을 사용")
    void ingest_MissingTimestamp_ShouldUseClock() {
        ingestionService.ingest(request("auth", "INFO", null));

        assertThat(eventBuffer.lastSeen("auth")).contains(NOW);
    }

    @Test
    @DisplayName("알 수 없는 심각도는 거부")
    void ingest_UnknownSeverity_ShouldBeRejected() {
        assertThatThrownBy(() -> ingestionService.ingest(request("auth", "FATALISH", NOW)))
                .isInstanceOf(DataQualityException.class)
                .hasMessageContaining("unknown severity");

        verify(logMetricsService, times(1)).recordRejected();
        verify(logMetricsService, never()).recordAccepted(any());
        assertThat(eventBuffer.size()).isZero();
    }

    @Test
    @DisplayName("서비스가 비어 있으면 거부")
    void ingest_BlankService_ShouldBeRejected() {
        assertThatThrownBy(() -> ingestionService.ingest(request("  ", "INFO", NOW)))
                .isInstanceOf(DataQualityException.class);

        verify(logMetricsService).recordRejected();
    }

    @Test
    @DisplayName("배치 수집 - 일부가 거부되어도 나머지는 적재")
    void ingestBatch_ShouldReportAcceptedAndRejected() {
        // given
        List<LogEventRequest> requests = List.of(
                request("auth", "INFO", NOW.minusSeconds(3)),
                request("auth", "NOPE", NOW.minusSeconds(2)),
                request("billing", "WARN", NOW.minusSeconds(1)),
                request("billing", "INFO", NOW.minus(Duration.ofHours(1))));

        // when
        IngestionResponse response = ingestionService.ingestBatch(requests);

        // then
        assertThat(response.getAccepted()).isEqualTo(2);
        assertThat(response.getRejected()).isEqualTo(2);
        assertThat(response.getErrors()).hasSize(2);
        assertThat(response.getErrors().get(0)).startsWith("[1] ");
        assertThat(response.getErrors().get(1)).startsWith("[3] ");
        assertThat(eventBuffer.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("배치 오류 메시지는 20개까지만 보고")
    void ingestBatch_ShouldCapReportedErrors() {
        List<LogEventRequest> requests = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            requests.add(request("auth", "BROKEN", NOW));
        }

        IngestionResponse response = ingestionService.ingestBatch(requests);

        assertThat(response.getRejected()).isEqualTo(30);
        assertThat(response.getErrors()).hasSize(20);
    }
}
