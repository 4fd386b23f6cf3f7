package com.tenacy.logradar.explanation;

import com.tenacy.logradar.alert.Alert;
import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import com.tenacy.logradar.config.ExplanationProperties;
import com.tenacy.logradar.exception.TransientIOException;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertExplanationServiceTest {

    @Mock
    private ExplanationClient client;

    private SimpleMeterRegistry meterRegistry;
    private AlertExplanationService explanationService;
    private Alert alert;

    @BeforeEach
    void setUp() {
        ExplanationProperties properties = new ExplanationProperties();
        properties.setMaxRetries(2);
        properties.setInitialBackoff(Duration.ZERO);
        meterRegistry = new SimpleMeterRegistry();
        explanationService = new AlertExplanationService(client, properties, meterRegistry);

        alert = Alert.builder()
                .id("alert-1")
                .kind(AlertKind.PATTERN_ANOMALY)
                .service("payment")
                .severity(AlertSeverity.WARNING)
                .score(0.72)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .occurrenceCount(1)
                .message("'payment' 서비스 로그 패턴 이상")
                .build();
    }

    @Test
    @DisplayName("설명을 받아 알림에 붙임")
    void explain_ShouldAttachExplanation() {
        // given
        when(client.isEnabled()).thenReturn(true);
        when(client.explain(any())).thenReturn("결제 게이트웨이 타임아웃이 늘었습니다.");

        // when
        explanationService.explain(alert, null);

        // then
        ArgumentCaptor<ExplanationRequest> captor = ArgumentCaptor.forClass(ExplanationRequest.class);
        verify(client).explain(captor.capture());
        assertThat(captor.getValue().getAlertId()).isEqualTo("alert-1");
        assertThat(captor.getValue().getKind()).isEqualTo(AlertKind.PATTERN_ANOMALY);
        assertThat(captor.getValue().getScore()).isEqualTo(0.72);

        assertThat(alert.getExplanation()).isEqualTo("결제 게이트웨이 타임아웃이 늘었습니다.");
        assertThat(meterRegistry.counter("logradar.explanations.attached").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("일시적 실패는 재시도 후 성공")
    void explain_TransientFailure_ShouldRetry() {
        when(client.isEnabled()).thenReturn(true);
        when(client.explain(any()))
                .thenThrow(new TransientIOException("503"))
                .thenReturn("복구된 설명");

        explanationService.explain(alert, null);

        verify(client, times(2)).explain(any());
        assertThat(alert.getExplanation()).isEqualTo("복구된 설명");
    }

    @Test
    @DisplayName("재시도를 모두 실패해도 알림은 그대로 남음")
    void explain_PersistentFailure_ShouldLeaveAlertUntouched() {
        when(client.isEnabled()).thenReturn(true);
        when(client.explain(any())).thenThrow(new TransientIOException("timeout"));

        explanationService.explain(alert, null);

        verify(client, times(3)).explain(any());
        assertThat(alert.getExplanation()).isNull();
        assertThat(meterRegistry.counter("logradar.explanations.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("비활성화 상태면 요청하지 않음")
    void explain_Disabled_ShouldSkip() {
        when(client.isEnabled()).thenReturn(false);

        explanationService.explain(alert, null);

        verify(client, never()).explain(any());
        assertThat(alert.getExplanation()).isNull();
    }
}
