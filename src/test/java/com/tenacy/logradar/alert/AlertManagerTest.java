package com.tenacy.logradar.alert;

import com.tenacy.logradar.config.AlertProperties;
import com.tenacy.logradar.detection.Detection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AlertManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final Duration TICK = Duration.ofSeconds(5);

    private SimpleMeterRegistry meterRegistry;
    private AlertManager alertManager;

    @BeforeEach
    void setUp() {
        AlertProperties properties = new AlertProperties();
        properties.setCooldown(Duration.ofMinutes(5));
        properties.setDecayCount(3);
        properties.setRecentHistorySize(10);
        meterRegistry = new SimpleMeterRegistry();
        alertManager = new AlertManager(properties, meterRegistry);
    }

    private static Detection flag(AlertKind kind, AlertSeverity severity, double score) {
        return Detection.builder()
                .detectorId("test")
                .kind(kind)
                .service("auth")
                .metric("error_ratio")
                .score(score)
                .severity(severity)
                .message(kind + " " + severity)
                .detectedAt(T0)
                .build();
    }

    private List<Alert> process(Instant now, Detection... detections) {
        return alertManager.process("auth", List.of(detections), now);
    }

    @Test
    @DisplayName("첫 플래그는 알림 하나를 내고 쿨다운 동안은 억제됨")
    void process_RepeatedFlagsWithinCooldown_ShouldEmitOnce() {
        // given
        Detection flag = flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0);

        // when
        List<Alert> first = process(T0, flag);
        int later = 0;
        for (int i = 1; i <= 10; i++) {
            later += process(T0.plus(TICK.multipliedBy(i)), flag).size();
        }

        // then
        assertThat(first).hasSize(1);
        assertThat(first.get(0).getOccurrenceCount()).isEqualTo(1);
        assertThat(first.get(0).getSuppressedUntil()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(later).isZero();
        assertThat(alertManager.getState("auth", AlertKind.SEVERITY_SHIFT)).isEqualTo(AlertState.SUPPRESSED);
        assertThat(meterRegistry.counter("logradar.alerts.suppressed").count()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("쿨다운이 끝난 뒤의 플래그는 그동안의 발생 횟수와 함께 다시 알림")
    void process_FlagAfterCooldown_ShouldReEmitWithOccurrenceCount() {
        Detection flag = flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0);
        process(T0, flag);
        process(T0.plusSeconds(60), flag);
        process(T0.plusSeconds(120), flag);

        List<Alert> again = process(T0.plus(Duration.ofMinutes(5)), flag);

        assertThat(again).hasSize(1);
        assertThat(again.get(0).getOccurrenceCount()).isEqualTo(3);
        assertThat(again.get(0).getSuppressedUntil()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("억제 중 심각도가 올라가면 즉시 알림하고 쿨다운을 다시 시작")
    void process_Escalation_ShouldEmitImmediately() {
        // given
        List<Alert> warning = process(T0, flag(AlertKind.VOLUME_SPIKE, AlertSeverity.WARNING, 4.0));

        // when
        List<Alert> sameLevel = process(T0.plusSeconds(10), flag(AlertKind.VOLUME_SPIKE, AlertSeverity.WARNING, 4.5));
        List<Alert> escalated = process(T0.plusSeconds(20), flag(AlertKind.VOLUME_SPIKE, AlertSeverity.ERROR, 9.0));

        // then
        assertThat(sameLevel).isEmpty();
        assertThat(escalated).hasSize(1);
        assertThat(escalated.get(0).getSeverity()).isEqualTo(AlertSeverity.ERROR);
        assertThat(escalated.get(0).getSuppressedUntil()).isEqualTo(T0.plusSeconds(20).plus(Duration.ofMinutes(5)));
        assertThat(warning.get(0).isSuppressedAt(T0.plusSeconds(21))).isFalse();
    }

    @Test
    @DisplayName("같은 종류의 탐지 여러 개는 최고 심각도와 최고 점수로 합쳐짐")
    void process_SameKindDetections_ShouldMerge() {
        List<Alert> alerts = process(T0,
                flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.WARNING, 9.0),
                flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.CRITICAL, 4.0));

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alerts.get(0).getScore()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("종류가 다르면 각각 알림")
    void process_DifferentKinds_ShouldEmitSeparately() {
        List<Alert> alerts = process(T0,
                flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0),
                flag(AlertKind.PATTERN_ANOMALY, AlertSeverity.WARNING, 0.7));

        assertThat(alerts).extracting(Alert::getKind)
                .containsExactlyInAnyOrder(AlertKind.SEVERITY_SHIFT, AlertKind.PATTERN_ANOMALY);
    }

    @Test
    @DisplayName("쿨다운 안에서는 플래그가 없어도 QUIET으로 돌아가지 않음")
    void process_QuietCyclesWithinCooldown_ShouldNotDecay() {
        Detection flag = flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0);
        process(T0, flag);

        for (int i = 1; i <= 5; i++) {
            process(T0.plus(TICK.multipliedBy(i)));
        }

        assertThat(alertManager.getState("auth", AlertKind.SEVERITY_SHIFT)).isNotEqualTo(AlertState.QUIET);
        assertThat(process(T0.plusSeconds(40), flag)).isEmpty();
    }

    @Test
    @DisplayName("쿨다운 이후 연속으로 플래그가 없으면 QUIET으로 돌아가고 다음 플래그는 새 알림")
    void process_DecayAfterCooldown_ShouldReturnToQuiet() {
        // given
        Detection flag = flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0);
        process(T0, flag);
        Instant afterCooldown = T0.plus(Duration.ofMinutes(6));

        // when
        process(afterCooldown);
        process(afterCooldown.plus(TICK));
        assertThat(alertManager.getState("auth", AlertKind.SEVERITY_SHIFT)).isEqualTo(AlertState.TRIGGERED);
        process(afterCooldown.plus(TICK.multipliedBy(2)));

        // then
        assertThat(alertManager.getState("auth", AlertKind.SEVERITY_SHIFT)).isEqualTo(AlertState.QUIET);
        assertThat(alertManager.getActiveAlerts()).isEmpty();
        List<Alert> fresh = process(afterCooldown.plus(TICK.multipliedBy(3)), flag);
        assertThat(fresh).hasSize(1);
        assertThat(fresh.get(0).getOccurrenceCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("최근 알림 이력은 최신순이며 크기가 제한됨")
    void getRecentAlerts_ShouldBeBoundedAndNewestFirst() {
        for (int i = 0; i < 15; i++) {
            alertManager.process("svc-" + i,
                    List.of(flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, i)), T0.plusSeconds(i));
        }

        List<Alert> recent = alertManager.getRecentAlerts(100);

        assertThat(recent).hasSize(10);
        assertThat(recent.get(0).getService()).isEqualTo("svc-14");
        assertThat(alertManager.getActiveAlerts()).hasSize(15);
        assertThat(alertManager.trackedServices()).hasSize(15);
    }

    @Test
    @DisplayName("같은 키를 여러 스레드가 동시에 평가해도 알림은 한 번만 나감")
    void process_Concurrently_ShouldEmitExactlyOnce() throws Exception {
        // given
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Alert> emitted = Collections.synchronizedList(new ArrayList<>());
        Detection flag = flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0);

        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 100; i++) {
                        emitted.addAll(alertManager.process("auth", List.of(flag), T0.plusSeconds(i % 60)));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // when
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(emitted).hasSize(1);
    }

    @Test
    @DisplayName("리셋하면 모든 상태와 이력이 비워짐")
    void reset_ShouldClearState() {
        process(T0, flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0));

        alertManager.reset();

        assertThat(alertManager.getActiveAlerts()).isEmpty();
        assertThat(alertManager.getRecentAlerts(10)).isEmpty();
        assertThat(process(T0.plusSeconds(5), flag(AlertKind.SEVERITY_SHIFT, AlertSeverity.ERROR, 5.0))).hasSize(1);
    }
}
