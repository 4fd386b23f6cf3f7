package com.tenacy.logradar.explanation;

import com.tenacy.logradar.alert.Alert;
import com.tenacy.logradar.config.ExplanationProperties;
import com.tenacy.logradar.exception.TransientIOException;
import com.tenacy.logradar.feature.WindowSummary;
import com.tenacy.logradar.support.BoundedRetry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 새 알림에 대한 AI 설명을 받아 알림에 붙인다. 실패해도 알림 전달에는 영향이 없다.
 */
@Service
@Slf4j
public class AlertExplanationService {

    private final ExplanationClient client;
    private final BoundedRetry retry;
    private final Counter attachedCounter;
    private final Counter failedCounter;

    public AlertExplanationService(ExplanationClient client, ExplanationProperties properties,
                                   MeterRegistry meterRegistry) {
        this.client = client;
        Duration initial = properties.getInitialBackoff();
        this.retry = new BoundedRetry("AI 설명 요청", properties.getMaxRetries(), initial, initial.multipliedBy(8));

        this.attachedCounter = Counter.builder("logradar.explanations.attached")
                .description("알림에 붙은 AI 설명 수")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("logradar.explanations.failed")
                .description("재시도 끝에 실패한 AI 설명 요청 수")
                .register(meterRegistry);
    }

    @Async("explanationTaskExecutor")
    public void explain(Alert alert, WindowSummary summary) {
        if (!client.isEnabled()) {
            return;
        }

        ExplanationRequest request = ExplanationRequest.builder()
                .alertId(alert.getId())
                .kind(alert.getKind())
                .service(alert.getService())
                .severity(alert.getSeverity())
                .score(alert.getScore())
                .description(alert.getMessage())
                .timestamp(alert.getTimestamp())
                .windowSummary(summary)
                .build();

        try {
            String explanation = retry.execute(() -> client.explain(request));
            alert.attachExplanation(explanation);
            attachedCounter.increment();
            log.info("AI 설명이 알림 {}에 추가되었습니다 ({} / {})", alert.getId(), alert.getService(), alert.getKind());
        } catch (TransientIOException e) {
            failedCounter.increment();
            log.error("AI 설명 요청 실패 - 알림 {}: {}", alert.getId(), e.getMessage(), e);
        }
    }
}
