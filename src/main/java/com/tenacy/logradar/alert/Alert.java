package com.tenacy.logradar.alert;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 발송된 알림. 발송 이후에는 억제 만료 시각과 AI 설명만 갱신된다.
 */
@Getter
@ToString
public class Alert {

    private final String id;
    private final AlertKind kind;
    private final String service;
    private final AlertSeverity severity;
    private final double score;
    private final Instant timestamp;
    private final int occurrenceCount;
    private final String message;

    private volatile Instant suppressedUntil;
    private volatile String explanation;

    @Builder
    private Alert(String id, AlertKind kind, String service, AlertSeverity severity, double score,
                  Instant timestamp, Instant suppressedUntil, int occurrenceCount, String message) {
        this.id = id;
        this.kind = kind;
        this.service = service;
        this.severity = severity;
        this.score = score;
        this.timestamp = timestamp;
        this.suppressedUntil = suppressedUntil;
        this.occurrenceCount = occurrenceCount;
        this.message = message;
    }

    /**
     * 상위 심각도 알림이 이 알림을 대체했을 때 억제를 즉시 끝낸다.
     */
    void endSuppression(Instant at) {
        this.suppressedUntil = at;
    }

    public void attachExplanation(String explanation) {
        this.explanation = explanation;
    }

    public boolean isSuppressedAt(Instant now) {
        return suppressedUntil != null && now.isBefore(suppressedUntil);
    }
}
