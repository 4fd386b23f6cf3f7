package com.tenacy.logradar.alert;

import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.feature.WindowSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 알림을 사람이 읽는 제목/본문으로 만들어 알림 채널에 넘긴다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertNotificationService {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final AlertService alertService;

    public void notify(Alert alert, WindowSummary summary) {
        try {
            alertService.sendAlert(subject(alert), body(alert, summary));
        } catch (Exception e) {
            log.error("알림 전송 실패: {}", e.getMessage(), e);
        }
    }

    String subject(Alert alert) {
        return String.format("[%s] %s - %s", alert.getSeverity(), alert.getService(), alert.getKind().getDisplayName());
    }

    String body(Alert alert, WindowSummary summary) {
        StringBuilder body = new StringBuilder();
        body.append("시각: ").append(TIME_FORMAT.format(alert.getTimestamp())).append('\n');
        body.append("서비스: ").append(alert.getService()).append('\n');
        body.append("종류: ").append(alert.getKind().getDisplayName()).append(" (").append(alert.getKind()).append(")\n");
        body.append("심각도: ").append(alert.getSeverity()).append('\n');
        body.append(String.format("점수: %.3f%n", alert.getScore()));
        if (alert.getOccurrenceCount() > 1) {
            body.append("직전 알림 이후 발생 횟수: ").append(alert.getOccurrenceCount()).append('\n');
        }
        body.append('\n').append(alert.getMessage()).append('\n');

        if (summary != null) {
            body.append("\n윈도우 요약 (").append(TIME_FORMAT.format(summary.getStart()))
                    .append(" ~ ").append(TIME_FORMAT.format(summary.getEnd())).append(")\n");
            body.append(String.format("  전체 %d건, %.2f건/초%n", summary.getTotalCount(), summary.getEventRate()));
            if (summary.getCountsBySeverity() != null) {
                for (Severity severity : Severity.values()) {
                    long count = summary.getCountsBySeverity().getOrDefault(severity, 0L);
                    if (count > 0) {
                        body.append("  ").append(severity).append(": ").append(count).append('\n');
                    }
                }
            }
            if (summary.getSampleMessages() != null && !summary.getSampleMessages().isEmpty()) {
                body.append("\n최근 주요 로그:\n");
                summary.getSampleMessages().forEach(m -> body.append("  ").append(m).append('\n'));
            }
        }

        body.append("\n다음 알림 가능 시각: ").append(TIME_FORMAT.format(alert.getSuppressedUntil()));
        return body.toString();
    }
}
