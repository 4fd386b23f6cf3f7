package com.tenacy.logradar.alert;

import com.tenacy.logradar.explanation.AlertExplanationService;
import com.tenacy.logradar.feature.WindowSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 새로 나온 알림을 알림 채널과 AI 설명 서비스로 넘긴다. 둘 다 비동기라 탐지 주기를 막지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertDispatcher {

    private final AlertNotificationService notificationService;
    private final AlertExplanationService explanationService;

    public void dispatch(List<Alert> alerts, WindowSummary summary) {
        for (Alert alert : alerts) {
            notificationService.notify(alert, summary);
            try {
                explanationService.explain(alert, summary);
            } catch (Exception e) {
                log.warn("Failed to hand off explanation request for alert {}: {}", alert.getId(), e.getMessage());
            }
        }
    }
}
