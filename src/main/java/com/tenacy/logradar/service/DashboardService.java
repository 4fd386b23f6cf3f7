package com.tenacy.logradar.service;

import com.tenacy.logradar.alert.Alert;
import com.tenacy.logradar.alert.AlertManager;
import com.tenacy.logradar.api.dto.AlertResponse;
import com.tenacy.logradar.api.dto.DashboardSnapshotResponse;
import com.tenacy.logradar.api.dto.ServiceStatusResponse;
import com.tenacy.logradar.buffer.EventBuffer;
import com.tenacy.logradar.engine.DetectionOrchestrator;
import com.tenacy.logradar.engine.DetectionSnapshot;
import com.tenacy.logradar.engine.ServiceSnapshot;
import com.tenacy.logradar.health.HealthPoint;
import com.tenacy.logradar.health.HealthScore;
import com.tenacy.logradar.health.ServiceHealthAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 최신 탐지 스냅샷을 대시보드 응답으로 바꾼다. 읽기 전용이다.
 */
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final DetectionOrchestrator orchestrator;
    private final AlertManager alertManager;
    private final ServiceHealthAggregator healthAggregator;
    private final EventBuffer eventBuffer;
    private final LogMetricsService logMetricsService;

    public DashboardSnapshotResponse getSnapshot() {
        DetectionSnapshot snapshot = orchestrator.getSnapshot();
        List<String> stale = snapshot.getSystemHealth().getStaleServices();

        List<ServiceStatusResponse> services = snapshot.getServices().values().stream()
                .map(s -> toResponse(s, stale.contains(s.getService())))
                .collect(Collectors.toList());

        double score = snapshot.getSystemHealth().getScore();
        return DashboardSnapshotResponse.builder()
                .timestamp(snapshot.getTimestamp())
                .systemHealthScore(score)
                .status(status(score))
                .services(services)
                .staleServices(stale)
                .activeAlerts(toResponses(alertManager.getActiveAlerts()))
                .bufferedEvents(eventBuffer.size())
                .rejectedEvents(logMetricsService.rejectedCount())
                .abandonedServices(snapshot.getAbandonedServices())
                .failedServices(snapshot.getFailedServices())
                .tickDurationMillis(snapshot.getTickDurationMillis())
                .build();
    }

    public Optional<ServiceStatusResponse> getServiceStatus(String service) {
        List<String> stale = orchestrator.getSnapshot().getSystemHealth().getStaleServices();
        return orchestrator.getServiceSnapshot(service)
                .map(s -> toResponse(s, stale.contains(service)));
    }

    public List<AlertResponse> getRecentAlerts(int limit) {
        return toResponses(alertManager.getRecentAlerts(limit));
    }

    public List<HealthPoint> getHealthHistory() {
        return healthAggregator.getHistory();
    }

    private ServiceStatusResponse toResponse(ServiceSnapshot snapshot, boolean stale) {
        HealthScore health = snapshot.getHealth();
        Map<String, Long> counts = new LinkedHashMap<>();
        snapshot.getCountsBySeverity().forEach((severity, count) -> counts.put(severity.name(), count));

        return ServiceStatusResponse.builder()
                .service(snapshot.getService())
                .healthScore(health.getScore())
                .errorRatio(health.getErrorRatio())
                .criticalRatio(health.getCriticalRatio())
                .anomalyScore(health.getAnomalyScore())
                .windowStart(snapshot.getWindowStart())
                .windowEnd(snapshot.getWindowEnd())
                .totalCount(snapshot.getTotalCount())
                .countsBySeverity(counts)
                .features(snapshot.getFeatures())
                .detectorScores(snapshot.getDetectorScores())
                .stale(stale)
                .lastSeen(eventBuffer.lastSeen(snapshot.getService()).orElse(null))
                .evaluatedAt(snapshot.getEvaluatedAt())
                .activeAlerts(toResponses(alertManager.getActiveAlerts(snapshot.getService())))
                .build();
    }

    private static List<AlertResponse> toResponses(List<Alert> alerts) {
        return alerts.stream().map(AlertResponse::from).collect(Collectors.toList());
    }

    static String status(double score) {
        if (score >= 80.0) {
            return "HEALTHY";
        }
        if (score >= 50.0) {
            return "DEGRADED";
        }
        return "CRITICAL";
    }
}
