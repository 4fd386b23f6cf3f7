package com.tenacy.logradar.detection.rate;

import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.detection.AbstractWindowDetector;
import com.tenacy.logradar.detection.Detection;
import com.tenacy.logradar.detection.DetectionOutcome;
import com.tenacy.logradar.domain.Feature;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.domain.Window;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 서비스의 ERROR/CRITICAL 비율이 고정 임계값을 넘으면 감지한다. 베이스라인이 없는 새 서비스도 잡는다.
 */
@Slf4j
@Component
@Order(3)
public class ServiceErrorRateDetector extends AbstractWindowDetector {

    public static final String DETECTOR_ID = "service-error-rate";

    private final DetectionProperties.ServiceRate settings;

    public ServiceErrorRateDetector(DetectionProperties properties) {
        super(
                DETECTOR_ID,
                "서비스 에러율 감지",
                "윈도우 내 ERROR 또는 CRITICAL 로그 비율이 고정 임계값을 넘는 서비스를 감지합니다."
        );
        this.settings = properties.getServiceRate();
    }

    @Override
    protected DetectionOutcome doEvaluate(Window window, FeatureVector vector) {
        if (window.getTotalCount() < settings.getMinEvents()) {
            return DetectionOutcome.empty();
        }

        List<Detection> detections = new ArrayList<>();
        double errorRate = vector.get(Feature.ERROR_RATIO);
        double criticalRate = vector.get(Feature.CRITICAL_RATIO);

        if (errorRate > settings.getErrorRateThreshold()) {
            detections.add(detection(window, AlertKind.SERVICE_ERROR_RATE, "error_rate", Math.min(errorRate, 1.0),
                    AlertSeverity.WARNING,
                    String.format("'%s' 서비스 에러율 높음: %.2f%%", window.getService(), errorRate * 100),
                    Map.of(
                            "errorRate", errorRate,
                            "errorCount", window.count(Severity.ERROR),
                            "totalLogs", window.getTotalCount())));
        }

        if (criticalRate > settings.getCriticalRateThreshold()) {
            detections.add(detection(window, AlertKind.SERVICE_ERROR_RATE, "critical_rate", Math.min(criticalRate, 1.0),
                    AlertSeverity.CRITICAL,
                    String.format("'%s' 서비스 치명 로그 비율 높음: %.2f%%", window.getService(), criticalRate * 100),
                    Map.of(
                            "criticalRate", criticalRate,
                            "criticalCount", window.count(Severity.CRITICAL),
                            "totalLogs", window.getTotalCount())));
        }

        if (!detections.isEmpty()) {
            log.debug("Service error rate exceeded for '{}': error={}, critical={}",
                    window.getService(), errorRate, criticalRate);
        }
        return new DetectionOutcome(detections, Map.of());
    }

    @Override
    public void resetState(String service) {
        // 상태 없음
    }

    @Override
    public void resetState() {
        // 상태 없음
    }
}
