package com.tenacy.logradar.detection;

import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.Window;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
public abstract class AbstractWindowDetector implements WindowDetector {

    private String detectorId;
    private String name;
    private String description;
    private boolean enabled = true;

    public AbstractWindowDetector(String detectorId, String name, String description) {
        this.detectorId = detectorId;
        this.name = name;
        this.description = description;
    }

    /**
     * 빈 윈도우는 탐지기 상태를 건드리지 않고 플래그도 내지 않는다.
     */
    @Override
    public final DetectionOutcome evaluate(Window window, FeatureVector vector) {
        if (window == null || window.isEmpty()) {
            return DetectionOutcome.empty();
        }
        return doEvaluate(window, vector);
    }

    protected abstract DetectionOutcome doEvaluate(Window window, FeatureVector vector);

    protected Detection detection(Window window, AlertKind kind, String metric, double score,
                                  AlertSeverity severity, String message, Map<String, Object> additionalData) {
        return Detection.builder()
                .detectorId(detectorId)
                .kind(kind)
                .service(window.getService())
                .metric(metric)
                .score(score)
                .severity(severity)
                .message(message)
                .detectedAt(window.getEnd())
                .additionalData(additionalData)
                .build();
    }
}
