package com.tenacy.logradar.detection;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 탐지 결과. 플래그가 없어도 원시 점수(z-score, 이상 점수)는 대시보드로 나간다.
 */
@Getter
@AllArgsConstructor
public class DetectionOutcome {
    private final List<Detection> detections;
    private final Map<String, Double> scores;

    public static DetectionOutcome empty() {
        return new DetectionOutcome(List.of(), Map.of());
    }

    public boolean isDetected() {
        return !detections.isEmpty();
    }

    public static DetectionOutcome merge(List<DetectionOutcome> outcomes) {
        List<Detection> detections = new ArrayList<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        for (DetectionOutcome outcome : outcomes) {
            detections.addAll(outcome.getDetections());
            scores.putAll(outcome.getScores());
        }
        return new DetectionOutcome(Collections.unmodifiableList(detections), Collections.unmodifiableMap(scores));
    }
}
