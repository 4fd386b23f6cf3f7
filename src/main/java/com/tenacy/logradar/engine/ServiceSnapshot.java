package com.tenacy.logradar.engine;

import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.health.HealthScore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 서비스 하나의 마지막 평가 결과. 윈도우가 비어 있던 주기에는 갱신되지 않는다.
 */
@Value
@Builder
public class ServiceSnapshot {
    String service;
    HealthScore health;
    Instant windowStart;
    Instant windowEnd;
    long totalCount;
    Map<Severity, Long> countsBySeverity;
    Map<String, Double> features;
    /** 탐지기 원시 점수. z.&lt;metric&gt;, anomaly_score */
    Map<String, Double> detectorScores;
    int flagCount;
    Instant evaluatedAt;
}
