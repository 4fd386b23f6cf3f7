package com.tenacy.logradar.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStatusResponse {
    private String service;
    private double healthScore;
    private double errorRatio;
    private double criticalRatio;
    private double anomalyScore;
    private Instant windowStart;
    private Instant windowEnd;
    private long totalCount;
    private Map<String, Long> countsBySeverity;
    private Map<String, Double> features;
    private Map<String, Double> detectorScores;
    private boolean stale;
    private Instant lastSeen;
    private Instant evaluatedAt;
    private List<AlertResponse> activeAlerts;
}
