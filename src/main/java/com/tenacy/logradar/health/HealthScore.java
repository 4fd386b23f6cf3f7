package com.tenacy.logradar.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthScore {
    String service;
    double score;
    double errorRatio;
    double criticalRatio;
    double anomalyScore;
    Instant computedAt;
}
