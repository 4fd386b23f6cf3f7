package com.tenacy.logradar.engine;

import com.tenacy.logradar.health.HealthScoreCalculator;
import com.tenacy.logradar.health.SystemHealth;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class DetectionSnapshot {
    Instant timestamp;
    SystemHealth systemHealth;
    Map<String, ServiceSnapshot> services;
    List<String> abandonedServices;
    List<String> failedServices;
    long tickDurationMillis;

    public static DetectionSnapshot empty(Instant now) {
        return DetectionSnapshot.builder()
                .timestamp(now)
                .systemHealth(SystemHealth.builder()
                        .score(HealthScoreCalculator.MAX_SCORE)
                        .timestamp(now)
                        .contributingServices(List.of())
                        .staleServices(List.of())
                        .build())
                .services(Map.of())
                .abandonedServices(List.of())
                .failedServices(List.of())
                .tickDurationMillis(0L)
                .build();
    }
}
