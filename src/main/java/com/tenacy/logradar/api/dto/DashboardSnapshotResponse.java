package com.tenacy.logradar.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSnapshotResponse {
    private Instant timestamp;
    private double systemHealthScore;
    private String status;
    private List<ServiceStatusResponse> services;
    private List<String> staleServices;
    private List<AlertResponse> activeAlerts;
    private long bufferedEvents;
    private long rejectedEvents;
    private List<String> abandonedServices;
    private List<String> failedServices;
    private long tickDurationMillis;
}
