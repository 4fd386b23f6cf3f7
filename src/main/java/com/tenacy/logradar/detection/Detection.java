package com.tenacy.logradar.detection;

import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * 탐지기가 한 윈도우에서 올린 플래그.
 */
@Data
@Builder
public class Detection {
    private String detectorId;
    private AlertKind kind;
    private String service;
    private String metric;
    private double score;
    private AlertSeverity severity;
    private String message;
    private Instant detectedAt;
    private Map<String, Object> additionalData;
}
