package com.tenacy.logradar.explanation;

import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import com.tenacy.logradar.feature.WindowSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplanationRequest {
    private String alertId;
    private AlertKind kind;
    private String service;
    private AlertSeverity severity;
    private double score;
    private String description;
    private Instant timestamp;
    private WindowSummary windowSummary;
}
