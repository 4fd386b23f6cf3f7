package com.tenacy.logradar.api.dto;

import com.tenacy.logradar.alert.Alert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private String id;
    private String kind;
    private String kindDisplayName;
    private String service;
    private String severity;
    private double score;
    private Instant timestamp;
    private Instant suppressedUntil;
    private int occurrenceCount;
    private String message;
    private String explanation;

    public static AlertResponse from(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .kind(alert.getKind().name())
                .kindDisplayName(alert.getKind().getDisplayName())
                .service(alert.getService())
                .severity(alert.getSeverity().name())
                .score(alert.getScore())
                .timestamp(alert.getTimestamp())
                .suppressedUntil(alert.getSuppressedUntil())
                .occurrenceCount(alert.getOccurrenceCount())
                .message(alert.getMessage())
                .explanation(alert.getExplanation())
                .build();
    }
}
