package com.tenacy.logradar.feature;

import com.tenacy.logradar.domain.Severity;
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
public class WindowSummary {
    private String service;
    private Instant start;
    private Instant end;
    private long totalCount;
    private Map<Severity, Long> countsBySeverity;
    private double eventRate;
    private double errorRatio;
    private double criticalRatio;
    private List<String> sampleMessages;
}
