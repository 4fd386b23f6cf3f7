package com.tenacy.logradar.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEventRequest {
    private String service;
    private String severity;
    private String message;
    /** 비어 있으면 수신 시각 */
    private Instant timestamp;
    private Map<String, String> metadata;
}
