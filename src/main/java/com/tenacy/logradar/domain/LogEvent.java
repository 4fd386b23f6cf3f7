package com.tenacy.logradar.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 수집된 단일 로그 이벤트. 생성 이후 변경되지 않는다.
 */
@Value
@Builder
public class LogEvent {
    String service;
    Severity severity;
    String message;
    Instant timestamp;
    Map<String, String> metadata;

    private LogEvent(String service, Severity severity, String message, Instant timestamp, Map<String, String> metadata) {
        this.service = service;
        this.severity = severity;
        this.message = message != null ? message : "";
        this.timestamp = timestamp;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public int messageLength() {
        return message.length();
    }
}
