package com.tenacy.logradar.domain;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 서비스 하나의 [start, end] 구간 집계. 닫힌 뒤에는 변경되지 않는다.
 */
@Value
public class Window {
    String service;
    Instant start;
    Instant end;
    Map<Severity, Long> countsBySeverity;
    long totalCount;
    /** 연속 이벤트 간 간격(초) */
    List<Double> interArrivalGaps;
    List<Integer> messageLengths;

    public Window(String service, Instant start, Instant end, Map<Severity, Long> countsBySeverity,
                  long totalCount, List<Double> interArrivalGaps, List<Integer> messageLengths) {
        this.service = service;
        this.start = start;
        this.end = end;

        EnumMap<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, countsBySeverity != null ? countsBySeverity.getOrDefault(severity, 0L) : 0L);
        }
        this.countsBySeverity = Collections.unmodifiableMap(counts);
        this.totalCount = totalCount;
        this.interArrivalGaps = interArrivalGaps != null ? List.copyOf(interArrivalGaps) : List.of();
        this.messageLengths = messageLengths != null ? List.copyOf(messageLengths) : List.of();
    }

    public static Window empty(String service, Instant start, Instant end) {
        return new Window(service, start, end, null, 0L, null, null);
    }

    public long count(Severity severity) {
        return countsBySeverity.get(severity);
    }

    public boolean isEmpty() {
        return totalCount == 0;
    }

    public double durationSeconds() {
        return Duration.between(start, end).toMillis() / 1000.0;
    }
}
