package com.tenacy.logradar.feature;

import com.tenacy.logradar.domain.Feature;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.LogEvent;
import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.domain.Window;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 로그 목록을 윈도우로 묶고, 윈도우를 고정 길이 특성 벡터로 바꾼다. 상태가 없다.
 */
@Component
public class FeatureExtractor {

    private static final int SUMMARY_SAMPLE_MESSAGES = 5;

    /**
     * [start, end] 구간의 이벤트로 윈도우를 만든다. 구간 밖의 이벤트와 다른 서비스의 이벤트는 무시한다.
     */
    public Window window(String service, Instant start, Instant end, List<LogEvent> events) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        List<Double> gaps = new ArrayList<>();
        List<Integer> lengths = new ArrayList<>();

        Instant previous = null;
        long total = 0;
        for (LogEvent event : events) {
            if (!service.equals(event.getService())) {
                continue;
            }
            Instant timestamp = event.getTimestamp();
            if (timestamp.isBefore(start) || timestamp.isAfter(end)) {
                continue;
            }

            counts.merge(event.getSeverity(), 1L, Long::sum);
            lengths.add(event.messageLength());
            if (previous != null) {
                gaps.add(Math.max(0L, Duration.between(previous, timestamp).toMillis()) / 1000.0);
            }
            previous = timestamp;
            total++;
        }

        return new Window(service, start, end, counts, total, gaps, lengths);
    }

    /**
     * 빈 윈도우는 예외 없이 0 벡터가 된다. 비율은 max(total, 1)로 나눈다.
     */
    public FeatureVector extract(Window window) {
        if (window.isEmpty()) {
            return FeatureVector.zero();
        }

        double total = window.getTotalCount();
        double denominator = Math.max(total, 1.0);
        double seconds = window.durationSeconds();

        double[] values = new double[Feature.DIMENSION];
        values[Feature.EVENT_RATE.index()] = seconds > 0 ? total / seconds : total;
        values[Feature.ERROR_RATIO.index()] = window.count(Severity.ERROR) / denominator;
        values[Feature.CRITICAL_RATIO.index()] = window.count(Severity.CRITICAL) / denominator;
        values[Feature.WARN_RATIO.index()] = window.count(Severity.WARN) / denominator;

        List<Double> gaps = window.getInterArrivalGaps();
        values[Feature.MEAN_INTER_ARRIVAL.index()] = mean(gaps);
        values[Feature.INTER_ARRIVAL_STDDEV.index()] = stddev(gaps);

        List<Double> lengths = window.getMessageLengths().stream()
                .map(Integer::doubleValue)
                .collect(Collectors.toList());
        values[Feature.MESSAGE_LENGTH_MEAN.index()] = mean(lengths);
        values[Feature.MESSAGE_LENGTH_STDDEV.index()] = stddev(lengths);

        return FeatureVector.of(values);
    }

    /**
     * 알림 메시지와 AI 설명 요청에 쓰이는 윈도우 요약.
     */
    public WindowSummary summarize(Window window, FeatureVector vector, List<LogEvent> events) {
        List<String> samples = events.stream()
                .filter(e -> window.getService().equals(e.getService()))
                .sorted(Comparator.comparing(LogEvent::getSeverity).reversed()
                        .thenComparing(LogEvent::getTimestamp, Comparator.reverseOrder()))
                .limit(SUMMARY_SAMPLE_MESSAGES)
                .map(e -> "[" + e.getSeverity() + "] " + e.getMessage())
                .collect(Collectors.toList());

        return WindowSummary.builder()
                .service(window.getService())
                .start(window.getStart())
                .end(window.getEnd())
                .totalCount(window.getTotalCount())
                .countsBySeverity(new EnumMap<>(window.getCountsBySeverity()))
                .eventRate(vector.get(Feature.EVENT_RATE))
                .errorRatio(vector.get(Feature.ERROR_RATIO))
                .criticalRatio(vector.get(Feature.CRITICAL_RATIO))
                .sampleMessages(samples)
                .build();
    }

    private static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double stddev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.size());
    }
}
