package com.tenacy.logradar.health;

import com.tenacy.logradar.config.DetectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 서비스별 최신 헬스 점수를 보관하고 시스템 전체 점수를 이벤트 수 가중 평균으로 낸다.
 */
@Slf4j
@Component
public class ServiceHealthAggregator {

    private final Map<String, HealthScore> latest = new ConcurrentHashMap<>();
    private final Deque<HealthPoint> history = new ArrayDeque<>();

    private final HealthScoreCalculator calculator;
    private final Duration staleAfter;
    private final int historySize;

    public ServiceHealthAggregator(HealthScoreCalculator calculator, DetectionProperties properties) {
        this.calculator = calculator;
        this.staleAfter = properties.getStaleAfter();
        this.historySize = properties.getHealth().getHistorySize();
    }

    /**
     * 이번 주기에 윈도우 활동이 있었던 서비스의 점수를 갱신한다.
     */
    public HealthScore update(String service, double errorRatio, double criticalRatio, double anomalyScore,
                              Instant now) {
        HealthScore score = HealthScore.builder()
                .service(service)
                .score(calculator.calculate(errorRatio, criticalRatio, anomalyScore))
                .errorRatio(errorRatio)
                .criticalRatio(criticalRatio)
                .anomalyScore(anomalyScore)
                .computedAt(now)
                .build();
        latest.put(service, score);
        return score;
    }

    /**
     * 보존 구간 안에 이벤트가 있고 stale이 아닌 서비스만 반영한다. 반영할 서비스가 없으면 100.
     *
     * @param horizonCounts 서비스별 보존 구간 내 이벤트 수 (가중치)
     * @param lastSeen 서비스별 마지막 이벤트 시각
     */
    public SystemHealth aggregate(Map<String, Integer> horizonCounts, Map<String, Instant> lastSeen, Instant now) {
        Set<String> stale = new TreeSet<>();
        Instant staleBefore = now.minus(staleAfter);
        lastSeen.forEach((service, seen) -> {
            if (seen.isBefore(staleBefore)) {
                stale.add(service);
            }
        });

        double weightedSum = 0.0;
        long totalWeight = 0;
        Set<String> contributing = new TreeSet<>();

        for (Map.Entry<String, Integer> entry : horizonCounts.entrySet()) {
            int weight = entry.getValue();
            HealthScore score = latest.get(entry.getKey());
            if (weight < 1 || score == null || stale.contains(entry.getKey())) {
                continue;
            }
            weightedSum += score.getScore() * weight;
            totalWeight += weight;
            contributing.add(entry.getKey());
        }

        double systemScore = totalWeight > 0 ? weightedSum / totalWeight : HealthScoreCalculator.MAX_SCORE;

        synchronized (history) {
            history.addLast(new HealthPoint(now, systemScore));
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }

        return SystemHealth.builder()
                .score(systemScore)
                .timestamp(now)
                .contributingServices(List.copyOf(contributing))
                .staleServices(List.copyOf(stale))
                .build();
    }

    public Optional<HealthScore> getLatest(String service) {
        return Optional.ofNullable(latest.get(service));
    }

    public List<HealthPoint> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public void remove(String service) {
        latest.remove(service);
    }

    public void reset() {
        latest.clear();
        synchronized (history) {
            history.clear();
        }
    }
}
