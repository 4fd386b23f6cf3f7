package com.tenacy.logradar.health;

import com.tenacy.logradar.config.DetectionProperties;
import org.springframework.stereotype.Component;

/**
 * 100 - clamp(we * 에러율 + wc * 치명율 * 2 + wa * 이상 점수, 0, 100).
 * 가중치가 음수가 아니므로 각 입력에 대해 단조 감소한다.
 */
@Component
public class HealthScoreCalculator {

    public static final double MAX_SCORE = 100.0;

    private final DetectionProperties.Health weights;

    public HealthScoreCalculator(DetectionProperties properties) {
        this.weights = properties.getHealth();
    }

    public double calculate(double errorRatio, double criticalRatio, double anomalyScore) {
        double penalty = weights.getErrorWeight() * errorRatio
                + weights.getCriticalWeight() * criticalRatio * 2
                + weights.getAnomalyWeight() * anomalyScore;
        return MAX_SCORE - clamp(penalty, 0.0, MAX_SCORE);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
