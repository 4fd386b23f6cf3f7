package com.tenacy.logradar.detection.statistical;

import lombok.Getter;

/**
 * 지수 가중 이동 평균/분산. 첫 관측이 평균을 초기화한다.
 */
@Getter
public class EwmaStatistic {

    private final double alpha;
    private long count;
    private double mean;
    private double variance;

    public EwmaStatistic(double alpha) {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1): " + alpha);
        }
        this.alpha = alpha;
    }

    /**
     * 갱신 전 통계 기준의 z-score. 관측이 없으면 0.
     */
    public double zScore(double x, double epsilon) {
        if (count == 0) {
            return 0.0;
        }
        return Math.abs(x - mean) / Math.sqrt(variance + epsilon);
    }

    public void update(double x) {
        if (count == 0) {
            mean = x;
            variance = 0.0;
        } else {
            double deviation = x - mean;
            mean = alpha * x + (1 - alpha) * mean;
            variance = alpha * deviation * deviation + (1 - alpha) * variance;
        }
        count++;
    }

    public double standardDeviation() {
        return Math.sqrt(variance);
    }
}
