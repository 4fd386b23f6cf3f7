package com.tenacy.logradar.detection.statistical;

import com.tenacy.logradar.domain.Feature;
import com.tenacy.logradar.domain.FeatureVector;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 서비스 하나의 지표별 EWMA 베이스라인.
 */
public class ServiceBaseline {

    private final Map<Feature, EwmaStatistic> statistics = new EnumMap<>(Feature.class);
    private final int warmupCount;
    private final double epsilon;
    private final double zThreshold;

    public ServiceBaseline(Set<Feature> metrics, double alpha, int warmupCount, double epsilon, double zThreshold) {
        for (Feature metric : metrics) {
            statistics.put(metric, new EwmaStatistic(alpha));
        }
        this.warmupCount = warmupCount;
        this.epsilon = epsilon;
        this.zThreshold = zThreshold;
    }

    /**
     * 벡터를 관측하고 갱신 전 통계 기준으로 벗어난 지표를 돌려준다.
     * 워밍업 중인 지표는 통계만 갱신하고 플래그를 내지 않는다.
     */
    public synchronized List<BaselineFlag> observe(FeatureVector vector, Map<Feature, Double> zScoresOut) {
        List<BaselineFlag> flags = new ArrayList<>();

        statistics.forEach((metric, statistic) -> {
            double x = vector.get(metric);
            double z = statistic.zScore(x, epsilon);
            boolean warmedUp = statistic.getCount() >= warmupCount;

            if (zScoresOut != null) {
                zScoresOut.put(metric, z);
            }
            if (warmedUp && z > zThreshold) {
                flags.add(new BaselineFlag(metric, z, x, statistic.getMean(), statistic.standardDeviation()));
            }

            statistic.update(x);
        });

        return flags;
    }
}
