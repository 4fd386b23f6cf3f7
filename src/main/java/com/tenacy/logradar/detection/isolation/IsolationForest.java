package com.tenacy.logradar.detection.isolation;

import com.tenacy.logradar.domain.FeatureVector;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * 학습이 끝난 포레스트. 만들어진 뒤에는 바뀌지 않으므로 여러 스레드가 잠금 없이 점수를 매긴다.
 */
@Getter
public final class IsolationForest {

    static final double EULER_MASCHERONI = 0.5772156649;

    private final List<IsolationTree> trees;
    private final int subsampleSize;
    private final int trainingSampleCount;
    private final Instant trainedAt;

    public IsolationForest(List<IsolationTree> trees, int subsampleSize, int trainingSampleCount, Instant trainedAt) {
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("forest must have at least one tree");
        }
        this.trees = List.copyOf(trees);
        this.subsampleSize = subsampleSize;
        this.trainingSampleCount = trainingSampleCount;
        this.trainedAt = trainedAt;
    }

    /**
     * 이상 점수 2^(-E[h(x)] / c(s')). 1에 가까울수록 고립되기 쉬운 점이다.
     */
    public double score(FeatureVector vector) {
        return score(vector.toArray());
    }

    public double score(double[] point) {
        double normalizer = averagePathLength(subsampleSize);
        if (normalizer <= 0.0) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double average = total / trees.size();
        return Math.pow(2.0, -average / normalizer);
    }

    /**
     * 크기 n인 이진 탐색 트리에서 실패한 탐색의 평균 경로 길이 c(n).
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    public int getTreeCount() {
        return trees.size();
    }
}
