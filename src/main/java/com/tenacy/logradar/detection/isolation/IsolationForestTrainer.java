package com.tenacy.logradar.detection.isolation;

import com.tenacy.logradar.exception.ModelBuildException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 표본 목록에서 새 포레스트를 만든다. 상태가 없다.
 */
public class IsolationForestTrainer {

    private final int treeCount;
    private final int subsampleSize;
    private final int minTrainingSamples;

    public IsolationForestTrainer(int treeCount, int subsampleSize, int minTrainingSamples) {
        this.treeCount = treeCount;
        this.subsampleSize = subsampleSize;
        this.minTrainingSamples = Math.max(2, minTrainingSamples);
    }

    /**
     * @throws ModelBuildException 표본이 최소 개수보다 적을 때
     */
    public IsolationForest train(List<double[]> samples, Random random, Instant now) {
        if (samples.size() < minTrainingSamples) {
            throw new ModelBuildException("insufficient training samples: " + samples.size()
                    + " < " + minTrainingSamples);
        }

        int effectiveSubsample = Math.min(subsampleSize, samples.size());
        double[][] pool = samples.toArray(new double[0][]);
        List<IsolationTree> trees = new ArrayList<>(treeCount);

        for (int t = 0; t < treeCount; t++) {
            trees.add(IsolationTree.build(subsample(pool, effectiveSubsample, random), random));
        }

        return new IsolationForest(trees, effectiveSubsample, samples.size(), now);
    }

    /**
     * 부분 Fisher-Yates 셔플로 중복 없이 size개를 고른다. pool의 순서가 바뀐다.
     */
    private static double[][] subsample(double[][] pool, int size, Random random) {
        double[][] picked = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            double[] tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
            picked[i] = pool[i];
        }
        return picked;
    }
}
