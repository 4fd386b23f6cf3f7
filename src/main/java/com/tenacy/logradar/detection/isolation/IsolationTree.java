package com.tenacy.logradar.detection.isolation;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Random;

/**
 * 무작위 분할 트리 하나. 노드는 배열에 평평하게 저장되고, 학습과 탐색 모두 재귀 없이 돈다.
 */
public final class IsolationTree {

    private static final int LEAF = -1;

    private final int[] splitDimension;
    private final double[] splitValue;
    private final int[] left;
    private final int[] right;
    private final int[] leafSize;
    private final int nodeCount;
    private final int maxDepth;

    private IsolationTree(int[] splitDimension, double[] splitValue, int[] left, int[] right,
                          int[] leafSize, int nodeCount, int maxDepth) {
        this.splitDimension = splitDimension;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.leafSize = leafSize;
        this.nodeCount = nodeCount;
        this.maxDepth = maxDepth;
    }

    /**
     * subsample 전체로 트리를 만든다. 높이는 ceil(log2(n))로 제한된다.
     */
    public static IsolationTree build(double[][] subsample, Random random) {
        int n = subsample.length;
        if (n == 0) {
            throw new IllegalArgumentException("subsample must not be empty");
        }
        int dimension = subsample[0].length;
        int maxDepth = heightLimit(n);
        int capacity = 2 * n;

        int[] splitDimension = new int[capacity];
        double[] splitValue = new double[capacity];
        int[] left = new int[capacity];
        int[] right = new int[capacity];
        int[] leafSize = new int[capacity];
        Arrays.fill(splitDimension, LEAF);

        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }

        int nodeCount = 1;
        Deque<int[]> stack = new ArrayDeque<>();
        // {node, from, to(exclusive), depth}
        stack.push(new int[]{0, 0, n, 0});

        double[] min = new double[dimension];
        double[] max = new double[dimension];
        int[] candidates = new int[dimension];

        while (!stack.isEmpty()) {
            int[] task = stack.pop();
            int node = task[0];
            int from = task[1];
            int to = task[2];
            int depth = task[3];
            int size = to - from;

            if (size <= 1 || depth >= maxDepth) {
                leafSize[node] = size;
                continue;
            }

            Arrays.fill(min, Double.POSITIVE_INFINITY);
            Arrays.fill(max, Double.NEGATIVE_INFINITY);
            for (int i = from; i < to; i++) {
                double[] point = subsample[indices[i]];
                for (int d = 0; d < dimension; d++) {
                    if (point[d] < min[d]) {
                        min[d] = point[d];
                    }
                    if (point[d] > max[d]) {
                        max[d] = point[d];
                    }
                }
            }

            int candidateCount = 0;
            for (int d = 0; d < dimension; d++) {
                if (max[d] > min[d]) {
                    candidates[candidateCount++] = d;
                }
            }
            if (candidateCount == 0) {
                // 모든 점이 같다. 더 나눌 수 없다.
                leafSize[node] = size;
                continue;
            }

            int d = candidates[random.nextInt(candidateCount)];
            double split = min[d] + random.nextDouble() * (max[d] - min[d]);
            if (split <= min[d]) {
                split = Math.nextUp(min[d]);
            }

            // [from, mid) < split <= [mid, to)
            int mid = from;
            for (int i = from; i < to; i++) {
                if (subsample[indices[i]][d] < split) {
                    int tmp = indices[i];
                    indices[i] = indices[mid];
                    indices[mid] = tmp;
                    mid++;
                }
            }

            int leftNode = nodeCount++;
            int rightNode = nodeCount++;
            splitDimension[node] = d;
            splitValue[node] = split;
            left[node] = leftNode;
            right[node] = rightNode;

            stack.push(new int[]{rightNode, mid, to, depth + 1});
            stack.push(new int[]{leftNode, from, mid, depth + 1});
        }

        return new IsolationTree(splitDimension, splitValue, left, right, leafSize, nodeCount, maxDepth);
    }

    /**
     * 도달한 잎까지의 깊이에 잎 크기 보정 c(size)를 더한 값.
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (splitDimension[node] != LEAF) {
            node = point[splitDimension[node]] < splitValue[node] ? left[node] : right[node];
            depth++;
        }
        return depth + IsolationForest.averagePathLength(leafSize[node]);
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    static int heightLimit(int n) {
        if (n <= 1) {
            return 0;
        }
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }
}
