package com.tenacy.logradar.detection.isolation;

import java.util.ArrayList;
import java.util.List;

/**
 * 최근 특성 벡터 N개를 담는 고정 크기 링 버퍼.
 */
public class SampleBuffer {

    private final double[][] slots;
    private int next;
    private int size;

    public SampleBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.slots = new double[capacity][];
    }

    public synchronized void add(double[] sample) {
        slots[next] = sample.clone();
        next = (next + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
    }

    /**
     * 오래된 것부터 순서대로 복사본을 돌려준다.
     */
    public synchronized List<double[]> snapshot() {
        List<double[]> copy = new ArrayList<>(size);
        int start = size < slots.length ? 0 : next;
        for (int i = 0; i < size; i++) {
            copy.add(slots[(start + i) % slots.length].clone());
        }
        return copy;
    }

    public synchronized int size() {
        return size;
    }
}
