package com.tenacy.logradar.domain;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 윈도우 하나에서 계산한 고정 길이 수치 벡터.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        if (values.length != Feature.DIMENSION) {
            throw new IllegalArgumentException(
                    "Feature vector must have " + Feature.DIMENSION + " dimensions but had " + values.length);
        }
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Feature vector must be finite: " + Arrays.toString(values));
            }
        }
        return new FeatureVector(values.clone());
    }

    public static FeatureVector zero() {
        return new FeatureVector(new double[Feature.DIMENSION]);
    }

    public double get(Feature feature) {
        return values[feature.index()];
    }

    public double get(int index) {
        return values[index];
    }

    public int dimension() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    public boolean isZero() {
        for (double value : values) {
            if (value != 0.0) {
                return false;
            }
        }
        return true;
    }

    public Map<String, Double> asNamedMap() {
        Map<String, Double> named = new LinkedHashMap<>();
        for (Feature feature : Feature.values()) {
            named.put(feature.name().toLowerCase(), values[feature.index()]);
        }
        return named;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
