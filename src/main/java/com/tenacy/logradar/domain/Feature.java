package com.tenacy.logradar.domain;

/**
 * 특성 벡터의 고정 인덱스. ordinal()이 벡터 내 위치이다.
 */
public enum Feature {
    EVENT_RATE,
    ERROR_RATIO,
    CRITICAL_RATIO,
    WARN_RATIO,
    MEAN_INTER_ARRIVAL,
    INTER_ARRIVAL_STDDEV,
    MESSAGE_LENGTH_MEAN,
    MESSAGE_LENGTH_STDDEV;

    public static final int DIMENSION = values().length;

    public int index() {
        return ordinal();
    }
}
