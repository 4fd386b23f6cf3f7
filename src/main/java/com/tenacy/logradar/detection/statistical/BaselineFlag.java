package com.tenacy.logradar.detection.statistical;

import com.tenacy.logradar.domain.Feature;
import lombok.Value;

@Value
public class BaselineFlag {
    Feature metric;
    double zScore;
    double value;
    double baselineMean;
    double baselineStddev;

    /**
     * 관측값이 베이스라인보다 위쪽으로 벗어났는지.
     */
    public boolean isIncrease() {
        return value > baselineMean;
    }
}
