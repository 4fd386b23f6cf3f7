package com.tenacy.logradar.detection;

import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.Window;

public interface WindowDetector {
    String getDetectorId();
    String getName();
    String getDescription();
    boolean isEnabled();
    DetectionOutcome evaluate(Window window, FeatureVector vector);
    void resetState(String service);
    void resetState();
}
