package com.tenacy.logradar.detection.isolation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

@Slf4j
@Component
public class ModelRetrainingScheduler {

    private final PatternAnomalyDetector detector;
    private final Executor trainingExecutor;

    public ModelRetrainingScheduler(PatternAnomalyDetector detector,
                                    @Qualifier("modelTrainingExecutor") Executor trainingExecutor) {
        this.detector = detector;
        this.trainingExecutor = trainingExecutor;
    }

    public void retrainModels() {
        if (!detector.isEnabled()) {
            return;
        }
        log.debug("Scheduling model retraining for {} services", detector.trackedServices().size());
        detector.retrainAll(trainingExecutor);
    }
}
