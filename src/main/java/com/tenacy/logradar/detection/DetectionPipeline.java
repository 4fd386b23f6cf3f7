package com.tenacy.logradar.detection;

import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.Window;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 등록된 탐지기를 순서대로 돌려 한 윈도우의 결과를 모은다.
 */
@Service
@Slf4j
public class DetectionPipeline {

    private final List<WindowDetector> detectors = new CopyOnWriteArrayList<>();
    private final Counter detectorErrorsCounter;

    public DetectionPipeline(List<WindowDetector> detectorList, MeterRegistry meterRegistry) {
        if (detectorList != null) {
            detectors.addAll(detectorList);
            log.info("Initialized DetectionPipeline with {} detectors", detectors.size());
        }
        this.detectorErrorsCounter = Counter.builder("logradar.detector.errors")
                .description("탐지기 실행 중 발생한 오류 수")
                .register(meterRegistry);
    }

    /**
     * 윈도우 하나를 모든 활성 탐지기로 평가한다. 한 탐지기의 실패는 나머지를 막지 않는다.
     */
    public DetectionOutcome evaluate(Window window, FeatureVector vector) {
        List<DetectionOutcome> outcomes = new ArrayList<>();

        for (WindowDetector detector : detectors) {
            if (!detector.isEnabled()) {
                continue;
            }

            try {
                outcomes.add(detector.evaluate(window, vector));
            } catch (Exception e) {
                detectorErrorsCounter.increment();
                log.error("Error evaluating window of '{}' with detector {}: {}",
                        window.getService(), detector.getDetectorId(), e.getMessage(), e);
            }
        }

        return DetectionOutcome.merge(outcomes);
    }

    /**
     * 서비스 하나의 탐지 상태(베이스라인, 표본, 모델)를 비운다.
     */
    public void resetService(String service) {
        detectors.forEach(d -> d.resetState(service));
        log.info("Reset detector state for service: {}", service);
    }

    public void resetAll() {
        detectors.forEach(WindowDetector::resetState);
        log.info("Reset state for all detectors");
    }
}
