package com.tenacy.logradar.detection.statistical;

import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.detection.AbstractWindowDetector;
import com.tenacy.logradar.detection.Detection;
import com.tenacy.logradar.detection.DetectionOutcome;
import com.tenacy.logradar.domain.Feature;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.Window;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 서비스/지표별 EWMA 베이스라인에서 z-score로 벗어난 윈도우를 찾는다.
 *
 * <p>EVENT_RATE는 양방향 변화를 VOLUME_SPIKE로, 심각도 비율은 증가한 경우에만
 * SEVERITY_SHIFT로 올린다.
 */
@Slf4j
@Component
@Order(1)
public class StatisticalBaselineDetector extends AbstractWindowDetector {

    public static final String DETECTOR_ID = "statistical-baseline";
    public static final Set<Feature> TRACKED_METRICS = EnumSet.of(
            Feature.EVENT_RATE, Feature.ERROR_RATIO, Feature.CRITICAL_RATIO, Feature.WARN_RATIO);

    private final Map<String, ServiceBaseline> baselines = new ConcurrentHashMap<>();
    private final DetectionProperties.Statistical settings;

    public StatisticalBaselineDetector(DetectionProperties properties) {
        super(
                DETECTOR_ID,
                "통계 베이스라인 이탈 감지",
                "서비스별 지표의 EWMA 평균/분산에서 z-score 임계값 이상 벗어난 윈도우를 감지합니다."
        );
        this.settings = properties.getStatistical();
        if (settings.repeatedDeviationZScore() <= settings.getZScoreThreshold()) {
            log.warn("EWMA alpha {} absorbs a repeated deviation to z={} (threshold {}); "
                            + "repeats inside the alert cooldown will not be counted",
                    settings.getAlpha(), String.format("%.3f", settings.repeatedDeviationZScore()),
                    settings.getZScoreThreshold());
        }
    }

    /**
     * 벡터를 관측하고 (지표, z-score) 플래그를 돌려준다.
     */
    public List<BaselineFlag> observe(String service, FeatureVector vector) {
        return baselineFor(service).observe(vector, null);
    }

    @Override
    protected DetectionOutcome doEvaluate(Window window, FeatureVector vector) {
        Map<Feature, Double> zScores = new EnumMap<>(Feature.class);
        List<BaselineFlag> flags = baselineFor(window.getService()).observe(vector, zScores);

        List<Detection> detections = new ArrayList<>();
        for (BaselineFlag flag : flags) {
            toDetection(window, flag).ifPresent(detections::add);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        zScores.forEach((metric, z) -> scores.put("z." + metric.name().toLowerCase(), z));

        if (!detections.isEmpty()) {
            log.debug("Baseline deviation for '{}': {}", window.getService(), flags);
        }
        return new DetectionOutcome(detections, scores);
    }

    private Optional<Detection> toDetection(Window window, BaselineFlag flag) {
        double threshold = settings.getZScoreThreshold();

        switch (flag.getMetric()) {
            case EVENT_RATE: {
                AlertSeverity severity = flag.getZScore() > threshold * 2 ? AlertSeverity.ERROR : AlertSeverity.WARNING;
                String direction = flag.isIncrease() ? "급증" : "급감";
                return Optional.of(detection(window, AlertKind.VOLUME_SPIKE, "event_rate", flag.getZScore(), severity,
                        String.format("'%s' 서비스 로그량 %s: %.2f/s (평소 %.2f ± %.2f, z=%.2f)",
                                window.getService(), direction, flag.getValue(),
                                flag.getBaselineMean(), flag.getBaselineStddev(), flag.getZScore()),
                        additionalData(flag)));
            }
            case ERROR_RATIO:
            case CRITICAL_RATIO:
            case WARN_RATIO: {
                if (!flag.isIncrease()) {
                    return Optional.empty();
                }
                AlertSeverity severity = flag.getMetric() == Feature.CRITICAL_RATIO ? AlertSeverity.CRITICAL
                        : flag.getMetric() == Feature.ERROR_RATIO ? AlertSeverity.ERROR
                        : AlertSeverity.WARNING;
                String metric = flag.getMetric().name().toLowerCase();
                return Optional.of(detection(window, AlertKind.SEVERITY_SHIFT, metric, flag.getZScore(), severity,
                        String.format("'%s' 서비스 %s 상승: %.1f%% (평소 %.1f%%, z=%.2f)",
                                window.getService(), metric, flag.getValue() * 100,
                                flag.getBaselineMean() * 100, flag.getZScore()),
                        additionalData(flag)));
            }
            default:
                return Optional.empty();
        }
    }

    private Map<String, Object> additionalData(BaselineFlag flag) {
        return Map.of(
                "value", flag.getValue(),
                "baselineMean", flag.getBaselineMean(),
                "baselineStddev", flag.getBaselineStddev(),
                "zScore", flag.getZScore(),
                "zThreshold", settings.getZScoreThreshold()
        );
    }

    private ServiceBaseline baselineFor(String service) {
        return baselines.computeIfAbsent(service, s -> new ServiceBaseline(
                TRACKED_METRICS,
                settings.getAlpha(),
                settings.getWarmupCount(),
                settings.getEpsilon(),
                settings.getZScoreThreshold()));
    }

    public Optional<ServiceBaseline> getBaseline(String service) {
        return Optional.ofNullable(baselines.get(service));
    }

    @Override
    public void resetState(String service) {
        baselines.remove(service);
    }

    @Override
    public void resetState() {
        baselines.clear();
    }
}
