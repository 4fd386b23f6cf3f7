package com.tenacy.logradar.detection.isolation;

import com.tenacy.logradar.alert.AlertKind;
import com.tenacy.logradar.alert.AlertSeverity;
import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.detection.AbstractWindowDetector;
import com.tenacy.logradar.detection.DetectionOutcome;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.Window;
import com.tenacy.logradar.exception.ModelBuildException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 서비스별 isolation forest로 평소와 다른 조합의 윈도우를 찾는다.
 *
 * <p>점수는 현재 모델로 먼저 매기고 그 다음 벡터를 표본에 넣는다. 재학습은 별도 풀에서
 * 돌고, 완성된 모델만 참조 교체로 반영된다.
 */
@Slf4j
@Component
@Order(2)
public class PatternAnomalyDetector extends AbstractWindowDetector {

    public static final String DETECTOR_ID = "pattern-anomaly";
    public static final String SCORE_KEY = "anomaly_score";

    private final Map<String, ServiceModel> models = new ConcurrentHashMap<>();
    private final DetectionProperties.Pattern settings;
    private final IsolationForestTrainer trainer;
    private final Clock clock;

    private final Counter modelsBuiltCounter;
    private final Counter buildsSkippedCounter;

    public PatternAnomalyDetector(DetectionProperties properties, Clock clock, MeterRegistry meterRegistry) {
        super(
                DETECTOR_ID,
                "로그 패턴 이상 감지",
                "서비스별 최근 특성 벡터로 학습한 isolation forest 점수가 임계값을 넘는 윈도우를 감지합니다."
        );
        this.settings = properties.getPattern();
        this.clock = clock;
        this.trainer = new IsolationForestTrainer(
                settings.getTreeCount(), settings.getSubsampleSize(), settings.getMinTrainingSamples());

        this.modelsBuiltCounter = Counter.builder("logradar.model.builds")
                .description("완료된 포레스트 재학습 수")
                .register(meterRegistry);
        this.buildsSkippedCounter = Counter.builder("logradar.model.builds.skipped")
                .description("표본 부족으로 건너뛴 재학습 수")
                .register(meterRegistry);
    }

    @Override
    protected DetectionOutcome doEvaluate(Window window, FeatureVector vector) {
        ServiceModel model = modelFor(window.getService());

        IsolationForest forest = model.forest.get();
        double score = forest != null ? forest.score(vector) : 0.0;
        model.samples.add(vector.toArray());

        Map<String, Double> scores = Map.of(SCORE_KEY, score);
        if (forest == null || score <= settings.getAnomalyThreshold()) {
            return new DetectionOutcome(List.of(), scores);
        }

        double threshold = settings.getAnomalyThreshold();
        AlertSeverity severity = score >= (1.0 + threshold) / 2.0 ? AlertSeverity.ERROR : AlertSeverity.WARNING;
        String message = String.format("'%s' 서비스 로그 패턴 이상: 점수 %.3f (임계값 %.2f)",
                window.getService(), score, threshold);

        log.debug("Pattern anomaly for '{}': score={}, vector={}", window.getService(), score, vector);
        return new DetectionOutcome(
                List.of(detection(window, AlertKind.PATTERN_ANOMALY, SCORE_KEY, score, severity, message, Map.of(
                        "anomalyScore", score,
                        "anomalyThreshold", threshold,
                        "features", vector.asNamedMap(),
                        "modelTrainedAt", forest.getTrainedAt().toString()))),
                scores);
    }

    /**
     * 서비스 하나를 지금 재학습한다. 표본이 부족하면 기존 모델을 유지한다.
     *
     * @return 새로 교체된 모델. 건너뛰었으면 empty
     */
    public Optional<IsolationForest> retrain(String service) {
        ServiceModel model = models.get(service);
        if (model == null) {
            return Optional.empty();
        }
        if (!model.training.compareAndSet(false, true)) {
            log.debug("Retraining for '{}' already in progress", service);
            return Optional.empty();
        }

        try {
            IsolationForest forest = trainer.train(model.samples.snapshot(), model.random, clock.instant());
            model.forest.set(forest);
            modelsBuiltCounter.increment();
            log.debug("Retrained forest for '{}' with {} samples", service, forest.getTrainingSampleCount());
            return Optional.of(forest);
        } catch (ModelBuildException e) {
            buildsSkippedCounter.increment();
            log.debug("Skipping retraining for '{}': {}", service, e.getMessage());
            return Optional.empty();
        } finally {
            model.training.set(false);
        }
    }

    /**
     * 모든 서비스의 재학습을 executor에 맡긴다. 호출 스레드는 기다리지 않는다.
     */
    public void retrainAll(Executor executor) {
        for (String service : models.keySet()) {
            try {
                executor.execute(() -> {
                    try {
                        retrain(service);
                    } catch (RuntimeException e) {
                        log.error("Retraining failed for '{}': {}", service, e.getMessage(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Retraining for '{}' rejected: {}", service, e.getMessage());
            }
        }
    }

    public Optional<IsolationForest> getModel(String service) {
        ServiceModel model = models.get(service);
        return model != null ? Optional.ofNullable(model.forest.get()) : Optional.empty();
    }

    public int sampleCount(String service) {
        ServiceModel model = models.get(service);
        return model != null ? model.samples.size() : 0;
    }

    public Set<String> trackedServices() {
        return new TreeSet<>(models.keySet());
    }

    @Override
    public void resetState(String service) {
        models.remove(service);
    }

    @Override
    public void resetState() {
        models.clear();
    }

    private ServiceModel modelFor(String service) {
        return models.computeIfAbsent(service, s -> new ServiceModel(settings.getSampleCapacity(), randomFor(s)));
    }

    private Random randomFor(String service) {
        Long seed = settings.getSeed();
        return seed != null ? new Random(seed * 31 + service.hashCode()) : new Random();
    }

    private static final class ServiceModel {
        private final SampleBuffer samples;
        private final AtomicReference<IsolationForest> forest = new AtomicReference<>();
        private final AtomicBoolean training = new AtomicBoolean();
        // training 플래그가 동시 학습을 막으므로 한 번에 한 스레드만 쓴다.
        private final Random random;

        private ServiceModel(int capacity, Random random) {
            this.samples = new SampleBuffer(capacity);
            this.random = random;
        }
    }
}
