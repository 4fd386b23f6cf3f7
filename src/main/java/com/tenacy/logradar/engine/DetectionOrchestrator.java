package com.tenacy.logradar.engine;

import com.tenacy.logradar.alert.Alert;
import com.tenacy.logradar.alert.AlertDispatcher;
import com.tenacy.logradar.alert.AlertManager;
import com.tenacy.logradar.buffer.EventBuffer;
import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.detection.DetectionOutcome;
import com.tenacy.logradar.detection.DetectionPipeline;
import com.tenacy.logradar.detection.isolation.PatternAnomalyDetector;
import com.tenacy.logradar.domain.Feature;
import com.tenacy.logradar.domain.FeatureVector;
import com.tenacy.logradar.domain.LogEvent;
import com.tenacy.logradar.domain.Window;
import com.tenacy.logradar.feature.FeatureExtractor;
import com.tenacy.logradar.health.HealthScore;
import com.tenacy.logradar.health.ServiceHealthAggregator;
import com.tenacy.logradar.health.SystemHealth;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 고정 주기로 서비스마다 윈도우 → 특성 → 탐지 → 헬스 → 알림을 돌리고 최신 스냅샷을 남긴다.
 *
 * <p>서비스별 작업은 detectionExecutor에서 병렬로 돌며 주기 데드라인까지만 기다린다.
 * 데드라인을 넘긴 주기 다음 한 번은 건너뛰고, 주기끼리는 겹치지 않는다.
 */
@Slf4j
@Service
public class DetectionOrchestrator {

    private final EventBuffer eventBuffer;
    private final FeatureExtractor featureExtractor;
    private final DetectionPipeline detectionPipeline;
    private final ServiceHealthAggregator healthAggregator;
    private final AlertManager alertManager;
    private final AlertDispatcher alertDispatcher;
    private final Executor detectionExecutor;
    private final Clock clock;

    private final Duration windowSize;
    private final Duration tickDeadline;
    private final Duration forgetAfter;

    private final AtomicReference<DetectionSnapshot> latestSnapshot;
    private final Map<String, ServiceSnapshot> serviceSnapshots = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean skipNext = new AtomicBoolean(false);
    private volatile boolean shuttingDown = false;

    private final Timer tickTimer;
    private final Counter skippedTicksCounter;
    private final Counter serviceFailuresCounter;
    private final Counter abandonedServicesCounter;

    public DetectionOrchestrator(EventBuffer eventBuffer,
                                 FeatureExtractor featureExtractor,
                                 DetectionPipeline detectionPipeline,
                                 ServiceHealthAggregator healthAggregator,
                                 AlertManager alertManager,
                                 AlertDispatcher alertDispatcher,
                                 DetectionProperties properties,
                                 @Qualifier("detectionExecutor") Executor detectionExecutor,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.eventBuffer = eventBuffer;
        this.featureExtractor = featureExtractor;
        this.detectionPipeline = detectionPipeline;
        this.healthAggregator = healthAggregator;
        this.alertManager = alertManager;
        this.alertDispatcher = alertDispatcher;
        this.detectionExecutor = detectionExecutor;
        this.clock = clock;
        this.windowSize = properties.getWindowSize();
        this.tickDeadline = properties.getTickDeadline();
        this.forgetAfter = properties.getRetentionHorizon().plus(properties.getStaleAfter());
        this.latestSnapshot = new AtomicReference<>(DetectionSnapshot.empty(clock.instant()));

        this.tickTimer = Timer.builder("logradar.tick.duration")
                .description("탐지 주기 한 번의 소요 시간")
                .register(meterRegistry);
        this.skippedTicksCounter = Counter.builder("logradar.tick.skipped")
                .description("이전 주기 초과로 건너뛴 주기 수")
                .register(meterRegistry);
        this.serviceFailuresCounter = Counter.builder("logradar.tick.service.failures")
                .description("주기 중 예외로 실패한 서비스 평가 수")
                .register(meterRegistry);
        this.abandonedServicesCounter = Counter.builder("logradar.tick.service.abandoned")
                .description("데드라인까지 끝나지 않아 버린 서비스 평가 수")
                .register(meterRegistry);
        meterRegistry.gauge("logradar.health.system", latestSnapshot,
                ref -> ref.get().getSystemHealth().getScore());
    }

    /**
     * 스케줄러 진입점. 주기는 {@code SchedulingConfig}가 등록한다.
     */
    public void scheduledTick() {
        try {
            tick(clock.instant());
        } catch (Exception e) {
            log.error("Detection tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 주기 한 번을 실행한다.
     *
     * @return 새 스냅샷. 건너뛴 주기면 empty
     */
    public Optional<DetectionSnapshot> tick(Instant now) {
        if (shuttingDown) {
            return Optional.empty();
        }
        if (skipNext.compareAndSet(true, false)) {
            skippedTicksCounter.increment();
            log.warn("Skipping detection tick at {} because the previous tick overran its deadline", now);
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            skippedTicksCounter.increment();
            log.warn("Skipping detection tick at {} because the previous tick is still running", now);
            return Optional.empty();
        }

        long startNanos = System.nanoTime();
        try {
            DetectionSnapshot snapshot = runTick(now, startNanos);
            long elapsedNanos = System.nanoTime() - startNanos;
            tickTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);

            if (elapsedNanos > tickDeadline.toNanos()) {
                skipNext.set(true);
                log.warn("Detection tick took {}ms (deadline {}ms), next tick will be skipped",
                        TimeUnit.NANOSECONDS.toMillis(elapsedNanos), tickDeadline.toMillis());
            }
            return Optional.of(snapshot);
        } finally {
            running.set(false);
        }
    }

    private DetectionSnapshot runTick(Instant now, long startNanos) {
        eventBuffer.evictExpired();
        Set<String> activeServices = eventBuffer.activeServices();

        Map<String, CompletableFuture<ServiceEvaluation>> futures = new LinkedHashMap<>();
        for (String service : activeServices) {
            futures.put(service, CompletableFuture.supplyAsync(() -> evaluateService(service, now), detectionExecutor));
        }

        long deadlineNanos = startNanos + tickDeadline.toNanos();
        List<String> abandoned = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<String, CompletableFuture<ServiceEvaluation>> entry : futures.entrySet()) {
            String service = entry.getKey();
            try {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                ServiceEvaluation evaluation = entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                if (evaluation.failed) {
                    failed.add(service);
                } else if (evaluation.snapshot != null) {
                    serviceSnapshots.put(service, evaluation.snapshot);
                }
            } catch (TimeoutException e) {
                abandoned.add(service);
                abandonedServicesCounter.increment();
                log.warn("Abandoning detection for '{}' in tick {}: deadline exceeded", service, now);
            } catch (ExecutionException e) {
                failed.add(service);
                serviceFailuresCounter.increment();
                log.error("Detection failed for '{}': {}", service, e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandoned.add(service);
                log.warn("Detection tick interrupted while waiting for '{}'", service);
                break;
            }
        }

        // 윈도우가 사라진 서비스도 알림 상태는 감쇠시킨다.
        for (String service : alertManager.trackedServices()) {
            if (!activeServices.contains(service)) {
                alertManager.process(service, List.of(), now);
            }
        }

        forgetSilentServices(now);

        Map<String, Integer> horizonCounts = new HashMap<>();
        for (String service : activeServices) {
            horizonCounts.put(service, eventBuffer.countWithinHorizon(service));
        }
        Map<String, Instant> lastSeen = new HashMap<>();
        for (String service : eventBuffer.knownServices()) {
            eventBuffer.lastSeen(service).ifPresent(seen -> lastSeen.put(service, seen));
        }
        SystemHealth systemHealth = healthAggregator.aggregate(horizonCounts, lastSeen, now);

        DetectionSnapshot snapshot = DetectionSnapshot.builder()
                .timestamp(now)
                .systemHealth(systemHealth)
                .services(new TreeMap<>(serviceSnapshots))
                .abandonedServices(List.copyOf(abandoned))
                .failedServices(List.copyOf(failed))
                .tickDurationMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                .build();
        latestSnapshot.set(snapshot);

        log.debug("Detection tick at {}: {} services, system health {}", now, activeServices.size(),
                String.format("%.1f", systemHealth.getScore()));
        return snapshot;
    }

    /**
     * 보존 구간과 stale 기간을 합친 것보다 오래 조용한 서비스의 상태를 모두 버린다.
     */
    private void forgetSilentServices(Instant now) {
        Set<String> forgotten = eventBuffer.forgetSilentServices(now.minus(forgetAfter));
        for (String service : forgotten) {
            serviceSnapshots.remove(service);
            healthAggregator.remove(service);
            detectionPipeline.resetService(service);
            alertManager.reset(service);
        }
        serviceSnapshots.keySet().removeIf(service -> eventBuffer.lastSeen(service).isEmpty());
    }

    private ServiceEvaluation evaluateService(String service, Instant now) {
        try {
            List<LogEvent> events = eventBuffer.drainWindow(service, windowSize);
            Window window = featureExtractor.window(service, now.minus(windowSize), now, events);

            if (window.isEmpty()) {
                // 마지막 점수를 유지한다. 알림 감쇠만 진행한다.
                alertManager.process(service, List.of(), now);
                return ServiceEvaluation.skipped();
            }

            FeatureVector vector = featureExtractor.extract(window);
            DetectionOutcome outcome = detectionPipeline.evaluate(window, vector);

            double anomalyScore = outcome.getScores().getOrDefault(PatternAnomalyDetector.SCORE_KEY, 0.0);
            HealthScore health = healthAggregator.update(service,
                    vector.get(Feature.ERROR_RATIO), vector.get(Feature.CRITICAL_RATIO), anomalyScore, now);

            List<Alert> alerts = alertManager.process(service, outcome.getDetections(), now);
            if (!alerts.isEmpty()) {
                alertDispatcher.dispatch(alerts, featureExtractor.summarize(window, vector, events));
            }

            return ServiceEvaluation.of(ServiceSnapshot.builder()
                    .service(service)
                    .health(health)
                    .windowStart(window.getStart())
                    .windowEnd(window.getEnd())
                    .totalCount(window.getTotalCount())
                    .countsBySeverity(window.getCountsBySeverity())
                    .features(vector.asNamedMap())
                    .detectorScores(outcome.getScores())
                    .flagCount(outcome.getDetections().size())
                    .evaluatedAt(now)
                    .build());
        } catch (Exception e) {
            serviceFailuresCounter.increment();
            log.error("Detection failed for service '{}': {}", service, e.getMessage(), e);
            return ServiceEvaluation.failure();
        }
    }

    public DetectionSnapshot getSnapshot() {
        return latestSnapshot.get();
    }

    public Optional<ServiceSnapshot> getServiceSnapshot(String service) {
        return Optional.ofNullable(latestSnapshot.get().getServices().get(service));
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 새 주기를 막고 진행 중인 주기를 데드라인까지 기다린다.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        long waitUntil = System.nanoTime() + tickDeadline.toNanos();

        while (running.get() && System.nanoTime() < waitUntil) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (running.get()) {
            log.warn("Shutting down with a detection tick still in flight; abandoning it");
        } else {
            log.info("Detection orchestrator stopped");
        }
    }

    private static final class ServiceEvaluation {
        private final ServiceSnapshot snapshot;
        private final boolean failed;

        private ServiceEvaluation(ServiceSnapshot snapshot, boolean failed) {
            this.snapshot = snapshot;
            this.failed = failed;
        }

        static ServiceEvaluation of(ServiceSnapshot snapshot) {
            return new ServiceEvaluation(snapshot, false);
        }

        static ServiceEvaluation skipped() {
            return new ServiceEvaluation(null, false);
        }

        static ServiceEvaluation failure() {
            return new ServiceEvaluation(null, true);
        }
    }
}
