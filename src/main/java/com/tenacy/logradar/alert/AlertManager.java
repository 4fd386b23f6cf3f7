package com.tenacy.logradar.alert;

import com.tenacy.logradar.config.AlertProperties;
import com.tenacy.logradar.detection.Detection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * (서비스, 알림 종류)마다 QUIET → TRIGGERED → SUPPRESSED → QUIET 상태를 관리한다.
 *
 * <p>상태 확인과 변경은 키 단위 {@link ConcurrentHashMap#compute}로 한 번에 일어나므로
 * 같은 키에 대한 동시 호출이 알림을 두 번 내보내지 않는다.
 */
@Slf4j
@Component
public class AlertManager {

    private final Map<AlertKey, AlertTrack> tracks = new ConcurrentHashMap<>();
    private final Deque<Alert> recentAlerts = new ArrayDeque<>();

    private final Duration cooldown;
    private final int decayCount;
    private final int recentHistorySize;

    private final MeterRegistry meterRegistry;
    private final Counter suppressedCounter;
    private final Counter escalationCounter;
    private final AtomicInteger activeGauge = new AtomicInteger();

    public AlertManager(AlertProperties properties, MeterRegistry meterRegistry) {
        this.cooldown = properties.getCooldown();
        this.decayCount = properties.getDecayCount();
        this.recentHistorySize = properties.getRecentHistorySize();
        this.meterRegistry = meterRegistry;

        this.suppressedCounter = Counter.builder("logradar.alerts.suppressed")
                .description("쿨다운 중이라 다시 보내지 않은 플래그 수")
                .register(meterRegistry);
        this.escalationCounter = Counter.builder("logradar.alerts.escalated")
                .description("쿨다운 중 심각도 상승으로 즉시 보낸 알림 수")
                .register(meterRegistry);
        meterRegistry.gauge("logradar.alerts.active", activeGauge);
    }

    /**
     * 한 서비스의 이번 주기 탐지 결과를 반영한다.
     *
     * <p>같은 종류의 탐지가 여러 개면 가장 높은 심각도와 점수로 합친다. 이번 주기에 플래그가
     * 없는 종류는 감쇠 카운트가 올라간다.
     *
     * @return 이번 주기에 새로 내보낼 알림
     */
    public List<Alert> process(String service, List<Detection> detections, Instant now) {
        Map<AlertKind, Detection> merged = merge(detections);
        List<Alert> emitted = new ArrayList<>();

        for (AlertKind kind : AlertKind.values()) {
            AlertKey key = new AlertKey(service, kind);
            Detection flag = merged.get(kind);

            if (flag != null) {
                Alert[] holder = new Alert[1];
                tracks.compute(key, (k, track) -> onFlag(k, track, flag, now, holder));
                if (holder[0] != null) {
                    emitted.add(holder[0]);
                }
            } else {
                tracks.computeIfPresent(key, (k, track) -> onQuietCycle(k, track, now));
            }
        }

        if (!emitted.isEmpty()) {
            record(emitted);
        }
        activeGauge.set(tracks.size());
        return emitted;
    }

    private AlertTrack onFlag(AlertKey key, AlertTrack track, Detection flag, Instant now, Alert[] holder) {
        if (track == null) {
            track = new AlertTrack();
        }
        track.missedCycles = 0;

        if (track.state == AlertState.QUIET) {
            holder[0] = emit(key, track, flag, now, 1);
            return track;
        }

        track.pendingCount++;

        if (!now.isBefore(track.suppressedUntil)) {
            holder[0] = emit(key, track, flag, now, track.pendingCount);
        } else if (flag.getSeverity().isHigherThan(track.level)) {
            escalationCounter.increment();
            log.info("Alert escalated for {}/{}: {} -> {}", key.getService(), key.getKind(),
                    track.level, flag.getSeverity());
            track.lastAlert.endSuppression(now);
            holder[0] = emit(key, track, flag, now, track.pendingCount);
        } else {
            track.state = AlertState.SUPPRESSED;
            suppressedCounter.increment();
            log.debug("Alert suppressed for {}/{} until {} (pending={})", key.getService(), key.getKind(),
                    track.suppressedUntil, track.pendingCount);
        }
        return track;
    }

    private AlertTrack onQuietCycle(AlertKey key, AlertTrack track, Instant now) {
        track.missedCycles++;
        if (track.missedCycles >= decayCount && !now.isBefore(track.suppressedUntil)) {
            log.debug("Alert state for {}/{} decayed to QUIET", key.getService(), key.getKind());
            return null;
        }
        return track;
    }

    private Alert emit(AlertKey key, AlertTrack track, Detection flag, Instant now, int occurrenceCount) {
        Instant suppressedUntil = now.plus(cooldown);
        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .kind(key.getKind())
                .service(key.getService())
                .severity(flag.getSeverity())
                .score(flag.getScore())
                .timestamp(now)
                .suppressedUntil(suppressedUntil)
                .occurrenceCount(occurrenceCount)
                .message(flag.getMessage())
                .build();

        track.state = AlertState.TRIGGERED;
        track.level = flag.getSeverity();
        track.suppressedUntil = suppressedUntil;
        track.pendingCount = 0;
        track.lastAlert = alert;

        meterRegistry.counter("logradar.alerts.emitted", "kind", key.getKind().name()).increment();
        log.info("Alert emitted: [{}] {} on '{}' (score={}, occurrences={})",
                alert.getSeverity(), alert.getKind(), alert.getService(),
                String.format("%.3f", alert.getScore()), occurrenceCount);
        return alert;
    }

    private static Map<AlertKind, Detection> merge(List<Detection> detections) {
        Map<AlertKind, Detection> merged = new EnumMap<>(AlertKind.class);
        Comparator<Detection> strongest = Comparator
                .comparing(Detection::getSeverity)
                .thenComparingDouble(Detection::getScore);

        for (Detection detection : detections) {
            merged.merge(detection.getKind(), detection, (a, b) -> {
                Detection winner = strongest.compare(a, b) >= 0 ? a : b;
                return Detection.builder()
                        .detectorId(winner.getDetectorId())
                        .kind(winner.getKind())
                        .service(winner.getService())
                        .metric(winner.getMetric())
                        .score(Math.max(a.getScore(), b.getScore()))
                        .severity(AlertSeverity.max(a.getSeverity(), b.getSeverity()))
                        .message(winner.getMessage())
                        .detectedAt(winner.getDetectedAt())
                        .additionalData(winner.getAdditionalData())
                        .build();
            });
        }
        return merged;
    }

    private void record(List<Alert> emitted) {
        synchronized (recentAlerts) {
            for (Alert alert : emitted) {
                recentAlerts.addFirst(alert);
            }
            while (recentAlerts.size() > recentHistorySize) {
                recentAlerts.removeLast();
            }
        }
    }

    public AlertState getState(String service, AlertKind kind) {
        AlertTrack track = tracks.get(new AlertKey(service, kind));
        return track != null ? track.state : AlertState.QUIET;
    }

    /**
     * QUIET이 아닌 (서비스, 종류)의 마지막 알림.
     */
    public List<Alert> getActiveAlerts() {
        List<Alert> active = new ArrayList<>();
        tracks.values().forEach(track -> {
            Alert last = track.lastAlert;
            if (last != null) {
                active.add(last);
            }
        });
        active.sort(Comparator.comparing(Alert::getTimestamp).reversed());
        return active;
    }

    public List<Alert> getActiveAlerts(String service) {
        List<Alert> active = new ArrayList<>();
        for (Alert alert : getActiveAlerts()) {
            if (alert.getService().equals(service)) {
                active.add(alert);
            }
        }
        return active;
    }

    /**
     * 최근에 내보낸 알림. 최신순.
     */
    public List<Alert> getRecentAlerts(int limit) {
        synchronized (recentAlerts) {
            List<Alert> recent = new ArrayList<>(Math.min(limit, recentAlerts.size()));
            for (Alert alert : recentAlerts) {
                if (recent.size() >= limit) {
                    break;
                }
                recent.add(alert);
            }
            return recent;
        }
    }

    /**
     * QUIET이 아닌 상태를 하나 이상 가진 서비스.
     */
    public Set<String> trackedServices() {
        Set<String> services = new TreeSet<>();
        tracks.keySet().forEach(key -> services.add(key.getService()));
        return services;
    }

    public void reset(String service) {
        tracks.keySet().removeIf(key -> key.getService().equals(service));
        activeGauge.set(tracks.size());
    }

    public void reset() {
        tracks.clear();
        synchronized (recentAlerts) {
            recentAlerts.clear();
        }
        activeGauge.set(0);
    }

    @Value
    private static class AlertKey {
        String service;
        AlertKind kind;
    }

    // compute 안에서만 변경된다. lastAlert만 조회 스레드가 읽는다.
    private static final class AlertTrack {
        private AlertState state = AlertState.QUIET;
        private AlertSeverity level;
        private Instant suppressedUntil = Instant.MIN;
        private int pendingCount;
        private int missedCycles;
        private volatile Alert lastAlert;
    }
}
