package com.tenacy.logradar.buffer;

import com.tenacy.logradar.config.DetectionProperties;
import com.tenacy.logradar.domain.LogEvent;
import com.tenacy.logradar.exception.DataQualityException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 서비스별로 최근 로그를 보존 구간만큼 들고 있는 버퍼.
 *
 * <p>수집 스레드 여러 개가 동시에 {@link #push(LogEvent)} 하고 탐지 주기가
 * {@link #drainWindow(String, Duration)} 로 읽는다. 서비스 단위로 잠금을 나누므로
 * 한 서비스의 읽기는 다른 서비스의 적재를 막지 않는다.
 */
@Slf4j
@Component
public class EventBuffer {

    private final Map<String, ServiceEvents> services = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    private final Clock clock;
    private final Duration retentionHorizon;
    private final Duration outOfOrderTolerance;
    private final Duration maxClockSkew;
    private final int maxEventsPerService;

    private final AtomicLong size = new AtomicLong();
    private final Counter evictedByCapCounter;

    public EventBuffer(DetectionProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.retentionHorizon = properties.getRetentionHorizon();
        this.outOfOrderTolerance = properties.getOutOfOrderTolerance();
        this.maxClockSkew = properties.getMaxClockSkew();
        this.maxEventsPerService = properties.getMaxEventsPerService();

        this.evictedByCapCounter = Counter.builder("logradar.buffer.evicted.cap")
                .description("서비스별 상한 초과로 밀려난 로그 수")
                .register(meterRegistry);
        meterRegistry.gauge("logradar.buffer.events", size);
        meterRegistry.gauge("logradar.buffer.services", services, Map::size);
    }

    /**
     * 이벤트를 적재한다. 보존 구간보다 오래된 이벤트는 같은 잠금 안에서 함께 정리된다.
     *
     * @throws DataQualityException 필수 필드 누락, 보존 구간 밖, 허용 범위를 넘는 순서 위반
     */
    public void push(LogEvent event) {
        validate(event);

        Instant now = clock.instant();
        Instant cutoff = now.minus(retentionHorizon);
        Instant timestamp = event.getTimestamp();

        if (timestamp.isBefore(cutoff)) {
            throw reject(event, "event is older than retention horizon: " + timestamp);
        }
        if (timestamp.isAfter(now.plus(maxClockSkew))) {
            throw reject(event, "event timestamp is too far in the future: " + timestamp);
        }

        while (true) {
            ServiceEvents serviceEvents = services.computeIfAbsent(event.getService(), ServiceEvents::new);
            serviceEvents.lock.lock();
            try {
                if (serviceEvents.retired) {
                    // evictExpired()가 방금 제거한 객체. 새로 만든 쪽에 적재한다.
                    continue;
                }
                if (serviceEvents.newest != null
                        && timestamp.isBefore(serviceEvents.newest.minus(outOfOrderTolerance))) {
                    throw reject(event, "event is out of order by more than " + outOfOrderTolerance
                            + " (newest=" + serviceEvents.newest + ", event=" + timestamp + ")");
                }

                serviceEvents.insert(event);
                size.incrementAndGet();
                serviceEvents.evictOlderThan(cutoff, size);

                while (serviceEvents.events.size() > maxEventsPerService) {
                    serviceEvents.events.pollFirst();
                    size.decrementAndGet();
                    evictedByCapCounter.increment();
                }
            } finally {
                serviceEvents.lock.unlock();
            }

            lastSeen.merge(event.getService(), timestamp, (a, b) -> a.isAfter(b) ? a : b);
            return;
        }
    }

    /**
     * 가장 최근 windowSize 안의 이벤트를 시간순으로 돌려준다. 버퍼에서 제거하지 않으며
     * 보존 구간보다 오래된 이벤트는 포함하지 않는다.
     */
    public List<LogEvent> drainWindow(String service, Duration windowSize) {
        ServiceEvents serviceEvents = services.get(service);
        if (serviceEvents == null) {
            return List.of();
        }

        Instant now = clock.instant();
        Instant windowStart = now.minus(windowSize);
        Instant horizonStart = now.minus(retentionHorizon);
        Instant cutoff = windowStart.isAfter(horizonStart) ? windowStart : horizonStart;

        List<LogEvent> window = new ArrayList<>();
        serviceEvents.lock.lock();
        try {
            Iterator<LogEvent> it = serviceEvents.events.descendingIterator();
            while (it.hasNext()) {
                LogEvent event = it.next();
                if (event.getTimestamp().isBefore(cutoff)) {
                    break;
                }
                window.add(event);
            }
        } finally {
            serviceEvents.lock.unlock();
        }

        Collections.reverse(window);
        return Collections.unmodifiableList(window);
    }

    /**
     * 보존 구간 안의 이벤트 수.
     */
    public int countWithinHorizon(String service) {
        return drainWindow(service, retentionHorizon).size();
    }

    /**
     * 더 이상 적재가 없는 서비스의 만료 이벤트를 정리한다. 비게 된 서비스는 제거된다.
     *
     * @return 제거한 이벤트 수
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retentionHorizon);
        int before = (int) size.get();

        for (ServiceEvents serviceEvents : services.values()) {
            serviceEvents.lock.lock();
            try {
                serviceEvents.evictOlderThan(cutoff, size);
                if (serviceEvents.events.isEmpty()) {
                    serviceEvents.retired = true;
                    services.remove(serviceEvents.service, serviceEvents);
                }
            } finally {
                serviceEvents.lock.unlock();
            }
        }

        int evicted = Math.max(0, before - (int) size.get());
        if (evicted > 0) {
            log.debug("Evicted {} expired events from buffer", evicted);
        }
        return evicted;
    }

    /**
     * 현재 버퍼에 이벤트가 남아 있는 서비스.
     */
    public Set<String> activeServices() {
        Set<String> active = new TreeSet<>();
        services.forEach((service, events) -> {
            if (!events.isEmpty()) {
                active.add(service);
            }
        });
        return active;
    }

    /**
     * 이벤트를 보낸 적 있는 서비스. 이벤트가 만료된 뒤에도 {@link #forgetSilentServices(Instant)} 전까지 남는다.
     */
    public Set<String> knownServices() {
        return new TreeSet<>(lastSeen.keySet());
    }

    /**
     * silentSince 이전부터 조용하고 버퍼에 이벤트도 없는 서비스를 잊는다.
     *
     * @return 잊은 서비스
     */
    public Set<String> forgetSilentServices(Instant silentSince) {
        Set<String> forgotten = new TreeSet<>();
        for (Map.Entry<String, Instant> entry : lastSeen.entrySet()) {
            String service = entry.getKey();
            if (!entry.getValue().isBefore(silentSince) || services.containsKey(service)) {
                continue;
            }
            // 그 사이 적재가 있었다면 값이 바뀌어 제거되지 않는다.
            if (lastSeen.remove(service, entry.getValue())) {
                forgotten.add(service);
            }
        }
        if (!forgotten.isEmpty()) {
            log.info("Forgot {} services silent since {}", forgotten.size(), silentSince);
        }
        return forgotten;
    }

    public Optional<Instant> lastSeen(String service) {
        return Optional.ofNullable(lastSeen.get(service));
    }

    public long size() {
        return size.get();
    }

    public Duration getRetentionHorizon() {
        return retentionHorizon;
    }

    public void clear() {
        services.clear();
        lastSeen.clear();
        size.set(0);
    }

    private void validate(LogEvent event) {
        if (event == null) {
            throw reject(null, "event is null");
        }
        if (event.getService() == null || event.getService().isBlank()) {
            throw reject(event, "service is required");
        }
        if (event.getSeverity() == null) {
            throw reject(event, "severity is required");
        }
        if (event.getTimestamp() == null) {
            throw reject(event, "timestamp is required");
        }
    }

    private DataQualityException reject(LogEvent event, String reason) {
        String service = event != null ? event.getService() : null;
        log.debug("Rejected log event from '{}': {}", service, reason);
        return new DataQualityException(service, reason);
    }

    private static final class ServiceEvents {
        private final String service;
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<LogEvent> events = new ArrayDeque<>();
        private Instant newest;
        private boolean retired;

        private ServiceEvents(String service) {
            this.service = service;
        }

        /**
         * 시간순을 유지하며 넣는다. 허용 범위 안의 지연 이벤트만 뒤에서부터 자리를 찾는다.
         */
        private void insert(LogEvent event) {
            Instant timestamp = event.getTimestamp();
            if (newest == null || !timestamp.isBefore(newest)) {
                events.addLast(event);
                newest = timestamp;
                return;
            }

            Deque<LogEvent> later = new ArrayDeque<>();
            while (!events.isEmpty() && events.peekLast().getTimestamp().isAfter(timestamp)) {
                later.push(events.pollLast());
            }
            events.addLast(event);
            while (!later.isEmpty()) {
                events.addLast(later.pop());
            }
        }

        private void evictOlderThan(Instant cutoff, AtomicLong size) {
            while (!events.isEmpty() && events.peekFirst().getTimestamp().isBefore(cutoff)) {
                events.pollFirst();
                size.decrementAndGet();
            }
        }

        private boolean isEmpty() {
            lock.lock();
            try {
                return events.isEmpty();
            } finally {
                lock.unlock();
            }
        }
    }
}
