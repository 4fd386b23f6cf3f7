package com.tenacy.logradar.service;

import com.tenacy.logradar.domain.LogEvent;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LogMetricsService {

    private final Counter ingestedEventsCounter;
    private final Counter rejectedEventsCounter;
    private final Counter debugLogsCounter;
    private final Counter infoLogsCounter;
    private final Counter warnLogsCounter;
    private final Counter errorLogsCounter;
    private final Counter criticalLogsCounter;

    public void recordAccepted(LogEvent event) {
        ingestedEventsCounter.increment();

        switch (event.getSeverity()) {
            case DEBUG:
                debugLogsCounter.increment();
                break;
            case WARN:
                warnLogsCounter.increment();
                break;
            case ERROR:
                errorLogsCounter.increment();
                break;
            case CRITICAL:
                criticalLogsCounter.increment();
                break;
            default:
                infoLogsCounter.increment();
        }
    }

    public void recordRejected() {
        rejectedEventsCounter.increment();
    }

    /**
     * 파싱 단계와 버퍼 단계를 합친 누적 거부 수.
     */
    public long rejectedCount() {
        return (long) rejectedEventsCounter.count();
    }
}
