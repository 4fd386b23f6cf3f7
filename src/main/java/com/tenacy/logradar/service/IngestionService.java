package com.tenacy.logradar.service;

import com.tenacy.logradar.api.dto.IngestionResponse;
import com.tenacy.logradar.api.dto.LogEventRequest;
import com.tenacy.logradar.buffer.EventBuffer;
import com.tenacy.logradar.domain.LogEvent;
import com.tenacy.logradar.domain.Severity;
import com.tenacy.logradar.exception.DataQualityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 요청 본문을 LogEvent로 바꿔 버퍼에 넣는다. 거부된 이벤트는 세고 버린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private static final int MAX_REPORTED_ERRORS = 20;

    private final EventBuffer eventBuffer;
    private final LogMetricsService logMetricsService;
    private final Clock clock;

    /**
     * @throws DataQualityException 이벤트가 거부되었을 때
     */
    public void ingest(LogEventRequest request) {
        LogEvent event = toEvent(request);
        try {
            eventBuffer.push(event);
        } catch (DataQualityException e) {
            logMetricsService.recordRejected();
            throw e;
        }
        logMetricsService.recordAccepted(event);
    }

    public IngestionResponse ingestBatch(List<LogEventRequest> requests) {
        int accepted = 0;
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            try {
                ingest(requests.get(i));
                accepted++;
            } catch (DataQualityException e) {
                if (errors.size() < MAX_REPORTED_ERRORS) {
                    errors.add("[" + i + "] " + e.getMessage());
                }
            }
        }

        int rejected = requests.size() - accepted;
        if (rejected > 0) {
            log.debug("Batch ingestion: {} accepted, {} rejected", accepted, rejected);
        }
        return IngestionResponse.builder()
                .accepted(accepted)
                .rejected(rejected)
                .errors(errors)
                .build();
    }

    private LogEvent toEvent(LogEventRequest request) {
        if (request == null) {
            logMetricsService.recordRejected();
            throw new DataQualityException(null, "request body is required");
        }

        Severity severity = Severity.parse(request.getSeverity());
        if (severity == null) {
            logMetricsService.recordRejected();
            throw new DataQualityException(request.getService(), "unknown severity: " + request.getSeverity());
        }

        return LogEvent.builder()
                .service(request.getService() != null ? request.getService().trim() : null)
                .severity(severity)
                .message(request.getMessage())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : clock.instant())
                .metadata(request.getMetadata())
                .build();
    }
}
