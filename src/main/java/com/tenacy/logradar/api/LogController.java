package com.tenacy.logradar.api;

import com.tenacy.logradar.api.dto.IngestionResponse;
import com.tenacy.logradar.api.dto.LogEventRequest;
import com.tenacy.logradar.exception.DataQualityException;
import com.tenacy.logradar.service.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/logs")
@RequiredArgsConstructor
public class LogController {

    private final IngestionService ingestionService;

    @PostMapping
    public ResponseEntity<IngestionResponse> ingestLog(@RequestBody LogEventRequest request) {
        try {
            ingestionService.ingest(request);
            return ResponseEntity.ok(IngestionResponse.builder()
                    .accepted(1)
                    .rejected(0)
                    .errors(List.of())
                    .build());
        } catch (DataQualityException e) {
            return ResponseEntity.badRequest().body(IngestionResponse.builder()
                    .accepted(0)
                    .rejected(1)
                    .errors(List.of(e.getMessage()))
                    .build());
        }
    }

    @PostMapping("/batch")
    public ResponseEntity<IngestionResponse> ingestLogs(@RequestBody List<LogEventRequest> requests) {
        return ResponseEntity.ok(ingestionService.ingestBatch(requests));
    }
}
