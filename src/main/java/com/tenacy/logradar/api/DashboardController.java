package com.tenacy.logradar.api;

import com.tenacy.logradar.api.dto.AlertResponse;
import com.tenacy.logradar.api.dto.DashboardSnapshotResponse;
import com.tenacy.logradar.api.dto.ServiceStatusResponse;
import com.tenacy.logradar.health.HealthPoint;
import com.tenacy.logradar.service.DashboardService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/snapshot")
    public ResponseEntity<DashboardSnapshotResponse> getSnapshot() {
        return ResponseEntity.ok(dashboardService.getSnapshot());
    }

    @GetMapping("/services/{service}")
    public ResponseEntity<ServiceStatusResponse> getServiceStatus(@PathVariable String service) {
        return dashboardService.getServiceStatus(service)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<AlertResponse>> getRecentAlerts(
            @RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, 500));
        return ResponseEntity.ok(dashboardService.getRecentAlerts(bounded));
    }

    @GetMapping("/health-history")
    public ResponseEntity<List<HealthPoint>> getHealthHistory() {
        return ResponseEntity.ok(dashboardService.getHealthHistory());
    }
}
