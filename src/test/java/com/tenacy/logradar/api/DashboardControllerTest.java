package com.tenacy.logradar.api;

import com.tenacy.logradar.api.dto.AlertResponse;
import com.tenacy.logradar.api.dto.DashboardSnapshotResponse;
import com.tenacy.logradar.api.dto.ServiceStatusResponse;
import com.tenacy.logradar.service.DashboardService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DashboardController.class)
class DashboardControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DashboardService dashboardService;

    @Test
    @DisplayName("스냅샷 조회")
    void getSnapshot_ShouldReturnSystemHealth() throws Exception {
        // given
        when(dashboardService.getSnapshot()).thenReturn(DashboardSnapshotResponse.builder()
                .timestamp(NOW)
                .systemHealthScore(72.5)
                .status("DEGRADED")
                .services(List.of())
                .staleServices(List.of("legacy"))
                .activeAlerts(List.of())
                .abandonedServices(List.of())
                .failedServices(List.of())
                .build());

        // when & then
        mockMvc.perform(get("/api/v1/dashboard/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.systemHealthScore", is(72.5)))
                .andExpect(jsonPath("$.status", is("DEGRADED")))
                .andExpect(jsonPath("$.staleServices[0]", is("legacy")));
    }

    @Test
    @DisplayName("서비스 상태 조회")
    void getServiceStatus_ShouldReturnService() throws Exception {
        when(dashboardService.getServiceStatus("auth")).thenReturn(Optional.of(ServiceStatusResponse.builder()
                .service("auth")
                .healthScore(60.0)
                .errorRatio(0.4)
                .totalCount(100)
                .activeAlerts(List.of())
                .build()));

        mockMvc.perform(get("/api/v1/dashboard/services/auth"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service", is("auth")))
                .andExpect(jsonPath("$.healthScore", is(60.0)))
                .andExpect(jsonPath("$.totalCount", is(100)));
    }

    @Test
    @DisplayName("알 수 없는 서비스는 404")
    void getServiceStatus_UnknownService_ShouldReturnNotFound() throws Exception {
        when(dashboardService.getServiceStatus("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/dashboard/services/ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("최근 알림 조회 - limit은 500으로 제한")
    void getRecentAlerts_ShouldClampLimit() throws Exception {
        when(dashboardService.getRecentAlerts(500)).thenReturn(List.of(AlertResponse.builder()
                .id("a-1")
                .kind("SEVERITY_SHIFT")
                .service("auth")
                .severity("ERROR")
                .occurrenceCount(1)
                .build()));

        mockMvc.perform(get("/api/v1/dashboard/alerts").param("limit", "10000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].kind", is("SEVERITY_SHIFT")));

        verify(dashboardService).getRecentAlerts(500);
    }
}
