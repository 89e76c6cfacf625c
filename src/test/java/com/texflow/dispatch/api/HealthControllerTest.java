package com.texflow.dispatch.api;

import com.texflow.core.health.HealthCheckService;
import com.texflow.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when every component is up")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("queue", HealthStatus.Status.UP, "Broker reachable", Map.of("waiting", "2")),
                new HealthStatus("worker", HealthStatus.Status.UP, "Embedded worker running", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.queue.status").value("UP"))
                .andExpect(jsonPath("$.components.queue.metadata.waiting").value("2"))
                .andExpect(jsonPath("$.components.worker.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void unhealthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("queue", HealthStatus.Status.UP, "Broker reachable", Map.of()),
                new HealthStatus("image", HealthStatus.Status.DOWN, "Image texflow-compiler:latest not found", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.image.detail").value("Image texflow-compiler:latest not found"));
    }
}
