package likelion._th.roadwatch.controller;

import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.exception.ApiExceptionHandler;
import likelion._th.roadwatch.exception.StoreAccessException;
import likelion._th.roadwatch.service.ClusterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ClusterControllerTest {

    private ClusterService clusterService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clusterService = mock(ClusterService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ClusterController(clusterService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldUpdateStatus() throws Exception {
        when(clusterService.updateStatus("12.9716_77.5946", "In Progress")).thenReturn(ClusterStatus.IN_PROGRESS);

        mockMvc.perform(post("/api/v1/clusters/12.9716_77.5946/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"In Progress\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cluster_id").value("12.9716_77.5946"))
                .andExpect(jsonPath("$.status").value("In Progress"));
    }

    @Test
    void shouldRejectInvalidStatus() throws Exception {
        when(clusterService.updateStatus("12.9716_77.5946", "Closed"))
                .thenThrow(new IllegalArgumentException("Invalid status: Closed (allowed: Open, In Progress, Fixed)"));

        mockMvc.perform(post("/api/v1/clusters/12.9716_77.5946/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"Closed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid status: Closed (allowed: Open, In Progress, Fixed)"));
    }

    @Test
    void shouldMapStoreFailureToServiceUnavailable() throws Exception {
        when(clusterService.dashboard()).thenThrow(new StoreAccessException("신고 전체 조회 timed out", null));

        mockMvc.perform(get("/api/v1/clusters"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Store unavailable"));
    }
}
