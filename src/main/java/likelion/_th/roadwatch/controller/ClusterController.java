package likelion._th.roadwatch.controller;

import jakarta.validation.Valid;
import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.dto.request.ClusterStatusRequest;
import likelion._th.roadwatch.dto.response.DashboardResponse;
import likelion._th.roadwatch.service.ClusterService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/clusters")
@RequiredArgsConstructor
public class ClusterController {

    private final ClusterService clusterService;

    @GetMapping
    public ResponseEntity<DashboardResponse> getDashboard() {
        return ResponseEntity.ok(clusterService.dashboard());
    }

    @PostMapping("/{clusterId}/status")
    public ResponseEntity<Map<String, Object>> updateStatus(
            @PathVariable String clusterId,
            @Valid @RequestBody ClusterStatusRequest request
    ) {
        ClusterStatus status = clusterService.updateStatus(clusterId, request.getStatus());
        return ResponseEntity.ok(Map.of("cluster_id", clusterId, "status", status));
    }
}
