package likelion._th.roadwatch.service;

import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.dto.response.ClusterView;
import likelion._th.roadwatch.dto.response.DashboardResponse;
import likelion._th.roadwatch.repository.ClusterStatusRepository;
import likelion._th.roadwatch.repository.ReportRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static likelion._th.roadwatch.support.TestReports.pothole;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClusterServiceTest {

    @Mock
    private ReportRepository reportRepository;

    @Mock
    private ClusterStatusRepository clusterStatusRepository;

    private ClusterService clusterService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
        clusterService = new ClusterService(
                reportRepository, clusterStatusRepository, new ClusterEngine(), new RoadwatchProperties(), clock);
    }

    @Test
    void shouldBuildDashboardWithNewestReportAsAnchor() {
        // Given
        when(reportRepository.findAll()).thenReturn(List.of(
                pothole("old", 12.9716, 77.5946, "Main St", Severity.LOW).toBuilder()
                        .timestamp("2026-02-01T08:00:00").build(),
                pothole("new", 12.9717, 77.5946, "Main St", Severity.HIGH).toBuilder()
                        .timestamp("2026-02-20T08:00:00").build(),
                pothole("clean", 12.9800, 77.6000, "Ring Rd", Severity.NONE).toBuilder()
                        .timestamp("2026-02-10T08:00:00").build()));
        when(clusterStatusRepository.findStatuses(List.of("12.9717_77.5946")))
                .thenReturn(Map.of("12.9717_77.5946", ClusterStatus.IN_PROGRESS));

        // When
        DashboardResponse dashboard = clusterService.dashboard();

        // Then
        assertEquals(3, dashboard.getSummary().getTotal());
        assertEquals(1, dashboard.getSummary().getHigh());
        assertEquals(1, dashboard.getSummary().getLow());
        assertEquals(1, dashboard.getSummary().getNone());

        assertEquals(1, dashboard.getClusters().size());
        ClusterView cluster = dashboard.getClusters().get(0);
        assertEquals("12.9717_77.5946", cluster.getId());
        assertEquals(ClusterStatus.IN_PROGRESS, cluster.getStatus());
        assertEquals(Severity.HIGH, cluster.getMaxSeverity());
        assertEquals("Koramangala – Main St", cluster.getFriendlyName());
        assertEquals(List.of("new", "old"), cluster.getReportIds());
        assertEquals(2, cluster.getCount());
    }

    @Test
    void shouldSaveValidStatusWithTimestamp() {
        ClusterStatus status = clusterService.updateStatus("12.9716_77.5946", "Fixed");

        assertEquals(ClusterStatus.FIXED, status);
        verify(clusterStatusRepository).saveStatus("12.9716_77.5946", ClusterStatus.FIXED, "2026-03-01T10:15:30");
    }

    @Test
    void shouldRejectInvalidStatusWithoutSaving() {
        assertThrows(IllegalArgumentException.class,
                () -> clusterService.updateStatus("12.9716_77.5946", "Done"));
        verify(clusterStatusRepository, never()).saveStatus(anyString(), any(), anyString());
    }
}
