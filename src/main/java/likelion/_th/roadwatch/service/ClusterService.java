package likelion._th.roadwatch.service;

import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.Cluster;
import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.dto.response.ClusterView;
import likelion._th.roadwatch.dto.response.DashboardResponse;
import likelion._th.roadwatch.dto.response.SeveritySummary;
import likelion._th.roadwatch.repository.ClusterStatusRepository;
import likelion._th.roadwatch.repository.ReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ClusterService {

    // 최신 신고가 먼저 기준점이 되도록
    private static final Comparator<Report> NEWEST_FIRST = Comparator.comparing(
            Report::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ReportRepository reportRepository;
    private final ClusterStatusRepository clusterStatusRepository;
    private final ClusterEngine clusterEngine;
    private final RoadwatchProperties properties;
    private final Clock clock;

    public DashboardResponse dashboard() {
        long startTime = System.currentTimeMillis();

        // 1. 신고 로드 (최신순)
        List<Report> reports = new ArrayList<>(reportRepository.findAll());
        reports.sort(NEWEST_FIRST);

        // 2. 클러스터 계산
        List<Cluster> clusters = clusterEngine.computeClusters(
                reports, properties.getClustering().getRadiusMeters());

        // 3. 상태 조회
        Map<String, ClusterStatus> statuses = clusterStatusRepository.findStatuses(
                clusters.stream().map(Cluster::getId).collect(Collectors.toList()));

        // 4. 이름, 범위
        List<ClusterView> views = clusters.stream()
                .map(cluster -> ClusterView.builder()
                        .id(cluster.getId())
                        .centerLat(cluster.getCenterLat())
                        .centerLon(cluster.getCenterLon())
                        .friendlyName(clusterEngine.friendlyName(cluster))
                        .status(statuses.getOrDefault(cluster.getId(), ClusterStatus.OPEN))
                        .maxSeverity(cluster.getMaxSeverity())
                        .count(cluster.getReports().size())
                        .bounds(clusterEngine.bounds(cluster))
                        .reportIds(cluster.getReports().stream()
                                .map(Report::getId)
                                .collect(Collectors.toList()))
                        .build())
                .collect(Collectors.toList());

        log.info("대시보드: 신고 {} 건, 클러스터 {} 개 ({}ms)",
                reports.size(), views.size(), System.currentTimeMillis() - startTime);
        return new DashboardResponse(summarize(reports), views);
    }

    /**
     * @throws IllegalArgumentException Open / In Progress / Fixed 이외의 상태
     */
    public ClusterStatus updateStatus(String clusterId, String statusLabel) {
        if (clusterId == null || clusterId.isBlank()) {
            throw new IllegalArgumentException("Cluster id is required");
        }
        ClusterStatus status = ClusterStatus.fromLabel(statusLabel);
        clusterStatusRepository.saveStatus(clusterId, status, LocalDateTime.now(clock).toString());
        return status;
    }

    private SeveritySummary summarize(List<Report> reports) {
        int high = 0, medium = 0, low = 0, none = 0;
        for (Report report : reports) {
            Severity severity = report.getSeverity() != null ? report.getSeverity() : Severity.NONE;
            switch (severity) {
                case HIGH:
                    high++;
                    break;
                case MEDIUM:
                    medium++;
                    break;
                case LOW:
                    low++;
                    break;
                default:
                    none++;
            }
        }
        return SeveritySummary.builder()
                .total(reports.size())
                .high(high)
                .medium(medium)
                .low(low)
                .none(none)
                .build();
    }
}
