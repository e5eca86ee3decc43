package likelion._th.roadwatch.service;

import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.BadSegment;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.dto.response.SegmentStatistics;
import likelion._th.roadwatch.dto.response.SegmentsResponse;
import likelion._th.roadwatch.repository.BadSegmentRepository;
import likelion._th.roadwatch.repository.ReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class BadSegmentService {

    private final ReportRepository reportRepository;
    private final BadSegmentRepository badSegmentRepository;
    private final SeriesDetector seriesDetector;
    private final RoadwatchProperties properties;

    // 탐지 + 저장 + 통계
    public SegmentsResponse detectAndStore() {
        List<Report> reports = reportRepository.findAll();
        List<BadSegment> segments = detect(reports);
        badSegmentRepository.replaceAll(segments);
        return new SegmentsResponse(segments, statistics(reports, segments));
    }

    // 탐지 + 저장, 저장한 구간 수만
    public int refresh() {
        List<BadSegment> segments = detect(reportRepository.findAll());
        return badSegmentRepository.replaceAll(segments);
    }

    /**
     * 경로 계획용 구간
     * 저장된 구간이 없으면 그 자리에서 탐지해서 저장한다.
     */
    public List<BadSegment> currentSegments() {
        List<BadSegment> stored = badSegmentRepository.findAll();
        if (!stored.isEmpty()) {
            return stored;
        }

        log.info("저장된 구간 없음 → 신고에서 재탐지");
        List<BadSegment> detected = detect(reportRepository.findAll());
        badSegmentRepository.replaceAll(detected);
        return detected;
    }

    private List<BadSegment> detect(List<Report> reports) {
        RoadwatchProperties.Series series = properties.getSeries();
        return seriesDetector.detectSeries(reports, series.getDistanceThresholdMeters(), series.getMinPotholes());
    }

    // ==================== 통계 ====================

    public SegmentStatistics statistics(List<Report> reports, List<BadSegment> segments) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put(Severity.HIGH.getLabel(), 0);
        breakdown.put(Severity.MEDIUM.getLabel(), 0);
        breakdown.put(Severity.LOW.getLabel(), 0);
        breakdown.put(Severity.NONE.getLabel(), 0);

        for (Report report : reports) {
            Severity severity = report.getSeverity() != null ? report.getSeverity() : Severity.NONE;
            breakdown.merge(severity.getLabel(), 1, Integer::sum);
        }

        int total = reports.size();
        int none = breakdown.get(Severity.NONE.getLabel());
        int potholes = total - none;
        int inSeries = segments.stream().mapToInt(BadSegment::getPotholeCount).sum();
        int roads = segments.stream()
                .map(BadSegment::getRoadName)
                .collect(Collectors.toSet())
                .size();

        return SegmentStatistics.builder()
                .totalReports(total)
                .potholeDetections(potholes)
                .noPotholeDetections(none)
                .severityBreakdown(breakdown)
                .badRoadSegments(segments.size())
                .roadsWithSeries(roads)
                .potholesInSeries(inSeries)
                .isolatedPotholes(potholes - inSeries)
                .build();
    }
}
