package likelion._th.roadwatch.service;

import likelion._th.roadwatch.domain.BadSegment;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.util.CoordinateKeys;
import likelion._th.roadwatch.util.GeoDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 같은 도로 이름의 신고를 (위도, 경도) 순으로 정렬한 뒤
 * 직전 신고와 threshold 이내로 이어지는 구간을 찾는다.
 *
 * 정렬 기준은 실제 도로 진행 방향이 아니라 위도 근사치다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SeriesDetector {

    public static final double DEFAULT_DISTANCE_THRESHOLD_METERS = 200;
    public static final int DEFAULT_MIN_POTHOLES = 3;

    private static final Comparator<Report> ALONG_ROAD_ORDER = Comparator
            .comparingDouble(Report::getLatitude)
            .thenComparingDouble(Report::getLongitude);

    private final Clock clock;

    public List<BadSegment> detectSeries(List<Report> reports) {
        return detectSeries(reports, DEFAULT_DISTANCE_THRESHOLD_METERS, DEFAULT_MIN_POTHOLES);
    }

    public List<BadSegment> detectSeries(List<Report> reports, double distanceThreshold, int minPotholes) {
        List<BadSegment> segments = new ArrayList<>();
        if (reports == null || reports.isEmpty()) {
            return segments;
        }

        // 도로별 그룹 (처음 나온 순서 유지, Unknown Road 도 하나의 그룹)
        Map<String, List<Report>> roadGroups = reports.stream()
                .filter(Report::isLocatedPothole)
                .collect(Collectors.groupingBy(
                        Report::getRoadOrUnknown,
                        LinkedHashMap::new,
                        Collectors.toList()));

        String createdAt = LocalDateTime.now(clock).toString();

        for (Map.Entry<String, List<Report>> entry : roadGroups.entrySet()) {
            String roadName = entry.getKey();
            List<Report> roadReports = new ArrayList<>(entry.getValue());

            if (roadReports.size() < minPotholes) {
                continue;
            }

            roadReports.sort(ALONG_ROAD_ORDER);

            List<Report> currentRun = new ArrayList<>();
            currentRun.add(roadReports.get(0));

            for (int i = 1; i < roadReports.size(); i++) {
                Report previous = currentRun.get(currentRun.size() - 1);
                Report current = roadReports.get(i);

                double distance = GeoDistance.haversineMeters(
                        previous.getLatitude(), previous.getLongitude(),
                        current.getLatitude(), current.getLongitude());

                if (distance <= distanceThreshold) {
                    currentRun.add(current);
                } else {
                    if (currentRun.size() >= minPotholes) {
                        segments.add(createSegment(currentRun, roadName, createdAt));
                    }
                    currentRun = new ArrayList<>();
                    currentRun.add(current);
                }
            }

            // 마지막 run
            if (currentRun.size() >= minPotholes) {
                segments.add(createSegment(currentRun, roadName, createdAt));
            }
        }

        log.info("연속 포트홀 구간 탐지: 도로 {} 개 → 구간 {} 개 (threshold={}m, min={})",
                roadGroups.size(), segments.size(), distanceThreshold, minPotholes);
        return segments;
    }

    private BadSegment createSegment(List<Report> run, String roadName, String createdAt) {
        Report first = run.get(0);
        Report last = run.get(run.size() - 1);

        double sumLat = 0;
        double sumLon = 0;
        Severity maxSeverity = Severity.LOW;
        for (Report report : run) {
            sumLat += report.getLatitude();
            sumLon += report.getLongitude();
            maxSeverity = Severity.max(maxSeverity, report.getSeverity());
        }
        double centerLat = sumLat / run.size();
        double centerLon = sumLon / run.size();

        String segmentId = roadName.replace(' ', '_') + "_" + CoordinateKeys.key(centerLat, centerLon);

        return BadSegment.builder()
                .segmentId(segmentId)
                .roadName(roadName)
                .startLat(first.getLatitude())
                .startLon(first.getLongitude())
                .endLat(last.getLatitude())
                .endLon(last.getLongitude())
                .centerLat(centerLat)
                .centerLon(centerLon)
                .potholeCount(run.size())
                .maxSeverity(maxSeverity)
                .area(first.getAreaOrUnknown())
                .potholeIds(run.stream()
                        .map(r -> r.getId() != null ? r.getId() : "")
                        .collect(Collectors.toList()))
                .createdAt(createdAt)
                .build();
    }
}
