package likelion._th.roadwatch.service;

import likelion._th.roadwatch.domain.Cluster;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.util.CoordinateKeys;
import likelion._th.roadwatch.util.GeoDistance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 신고를 기준점(anchor) 반경 안으로 묶는다.
 * - 입력 순서대로 한 번만 훑는 greedy 방식
 * - 멤버 판정은 기준점과의 거리만 본다 (멤버끼리 이어지지 않음)
 * - 같은 입력이라도 순서가 바뀌면 결과가 달라질 수 있다
 */
@Component
@Slf4j
public class ClusterEngine {

    public static final double DEFAULT_RADIUS_METERS = 100;

    public List<Cluster> computeClusters(List<Report> reports) {
        return computeClusters(reports, DEFAULT_RADIUS_METERS);
    }

    public List<Cluster> computeClusters(List<Report> reports, double radiusMeters) {
        List<Cluster> clusters = new ArrayList<>();
        if (reports == null || reports.isEmpty()) {
            return clusters;
        }

        // 호출마다 새로 만드는 방문 표시
        boolean[] assigned = new boolean[reports.size()];

        for (int i = 0; i < reports.size(); i++) {
            Report anchor = reports.get(i);
            if (assigned[i] || !anchor.isLocatedPothole()) {
                continue;
            }
            assigned[i] = true;

            double anchorLat = anchor.getLatitude();
            double anchorLon = anchor.getLongitude();

            List<Report> members = new ArrayList<>();
            members.add(anchor);
            Severity maxSeverity = anchor.getSeverity();

            for (int j = i + 1; j < reports.size(); j++) {
                Report other = reports.get(j);
                if (assigned[j] || !other.isLocatedPothole()) {
                    continue;
                }

                double distance = GeoDistance.haversineMeters(
                        anchorLat, anchorLon, other.getLatitude(), other.getLongitude());

                if (distance <= radiusMeters) {
                    members.add(other);
                    assigned[j] = true;
                    maxSeverity = Severity.max(maxSeverity, other.getSeverity());
                }
            }

            clusters.add(Cluster.builder()
                    .id(CoordinateKeys.key(anchorLat, anchorLon))
                    .centerLat(anchorLat)
                    .centerLon(anchorLon)
                    .reports(members)
                    .maxSeverity(maxSeverity)
                    .build());
        }

        log.debug("클러스터 계산 완료: 신고 {} 건 → 클러스터 {} 개 (반경 {}m)",
                reports.size(), clusters.size(), radiusMeters);
        return clusters;
    }

    // ==================== 대시보드 표시용 ====================

    /**
     * 클러스터 이름: "가장 많은 지역 – 가장 많은 도로"
     * 동률이면 먼저 나온 값, 둘 다 알 수 없으면 "Cluster #<위도>"
     */
    public String friendlyName(Cluster cluster) {
        String area = mostFrequent(cluster.getReports().stream()
                .map(Report::getArea)
                .filter(a -> isKnown(a, Report.UNKNOWN_AREA))
                .collect(Collectors.toList()));
        String road = mostFrequent(cluster.getReports().stream()
                .map(Report::getRoad)
                .filter(r -> isKnown(r, Report.UNKNOWN_ROAD))
                .collect(Collectors.toList()));

        if (area == null && road == null) {
            return "Cluster #" + cluster.getId().split("_")[0];
        }
        return String.format("%s – %s",
                area != null ? area : Report.UNKNOWN_AREA,
                road != null ? road : Report.UNKNOWN_ROAD);
    }

    /**
     * [[minLat, minLon], [maxLat, maxLon]]
     * 좌표 있는 멤버가 없으면 기준점 한 점짜리 박스
     */
    public double[][] bounds(Cluster cluster) {
        double minLat = Double.POSITIVE_INFINITY, minLon = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY, maxLon = Double.NEGATIVE_INFINITY;
        boolean any = false;

        for (Report report : cluster.getReports()) {
            if (!report.hasValidLocation()) {
                continue;
            }
            any = true;
            minLat = Math.min(minLat, report.getLatitude());
            maxLat = Math.max(maxLat, report.getLatitude());
            minLon = Math.min(minLon, report.getLongitude());
            maxLon = Math.max(maxLon, report.getLongitude());
        }

        if (!any) {
            return new double[][]{
                    {cluster.getCenterLat(), cluster.getCenterLon()},
                    {cluster.getCenterLat(), cluster.getCenterLon()}
            };
        }
        return new double[][]{{minLat, minLon}, {maxLat, maxLon}};
    }

    private boolean isKnown(String value, String unknownSentinel) {
        return value != null && !value.isBlank() && !value.equals(unknownSentinel);
    }

    private String mostFrequent(List<String> values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
        }

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            // 엄격하게 클 때만 교체 → 동률은 먼저 나온 값 유지
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
