package likelion._th.roadwatch.service;

import likelion._th.roadwatch.client.Geocoder;
import likelion._th.roadwatch.client.RouteProvider;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.BadSegment;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.dto.request.LocationInput;
import likelion._th.roadwatch.dto.response.Recommendation;
import likelion._th.roadwatch.dto.response.RecommendationTier;
import likelion._th.roadwatch.dto.response.RoutePlanResponse;
import likelion._th.roadwatch.dto.response.RouteSummary;
import likelion._th.roadwatch.exception.LocationResolutionException;
import likelion._th.roadwatch.util.GeoDistance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 기본 경로가 연속 포트홀 구간을 지나가는지 확인하고,
 * 지나간다면 구간 중심을 피하는 대체 경로를 받아 비교한다.
 */
@Service
@Slf4j
public class RouteAvoidancePlanner {

    public static final double DEFAULT_INTERSECTION_THRESHOLD_METERS = 50;

    static final String ROUTE_ERROR = "Could not calculate route";
    static final String CLEAR_MESSAGE = "Route is clear! No pothole series detected along this route.";

    // 추천 등급 경계 (km)
    private static final double RECOMMENDED_MAX_DETOUR_KM = 2;
    private static final double CONSIDER_MAX_DETOUR_KM = 5;

    private final RouteProvider routeProvider;
    private final Geocoder geocoder;
    private final double intersectionThresholdMeters;

    public RouteAvoidancePlanner(RouteProvider routeProvider, Geocoder geocoder, RoadwatchProperties properties) {
        this.routeProvider = routeProvider;
        this.geocoder = geocoder;
        this.intersectionThresholdMeters = properties.getRouting().getIntersectionThresholdMeters();
    }

    // ==================== 입력 해석 ====================

    /**
     * 좌표는 그대로, 주소는 지오코딩
     *
     * @param role "start" 또는 "end"
     * @throws LocationResolutionException 주소를 찾지 못한 경우
     */
    public LatLng resolveEndpoint(LocationInput input, String role) {
        if (input.isCoordinates()) {
            return input.getCoordinates();
        }

        Optional<LatLng> resolved;
        try {
            resolved = geocoder.geocode(input.getAddress());
        } catch (RuntimeException e) {
            log.warn("[Geocode] {} 주소 변환 중 오류: {} - {}", role, input.getAddress(), e.getMessage());
            resolved = Optional.empty();
        }

        return resolved.orElseThrow(() -> new LocationResolutionException(role, input.getAddress()));
    }

    // ==================== 경로 조회 ====================

    // 제공자 실패는 모두 Optional.empty() 로 변환
    public Optional<Route> fetchRoute(LatLng start, LatLng end, List<LatLng> avoidPoints) {
        try {
            Optional<Route> route = routeProvider.fetchRoute(start, end, avoidPoints);
            return route != null ? route : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Route] 경로 제공자 오류: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== 교차 판정 ====================

    public List<BadSegment> checkIntersection(List<LatLng> polyline, List<BadSegment> segments) {
        return checkIntersection(polyline, segments, intersectionThresholdMeters);
    }

    /**
     * 구간 중심에서 threshold 이내에 경로 꼭짓점이 하나라도 있으면 교차
     * (꼭짓점 사이 선분까지의 거리는 보지 않는다)
     */
    public List<BadSegment> checkIntersection(List<LatLng> polyline, List<BadSegment> segments, double thresholdMeters) {
        List<BadSegment> intersected = new ArrayList<>();
        if (polyline == null || polyline.isEmpty() || segments == null) {
            return intersected;
        }

        for (BadSegment segment : segments) {
            LatLng center = segment.center();
            for (LatLng vertex : polyline) {
                if (GeoDistance.haversineMeters(center, vertex) <= thresholdMeters) {
                    intersected.add(segment);
                    break;
                }
            }
        }
        return intersected;
    }

    // ==================== 경로 계획 ====================

    public RoutePlanResponse planRoute(LocationInput startInput, LocationInput endInput, List<BadSegment> segments) {
        return planRoute(startInput, endInput, () -> segments);
    }

    /**
     * 출발/도착 해석 후 회피 계획. 예외를 던지지 않는다.
     * 구간 목록은 두 지점이 모두 해석된 뒤에 가져온다.
     */
    public RoutePlanResponse planRoute(LocationInput startInput, LocationInput endInput,
                                       Supplier<List<BadSegment>> segmentSource) {
        LatLng start;
        LatLng end;
        try {
            start = resolveEndpoint(startInput, "start");
            end = resolveEndpoint(endInput, "end");
        } catch (LocationResolutionException e) {
            log.info("[Route] 위치 해석 실패: {}", e.getMessage());
            return RoutePlanResponse.builder()
                    .error(e.getMessage())
                    .failedEndpoint(e.getEndpoint())
                    .build();
        }

        // 구간 조회 실패는 계획을 중단하지 않는다 (교차 없음으로 진행)
        List<BadSegment> segments;
        try {
            segments = segmentSource.get();
        } catch (RuntimeException e) {
            log.error("[Route] 구간 조회 실패, 구간 없이 진행: {}", e.getMessage());
            segments = Collections.emptyList();
        }

        return planWithAvoidance(start, end, segments);
    }

    public RoutePlanResponse planWithAvoidance(LatLng start, LatLng end, List<BadSegment> segments) {
        long startTime = System.currentTimeMillis();

        // 1. 기본 경로
        Optional<Route> primary = fetchRoute(start, end, Collections.emptyList());
        if (primary.isEmpty()) {
            log.warn("[Route] 기본 경로 없음: {} → {}", start, end);
            return RoutePlanResponse.builder()
                    .error(ROUTE_ERROR)
                    .badSegmentsDetected(Collections.emptyList())
                    .build();
        }
        Route originalRoute = primary.get();

        // 2. 교차 구간
        List<BadSegment> intersected = checkIntersection(originalRoute.getGeometry(), segments);

        RoutePlanResponse.RoutePlanResponseBuilder result = RoutePlanResponse.builder()
                .startCoords(start.toLatLon())
                .endCoords(end.toLatLon())
                .originalRoute(RouteSummary.from(originalRoute))
                .badSegmentsDetected(intersected);

        if (intersected.isEmpty()) {
            log.info("[Route] 교차 구간 없음 ({}ms)", System.currentTimeMillis() - startTime);
            return result
                    .recommendation(Recommendation.builder()
                            .message(CLEAR_MESSAGE)
                            .severity(RecommendationTier.SAFE)
                            .build())
                    .build();
        }

        // 3. 구간 중심을 피하는 대체 경로
        List<LatLng> avoidPoints = intersected.stream()
                .map(BadSegment::center)
                .collect(Collectors.toList());
        Optional<Route> alternative = fetchRoute(start, end, avoidPoints);

        if (alternative.isEmpty()) {
            log.info("[Route] 교차 {} 개, 대체 경로 없음 ({}ms)",
                    intersected.size(), System.currentTimeMillis() - startTime);
            return result
                    .recommendation(buildRecommendation(intersected, null, null, false))
                    .build();
        }

        Route alternativeRoute = alternative.get();
        List<BadSegment> stillIntersected = checkIntersection(alternativeRoute.getGeometry(), intersected);

        // 4. 차이 = 대체 - 기본
        double distanceDiffKm = (alternativeRoute.getDistanceMeters() - originalRoute.getDistanceMeters()) / 1000;
        double timeDiffMin = (alternativeRoute.getDurationSeconds() - originalRoute.getDurationSeconds()) / 60;
        boolean avoidedAny = stillIntersected.size() < intersected.size();

        log.info("[Route] 교차 {} 개, 대체 경로 +{}km (남은 교차 {} 개, {}ms)",
                intersected.size(), String.format(Locale.US, "%.2f", distanceDiffKm),
                stillIntersected.size(), System.currentTimeMillis() - startTime);

        return result
                .alternativeRoute(RouteSummary.from(alternativeRoute))
                .alternativeBadSegmentsDetected(stillIntersected.size())
                .recommendation(buildRecommendation(intersected, distanceDiffKm, timeDiffMin, avoidedAny))
                .build();
    }

    // ==================== 추천 문구 ====================

    /**
     * distanceDiffKm == null 이면 대체 경로 없음 → caution
     * 대체 경로가 교차 구간을 하나도 피하지 못했으면 (회피 미지원 제공자 등) → caution
     */
    Recommendation buildRecommendation(List<BadSegment> intersected, Double distanceDiffKm,
                                       Double timeDiffMin, boolean avoidedAny) {
        int totalPotholes = 0;
        Severity worst = Severity.LOW;
        Set<String> roads = new LinkedHashSet<>();
        for (BadSegment segment : intersected) {
            totalPotholes += segment.getPotholeCount();
            worst = Severity.max(worst, segment.getMaxSeverity());
            roads.add(segment.getRoadName());
        }
        List<String> affectedRoads = new ArrayList<>(roads);

        List<String> parts = new ArrayList<>();
        parts.add(String.format("Warning: %s a series of %d potholes (%s severity).",
                roadsText(affectedRoads), totalPotholes, worst.getLabel()));

        RecommendationTier tier;
        if (distanceDiffKm == null) {
            parts.add("No alternative route available. Proceed with caution on original route.");
            tier = RecommendationTier.CAUTION;
        } else if (!avoidedAny) {
            parts.add("Alternative route could not avoid all bad segments.");
            tier = RecommendationTier.CAUTION;
        } else {
            if (distanceDiffKm > 0) {
                parts.add(String.format(Locale.US,
                        "Alternative route adds %.1f km and ~%.0f minutes but avoids damaged sections.",
                        distanceDiffKm, timeDiffMin));
            } else {
                parts.add(String.format(Locale.US,
                        "Alternative route is %.1f km shorter and avoids damaged sections.",
                        -distanceDiffKm));
            }

            if (distanceDiffKm < RECOMMENDED_MAX_DETOUR_KM && worst == Severity.HIGH) {
                parts.add("Recommended: Take the alternative route for smoother travel.");
                tier = RecommendationTier.RECOMMENDED;
            } else if (distanceDiffKm < CONSIDER_MAX_DETOUR_KM) {
                parts.add("Consider the alternative route to avoid road damage.");
                tier = RecommendationTier.CONSIDER;
            } else {
                parts.add("Significant detour required. Proceed with caution on original route.");
                tier = RecommendationTier.CAUTION;
            }
        }

        return Recommendation.builder()
                .message(String.join(" ", parts))
                .severity(tier)
                .affectedRoads(affectedRoads)
                .totalPotholes(totalPotholes)
                .worstSeverity(worst)
                .detourDistanceKm(distanceDiffKm)
                .detourTimeMin(timeDiffMin)
                .build();
    }

    // 1~2 개는 이름, 3 개 이상은 개수
    private String roadsText(List<String> roads) {
        if (roads.size() == 1) {
            return roads.get(0) + " has";
        }
        if (roads.size() == 2) {
            return roads.get(0) + " and " + roads.get(1) + " have";
        }
        return roads.size() + " roads have";
    }
}
