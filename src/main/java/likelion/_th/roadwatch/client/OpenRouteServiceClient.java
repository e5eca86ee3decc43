package likelion._th.roadwatch.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
// OpenRouteService (유료 키 필요, avoid_polygons 지원)
public class OpenRouteServiceClient {

    // 위도 1도 ≒ 111,320m
    private static final double METERS_PER_DEGREE = 111_320;

    private final WebClient webClient;
    private final String apiKey;
    private final double avoidRadiusMeters;
    private final Duration timeout;

    public OpenRouteServiceClient(
            @Qualifier("orsWebClient") WebClient webClient,
            @Value("${external-api.ors.api-key:}") String apiKey,
            RoadwatchProperties properties
    ) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.avoidRadiusMeters = properties.getRouting().getAvoidRadiusMeters();
        this.timeout = properties.getTimeouts().getRouting();
    }

    // 키가 없으면 회피 경로 요청 자체를 하지 않는다
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Optional<Route> fetchRoute(LatLng start, LatLng end, List<LatLng> avoidPoints) {
        if (!isEnabled()) {
            return Optional.empty();
        }

        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = webClient.post()
                    .uri("/v2/directions/driving-car/geojson")
                    .bodyValue(buildRequestBody(start, end, avoidPoints))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);

            Optional<Route> route = parseRoute(response);
            log.debug("[ORS] 응답 수신: found={}, 회피 지점 {} 개 ({}ms)",
                    route.isPresent(), avoidPoints == null ? 0 : avoidPoints.size(),
                    System.currentTimeMillis() - startTime);
            return route;

        } catch (Exception e) {
            log.warn("[ORS] 경로 조회 실패 ({}ms): {}",
                    System.currentTimeMillis() - startTime, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 요청 바디
     * - coordinates: [[lon, lat], [lon, lat]]
     * - options.avoid_polygons: 회피 지점마다 반폭 avoidRadiusMeters 사각형 (MultiPolygon)
     */
    Map<String, Object> buildRequestBody(LatLng start, LatLng end, List<LatLng> avoidPoints) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("coordinates", List.of(start.toLonLat(), end.toLonLat()));

        if (avoidPoints != null && !avoidPoints.isEmpty()) {
            List<List<List<List<Double>>>> polygons = new ArrayList<>();
            for (LatLng point : avoidPoints) {
                polygons.add(List.of(avoidSquare(point)));
            }
            body.put("options", Map.of("avoid_polygons", Map.of(
                    "type", "MultiPolygon",
                    "coordinates", polygons
            )));
        }
        return body;
    }

    // 닫힌 링 (첫 점 = 마지막 점)
    private List<List<Double>> avoidSquare(LatLng point) {
        double dLat = avoidRadiusMeters / METERS_PER_DEGREE;
        double dLon = avoidRadiusMeters / (METERS_PER_DEGREE * Math.cos(Math.toRadians(point.getLat())));
        double lat = point.getLat();
        double lon = point.getLng();

        return List.of(
                List.of(lon - dLon, lat - dLat),
                List.of(lon + dLon, lat - dLat),
                List.of(lon + dLon, lat + dLat),
                List.of(lon - dLon, lat + dLat),
                List.of(lon - dLon, lat - dLat)
        );
    }

    // GeoJSON FeatureCollection 파싱
    private Optional<Route> parseRoute(JsonNode response) {
        if (response == null) {
            return Optional.empty();
        }

        JsonNode features = response.path("features");
        if (!features.isArray() || features.isEmpty()) {
            log.warn("[ORS] features 없음: {}", response.path("error"));
            return Optional.empty();
        }

        JsonNode feature = features.get(0);
        JsonNode summary = feature.path("properties").path("summary");

        List<LatLng> geometry = new ArrayList<>();
        for (JsonNode coord : feature.path("geometry").path("coordinates")) {
            if (coord.isArray() && coord.size() >= 2) {
                geometry.add(new LatLng(coord.get(1).asDouble(), coord.get(0).asDouble()));
            }
        }

        if (geometry.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(Route.builder()
                .distanceMeters(summary.path("distance").asDouble(0))
                .durationSeconds(summary.path("duration").asDouble(0))
                .geometry(geometry)
                .build());
    }
}
