package likelion._th.roadwatch.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
// OSRM 공개 서버 (API 키 불필요, 회피 영역 미지원)
public class OsrmClient {

    private final WebClient webClient;
    private final Duration timeout;

    public OsrmClient(
            @Qualifier("osrmWebClient") WebClient webClient,
            RoadwatchProperties properties
    ) {
        this.webClient = webClient;
        this.timeout = properties.getTimeouts().getRouting();
    }

    /**
     * 자동차 경로 1개 조회
     * OSRM 좌표 순서는 lon,lat
     */
    public Optional<Route> fetchRoute(LatLng start, LatLng end) {
        String coordinates = start.getLng() + "," + start.getLat() + ";"
                + end.getLng() + "," + end.getLat();

        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/route/v1/driving/" + coordinates)
                            .queryParam("overview", "full")
                            .queryParam("geometries", "geojson")
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);

            Optional<Route> route = parseRoute(response);
            log.debug("[OSRM] 응답 수신: found={} ({}ms)",
                    route.isPresent(), System.currentTimeMillis() - startTime);
            return route;

        } catch (Exception e) {
            log.warn("[OSRM] 경로 조회 실패 ({}ms): {}",
                    System.currentTimeMillis() - startTime, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Route> parseRoute(JsonNode response) {
        if (response == null || !"Ok".equals(response.path("code").asText())) {
            log.warn("[OSRM] 비정상 응답 code={}", response == null ? null : response.path("code").asText());
            return Optional.empty();
        }

        JsonNode routes = response.path("routes");
        if (!routes.isArray() || routes.isEmpty()) {
            return Optional.empty();
        }

        JsonNode routeNode = routes.get(0);
        List<LatLng> geometry = new ArrayList<>();
        for (JsonNode coord : routeNode.path("geometry").path("coordinates")) {
            if (coord.isArray() && coord.size() >= 2) {
                double lng = coord.get(0).asDouble();
                double lat = coord.get(1).asDouble();
                geometry.add(new LatLng(lat, lng));
            }
        }

        if (geometry.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(Route.builder()
                .distanceMeters(routeNode.path("distance").asDouble())
                .durationSeconds(routeNode.path("duration").asDouble())
                .geometry(geometry)
                .build());
    }
}
