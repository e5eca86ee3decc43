package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@Builder
public class RouteSummary {

    @JsonProperty("distance_km")
    private double distanceKm;

    @JsonProperty("duration_minutes")
    private double durationMinutes;

    // 지도 표시용 [lon, lat] 목록
    private List<List<Double>> coordinates;

    public static RouteSummary from(Route route) {
        return RouteSummary.builder()
                .distanceKm(route.getDistanceMeters() / 1000)
                .durationMinutes(route.getDurationSeconds() / 60)
                .coordinates(route.getGeometry().stream()
                        .map(LatLng::toLonLat)
                        .collect(Collectors.toList()))
                .build();
    }
}
