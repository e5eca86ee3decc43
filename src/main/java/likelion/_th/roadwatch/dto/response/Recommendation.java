package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.roadwatch.domain.Severity;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {

    private String message;

    // 추천 등급 (safe / recommended / consider / caution)
    private RecommendationTier severity;

    @JsonProperty("affected_roads")
    private List<String> affectedRoads;

    @JsonProperty("total_potholes")
    private Integer totalPotholes;

    @JsonProperty("worst_severity")
    private Severity worstSeverity;

    // 대체 경로가 없으면 null
    @JsonProperty("detour_distance_km")
    private Double detourDistanceKm;

    @JsonProperty("detour_time_min")
    private Double detourTimeMin;
}
