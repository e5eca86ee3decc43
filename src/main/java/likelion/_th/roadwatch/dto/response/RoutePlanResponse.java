package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.roadwatch.domain.BadSegment;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 경로 계획 결과
 * - 주소 변환 실패: error + failed_endpoint 만 채움
 * - 기본 경로 실패: error + 빈 bad_segments_detected
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutePlanResponse {

    private String error;

    @JsonProperty("failed_endpoint")
    private String failedEndpoint;

    @JsonProperty("start_coords")
    private List<Double> startCoords;

    @JsonProperty("end_coords")
    private List<Double> endCoords;

    @JsonProperty("original_route")
    private RouteSummary originalRoute;

    @JsonProperty("bad_segments_detected")
    private List<BadSegment> badSegmentsDetected;

    @JsonProperty("alternative_route")
    private RouteSummary alternativeRoute;

    // 대체 경로도 여전히 지나가는 구간 수
    @JsonProperty("alternative_bad_segments_detected")
    private Integer alternativeBadSegmentsDetected;

    private Recommendation recommendation;

    @JsonIgnore
    public boolean isUnresolved() {
        return failedEndpoint != null;
    }
}
