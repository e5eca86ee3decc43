package likelion._th.roadwatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
// 같은 도로에서 연속으로 발견된 포트홀 구간
public class BadSegment {

    @JsonProperty("segment_id")
    private String segmentId;

    @JsonProperty("road_name")
    private String roadName;

    @JsonProperty("start_lat")
    private double startLat;

    @JsonProperty("start_lon")
    private double startLon;

    @JsonProperty("end_lat")
    private double endLat;

    @JsonProperty("end_lon")
    private double endLon;

    @JsonProperty("center_lat")
    private double centerLat;

    @JsonProperty("center_lon")
    private double centerLon;

    @JsonProperty("pothole_count")
    private int potholeCount;

    @JsonProperty("max_severity")
    private Severity maxSeverity;

    private String area;

    @JsonProperty("pothole_ids")
    private List<String> potholeIds;

    @JsonProperty("created_at")
    private String createdAt;

    public LatLng center() {
        return new LatLng(centerLat, centerLon);
    }
}
