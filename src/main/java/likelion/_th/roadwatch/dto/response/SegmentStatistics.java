package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class SegmentStatistics {

    @JsonProperty("total_reports")
    private int totalReports;

    @JsonProperty("pothole_detections")
    private int potholeDetections;

    @JsonProperty("no_pothole_detections")
    private int noPotholeDetections;

    // High / Medium / Low / None 순서
    @JsonProperty("severity_breakdown")
    private Map<String, Integer> severityBreakdown;

    @JsonProperty("bad_road_segments")
    private int badRoadSegments;

    @JsonProperty("roads_with_series")
    private int roadsWithSeries;

    @JsonProperty("potholes_in_series")
    private int potholesInSeries;

    @JsonProperty("isolated_potholes")
    private int isolatedPotholes;
}
