package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.domain.Severity;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ClusterView {

    private String id;

    @JsonProperty("center_lat")
    private double centerLat;

    @JsonProperty("center_lon")
    private double centerLon;

    @JsonProperty("friendly_name")
    private String friendlyName;

    private ClusterStatus status;

    @JsonProperty("max_severity")
    private Severity maxSeverity;

    private int count;

    // [[minLat, minLon], [maxLat, maxLon]]
    private double[][] bounds;

    @JsonProperty("report_ids")
    private List<String> reportIds;
}
