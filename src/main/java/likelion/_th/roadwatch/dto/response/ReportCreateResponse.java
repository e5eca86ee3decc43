package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.roadwatch.domain.Report;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ReportCreateResponse {

    private Report report;

    // 재탐지 후 저장된 구간 수 (재탐지 실패 시 null)
    @JsonProperty("bad_segments")
    private Integer badSegments;
}
