package likelion._th.roadwatch.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 신고 등록
 * - detections: 이미지 분석 결과 탐지 개수 (심각도 자동 산출)
 * - severity: 관리자 수동 등록 (Low / Medium / High)
 * 둘 중 하나는 있어야 한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportCreateRequest {

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @Min(0)
    private Integer detections;

    private String severity;

    // 역지오코딩 결과 대신 쓸 도로 이름
    private String road;

    private String notes;

    private String source;
}
