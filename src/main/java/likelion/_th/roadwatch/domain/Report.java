package likelion._th.roadwatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.roadwatch.util.GeoValidator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
// 포트홀 신고 1건 (생성 후 변경하지 않음)
public class Report {
    public static final String UNKNOWN_ROAD = "Unknown Road";
    public static final String UNKNOWN_AREA = "Unknown Area";
    public static final String UNKNOWN_ADDRESS = "Address not found";

    private String id;              // 저장소가 발급한 문서 id
    private Double latitude;        // GPS 없으면 null
    private Double longitude;
    private Severity severity;
    private Integer detections;     // 이미지에서 탐지된 포트홀 개수
    private String road;
    private String area;

    @JsonProperty("full_address")
    private String fullAddress;

    private String source;          // web / whatsapp / admin_manual
    private String timestamp;       // ISO-8601
    private String notes;

    @JsonIgnore
    public boolean hasValidLocation() {
        return latitude != null && longitude != null
                && GeoValidator.isValidCoordinate(latitude, longitude);
    }

    // 공간 계산 대상 여부: 심각도 None 이 아니고 좌표가 유효
    @JsonIgnore
    public boolean isLocatedPothole() {
        return severity != null && severity.isPothole() && hasValidLocation();
    }

    @JsonIgnore
    public String getRoadOrUnknown() {
        return road == null || road.isBlank() ? UNKNOWN_ROAD : road;
    }

    @JsonIgnore
    public String getAreaOrUnknown() {
        return area == null || area.isBlank() ? UNKNOWN_AREA : area;
    }
}
