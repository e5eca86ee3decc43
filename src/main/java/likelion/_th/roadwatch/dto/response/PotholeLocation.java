package likelion._th.roadwatch.dto.response;

import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
// 지도 마커 1개
public class PotholeLocation {
    private String id;
    private double lat;
    private double lon;
    private Severity severity;
    private String road;
    private String area;
    private int detections;
    private String timestamp;

    public static PotholeLocation from(Report report) {
        return PotholeLocation.builder()
                .id(report.getId())
                .lat(report.getLatitude())
                .lon(report.getLongitude())
                .severity(report.getSeverity())
                .road(report.getRoadOrUnknown())
                .area(report.getAreaOrUnknown())
                .detections(report.getDetections() != null ? report.getDetections() : 0)
                .timestamp(report.getTimestamp() != null ? report.getTimestamp() : "")
                .build();
    }
}
