package likelion._th.roadwatch.repository.firestore;

import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;

import java.util.HashMap;
import java.util.Map;

/**
 * pothole_reports 문서 ↔ Report
 * 읽을 때는 관대하게: 숫자/문자열 좌표 모두 허용, 모르는 심각도는 None
 */
public final class ReportDocumentMapper {

    static final String STATUS_DETECTED = "Pothole Detected";
    static final String STATUS_NOT_DETECTED = "No Pothole";

    private ReportDocumentMapper() {
    }

    public static Report fromDocument(String id, Map<String, Object> data) {
        return Report.builder()
                .id(id)
                .latitude(DocumentValues.toDouble(data.get("latitude")))
                .longitude(DocumentValues.toDouble(data.get("longitude")))
                .severity(Severity.fromLabel(DocumentValues.toText(data, "severity")))
                .detections(DocumentValues.toInteger(data.get("detections")))
                .road(DocumentValues.toText(data, "road"))
                .area(DocumentValues.toText(data, "area"))
                .fullAddress(DocumentValues.toText(data, "full_address"))
                .source(DocumentValues.toText(data, "source"))
                .timestamp(DocumentValues.toText(data, "timestamp"))
                .notes(DocumentValues.toText(data, "notes"))
                .build();
    }

    public static Map<String, Object> toDocument(Report report) {
        Severity severity = report.getSeverity() != null ? report.getSeverity() : Severity.NONE;

        Map<String, Object> data = new HashMap<>();
        data.put("detections", report.getDetections() != null ? report.getDetections() : 0);
        data.put("severity", severity.getLabel());
        data.put("status", severity.isPothole() ? STATUS_DETECTED : STATUS_NOT_DETECTED);
        data.put("latitude", report.getLatitude());
        data.put("longitude", report.getLongitude());
        data.put("road", report.getRoad());
        data.put("area", report.getArea());
        data.put("full_address", report.getFullAddress());
        data.put("source", report.getSource());
        data.put("timestamp", report.getTimestamp());
        if (report.getNotes() != null) {
            data.put("notes", report.getNotes());
        }
        return data;
    }
}
