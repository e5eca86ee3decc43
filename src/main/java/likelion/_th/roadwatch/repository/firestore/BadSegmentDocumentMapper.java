package likelion._th.roadwatch.repository.firestore;

import likelion._th.roadwatch.domain.BadSegment;
import likelion._th.roadwatch.domain.Severity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// bad_road_segments 문서 ↔ BadSegment (segment_id 는 본문에도 저장)
public final class BadSegmentDocumentMapper {

    private BadSegmentDocumentMapper() {
    }

    /**
     * 중심 좌표가 숫자가 아닌 문서는 empty
     */
    public static Optional<BadSegment> fromDocument(String id, Map<String, Object> data) {
        Double centerLat = DocumentValues.toDouble(data.get("center_lat"));
        Double centerLon = DocumentValues.toDouble(data.get("center_lon"));
        if (centerLat == null || centerLon == null) {
            return Optional.empty();
        }

        String segmentId = DocumentValues.toText(data, "segment_id");

        List<String> potholeIds = new ArrayList<>();
        Object ids = data.get("pothole_ids");
        if (ids instanceof List) {
            for (Object value : (List<?>) ids) {
                potholeIds.add(value != null ? value.toString() : "");
            }
        }

        return Optional.of(BadSegment.builder()
                .segmentId(segmentId != null ? segmentId : id)
                .roadName(DocumentValues.toText(data, "road_name"))
                .startLat(doubleOrZero(data.get("start_lat")))
                .startLon(doubleOrZero(data.get("start_lon")))
                .endLat(doubleOrZero(data.get("end_lat")))
                .endLon(doubleOrZero(data.get("end_lon")))
                .centerLat(centerLat)
                .centerLon(centerLon)
                .potholeCount(intOrZero(data.get("pothole_count")))
                .maxSeverity(Severity.fromLabel(DocumentValues.toText(data, "max_severity")))
                .area(DocumentValues.toText(data, "area"))
                .potholeIds(potholeIds)
                .createdAt(DocumentValues.toText(data, "created_at"))
                .build());
    }

    public static Map<String, Object> toDocument(BadSegment segment) {
        Map<String, Object> data = new HashMap<>();
        data.put("segment_id", segment.getSegmentId());
        data.put("road_name", segment.getRoadName());
        data.put("start_lat", segment.getStartLat());
        data.put("start_lon", segment.getStartLon());
        data.put("end_lat", segment.getEndLat());
        data.put("end_lon", segment.getEndLon());
        data.put("center_lat", segment.getCenterLat());
        data.put("center_lon", segment.getCenterLon());
        data.put("pothole_count", segment.getPotholeCount());
        data.put("max_severity", segment.getMaxSeverity() != null ? segment.getMaxSeverity().getLabel() : null);
        data.put("area", segment.getArea());
        data.put("pothole_ids", segment.getPotholeIds());
        data.put("created_at", segment.getCreatedAt());
        return data;
    }

    private static double doubleOrZero(Object value) {
        Double number = DocumentValues.toDouble(value);
        return number != null ? number : 0;
    }

    private static int intOrZero(Object value) {
        Integer number = DocumentValues.toInteger(value);
        return number != null ? number : 0;
    }
}
