package likelion._th.roadwatch.dto.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.util.GeoValidator;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 경로 출발지/도착지 입력
 * - 문자열: 주소 (지오코딩 필요)
 * - [lat, lon] 배열: 좌표 그대로 사용
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LocationInput {

    private final String address;
    private final LatLng coordinates;

    public static LocationInput ofAddress(String address) {
        return new LocationInput(address, null);
    }

    public static LocationInput ofCoordinates(double lat, double lon) {
        if (!GeoValidator.isValidCoordinate(lat, lon)) {
            throw new IllegalArgumentException("Invalid coordinates: [" + lat + ", " + lon + "]");
        }
        return new LocationInput(null, new LatLng(lat, lon));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LocationInput from(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Location is required");
        }
        if (node.isTextual()) {
            if (node.asText().isBlank()) {
                throw new IllegalArgumentException("Location is required");
            }
            return ofAddress(node.asText().trim());
        }
        if (node.isArray() && node.size() == 2 && node.get(0).isNumber() && node.get(1).isNumber()) {
            return ofCoordinates(node.get(0).asDouble(), node.get(1).asDouble());
        }
        throw new IllegalArgumentException("Location must be an address or [lat, lon]");
    }

    public boolean isCoordinates() {
        return coordinates != null;
    }

    @Override
    public String toString() {
        return isCoordinates() ? coordinates.toLatLon().toString() : address;
    }
}
