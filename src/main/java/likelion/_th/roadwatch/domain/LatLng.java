package likelion._th.roadwatch.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
// 위도/경도 좌표 (단위: 도)
public class LatLng {
    private double lat;
    private double lng;

    // 외부 응답에서 쓰는 [lon, lat] 순서
    public List<Double> toLonLat() {
        return List.of(lng, lat);
    }

    public List<Double> toLatLon() {
        return List.of(lat, lng);
    }
}
