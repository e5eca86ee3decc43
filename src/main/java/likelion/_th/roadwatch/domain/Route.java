package likelion._th.roadwatch.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
// 경로 제공자가 돌려준 주행 경로
public class Route {
    private double distanceMeters;
    private double durationSeconds;
    private List<LatLng> geometry;   // 진행 순서대로
}
