package likelion._th.roadwatch.client;

import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;

import java.util.List;
import java.util.Optional;

/**
 * 주행 경로 제공자.
 * 실패(타임아웃, 비정상 응답, 파싱 오류)는 예외 대신 Optional.empty() 로 돌려준다.
 */
public interface RouteProvider {

    Optional<Route> fetchRoute(LatLng start, LatLng end, List<LatLng> avoidPoints);
}
