package likelion._th.roadwatch.client;

import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 경로 제공자 선택
 * - 회피 지점 있음 + ORS 키 있음 → ORS 회피 요청, 실패 시 OSRM
 * - 회피 지점 없음 → OSRM, 실패 시 ORS (키 있을 때만)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoutingGateway implements RouteProvider {

    private final OsrmClient osrmClient;
    private final OpenRouteServiceClient orsClient;

    @Override
    public Optional<Route> fetchRoute(LatLng start, LatLng end, List<LatLng> avoidPoints) {
        boolean avoiding = avoidPoints != null && !avoidPoints.isEmpty();

        if (avoiding) {
            if (orsClient.isEnabled()) {
                Optional<Route> biased = orsClient.fetchRoute(start, end, avoidPoints);
                if (biased.isPresent()) {
                    return biased;
                }
                log.warn("ORS 회피 경로 실패 → OSRM 기본 경로로 대체");
            } else {
                log.info("ORS 키 없음 → 회피 없이 OSRM 경로 요청");
            }
            return osrmClient.fetchRoute(start, end);
        }

        Optional<Route> route = osrmClient.fetchRoute(start, end);
        if (route.isEmpty() && orsClient.isEnabled()) {
            log.info("OSRM 실패 → ORS 로 재시도");
            return orsClient.fetchRoute(start, end, Collections.emptyList());
        }
        return route;
    }
}
