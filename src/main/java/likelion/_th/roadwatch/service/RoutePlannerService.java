package likelion._th.roadwatch.service;

import likelion._th.roadwatch.dto.request.RoutePlanRequest;
import likelion._th.roadwatch.dto.response.RoutePlanResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoutePlannerService {

    private final RouteAvoidancePlanner routeAvoidancePlanner;
    private final BadSegmentService badSegmentService;

    // 출발/도착을 먼저 해석하고, 그 다음에 저장된 구간을 읽는다
    public RoutePlanResponse plan(RoutePlanRequest request) {
        log.info("경로 계획 요청: {} → {}", request.getStart(), request.getEnd());
        return routeAvoidancePlanner.planRoute(
                request.getStart(), request.getEnd(), badSegmentService::currentSegments);
    }
}
