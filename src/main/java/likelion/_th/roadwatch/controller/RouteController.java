package likelion._th.roadwatch.controller;

import jakarta.validation.Valid;
import likelion._th.roadwatch.dto.request.RoutePlanRequest;
import likelion._th.roadwatch.dto.response.RoutePlanResponse;
import likelion._th.roadwatch.service.RoutePlannerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
public class RouteController {

    private final RoutePlannerService routePlannerService;

    // 주소 해석 실패만 400, 경로 계산 실패는 200 + error
    @PostMapping("/plan")
    public ResponseEntity<RoutePlanResponse> planRoute(
            @Valid @RequestBody RoutePlanRequest request
    ) {
        RoutePlanResponse response = routePlannerService.plan(request);
        if (response.isUnresolved()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
