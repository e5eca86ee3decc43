package likelion._th.roadwatch.controller;

import likelion._th.roadwatch.dto.response.RefreshResponse;
import likelion._th.roadwatch.dto.response.SegmentsResponse;
import likelion._th.roadwatch.service.BadSegmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/bad-segments")
@RequiredArgsConstructor
public class BadSegmentController {

    private final BadSegmentService badSegmentService;

    @GetMapping
    public ResponseEntity<SegmentsResponse> getSegments() {
        return ResponseEntity.ok(badSegmentService.detectAndStore());
    }

    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh() {
        return ResponseEntity.ok(RefreshResponse.of(badSegmentService.refresh()));
    }
}
