package likelion._th.roadwatch.controller;

import jakarta.validation.Valid;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.dto.request.ReportCreateRequest;
import likelion._th.roadwatch.dto.response.PotholeLocationsResponse;
import likelion._th.roadwatch.dto.response.ReportCreateResponse;
import likelion._th.roadwatch.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping
    public ResponseEntity<List<Report>> getReports() {
        return ResponseEntity.ok(reportService.findAll());
    }

    @PostMapping
    public ResponseEntity<ReportCreateResponse> createReport(
            @Valid @RequestBody ReportCreateRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reportService.create(request));
    }

    @GetMapping("/locations")
    public ResponseEntity<PotholeLocationsResponse> getLocations() {
        return ResponseEntity.ok(reportService.locations());
    }
}
