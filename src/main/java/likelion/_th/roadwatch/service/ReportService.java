package likelion._th.roadwatch.service;

import likelion._th.roadwatch.client.ReverseGeocoder;
import likelion._th.roadwatch.domain.Address;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.dto.request.ReportCreateRequest;
import likelion._th.roadwatch.dto.response.PotholeLocation;
import likelion._th.roadwatch.dto.response.PotholeLocationsResponse;
import likelion._th.roadwatch.dto.response.ReportCreateResponse;
import likelion._th.roadwatch.exception.StoreAccessException;
import likelion._th.roadwatch.repository.ReportRepository;
import likelion._th.roadwatch.util.GeoValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    static final String SOURCE_WEB = "web";
    static final String SOURCE_ADMIN = "admin_manual";

    private final ReportRepository reportRepository;
    private final ReverseGeocoder reverseGeocoder;
    private final BadSegmentService badSegmentService;
    private final Clock clock;

    public List<Report> findAll() {
        return reportRepository.findAll();
    }

    // 지도 표시용: 좌표 있고 포트홀인 신고만
    public PotholeLocationsResponse locations() {
        List<PotholeLocation> potholes = reportRepository.findAll().stream()
                .filter(Report::isLocatedPothole)
                .map(PotholeLocation::from)
                .collect(Collectors.toList());
        return new PotholeLocationsResponse(potholes, potholes.size());
    }

    public ReportCreateResponse create(ReportCreateRequest request) {
        // 1. 심각도 (수동 입력 우선)
        boolean manual = request.getSeverity() != null && !request.getSeverity().isBlank();
        Severity severity;
        int detections;
        if (manual) {
            severity = Severity.fromLabel(request.getSeverity());
            if (!severity.isPothole()) {
                throw new IllegalArgumentException("Invalid severity: " + request.getSeverity()
                        + " (allowed: Low, Medium, High)");
            }
            detections = severity.toDetections();
        } else if (request.getDetections() != null) {
            detections = request.getDetections();
            severity = Severity.fromDetections(detections);
        } else {
            throw new IllegalArgumentException("Either detections or severity is required");
        }

        // 2. 위치 → 주소
        Double latitude = request.getLatitude();
        Double longitude = request.getLongitude();
        Address address;
        if (latitude != null && longitude != null) {
            if (!GeoValidator.isValidCoordinate(latitude, longitude)) {
                throw new IllegalArgumentException("Invalid coordinates");
            }
            address = reverseGeocoder.reverseGeocode(latitude, longitude);
        } else if (latitude == null && longitude == null) {
            if (manual) {
                throw new IllegalArgumentException("Latitude and longitude are required");
            }
            address = Address.unknown();
        } else {
            throw new IllegalArgumentException("Latitude and longitude must be given together");
        }

        // 3. 도로 이름 직접 입력 시 덮어씀
        String road = address.getRoad();
        if (request.getRoad() != null && !request.getRoad().isBlank()) {
            road = request.getRoad().trim();
        }

        String source = request.getSource() != null && !request.getSource().isBlank()
                ? request.getSource()
                : (manual ? SOURCE_ADMIN : SOURCE_WEB);

        Report report = Report.builder()
                .latitude(latitude)
                .longitude(longitude)
                .severity(severity)
                .detections(detections)
                .road(road)
                .area(address.getArea())
                .fullAddress(address.getFullAddress())
                .source(source)
                .timestamp(LocalDateTime.now(clock).toString())
                .notes(request.getNotes())
                .build();

        // 4. 저장
        String id = reportRepository.save(report);
        Report saved = report.toBuilder().id(id).build();
        log.info("신고 등록 id={}, severity={}, road={}, source={}", id, severity, road, source);

        // 5. 구간 재탐지 (실패해도 신고 저장은 유지)
        Integer segmentCount = null;
        try {
            segmentCount = badSegmentService.refresh();
        } catch (StoreAccessException e) {
            log.error("신고 등록 후 구간 재탐지 실패: {}", e.getMessage());
        }

        return ReportCreateResponse.builder()
                .report(saved)
                .badSegments(segmentCount)
                .build();
    }
}
