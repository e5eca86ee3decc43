package likelion._th.roadwatch.repository;

import likelion._th.roadwatch.domain.Report;

import java.util.List;

public interface ReportRepository {

    // 전체 신고 (필터링 없이 그대로)
    List<Report> findAll();

    // 저장 후 발급된 id 반환
    String save(Report report);
}
