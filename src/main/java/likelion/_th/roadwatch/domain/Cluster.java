package likelion._th.roadwatch.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
// 기준점 반경 안의 신고 묶음 (매 요청마다 다시 계산)
public class Cluster {
    private String id;              // 기준점 좌표 반올림으로 생성
    private double centerLat;
    private double centerLon;
    private List<Report> reports;
    private Severity maxSeverity;
}
