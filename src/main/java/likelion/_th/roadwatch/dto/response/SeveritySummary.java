package likelion._th.roadwatch.dto.response;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
// 대시보드 상단 집계
public class SeveritySummary {
    private int total;
    private int high;
    private int medium;
    private int low;
    private int none;
}
