package likelion._th.roadwatch.dto.response;

import likelion._th.roadwatch.domain.BadSegment;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class SegmentsResponse {
    private List<BadSegment> segments;
    private SegmentStatistics statistics;
}
