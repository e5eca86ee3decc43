package likelion._th.roadwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class DashboardResponse {
    private SeveritySummary summary;
    private List<ClusterView> clusters;
}
