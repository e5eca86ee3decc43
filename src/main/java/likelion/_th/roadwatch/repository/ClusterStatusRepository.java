package likelion._th.roadwatch.repository;

import likelion._th.roadwatch.domain.ClusterStatus;

import java.util.Collection;
import java.util.Map;

public interface ClusterStatusRepository {

    // 기록이 없으면 OPEN
    ClusterStatus findStatus(String clusterId);

    // 요청한 id 전부를 키로 갖는 맵 (기록 없으면 OPEN)
    Map<String, ClusterStatus> findStatuses(Collection<String> clusterIds);

    void saveStatus(String clusterId, ClusterStatus status, String updatedAt);
}
