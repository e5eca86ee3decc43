package likelion._th.roadwatch.repository.firestore;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.repository.ClusterStatusRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@Slf4j
public class FirestoreClusterStatusRepository implements ClusterStatusRepository {

    static final String COLLECTION = "cluster_status";

    private final Firestore firestore;
    private final Duration timeout;

    public FirestoreClusterStatusRepository(Firestore firestore, RoadwatchProperties properties) {
        this.firestore = firestore;
        this.timeout = properties.getTimeouts().getStore();
    }

    @Override
    public ClusterStatus findStatus(String clusterId) {
        DocumentSnapshot snapshot = FirestoreSupport.await(
                firestore.collection(COLLECTION).document(clusterId).get(),
                timeout, "클러스터 상태 조회 " + clusterId);
        return toStatus(snapshot);
    }

    @Override
    public Map<String, ClusterStatus> findStatuses(Collection<String> clusterIds) {
        Map<String, ClusterStatus> statuses = new LinkedHashMap<>();
        if (clusterIds == null || clusterIds.isEmpty()) {
            return statuses;
        }

        DocumentReference[] references = clusterIds.stream()
                .map(id -> firestore.collection(COLLECTION).document(id))
                .toArray(DocumentReference[]::new);

        List<DocumentSnapshot> snapshots = FirestoreSupport.await(
                firestore.getAll(references), timeout, "클러스터 상태 일괄 조회");

        clusterIds.forEach(id -> statuses.put(id, ClusterStatus.OPEN));
        for (DocumentSnapshot snapshot : snapshots) {
            statuses.put(snapshot.getId(), toStatus(snapshot));
        }
        return statuses;
    }

    @Override
    public void saveStatus(String clusterId, ClusterStatus status, String updatedAt) {
        FirestoreSupport.await(
                firestore.collection(COLLECTION).document(clusterId)
                        .set(Map.of("status", status.getLabel(), "updated_at", updatedAt)),
                timeout, "클러스터 상태 저장 " + clusterId);
        log.info("[DB] 클러스터 {} 상태 → {}", clusterId, status.getLabel());
    }

    private ClusterStatus toStatus(DocumentSnapshot snapshot) {
        if (snapshot == null || !snapshot.exists()) {
            return ClusterStatus.OPEN;
        }
        return ClusterStatus.fromStoredLabel(snapshot.getString("status"));
    }
}
