package likelion._th.roadwatch.repository.firestore;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.WriteBatch;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.BadSegment;
import likelion._th.roadwatch.exception.StoreAccessException;
import likelion._th.roadwatch.repository.BadSegmentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@Slf4j
public class FirestoreBadSegmentRepository implements BadSegmentRepository {

    static final String COLLECTION = "bad_road_segments";

    private final Firestore firestore;
    private final Duration timeout;

    public FirestoreBadSegmentRepository(Firestore firestore, RoadwatchProperties properties) {
        this.firestore = firestore;
        this.timeout = properties.getTimeouts().getStore();
    }

    @Override
    public int replaceAll(List<BadSegment> segments) {
        long startTime = System.currentTimeMillis();
        try {
            CollectionReference collection = firestore.collection(COLLECTION);

            // 1. 문서 참조를 먼저 만든다 (잘못된 id 로 삭제만 되고 끝나지 않도록)
            List<DocumentReference> targets = new ArrayList<>();
            for (BadSegment segment : segments) {
                targets.add(collection.document(FirestoreSupport.documentId(segment.getSegmentId())));
            }

            // 2. 기존 문서 삭제
            QuerySnapshot existing = FirestoreSupport.await(collection.get(), timeout, "구간 목록 조회");
            List<QueryDocumentSnapshot> documents = existing.getDocuments();
            for (List<QueryDocumentSnapshot> chunk : FirestoreSupport.partitionList(documents, FirestoreSupport.BATCH_SIZE)) {
                WriteBatch batch = firestore.batch();
                chunk.forEach(document -> batch.delete(document.getReference()));
                FirestoreSupport.await(batch.commit(), timeout, "구간 삭제");
            }

            // 3. 새 구간 저장
            for (int from = 0; from < segments.size(); from += FirestoreSupport.BATCH_SIZE) {
                int to = Math.min(from + FirestoreSupport.BATCH_SIZE, segments.size());
                WriteBatch batch = firestore.batch();
                for (int i = from; i < to; i++) {
                    batch.set(targets.get(i), BadSegmentDocumentMapper.toDocument(segments.get(i)));
                }
                FirestoreSupport.await(batch.commit(), timeout, "구간 저장");
            }

            log.info("[DB] 구간 교체: 삭제 {} 개, 저장 {} 개 ({}ms)",
                    documents.size(), segments.size(), System.currentTimeMillis() - startTime);
            return segments.size();

        } catch (StoreAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[DB ERROR] 구간 교체 ({}ms) - {}", System.currentTimeMillis() - startTime, e.getMessage());
            throw new StoreAccessException("구간 교체 failed", e);
        }
    }

    @Override
    public List<BadSegment> findAll() {
        QuerySnapshot snapshot = FirestoreSupport.await(
                firestore.collection(COLLECTION).get(), timeout, "구간 전체 조회");

        List<BadSegment> segments = new ArrayList<>();
        int skipped = 0;
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            Optional<BadSegment> segment = BadSegmentDocumentMapper.fromDocument(document.getId(), document.getData());
            if (segment.isPresent()) {
                segments.add(segment.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("[DB] 중심 좌표 없는 구간 {} 개 제외", skipped);
        }
        return segments;
    }
}
