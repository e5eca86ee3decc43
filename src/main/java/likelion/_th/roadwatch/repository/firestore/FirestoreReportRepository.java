package likelion._th.roadwatch.repository.firestore;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.repository.ReportRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Repository
@Slf4j
public class FirestoreReportRepository implements ReportRepository {

    static final String COLLECTION = "pothole_reports";

    private final Firestore firestore;
    private final Duration timeout;

    public FirestoreReportRepository(Firestore firestore, RoadwatchProperties properties) {
        this.firestore = firestore;
        this.timeout = properties.getTimeouts().getStore();
    }

    @Override
    public List<Report> findAll() {
        QuerySnapshot snapshot = FirestoreSupport.await(
                firestore.collection(COLLECTION).get(), timeout, "신고 전체 조회");

        List<Report> reports = new ArrayList<>();
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            reports.add(ReportDocumentMapper.fromDocument(document.getId(), document.getData()));
        }
        log.info("[DB] 신고 {} 건 로드", reports.size());
        return reports;
    }

    @Override
    public String save(Report report) {
        DocumentReference reference = FirestoreSupport.await(
                firestore.collection(COLLECTION).add(ReportDocumentMapper.toDocument(report)),
                timeout, "신고 저장");
        log.info("[DB] 신고 저장 id={}, severity={}", reference.getId(), report.getSeverity());
        return reference.getId();
    }
}
