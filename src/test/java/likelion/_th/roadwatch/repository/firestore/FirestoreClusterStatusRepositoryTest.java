package likelion._th.roadwatch.repository.firestore;

import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.ClusterStatus;
import likelion._th.roadwatch.exception.StoreAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FirestoreClusterStatusRepositoryTest {

    private Firestore firestore;
    private DocumentReference document;
    private FirestoreClusterStatusRepository repository;

    @BeforeEach
    void setUp() {
        firestore = mock(Firestore.class);
        CollectionReference collection = mock(CollectionReference.class);
        document = mock(DocumentReference.class);
        when(firestore.collection("cluster_status")).thenReturn(collection);
        when(collection.document("12.9716_77.5946")).thenReturn(document);

        repository = new FirestoreClusterStatusRepository(firestore, new RoadwatchProperties());
    }

    @Test
    void shouldDefaultToOpenWhenNoDocument() {
        DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
        when(snapshot.exists()).thenReturn(false);
        when(document.get()).thenReturn(ApiFutures.immediateFuture(snapshot));

        assertEquals(ClusterStatus.OPEN, repository.findStatus("12.9716_77.5946"));
    }

    @Test
    void shouldReadStoredStatus() {
        DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
        when(snapshot.exists()).thenReturn(true);
        when(snapshot.getString("status")).thenReturn("In Progress");
        when(document.get()).thenReturn(ApiFutures.immediateFuture(snapshot));

        assertEquals(ClusterStatus.IN_PROGRESS, repository.findStatus("12.9716_77.5946"));
    }

    @Test
    void shouldWriteStatusLabelWithTimestamp() {
        when(document.set(anyMap())).thenReturn(ApiFutures.immediateFuture(null));

        repository.saveStatus("12.9716_77.5946", ClusterStatus.FIXED, "2026-03-01T10:15:30");

        verify(document).set(Map.of("status", "Fixed", "updated_at", "2026-03-01T10:15:30"));
    }

    @Test
    void shouldWrapStoreFailure() {
        when(document.get()).thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("unavailable")));

        StoreAccessException ex = assertThrows(StoreAccessException.class,
                () -> repository.findStatus("12.9716_77.5946"));

        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }
}
