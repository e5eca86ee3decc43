package likelion._th.roadwatch.repository.firestore;

import com.google.api.core.ApiFuture;
import likelion._th.roadwatch.exception.StoreAccessException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Firestore 호출 공통 처리
 * - 호출마다 타임아웃
 * - 실패는 StoreAccessException 으로 변환
 */
@Slf4j
final class FirestoreSupport {

    // 배치 쓰기 한도
    static final int BATCH_SIZE = 500;

    private FirestoreSupport() {
    }

    static <T> T await(ApiFuture<T> future, Duration timeout, String action) {
        long start = System.currentTimeMillis();
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[DB SUCCESS] {} ({}ms)", action, System.currentTimeMillis() - start);
            return result;

        } catch (ExecutionException e) {
            log.error("[DB ERROR] {} ({}ms) - {}", action, System.currentTimeMillis() - start, e.getMessage());
            throw new StoreAccessException(action + " failed", e.getCause() != null ? e.getCause() : e);

        } catch (TimeoutException e) {
            log.error("[DB TIMEOUT] {} ({}ms)", action, System.currentTimeMillis() - start);
            throw new StoreAccessException(action + " timed out", e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreAccessException(action + " interrupted", e);
        }
    }

    /**
     * 문서 id 로 쓸 수 없는 문자를 치환 ("/" 는 경로 구분자)
     * 원래 값은 문서 본문에 그대로 저장한다.
     */
    static String documentId(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("document id must not be empty");
        }
        String escaped = raw.replace("%", "%25").replace("/", "%2F");
        if (escaped.equals(".") || escaped.equals("..")) {
            return escaped.replace(".", "%2E");
        }
        return escaped;
    }

    // 리스트를 N개씩 분할
    static <T> List<List<T>> partitionList(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}
