package likelion._th.roadwatch.exception;

// Firestore 조회/저장 실패
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
