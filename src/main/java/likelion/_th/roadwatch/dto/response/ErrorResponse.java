package likelion._th.roadwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ErrorResponse {
    private String message;   // "Invalid request"
    private String error;     // 상세 사유

    public static ErrorResponse of(String message, String error) {
        return new ErrorResponse(message, error);
    }
}
