package likelion._th.roadwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RefreshResponse {
    private boolean success;
    private int count;
    private String message;

    public static RefreshResponse of(int count) {
        return new RefreshResponse(true, count, "Updated " + count + " bad road segments");
    }
}
