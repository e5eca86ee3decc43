package likelion._th.roadwatch.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
public class RoutePlanRequest {

    @NotNull(message = "Start and end locations required")
    private LocationInput start;

    @NotNull(message = "Start and end locations required")
    private LocationInput end;

    public RoutePlanRequest(LocationInput start, LocationInput end) {
        this.start = start;
        this.end = end;
    }
}
