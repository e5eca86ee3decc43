package likelion._th.roadwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class PotholeLocationsResponse {
    private List<PotholeLocation> potholes;
    private int total;
}
