package likelion._th.roadwatch.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ClusterStatusRequest {

    // Open / In Progress / Fixed
    @NotBlank
    private String status;
}
