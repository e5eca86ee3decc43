package likelion._th.roadwatch.exception;

import lombok.Getter;

// 주소 → 좌표 변환 실패 (출발지/도착지 구분)
@Getter
public class LocationResolutionException extends RuntimeException {

    private final String endpoint;   // "start" 또는 "end"
    private final String input;

    public LocationResolutionException(String endpoint, String input) {
        super(String.format("Could not resolve %s location: %s", endpoint, input));
        this.endpoint = endpoint;
        this.input = input;
    }
}
