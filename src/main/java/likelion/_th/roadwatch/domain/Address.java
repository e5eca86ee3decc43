package likelion._th.roadwatch.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
// 역지오코딩 결과
public class Address {
    private String road;
    private String area;
    private String fullAddress;

    public static Address unknown() {
        return new Address(Report.UNKNOWN_ROAD, Report.UNKNOWN_AREA, Report.UNKNOWN_ADDRESS);
    }
}
