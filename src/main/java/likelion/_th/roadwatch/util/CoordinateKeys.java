package likelion._th.roadwatch.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 클러스터/구간 id 에 들어가는 좌표 문자열.
 * 소수점 5자리 반올림, 뒤쪽 0 제거 (12.97160 → "12.9716", 12.0 → "12.0")
 * 반올림은 double 의 실제 이진 값 기준 (기존 cluster_status 문서 id 와 일치)
 */
public final class CoordinateKeys {

    private static final int ID_SCALE = 5;

    private CoordinateKeys() {
    }

    public static String round5(double value) {
        BigDecimal rounded = new BigDecimal(value)
                .setScale(ID_SCALE, RoundingMode.HALF_EVEN)
                .stripTrailingZeros();
        if (rounded.scale() <= 0) {
            rounded = rounded.setScale(1, RoundingMode.UNNECESSARY);
        }
        return rounded.toPlainString();
    }

    public static String key(double lat, double lon) {
        return round5(lat) + "_" + round5(lon);
    }
}
