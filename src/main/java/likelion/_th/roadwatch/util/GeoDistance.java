package likelion._th.roadwatch.util;

import likelion._th.roadwatch.domain.LatLng;

/**
 * 두 좌표 사이의 대권 거리 (haversine, 지구 반지름 6,371,000m)
 * 클러스터링, 연속 구간 탐지, 경로 교차 판정 모두 이 공식 하나만 사용한다.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000;

    private GeoDistance() {
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2)
                * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    public static double haversineMeters(LatLng from, LatLng to) {
        return haversineMeters(from.getLat(), from.getLng(), to.getLat(), to.getLng());
    }
}
