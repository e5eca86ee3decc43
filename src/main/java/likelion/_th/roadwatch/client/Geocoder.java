package likelion._th.roadwatch.client;

import likelion._th.roadwatch.domain.LatLng;

import java.util.Optional;

// 주소 → 좌표
public interface Geocoder {

    Optional<LatLng> geocode(String address);
}
