package likelion._th.roadwatch.client;

import likelion._th.roadwatch.domain.Address;

// 좌표 → 도로/지역 이름. 실패해도 Unknown 값으로 채워서 돌려준다.
public interface ReverseGeocoder {

    Address reverseGeocode(double latitude, double longitude);
}
