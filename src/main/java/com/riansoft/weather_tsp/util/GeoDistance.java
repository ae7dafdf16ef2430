package com.riansoft.weather_tsp.util;

import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.model.Stop;

public final class GeoDistance {

    // 지구 평균 반지름 (킬로미터)
    public static final double EARTH_RADIUS_KM = 6371.0088;

    private GeoDistance() {
    }

    /**
     * 두 지점의 위도, 경도를 받아 대원 거리(킬로미터)를 계산합니다. (Haversine 공식)
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        requireCoordinate(lat1, lon1);
        requireCoordinate(lat2, lon2);
        double latDistance = Math.toRadians(lat2 - lat1);
        double lonDistance = Math.toRadians(lon2 - lon1);
        double a = Math.sin(latDistance / 2) * Math.sin(latDistance / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(lonDistance / 2) * Math.sin(lonDistance / 2);
        // 부동소수 오차로 a 가 1을 살짝 넘는 대척점 근처 입력 보호
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(Math.min(1.0, a)));
    }

    public static double haversineKm(Stop origin, Stop destination) {
        return haversineKm(origin.lat, origin.lon, destination.lat, destination.lon);
    }

    private static void requireCoordinate(double lat, double lon) {
        if (!Stop.isValidLatitude(lat) || !Stop.isValidLongitude(lon)) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_COORDINATE,
                    String.format("좌표가 범위를 벗어났습니다: (%s, %s)", lat, lon));
        }
    }
}
