package com.riansoft.weather_tsp.model;

import com.riansoft.weather_tsp.exception.InvalidInputException;

import java.time.OffsetDateTime;

public class Stop {
    public final String id;
    public final String name;
    public final double lat;
    public final double lon;
    // 예상 도착 시각. 없으면 null 이며 계획의 기본 출발 시각으로 대체됩니다.
    public final OffsetDateTime arrivalTime;

    public Stop(String id, String name, double lat, double lon, OffsetDateTime arrivalTime) {
        if (!isValidLatitude(lat) || !isValidLongitude(lon)) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_COORDINATE,
                    String.format("정류장 '%s'의 좌표가 범위를 벗어났습니다: (%s, %s)", name, lat, lon));
        }
        this.id = id;
        this.name = name;
        this.lat = lat;
        this.lon = lon;
        this.arrivalTime = arrivalTime;
    }

    public Stop(String id, String name, double lat, double lon) {
        this(id, name, lat, lon, null);
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90.0 && lat <= 90.0;
    }

    public static boolean isValidLongitude(double lon) {
        return lon >= -180.0 && lon <= 180.0;
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }
}
