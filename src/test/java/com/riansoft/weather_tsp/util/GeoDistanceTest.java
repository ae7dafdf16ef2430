package com.riansoft.weather_tsp.util;

import com.riansoft.weather_tsp.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoDistanceTest {

    @Test
    @DisplayName("같은 지점 사이의 거리는 0이다")
    void distanceToSelfIsZero() {
        assertEquals(0.0, GeoDistance.haversineKm(41.1176, -85.0689, 41.1176, -85.0689));
        assertEquals(0.0, GeoDistance.haversineKm(-90, 180, -90, 180));
    }

    @Test
    @DisplayName("임의의 좌표쌍에 대해 거리는 대칭이다")
    void distanceIsSymmetric() {
        Random random = new Random(42);
        for (int k = 0; k < 500; k++) {
            double lat1 = random.nextDouble() * 180 - 90;
            double lon1 = random.nextDouble() * 360 - 180;
            double lat2 = random.nextDouble() * 180 - 90;
            double lon2 = random.nextDouble() * 360 - 180;
            double ab = GeoDistance.haversineKm(lat1, lon1, lat2, lon2);
            double ba = GeoDistance.haversineKm(lat2, lon2, lat1, lon1);
            assertEquals(ab, ba, 1e-9);
            assertTrue(ab >= 0);
        }
    }

    @Test
    @DisplayName("적도 위 경도 1도는 약 111.2km 이고 대척점은 반 둘레이다")
    void knownDistances() {
        assertEquals(Math.toRadians(1) * GeoDistance.EARTH_RADIUS_KM,
                GeoDistance.haversineKm(0, 0, 0, 1), 1e-6);
        assertEquals(Math.PI * GeoDistance.EARTH_RADIUS_KM,
                GeoDistance.haversineKm(0, 0, 0, 180), 1e-6);
    }

    @Test
    @DisplayName("예시 차고지에서 Stop A 까지의 거리")
    void depotToStopA() {
        double km = GeoDistance.haversineKm(41.1176, -85.0689, 41.1802, -84.9960);
        assertEquals(9.258, km, 0.005);
    }

    @Test
    @DisplayName("범위를 벗어난 좌표는 INVALID_COORDINATE 로 거부된다")
    void rejectsOutOfDomainCoordinates() {
        InvalidInputException latError = assertThrows(InvalidInputException.class,
                () -> GeoDistance.haversineKm(90.5, 0, 0, 0));
        assertEquals(InvalidInputException.Reason.INVALID_COORDINATE, latError.getReason());
        InvalidInputException lonError = assertThrows(InvalidInputException.class,
                () -> GeoDistance.haversineKm(0, 0, 0, -180.01));
        assertEquals(InvalidInputException.Reason.INVALID_COORDINATE, lonError.getReason());
    }
}
