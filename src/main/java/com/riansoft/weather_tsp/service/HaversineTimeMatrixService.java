package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.model.TimeMatrix;
import com.riansoft.weather_tsp.util.GeoDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 직선(대원) 거리와 가정 평균 속도로 이동 시간 행렬을 만듭니다.
 */
@Service
public class HaversineTimeMatrixService implements TravelTimeMatrixProvider {

    private static final Logger log = LoggerFactory.getLogger(HaversineTimeMatrixService.class);

    @Override
    public TimeMatrix buildBaseMatrix(List<Stop> stops, double averageSpeedKph) {
        if (!(averageSpeedKph > 0) || Double.isInfinite(averageSpeedKph)) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_SPEED,
                    "평균 속도는 0보다 큰 유한한 값이어야 합니다: " + averageSpeedKph);
        }
        int numStops = stops.size();
        double[][] minutes = new double[numStops][numStops];
        // 거리와 속도 모두 대칭이므로 위쪽 삼각형만 계산합니다.
        for (int i = 0; i < numStops; i++) {
            for (int j = i + 1; j < numStops; j++) {
                double km = GeoDistance.haversineKm(stops.get(i), stops.get(j));
                double travelMinutes = km / averageSpeedKph * 60.0;
                minutes[i][j] = travelMinutes;
                minutes[j][i] = travelMinutes;
            }
        }
        log.debug("[MATRIX] {}x{} 기본 시간 행렬 생성 완료 (평균 속도 {}km/h)", numStops, numStops, averageSpeedKph);
        return new TimeMatrix(minutes);
    }
}
