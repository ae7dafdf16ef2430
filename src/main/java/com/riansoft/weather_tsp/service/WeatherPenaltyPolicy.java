package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.model.WeatherObservation;
import com.riansoft.weather_tsp.model.WeatherThresholds;
import org.springframework.stereotype.Service;

/**
 * 예보값을 1.0 이상의 이동 시간 지연 계수로 바꿉니다.
 */
@Service
public class WeatherPenaltyPolicy {

    public double factorFor(WeatherObservation observation, WeatherThresholds t) {
        double factor = 1.0;
        // 비: 완만한 지연
        if (observation.precipitationMm >= t.lightRainMm) factor += t.lightRainPenalty;
        if (observation.precipitationMm >= t.heavyRainMm) factor += t.heavyRainPenalty;
        // 눈: 큰 지연
        if (observation.snowfallCm >= t.lightSnowCm) factor += t.lightSnowPenalty;
        if (observation.snowfallCm >= t.heavySnowCm) factor += t.heavySnowPenalty;
        // 바람, 돌풍
        if (observation.windSpeedKph >= t.windKph) factor += t.windPenalty;
        if (observation.windGustsKph >= t.gustKph) factor += t.gustPenalty;
        return factor;
    }
}
