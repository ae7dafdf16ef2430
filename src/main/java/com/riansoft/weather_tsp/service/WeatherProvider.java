package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.exception.WeatherProviderException;
import com.riansoft.weather_tsp.model.WeatherObservation;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * 외부 날씨 예보 서비스 경계.
 */
public interface WeatherProvider {

    /**
     * @param utcHour UTC 기준으로 정시에 맞춘 요청 시각
     * @return 해당 시각의 예보. 응답에 그 시각 구간이 없으면 빈 값
     * @throws WeatherProviderException 통신 실패, HTTP 오류, 응답 해석 실패
     */
    Optional<WeatherObservation> hourlyObservation(double lat, double lon, OffsetDateTime utcHour);
}
