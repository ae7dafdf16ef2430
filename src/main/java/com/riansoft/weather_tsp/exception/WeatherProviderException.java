package com.riansoft.weather_tsp.exception;

/**
 * 날씨 제공자 호출 실패 (네트워크, HTTP 오류, 응답 해석 실패).
 * 파이프라인은 이 오류를 중립 계수(1.0)로 복구하므로 RoutePlanningException 계열이 아닙니다.
 */
public class WeatherProviderException extends RuntimeException {

    public WeatherProviderException(String message) {
        super(message);
    }

    public WeatherProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
