package com.riansoft.weather_tsp.exception;

/**
 * 경로 계획 파이프라인에서 발생하는 모든 치명적 오류의 공통 상위 타입입니다.
 */
public abstract class RoutePlanningException extends RuntimeException {

    protected RoutePlanningException(String message) {
        super(message);
    }

    protected RoutePlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
