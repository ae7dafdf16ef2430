package com.riansoft.weather_tsp.exception;

/**
 * 닫힌 순회 경로를 만들 수 없을 때 발생합니다. 부분 경로는 반환하지 않습니다.
 */
public class NoFeasibleTourException extends RoutePlanningException {

    public NoFeasibleTourException(String message) {
        super(message);
    }
}
