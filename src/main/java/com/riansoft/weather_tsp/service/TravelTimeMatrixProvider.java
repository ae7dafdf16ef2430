package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.model.TimeMatrix;

import java.util.List;

/**
 * 정류장 목록으로부터 기본 이동 시간 행렬(분)을 만드는 제공자.
 * 도로망 기반 ETA 제공자로 교체할 수 있으며, 구현체는 n x n, 대각선 0, 음수 없는 행렬을 반환해야 합니다.
 */
public interface TravelTimeMatrixProvider {

    TimeMatrix buildBaseMatrix(List<Stop> stops, double averageSpeedKph);
}
