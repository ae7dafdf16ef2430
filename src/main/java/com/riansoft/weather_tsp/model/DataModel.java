package com.riansoft.weather_tsp.model;

import java.util.List;

/**
 * 계획 실행 한 번에서 파생된 데이터. 실행마다 새로 만들어집니다.
 */
public class DataModel {
    public final List<Stop> stops;
    public final TimeMatrix baseMatrix;
    public final List<WeatherLookup> weatherLookups;
    public final TimeMatrix adjustedMatrix;
    public final int startIndex;

    public DataModel(List<Stop> stops, TimeMatrix baseMatrix, List<WeatherLookup> weatherLookups,
                     TimeMatrix adjustedMatrix, int startIndex) {
        this.stops = List.copyOf(stops);
        this.baseMatrix = baseMatrix;
        this.weatherLookups = List.copyOf(weatherLookups);
        this.adjustedMatrix = adjustedMatrix;
        this.startIndex = startIndex;
    }
}
