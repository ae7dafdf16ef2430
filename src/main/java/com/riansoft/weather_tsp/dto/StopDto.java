package com.riansoft.weather_tsp.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class StopDto {
    private String id;
    private String name;
    private Double lat;
    private Double lon;
    private String expectedArrival; // ISO-8601 (UTC 오프셋 포함), 선택 값
    private Integer index;
    private Double minutesFromStart;
    private Double weatherFactor;

    // 1. 기본 생성자
    public StopDto() {}

    // 2. 요청 / 정류장 목록 조회용 생성자
    public StopDto(String id, String name, double lat, double lon, String expectedArrival) {
        this.id = id;
        this.name = name;
        this.lat = lat;
        this.lon = lon;
        this.expectedArrival = expectedArrival;
    }

    // --- Getters and Setters ---
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Double getLat() { return lat; }
    public void setLat(Double lat) { this.lat = lat; }
    public Double getLon() { return lon; }
    public void setLon(Double lon) { this.lon = lon; }
    public String getExpectedArrival() { return expectedArrival; }
    public void setExpectedArrival(String expectedArrival) { this.expectedArrival = expectedArrival; }
    public Integer getIndex() { return index; }
    public void setIndex(Integer index) { this.index = index; }
    public Double getMinutesFromStart() { return minutesFromStart; }
    public void setMinutesFromStart(Double minutesFromStart) { this.minutesFromStart = minutesFromStart; }
    public Double getWeatherFactor() { return weatherFactor; }
    public void setWeatherFactor(Double weatherFactor) { this.weatherFactor = weatherFactor; }
}
