package com.riansoft.weather_tsp.dto;

import java.util.List;

// 정류장 목록과 선택적 설정 덮어쓰기 값을 한번에 담는 요청 DTO
public class PlanRequestDto {
    private List<StopDto> stops;
    private Double averageSpeedKph;
    private Long timeLimitSeconds;
    private Integer startIndex;

    // Getters and Setters
    public List<StopDto> getStops() { return stops; }
    public void setStops(List<StopDto> stops) { this.stops = stops; }
    public Double getAverageSpeedKph() { return averageSpeedKph; }
    public void setAverageSpeedKph(Double averageSpeedKph) { this.averageSpeedKph = averageSpeedKph; }
    public Long getTimeLimitSeconds() { return timeLimitSeconds; }
    public void setTimeLimitSeconds(Long timeLimitSeconds) { this.timeLimitSeconds = timeLimitSeconds; }
    public Integer getStartIndex() { return startIndex; }
    public void setStartIndex(Integer startIndex) { this.startIndex = startIndex; }
}
