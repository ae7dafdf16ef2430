package com.riansoft.weather_tsp.dto;

// 정류장별로 실제 사용된 날씨 계수와 조회 상태
public class StopFactorDto {
    private int index;
    private String name;
    private double factor;
    private String status;
    private String requestedHourUtc;
    private String detail;

    public StopFactorDto() {}

    public StopFactorDto(int index, String name, double factor, String status, String requestedHourUtc, String detail) {
        this.index = index;
        this.name = name;
        this.factor = factor;
        this.status = status;
        this.requestedHourUtc = requestedHourUtc;
        this.detail = detail;
    }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public double getFactor() { return factor; }
    public void setFactor(double factor) { this.factor = factor; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getRequestedHourUtc() { return requestedHourUtc; }
    public void setRequestedHourUtc(String requestedHourUtc) { this.requestedHourUtc = requestedHourUtc; }
    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }
}
