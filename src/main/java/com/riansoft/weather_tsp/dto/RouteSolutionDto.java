package com.riansoft.weather_tsp.dto;

import java.util.List;

public class RouteSolutionDto {

    private List<Integer> visitOrder;
    private List<StopDto> route;
    private double totalMinutes;
    private double initialMinutes;
    private List<StopFactorDto> weatherFactors;
    private List<String> estimatedFactorStops;
    private String strategy;
    private long solveTimeMs;
    private boolean timeBudgetExhausted;

    // 1. 기본 생성자
    public RouteSolutionDto() {}

    // 2. SolutionFormatterService에서 최종 결과를 담을 때 사용하는 생성자
    public RouteSolutionDto(List<Integer> visitOrder, List<StopDto> route, double totalMinutes, double initialMinutes,
                            List<StopFactorDto> weatherFactors, List<String> estimatedFactorStops,
                            String strategy, long solveTimeMs, boolean timeBudgetExhausted) {
        this.visitOrder = visitOrder;
        this.route = route;
        this.totalMinutes = totalMinutes;
        this.initialMinutes = initialMinutes;
        this.weatherFactors = weatherFactors;
        this.estimatedFactorStops = estimatedFactorStops;
        this.strategy = strategy;
        this.solveTimeMs = solveTimeMs;
        this.timeBudgetExhausted = timeBudgetExhausted;
    }

    // --- Getters and Setters ---
    public List<Integer> getVisitOrder() { return visitOrder; }
    public void setVisitOrder(List<Integer> visitOrder) { this.visitOrder = visitOrder; }
    public List<StopDto> getRoute() { return route; }
    public void setRoute(List<StopDto> route) { this.route = route; }
    public double getTotalMinutes() { return totalMinutes; }
    public void setTotalMinutes(double totalMinutes) { this.totalMinutes = totalMinutes; }
    public double getInitialMinutes() { return initialMinutes; }
    public void setInitialMinutes(double initialMinutes) { this.initialMinutes = initialMinutes; }
    public List<StopFactorDto> getWeatherFactors() { return weatherFactors; }
    public void setWeatherFactors(List<StopFactorDto> weatherFactors) { this.weatherFactors = weatherFactors; }
    public List<String> getEstimatedFactorStops() { return estimatedFactorStops; }
    public void setEstimatedFactorStops(List<String> estimatedFactorStops) { this.estimatedFactorStops = estimatedFactorStops; }
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }
    public long getSolveTimeMs() { return solveTimeMs; }
    public void setSolveTimeMs(long solveTimeMs) { this.solveTimeMs = solveTimeMs; }
    public boolean isTimeBudgetExhausted() { return timeBudgetExhausted; }
    public void setTimeBudgetExhausted(boolean timeBudgetExhausted) { this.timeBudgetExhausted = timeBudgetExhausted; }
}
