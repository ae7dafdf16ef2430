package com.riansoft.weather_tsp.model;

import com.riansoft.weather_tsp.solver.SolverOptions;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * 계획 실행 한 번에 적용되는 설정 값. 각 단계에 명시적으로 전달되며 실행 간에 공유되지 않습니다.
 */
public class PlanOptions {
    public final double averageSpeedKph;
    public final int startIndex;
    // 첫 정류장에도 도착 시각이 없을 때 사용할 출발 시각. null 이면 계획 시점의 현재 시각.
    public final OffsetDateTime defaultDeparture;
    public final WeatherThresholds thresholds;
    public final SolverOptions solverOptions;

    public PlanOptions(double averageSpeedKph, int startIndex, OffsetDateTime defaultDeparture,
                       WeatherThresholds thresholds, SolverOptions solverOptions) {
        this.averageSpeedKph = averageSpeedKph;
        this.startIndex = startIndex;
        this.defaultDeparture = defaultDeparture;
        this.thresholds = thresholds;
        this.solverOptions = solverOptions;
    }

    public static PlanOptions defaults() {
        return new PlanOptions(35.0, 0, null, WeatherThresholds.defaults(), SolverOptions.defaults());
    }

    public Duration getTimeLimit() {
        return solverOptions.timeLimit;
    }

    public PlanOptions withAverageSpeedKph(double speedKph) {
        return new PlanOptions(speedKph, startIndex, defaultDeparture, thresholds, solverOptions);
    }

    public PlanOptions withStartIndex(int index) {
        return new PlanOptions(averageSpeedKph, index, defaultDeparture, thresholds, solverOptions);
    }

    public PlanOptions withTimeLimit(Duration timeLimit) {
        return new PlanOptions(averageSpeedKph, startIndex, defaultDeparture, thresholds,
                solverOptions.withTimeLimit(timeLimit));
    }

    public PlanOptions withDefaultDeparture(OffsetDateTime departure) {
        return new PlanOptions(averageSpeedKph, startIndex, departure, thresholds, solverOptions);
    }
}
