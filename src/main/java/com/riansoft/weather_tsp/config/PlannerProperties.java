package com.riansoft.weather_tsp.config;

import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.model.PlanOptions;
import com.riansoft.weather_tsp.model.WeatherThresholds;
import com.riansoft.weather_tsp.solver.SolverOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * application.properties 의 planner.* 설정.
 */
@Configuration
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * 기본 이동 시간 계산에 쓰는 가정 평균 속도 (km/h).
     */
    private double averageSpeedKph = 35.0;

    /**
     * 경로 탐색 시간 제한 (초).
     */
    private long timeLimitSeconds = 10;

    private int startIndex = 0;

    /**
     * 클래스패스에서 읽을 정류장 CSV 파일.
     */
    private String stopFile = "stops.csv";

    /**
     * 첫 정류장에 도착 시각이 없을 때의 출발 시각 (ISO-8601, UTC 오프셋 포함).
     */
    private String defaultDeparture;

    private Weather weather = new Weather();

    private Solver solver = new Solver();

    public PlanOptions toPlanOptions() {
        OffsetDateTime departure = null;
        if (defaultDeparture != null && !defaultDeparture.isBlank()) {
            try {
                departure = OffsetDateTime.parse(defaultDeparture.trim());
            } catch (DateTimeParseException e) {
                throw new InvalidInputException(InvalidInputException.Reason.INVALID_TIMESTAMP,
                        "planner.default-departure 형식 오류: " + defaultDeparture, e);
            }
        }
        SolverOptions solverOptions = new SolverOptions(Duration.ofSeconds(timeLimitSeconds),
                solver.getExhaustiveNodeLimit(), solver.getStallLimit(), solver.getPenaltyCoefficient());
        return new PlanOptions(averageSpeedKph, startIndex, departure, weather.toThresholds(), solverOptions);
    }

    // --- Getters and Setters ---
    public double getAverageSpeedKph() { return averageSpeedKph; }
    public void setAverageSpeedKph(double averageSpeedKph) { this.averageSpeedKph = averageSpeedKph; }
    public long getTimeLimitSeconds() { return timeLimitSeconds; }
    public void setTimeLimitSeconds(long timeLimitSeconds) { this.timeLimitSeconds = timeLimitSeconds; }
    public int getStartIndex() { return startIndex; }
    public void setStartIndex(int startIndex) { this.startIndex = startIndex; }
    public String getStopFile() { return stopFile; }
    public void setStopFile(String stopFile) { this.stopFile = stopFile; }
    public String getDefaultDeparture() { return defaultDeparture; }
    public void setDefaultDeparture(String defaultDeparture) { this.defaultDeparture = defaultDeparture; }
    public Weather getWeather() { return weather; }
    public void setWeather(Weather weather) { this.weather = weather; }
    public Solver getSolver() { return solver; }
    public void setSolver(Solver solver) { this.solver = solver; }

    /**
     * 날씨 지연 계수 규칙. 기본값은 비 0.5/5.0mm, 눈 0.1/1.0cm, 풍속 30km/h, 돌풍 50km/h.
     */
    public static class Weather {
        private double lightRainMm = 0.5;
        private double lightRainPenalty = 0.10;
        private double heavyRainMm = 5.0;
        private double heavyRainPenalty = 0.10;
        private double lightSnowCm = 0.1;
        private double lightSnowPenalty = 0.20;
        private double heavySnowCm = 1.0;
        private double heavySnowPenalty = 0.30;
        private double windKph = 30;
        private double windPenalty = 0.05;
        private double gustKph = 50;
        private double gustPenalty = 0.10;
        private int maxConcurrentRequests = 4;

        public WeatherThresholds toThresholds() {
            return new WeatherThresholds(lightRainMm, lightRainPenalty, heavyRainMm, heavyRainPenalty,
                    lightSnowCm, lightSnowPenalty, heavySnowCm, heavySnowPenalty,
                    windKph, windPenalty, gustKph, gustPenalty);
        }

        public double getLightRainMm() { return lightRainMm; }
        public void setLightRainMm(double lightRainMm) { this.lightRainMm = lightRainMm; }
        public double getLightRainPenalty() { return lightRainPenalty; }
        public void setLightRainPenalty(double lightRainPenalty) { this.lightRainPenalty = lightRainPenalty; }
        public double getHeavyRainMm() { return heavyRainMm; }
        public void setHeavyRainMm(double heavyRainMm) { this.heavyRainMm = heavyRainMm; }
        public double getHeavyRainPenalty() { return heavyRainPenalty; }
        public void setHeavyRainPenalty(double heavyRainPenalty) { this.heavyRainPenalty = heavyRainPenalty; }
        public double getLightSnowCm() { return lightSnowCm; }
        public void setLightSnowCm(double lightSnowCm) { this.lightSnowCm = lightSnowCm; }
        public double getLightSnowPenalty() { return lightSnowPenalty; }
        public void setLightSnowPenalty(double lightSnowPenalty) { this.lightSnowPenalty = lightSnowPenalty; }
        public double getHeavySnowCm() { return heavySnowCm; }
        public void setHeavySnowCm(double heavySnowCm) { this.heavySnowCm = heavySnowCm; }
        public double getHeavySnowPenalty() { return heavySnowPenalty; }
        public void setHeavySnowPenalty(double heavySnowPenalty) { this.heavySnowPenalty = heavySnowPenalty; }
        public double getWindKph() { return windKph; }
        public void setWindKph(double windKph) { this.windKph = windKph; }
        public double getWindPenalty() { return windPenalty; }
        public void setWindPenalty(double windPenalty) { this.windPenalty = windPenalty; }
        public double getGustKph() { return gustKph; }
        public void setGustKph(double gustKph) { this.gustKph = gustKph; }
        public double getGustPenalty() { return gustPenalty; }
        public void setGustPenalty(double gustPenalty) { this.gustPenalty = gustPenalty; }
        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }
    }

    public static class Solver {
        private int exhaustiveNodeLimit = 9;
        private int stallLimit = 200;
        private double penaltyCoefficient = 0.1;

        public int getExhaustiveNodeLimit() { return exhaustiveNodeLimit; }
        public void setExhaustiveNodeLimit(int exhaustiveNodeLimit) { this.exhaustiveNodeLimit = exhaustiveNodeLimit; }
        public int getStallLimit() { return stallLimit; }
        public void setStallLimit(int stallLimit) { this.stallLimit = stallLimit; }
        public double getPenaltyCoefficient() { return penaltyCoefficient; }
        public void setPenaltyCoefficient(double penaltyCoefficient) { this.penaltyCoefficient = penaltyCoefficient; }
    }
}
