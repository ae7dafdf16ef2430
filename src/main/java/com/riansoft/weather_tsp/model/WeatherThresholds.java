package com.riansoft.weather_tsp.model;

/**
 * 예보값을 지연 계수로 바꾸는 임계값과 가산치. 각 임계값은 독립적으로 누적됩니다.
 */
public class WeatherThresholds {
    public final double lightRainMm;
    public final double lightRainPenalty;
    public final double heavyRainMm;
    public final double heavyRainPenalty;
    public final double lightSnowCm;
    public final double lightSnowPenalty;
    public final double heavySnowCm;
    public final double heavySnowPenalty;
    public final double windKph;
    public final double windPenalty;
    public final double gustKph;
    public final double gustPenalty;

    public WeatherThresholds(double lightRainMm, double lightRainPenalty, double heavyRainMm, double heavyRainPenalty,
                             double lightSnowCm, double lightSnowPenalty, double heavySnowCm, double heavySnowPenalty,
                             double windKph, double windPenalty, double gustKph, double gustPenalty) {
        requireNonNegative("lightRainPenalty", lightRainPenalty);
        requireNonNegative("heavyRainPenalty", heavyRainPenalty);
        requireNonNegative("lightSnowPenalty", lightSnowPenalty);
        requireNonNegative("heavySnowPenalty", heavySnowPenalty);
        requireNonNegative("windPenalty", windPenalty);
        requireNonNegative("gustPenalty", gustPenalty);
        this.lightRainMm = lightRainMm;
        this.lightRainPenalty = lightRainPenalty;
        this.heavyRainMm = heavyRainMm;
        this.heavyRainPenalty = heavyRainPenalty;
        this.lightSnowCm = lightSnowCm;
        this.lightSnowPenalty = lightSnowPenalty;
        this.heavySnowCm = heavySnowCm;
        this.heavySnowPenalty = heavySnowPenalty;
        this.windKph = windKph;
        this.windPenalty = windPenalty;
        this.gustKph = gustKph;
        this.gustPenalty = gustPenalty;
    }

    public static WeatherThresholds defaults() {
        return new WeatherThresholds(0.5, 0.10, 5.0, 0.10,
                0.1, 0.20, 1.0, 0.30,
                30, 0.05, 50, 0.10);
    }

    private static void requireNonNegative(String name, double penalty) {
        // 가산치가 음수이면 계수가 1.0 아래로 내려갈 수 있습니다.
        if (!(penalty >= 0)) {
            throw new IllegalArgumentException(name + " 는 0 이상이어야 합니다: " + penalty);
        }
    }
}
