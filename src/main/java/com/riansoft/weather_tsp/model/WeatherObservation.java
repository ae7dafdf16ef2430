package com.riansoft.weather_tsp.model;

/**
 * 특정 위치, 특정 시각(UTC 정시)의 예보값.
 */
public class WeatherObservation {
    public final double precipitationMm;
    public final double snowfallCm;
    public final double windSpeedKph;
    public final double windGustsKph;

    public WeatherObservation(double precipitationMm, double snowfallCm, double windSpeedKph, double windGustsKph) {
        this.precipitationMm = precipitationMm;
        this.snowfallCm = snowfallCm;
        this.windSpeedKph = windSpeedKph;
        this.windGustsKph = windGustsKph;
    }

    public static WeatherObservation calm() {
        return new WeatherObservation(0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return String.format("강수 %.1fmm, 적설 %.1fcm, 풍속 %.0fkm/h, 돌풍 %.0fkm/h",
                precipitationMm, snowfallCm, windSpeedKph, windGustsKph);
    }
}
