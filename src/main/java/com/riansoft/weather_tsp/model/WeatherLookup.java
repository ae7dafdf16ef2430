package com.riansoft.weather_tsp.model;

import java.time.OffsetDateTime;

/**
 * 정류장 하나에 대한 날씨 계수 조회 결과.
 * RESOLVED 가 아니면 계수는 항상 중립값 1.0 이며, 결과 보고 시 추정치로 표시됩니다.
 */
public class WeatherLookup {

    public static final double NEUTRAL_FACTOR = 1.0;

    public enum Status {
        RESOLVED,
        MISSING_HOUR,
        PROVIDER_FAILURE
    }

    public final Status status;
    public final double factor;
    public final OffsetDateTime requestedHourUtc;
    public final String detail;

    private WeatherLookup(Status status, double factor, OffsetDateTime requestedHourUtc, String detail) {
        this.status = status;
        this.factor = factor;
        this.requestedHourUtc = requestedHourUtc;
        this.detail = detail;
    }

    public static WeatherLookup resolved(double factor, OffsetDateTime requestedHourUtc, WeatherObservation observation) {
        if (!(factor >= NEUTRAL_FACTOR)) {
            throw new IllegalArgumentException("날씨 계수는 1.0 이상이어야 합니다: " + factor);
        }
        return new WeatherLookup(Status.RESOLVED, factor, requestedHourUtc, observation.toString());
    }

    public static WeatherLookup missingHour(OffsetDateTime requestedHourUtc) {
        return new WeatherLookup(Status.MISSING_HOUR, NEUTRAL_FACTOR, requestedHourUtc,
                "요청 시각의 예보 구간 없음");
    }

    public static WeatherLookup providerFailure(OffsetDateTime requestedHourUtc, String cause) {
        return new WeatherLookup(Status.PROVIDER_FAILURE, NEUTRAL_FACTOR, requestedHourUtc, cause);
    }

    public boolean isDegraded() {
        return status != Status.RESOLVED;
    }
}
