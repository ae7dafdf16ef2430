package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.dto.OpenMeteoForecastDto;
import com.riansoft.weather_tsp.exception.WeatherProviderException;
import com.riansoft.weather_tsp.model.WeatherObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Open-Meteo 예보 API(키 불필요)로 시간별 강수, 적설, 풍속, 돌풍 값을 조회합니다.
 */
@Service
public class OpenMeteoApiService implements WeatherProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoApiService.class);

    static final String HOURLY_FIELDS = "precipitation,snowfall,wind_speed_10m,wind_gusts_10m";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter HOUR_BUCKET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:00");

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public OpenMeteoApiService(RestTemplateBuilder builder,
                               @Value("${open-meteo.api.base-url}") String baseUrl,
                               @Value("${open-meteo.api.timeout-seconds:20}") long timeoutSeconds) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<WeatherObservation> hourlyObservation(double lat, double lon, OffsetDateTime utcHour) {
        OffsetDateTime hour = utcHour.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.HOURS);
        String date = hour.format(DATE_FORMAT);
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("latitude", lat)
                .queryParam("longitude", lon)
                .queryParam("hourly", HOURLY_FIELDS)
                .queryParam("start_date", date)
                .queryParam("end_date", date)
                .queryParam("timezone", "UTC")
                .build()
                .toUriString();

        OpenMeteoForecastDto body;
        try {
            log.debug("[API LOG] 날씨 예보 조회: ({}, {}) {}", lat, lon, hour);
            body = restTemplate.getForObject(url, OpenMeteoForecastDto.class);
        } catch (RestClientException e) {
            throw new WeatherProviderException(
                    String.format("Open-Meteo 호출 실패: (%s, %s) %s | 원인: %s", lat, lon, date, e.getMessage()), e);
        }
        if (body == null || body.getHourly() == null) {
            throw new WeatherProviderException(
                    String.format("Open-Meteo 응답에 hourly 블록이 없습니다: (%s, %s) %s", lat, lon, date));
        }
        return findObservation(body.getHourly(), hour);
    }

    /**
     * 응답의 시간 목록에서 요청 시각 구간을 찾아 예보값을 꺼냅니다. 값이 비어 있으면 0으로 봅니다.
     */
    static Optional<WeatherObservation> findObservation(OpenMeteoForecastDto.Hourly hourly, OffsetDateTime utcHour) {
        List<String> times = hourly.getTime();
        if (times == null) {
            return Optional.empty();
        }
        int idx = times.indexOf(utcHour.format(HOUR_BUCKET_FORMAT));
        if (idx < 0) {
            return Optional.empty();
        }
        return Optional.of(new WeatherObservation(
                valueAt(hourly.getPrecipitation(), idx),
                valueAt(hourly.getSnowfall(), idx),
                valueAt(hourly.getWindSpeed10m(), idx),
                valueAt(hourly.getWindGusts10m(), idx)));
    }

    private static double valueAt(List<Double> series, int idx) {
        if (series == null || idx >= series.size() || series.get(idx) == null) {
            return 0.0;
        }
        return series.get(idx);
    }
}
