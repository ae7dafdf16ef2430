package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.exception.WeatherProviderException;
import com.riansoft.weather_tsp.model.PlanOptions;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.model.WeatherLookup;
import com.riansoft.weather_tsp.model.WeatherObservation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherFactorServiceTest {

    private static final OffsetDateTime DEPARTURE = OffsetDateTime.parse("2025-11-10T08:00:00-05:00");
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-11-12T17:42:10Z"), ZoneOffset.UTC);

    private final Map<Double, OffsetDateTime> requestedHours = new ConcurrentHashMap<>();
    private WeatherFactorService factorService;

    @AfterEach
    void tearDown() {
        if (factorService != null) {
            factorService.shutdown();
        }
    }

    private WeatherFactorService serviceWith(WeatherProvider provider) {
        factorService = new WeatherFactorService(provider, new WeatherPenaltyPolicy(), 4, FIXED_CLOCK);
        return factorService;
    }

    private List<Stop> exampleStops() {
        return List.of(
                new Stop("ST_0", "Depot", 41.1176, -85.0689, DEPARTURE),
                new Stop("ST_1", "Stop A", 41.1802, -84.9960, OffsetDateTime.parse("2025-11-10T08:15:00-05:00")),
                new Stop("ST_2", "Stop B", 41.0953, -85.1394, null),
                new Stop("ST_3", "Stop C", 41.2281, -85.0111, OffsetDateTime.parse("2025-11-10T09:45:00-05:00")));
    }

    @Test
    @DisplayName("예보가 있으면 규칙에 따라 계수가 정해지고 정류장 순서대로 반환된다")
    void resolvesFactorsInStopOrder() {
        WeatherFactorService service = serviceWith((lat, lon, hour) -> {
            if (lat == 41.1802) return Optional.of(new WeatherObservation(6.0, 0, 0, 0));
            if (lat == 41.2281) return Optional.of(new WeatherObservation(0, 0.5, 35, 0));
            return Optional.of(WeatherObservation.calm());
        });

        List<WeatherLookup> lookups = service.resolveFactors(exampleStops(), PlanOptions.defaults());

        assertEquals(4, lookups.size());
        assertEquals(1.0, lookups.get(0).factor, 1e-9);
        assertEquals(1.2, lookups.get(1).factor, 1e-9);
        assertEquals(1.0, lookups.get(2).factor, 1e-9);
        assertEquals(1.25, lookups.get(3).factor, 1e-9);
        lookups.forEach(lookup -> assertEquals(WeatherLookup.Status.RESOLVED, lookup.status));
    }

    @Test
    @DisplayName("도착 시각은 UTC 정시로 맞추고, 없는 정류장은 첫 정류장 시각을 사용한다")
    void resolvesArrivalHours() {
        WeatherFactorService service = serviceWith((lat, lon, hour) -> {
            requestedHours.put(lat, hour);
            return Optional.of(WeatherObservation.calm());
        });

        List<WeatherLookup> lookups = service.resolveFactors(exampleStops(), PlanOptions.defaults());

        assertEquals(OffsetDateTime.parse("2025-11-10T13:00Z"), requestedHours.get(41.1176));
        assertEquals(OffsetDateTime.parse("2025-11-10T13:00Z"), requestedHours.get(41.1802));
        assertEquals(OffsetDateTime.parse("2025-11-10T13:00Z"), requestedHours.get(41.0953));
        assertEquals(OffsetDateTime.parse("2025-11-10T14:00Z"), requestedHours.get(41.2281));
        assertEquals(OffsetDateTime.parse("2025-11-10T14:00Z"), lookups.get(3).requestedHourUtc);
    }

    @Test
    @DisplayName("첫 정류장에도 시각이 없으면 설정된 기본 출발 시각, 그마저 없으면 현재 시각을 사용한다")
    void fallbackDepartureChain() {
        WeatherFactorService service = serviceWith((lat, lon, hour) -> {
            requestedHours.put(lat, hour);
            return Optional.of(WeatherObservation.calm());
        });
        List<Stop> untimed = List.of(new Stop("ST_0", "Depot", 41.1176, -85.0689),
                new Stop("ST_1", "Stop A", 41.1802, -84.9960));

        service.resolveFactors(untimed, PlanOptions.defaults()
                .withDefaultDeparture(OffsetDateTime.parse("2025-11-10T07:30:00-05:00")));
        assertEquals(OffsetDateTime.parse("2025-11-10T12:00Z"), requestedHours.get(41.1802));

        service.resolveFactors(untimed, PlanOptions.defaults());
        assertEquals(OffsetDateTime.parse("2025-11-12T17:00Z"), requestedHours.get(41.1802));
    }

    @Test
    @DisplayName("날씨 서비스에 접속할 수 없으면 계수는 정확히 1.0이고 조회 실패로 표시된다")
    void providerFailureIsNeutral() {
        WeatherFactorService service = serviceWith((lat, lon, hour) -> {
            throw new WeatherProviderException("Connection refused");
        });

        List<WeatherLookup> lookups = service.resolveFactors(exampleStops(), PlanOptions.defaults());

        for (WeatherLookup lookup : lookups) {
            assertEquals(1.0, lookup.factor);
            assertEquals(WeatherLookup.Status.PROVIDER_FAILURE, lookup.status);
            assertTrue(lookup.isDegraded());
            assertTrue(lookup.detail.contains("Connection refused"));
        }
    }

    @Test
    @DisplayName("요청 시각 구간이 없으면 중립 계수와 MISSING_HOUR 로 구분된다")
    void missingHourIsNeutral() {
        WeatherFactorService service = serviceWith((lat, lon, hour) ->
                lat == 41.0953 ? Optional.empty() : Optional.of(new WeatherObservation(0, 0, 0, 80)));

        List<WeatherLookup> lookups = service.resolveFactors(exampleStops(), PlanOptions.defaults());

        assertEquals(WeatherLookup.Status.MISSING_HOUR, lookups.get(2).status);
        assertEquals(1.0, lookups.get(2).factor);
        assertEquals(WeatherLookup.Status.RESOLVED, lookups.get(0).status);
        assertEquals(1.1, lookups.get(0).factor, 1e-9);
        assertFalse(lookups.get(0).isDegraded());
    }

    @Test
    @DisplayName("정류장별 조회는 동시에 실행된다")
    void lookupsRunConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(3);
        WeatherFactorService service = serviceWith((lat, lon, hour) -> {
            allStarted.countDown();
            try {
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                    throw new WeatherProviderException("다른 조회가 동시에 시작되지 않았습니다.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WeatherProviderException("interrupted", e);
            }
            return Optional.of(WeatherObservation.calm());
        });

        List<WeatherLookup> lookups = service.resolveFactors(exampleStops().subList(0, 3), PlanOptions.defaults());

        lookups.forEach(lookup -> assertEquals(WeatherLookup.Status.RESOLVED, lookup.status));
    }

    @Test
    @DisplayName("제공자 실패가 아닌 예외(버그)는 삼키지 않고 그대로 전파된다")
    void unexpectedErrorsPropagate() {
        WeatherFactorService service = serviceWith((lat, lon, hour) -> {
            throw new IllegalStateException("bug");
        });

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> service.resolveFactors(exampleStops(), PlanOptions.defaults()));
        assertEquals("bug", e.getMessage());
    }
}
