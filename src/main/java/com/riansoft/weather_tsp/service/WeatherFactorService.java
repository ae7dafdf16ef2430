package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.config.PlannerProperties;
import com.riansoft.weather_tsp.exception.WeatherProviderException;
import com.riansoft.weather_tsp.model.PlanOptions;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.model.WeatherLookup;
import com.riansoft.weather_tsp.model.WeatherObservation;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 각 정류장의 예상 도착 시각에 맞춰 날씨 지연 계수를 조회합니다.
 * 정류장별 조회는 서로 독립적이므로 동시에 요청하고, 결과는 정류장 순서대로 다시 모읍니다.
 */
@Service
public class WeatherFactorService {

    private static final Logger log = LoggerFactory.getLogger(WeatherFactorService.class);

    private final WeatherProvider weatherProvider;
    private final WeatherPenaltyPolicy penaltyPolicy;
    private final ExecutorService executor;
    private final Clock clock;

    @Autowired
    public WeatherFactorService(WeatherProvider weatherProvider, WeatherPenaltyPolicy penaltyPolicy,
                                PlannerProperties properties) {
        this(weatherProvider, penaltyPolicy, properties.getWeather().getMaxConcurrentRequests(), Clock.systemUTC());
    }

    WeatherFactorService(WeatherProvider weatherProvider, WeatherPenaltyPolicy penaltyPolicy,
                         int maxConcurrentRequests, Clock clock) {
        this.weatherProvider = weatherProvider;
        this.penaltyPolicy = penaltyPolicy;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, maxConcurrentRequests), runnable -> {
            Thread thread = new Thread(runnable, "weather-lookup-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.clock = clock;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public List<WeatherLookup> resolveFactors(List<Stop> stops, PlanOptions options) {
        log.info("========= [3/5] 정류장별 날씨 계수 조회 시작 ({}곳) ==========", stops.size());
        OffsetDateTime fallbackArrival = resolveFallbackArrival(stops, options);

        List<CompletableFuture<WeatherLookup>> pending = new ArrayList<>(stops.size());
        for (Stop stop : stops) {
            OffsetDateTime arrival = stop.arrivalTime != null ? stop.arrivalTime : fallbackArrival;
            pending.add(CompletableFuture.supplyAsync(() -> lookup(stop, arrival, options), executor));
        }

        List<WeatherLookup> lookups = new ArrayList<>(stops.size());
        for (CompletableFuture<WeatherLookup> future : pending) {
            try {
                lookups.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }

        long degraded = lookups.stream().filter(WeatherLookup::isDegraded).count();
        log.info("========= [3/5] 날씨 계수 조회 완료 (추정치 {}곳) ==========", degraded);
        return lookups;
    }

    WeatherLookup lookup(Stop stop, OffsetDateTime arrival, PlanOptions options) {
        OffsetDateTime utcHour = toUtcHour(arrival);
        try {
            Optional<WeatherObservation> observation = weatherProvider.hourlyObservation(stop.lat, stop.lon, utcHour);
            if (observation.isEmpty()) {
                log.warn("  [WEATHER] '{}' {} 시각의 예보 구간이 없어 중립 계수(1.0)를 사용합니다.", stop.name, utcHour);
                return WeatherLookup.missingHour(utcHour);
            }
            double factor = penaltyPolicy.factorFor(observation.get(), options.thresholds);
            log.debug("  [WEATHER] '{}' {} -> {} (계수 {})", stop.name, utcHour, observation.get(), factor);
            return WeatherLookup.resolved(factor, utcHour, observation.get());
        } catch (WeatherProviderException e) {
            log.warn("  [WEATHER] '{}' 날씨 조회 실패, 중립 계수(1.0)를 사용합니다. 원인: {}", stop.name, e.getMessage());
            return WeatherLookup.providerFailure(utcHour, e.getMessage());
        }
    }

    private OffsetDateTime resolveFallbackArrival(List<Stop> stops, PlanOptions options) {
        if (!stops.isEmpty() && stops.get(0).arrivalTime != null) {
            return stops.get(0).arrivalTime;
        }
        if (options.defaultDeparture != null) {
            return options.defaultDeparture;
        }
        return OffsetDateTime.now(clock);
    }

    static OffsetDateTime toUtcHour(OffsetDateTime arrival) {
        return arrival.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.HOURS);
    }
}
