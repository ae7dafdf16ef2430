package com.riansoft.weather_tsp.controller;

import com.riansoft.weather_tsp.config.PlannerProperties;
import com.riansoft.weather_tsp.dto.PlanRequestDto;
import com.riansoft.weather_tsp.dto.RouteSolutionDto;
import com.riansoft.weather_tsp.dto.StopDto;
import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.model.PlanOptions;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.service.RouteOptimizationService;
import com.riansoft.weather_tsp.service.StopDataService;
import com.riansoft.weather_tsp.solver.SolverOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api")
public class RouteController {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    private final RouteOptimizationService routeService;
    private final StopDataService stopDataService;
    private final PlannerProperties properties;

    @Autowired
    public RouteController(RouteOptimizationService routeService, StopDataService stopDataService,
                           PlannerProperties properties) {
        this.routeService = routeService;
        this.stopDataService = stopDataService;
        this.properties = properties;
    }

    /**
     * 설정된 정류장 파일로 최적 경로를 계산하여 반환합니다.
     */
    @GetMapping("/optimize-route")
    public ResponseEntity<RouteSolutionDto> getOptimalRoute(@RequestParam(required = false) Double speed,
                                                            @RequestParam(required = false) Long timeLimit,
                                                            @RequestParam(required = false) Integer start) {
        PlanOptions options = applyOverrides(properties.toPlanOptions(), speed, timeLimit, start);
        return ResponseEntity.ok(routeService.findOptimalRoutes(options));
    }

    /**
     * 요청 본문의 정류장 목록으로 최적 경로를 계산합니다.
     */
    @PostMapping("/optimize-route")
    public ResponseEntity<RouteSolutionDto> optimizeRoute(@RequestBody PlanRequestDto request) {
        List<Stop> stops = stopDataService.toStops(request.getStops());
        log.info("[CONTROLLER LOG] 경로 계획 요청 수신: 정류장 {}개", stops.size());
        PlanOptions options = applyOverrides(properties.toPlanOptions(), request.getAverageSpeedKph(),
                request.getTimeLimitSeconds(), request.getStartIndex());
        return ResponseEntity.ok(routeService.optimize(stops, options));
    }

    @GetMapping("/all-stops")
    public ResponseEntity<List<StopDto>> getAllStops() {
        return ResponseEntity.ok(stopDataService.getAllStopsAsDto(properties.getStopFile()));
    }

    private PlanOptions applyOverrides(PlanOptions options, Double speed, Long timeLimitSeconds, Integer start) {
        if (speed != null) {
            options = options.withAverageSpeedKph(speed);
        }
        if (timeLimitSeconds != null) {
            if (timeLimitSeconds <= 0 || timeLimitSeconds > SolverOptions.MAX_TIME_LIMIT.toSeconds()) {
                throw new InvalidInputException(InvalidInputException.Reason.INVALID_TIME_LIMIT,
                        String.format("탐색 시간 제한은 1~%d초 범위여야 합니다: %d",
                                SolverOptions.MAX_TIME_LIMIT.toSeconds(), timeLimitSeconds));
            }
            options = options.withTimeLimit(Duration.ofSeconds(timeLimitSeconds));
        }
        if (start != null) {
            options = options.withStartIndex(start);
        }
        return options;
    }
}
