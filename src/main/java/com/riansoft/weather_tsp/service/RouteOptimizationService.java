package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.config.PlannerProperties;
import com.riansoft.weather_tsp.dto.RouteSolutionDto;
import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.model.DataModel;
import com.riansoft.weather_tsp.model.PlanOptions;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.model.TimeMatrix;
import com.riansoft.weather_tsp.model.WeatherLookup;
import com.riansoft.weather_tsp.solver.RouteSolverService;
import com.riansoft.weather_tsp.solver.SolverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 좌표 -> 기본 시간 행렬 -> 날씨 계수 -> 보정 행렬 -> 순회 경로 순서로 계획 한 번을 실행합니다.
 */
@Service
public class RouteOptimizationService {

    private static final Logger log = LoggerFactory.getLogger(RouteOptimizationService.class);

    private final StopDataService stopDataService;
    private final TravelTimeMatrixProvider matrixProvider;
    private final WeatherFactorService weatherFactorService;
    private final WeatherAdjustmentService adjustmentService;
    private final RouteSolverService solverService;
    private final SolutionFormatterService solutionFormatterService;
    private final PlannerProperties properties;

    @Autowired
    public RouteOptimizationService(StopDataService stopDataService, TravelTimeMatrixProvider matrixProvider,
                                    WeatherFactorService weatherFactorService, WeatherAdjustmentService adjustmentService,
                                    RouteSolverService solverService, SolutionFormatterService solutionFormatterService,
                                    PlannerProperties properties) {
        this.stopDataService = stopDataService;
        this.matrixProvider = matrixProvider;
        this.weatherFactorService = weatherFactorService;
        this.adjustmentService = adjustmentService;
        this.solverService = solverService;
        this.solutionFormatterService = solutionFormatterService;
        this.properties = properties;
    }

    /**
     * 설정된 정류장 파일로 최적 경로를 계산합니다.
     */
    public RouteSolutionDto findOptimalRoutes(PlanOptions options) {
        log.info("========= [1/5] 정류장 데이터 로드 ({}) ==========", properties.getStopFile());
        List<Stop> stops = stopDataService.loadStops(properties.getStopFile());
        return optimize(stops, options);
    }

    public RouteSolutionDto optimize(List<Stop> stops, PlanOptions options) {
        validate(stops, options);

        log.info("========= [2/5] 기본 시간 행렬 생성 (정류장 {}개, 평균 {}km/h) ==========",
                stops.size(), options.averageSpeedKph);
        TimeMatrix baseMatrix = matrixProvider.buildBaseMatrix(stops, options.averageSpeedKph);

        List<WeatherLookup> lookups = weatherFactorService.resolveFactors(stops, options);

        log.info("========= [4/5] 날씨 보정 행렬 적용 ==========");
        TimeMatrix adjustedMatrix = adjustmentService.adjustWithLookups(baseMatrix, lookups);
        DataModel data = new DataModel(stops, baseMatrix, lookups, adjustedMatrix, options.startIndex);

        log.info("========= [5/5] 경로 최적화 계산 시작 (최대 {}초) ==========", options.getTimeLimit().toSeconds());
        SolverResult result = solverService.solve(adjustedMatrix, options.startIndex, options.solverOptions);

        RouteSolutionDto solution = solutionFormatterService.formatSolutionToDto(data, result);
        log.info("[RESULT]\n{}", solutionFormatterService.renderReport(solution));
        return solution;
    }

    // 네트워크 호출 전에 입력 오류를 모두 걸러냅니다.
    private void validate(List<Stop> stops, PlanOptions options) {
        if (stops == null || stops.isEmpty()) {
            throw new InvalidInputException(InvalidInputException.Reason.EMPTY_STOP_LIST,
                    "정류장 목록이 비어 있습니다. 최소 1개(출발 정류장)가 필요합니다.");
        }
        if (options.startIndex < 0 || options.startIndex >= stops.size()) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_START_INDEX,
                    String.format("출발 정류장 인덱스 %d 가 범위(0~%d)를 벗어났습니다.", options.startIndex, stops.size() - 1));
        }
        if (!(options.averageSpeedKph > 0) || Double.isInfinite(options.averageSpeedKph)) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_SPEED,
                    "평균 속도는 0보다 큰 유한한 값이어야 합니다: " + options.averageSpeedKph);
        }
    }
}
