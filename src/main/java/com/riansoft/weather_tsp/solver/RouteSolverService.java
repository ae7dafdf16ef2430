package com.riansoft.weather_tsp.solver;

import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.exception.NoFeasibleTourException;
import com.riansoft.weather_tsp.model.TimeMatrix;
import com.riansoft.weather_tsp.model.Tour;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 날씨 보정 시간 행렬 위에서 출발 정류장으로 돌아오는 저비용 순회 경로를 찾습니다.
 * <p>
 * 초기해는 path-cheapest-arc 로 만들고, 노드 수가 작으면 전수 탐색으로, 그 외에는 유도 지역 탐색으로
 * 개선합니다. 반환되는 경로는 초기해보다 나쁘지 않으며 시간 제한에 걸려도 최선해를 돌려줍니다.
 */
@Service
public class RouteSolverService {

    private static final Logger log = LoggerFactory.getLogger(RouteSolverService.class);

    public SolverResult solve(TimeMatrix matrix, int startIndex, SolverOptions options) {
        long startedAt = System.nanoTime();
        int n = matrix.size();
        if (n == 0) {
            throw new NoFeasibleTourException("정류장이 없어 순회 경로를 만들 수 없습니다.");
        }
        if (startIndex < 0 || startIndex >= n) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_START_INDEX,
                    String.format("출발 정류장 인덱스 %d 가 범위(0~%d)를 벗어났습니다.", startIndex, n - 1));
        }
        requireConnected(matrix);

        if (n == 1) {
            return new SolverResult(new Tour(List.of(startIndex, startIndex), 0.0), 0.0,
                    SolverResult.Strategy.TRIVIAL, elapsedMillis(startedAt), false, 0);
        }
        if (n == 2) {
            Tour roundTrip = Tour.of(new int[]{startIndex, 1 - startIndex}, matrix);
            return new SolverResult(roundTrip, roundTrip.getTotalMinutes(),
                    SolverResult.Strategy.TRIVIAL, elapsedMillis(startedAt), false, 0);
        }

        // nanoTime 비교는 차이로 하므로 예산이 상한 이내이면 덧셈이 넘쳐도 안전합니다.
        long deadlineNanos = startedAt + options.searchBudgetNanos();
        long[][] cost = TourCosts.scale(matrix.toArray());
        int[] initial = PathCheapestArcBuilder.build(cost, startIndex);
        double initialMinutes = Tour.of(initial, matrix).getTotalMinutes();
        log.info("[SOLVER] 초기 경로(path cheapest arc) 비용: {}분", String.format("%.1f", initialMinutes));

        int[] best;
        SolverResult.Strategy strategy;
        boolean timeBudgetExhausted;
        int penaltyRounds = 0;
        if (n <= options.exhaustiveNodeLimit) {
            ExhaustiveTourSearch exhaustive = new ExhaustiveTourSearch(cost, startIndex, deadlineNanos);
            best = exhaustive.search(initial);
            strategy = SolverResult.Strategy.EXHAUSTIVE;
            timeBudgetExhausted = exhaustive.isDeadlineReached();
        } else {
            log.info("[SOLVER] 유도 지역 탐색 시작 (노드 {}개, 최대 {}초)", n, options.timeLimit.toSeconds());
            GuidedLocalSearch gls = new GuidedLocalSearch(cost, options.penaltyCoefficient, deadlineNanos);
            best = gls.search(initial, options.stallLimit);
            strategy = SolverResult.Strategy.GUIDED_LOCAL_SEARCH;
            timeBudgetExhausted = gls.isDeadlineReached();
            penaltyRounds = gls.getPenaltyRounds();
        }

        Tour tour = Tour.of(best, matrix);
        long elapsed = elapsedMillis(startedAt);
        if (timeBudgetExhausted) {
            log.info("[SOLVER] 시간 제한({}초) 도달, 현재까지의 최선해를 반환합니다.", options.timeLimit.toSeconds());
        }
        log.info("[SOLVER] 최적 경로 계산 완료: {} / {} ({}ms)", strategy, tour, elapsed);
        return new SolverResult(tour, initialMinutes, strategy, elapsed, timeBudgetExhausted, penaltyRounds);
    }

    private void requireConnected(TimeMatrix matrix) {
        for (int i = 0; i < matrix.size(); i++) {
            for (int j = 0; j < matrix.size(); j++) {
                if (Double.isInfinite(matrix.get(i, j))) {
                    throw new NoFeasibleTourException(
                            String.format("정류장 %d -> %d 구간이 연결되어 있지 않아 순회 경로를 만들 수 없습니다.", i, j));
                }
            }
        }
    }

    private long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
