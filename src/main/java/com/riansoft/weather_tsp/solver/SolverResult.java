package com.riansoft.weather_tsp.solver;

import com.riansoft.weather_tsp.model.Tour;

/**
 * 솔버 실행 결과: 최종 순회 경로와 탐색 통계.
 */
public class SolverResult {

    public enum Strategy {
        TRIVIAL,
        EXHAUSTIVE,
        GUIDED_LOCAL_SEARCH
    }

    private final Tour tour;
    private final double initialMinutes;
    private final Strategy strategy;
    private final long elapsedMillis;
    private final boolean timeBudgetExhausted;
    private final int penaltyRounds;

    public SolverResult(Tour tour, double initialMinutes, Strategy strategy, long elapsedMillis,
                        boolean timeBudgetExhausted, int penaltyRounds) {
        this.tour = tour;
        this.initialMinutes = initialMinutes;
        this.strategy = strategy;
        this.elapsedMillis = elapsedMillis;
        this.timeBudgetExhausted = timeBudgetExhausted;
        this.penaltyRounds = penaltyRounds;
    }

    public Tour getTour() { return tour; }
    /** 초기 구성 경로의 비용 (분). */
    public double getInitialMinutes() { return initialMinutes; }
    public Strategy getStrategy() { return strategy; }
    public long getElapsedMillis() { return elapsedMillis; }
    /** 시간 제한 때문에 탐색이 중단되었는지 여부. 오류가 아니며 최선해는 그대로 반환됩니다. */
    public boolean isTimeBudgetExhausted() { return timeBudgetExhausted; }
    public int getPenaltyRounds() { return penaltyRounds; }
}
