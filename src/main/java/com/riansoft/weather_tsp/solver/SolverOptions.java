package com.riansoft.weather_tsp.solver;

import java.time.Duration;

/**
 * 순회 경로 탐색 파라미터.
 */
public class SolverOptions {

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(10);
    /** 탐색 시간 제한의 상한. 이보다 긴 값은 이 값으로 잘라 씁니다. */
    public static final Duration MAX_TIME_LIMIT = Duration.ofHours(24);

    public final Duration timeLimit;
    /** 이 노드 수 이하의 인스턴스는 전수 탐색으로 최적해를 구합니다. */
    public final int exhaustiveNodeLimit;
    /** 최선해 갱신 없이 연속으로 허용하는 지역 최적점 횟수. */
    public final int stallLimit;
    /** 유도 지역 탐색의 lambda 계수. */
    public final double penaltyCoefficient;

    public SolverOptions(Duration timeLimit, int exhaustiveNodeLimit, int stallLimit, double penaltyCoefficient) {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("탐색 시간 제한은 0보다 커야 합니다: " + timeLimit);
        }
        if (stallLimit < 1) {
            throw new IllegalArgumentException("stallLimit 는 1 이상이어야 합니다: " + stallLimit);
        }
        if (!(penaltyCoefficient > 0)) {
            throw new IllegalArgumentException("penaltyCoefficient 는 0보다 커야 합니다: " + penaltyCoefficient);
        }
        this.timeLimit = timeLimit;
        this.exhaustiveNodeLimit = exhaustiveNodeLimit;
        this.stallLimit = stallLimit;
        this.penaltyCoefficient = penaltyCoefficient;
    }

    /**
     * 실제 탐색에 쓰는 시간 예산(나노초). {@link #MAX_TIME_LIMIT} 를 넘지 않습니다.
     */
    public long searchBudgetNanos() {
        return timeLimit.compareTo(MAX_TIME_LIMIT) > 0 ? MAX_TIME_LIMIT.toNanos() : timeLimit.toNanos();
    }

    public static SolverOptions defaults() {
        return new SolverOptions(DEFAULT_TIME_LIMIT, 9, 200, 0.1);
    }

    public SolverOptions withTimeLimit(Duration newTimeLimit) {
        return new SolverOptions(newTimeLimit, exhaustiveNodeLimit, stallLimit, penaltyCoefficient);
    }

    public SolverOptions withExhaustiveNodeLimit(int newLimit) {
        return new SolverOptions(timeLimit, newLimit, stallLimit, penaltyCoefficient);
    }

    public SolverOptions withStallLimit(int newStallLimit) {
        return new SolverOptions(timeLimit, exhaustiveNodeLimit, newStallLimit, penaltyCoefficient);
    }
}
