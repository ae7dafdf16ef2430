package com.riansoft.weather_tsp.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 유도 지역 탐색 (Guided Local Search).
 * <p>
 * 지역 탐색은 2-opt 구간 뒤집기와 or-opt 구간 재배치(1~3개 노드)를
 * cost + lambda * penalty 기준의 첫 개선 규칙으로 적용합니다. 비대칭 행렬이므로 2-opt 는
 * 뒤집힌 구간 내부의 방향 비용까지 다시 계산합니다. 지역 최적점에 도달하면 현재 경로에서
 * 효용 cost / (1 + penalty) 가 가장 큰 간선의 벌점을 1 올리고 탐색을 이어갑니다.
 * 최선해 판정은 벌점을 뺀 실제 비용으로 합니다.
 */
final class GuidedLocalSearch {

    private static final Logger log = LoggerFactory.getLogger(GuidedLocalSearch.class);

    private static final int MAX_SEGMENT_LENGTH = 3;

    private final long[][] cost;
    private final int n;
    private final int[][] penalties;
    private final double penaltyCoefficient;
    private final long deadlineNanos;

    private long lambda;
    private int penaltyRounds;
    private boolean deadlineReached;

    GuidedLocalSearch(long[][] cost, double penaltyCoefficient, long deadlineNanos) {
        this.cost = cost;
        this.n = cost.length;
        this.penalties = new int[n][n];
        this.penaltyCoefficient = penaltyCoefficient;
        this.deadlineNanos = deadlineNanos;
    }

    int[] search(int[] initial, int stallLimit) {
        int[] current = initial.clone();
        int[] best = initial.clone();
        long bestCost = TourCosts.routeCost(cost, best);
        int stalledRounds = 0;

        while (true) {
            boolean improvedBest = false;
            while (improve(current)) {
                long currentCost = TourCosts.routeCost(cost, current);
                if (currentCost < bestCost) {
                    bestCost = currentCost;
                    best = current.clone();
                    improvedBest = true;
                }
            }
            if (deadlineReached) {
                break;
            }
            stalledRounds = improvedBest ? 0 : stalledRounds + 1;
            if (stalledRounds >= stallLimit) {
                log.debug("[SOLVER] {}회 연속 개선 없음, 탐색 종료", stalledRounds);
                break;
            }
            if (lambda == 0) {
                lambda = Math.max(1L, Math.round(penaltyCoefficient * TourCosts.routeCost(cost, current) / n));
            }
            penalizeMaxUtilityEdges(current);
            penaltyRounds++;
        }
        log.debug("[SOLVER] GLS 종료: 벌점 라운드 {}회, 최선 비용 {}", penaltyRounds, bestCost);
        return best;
    }

    int getPenaltyRounds() {
        return penaltyRounds;
    }

    boolean isDeadlineReached() {
        return deadlineReached;
    }

    long augmented(int from, int to) {
        return cost[from][to] + lambda * penalties[from][to];
    }

    /**
     * 개선 이동을 하나 찾아 route 에 적용하면 true.
     */
    boolean improve(int[] route) {
        return twoOpt(route) || orOpt(route);
    }

    private boolean twoOpt(int[] route) {
        for (int i = 1; i < n - 1; i++) {
            if (TourCosts.deadlinePassed(deadlineNanos)) {
                deadlineReached = true;
                return false;
            }
            int prev = route[i - 1];
            int first = route[i];
            long forward = 0;
            long reversed = 0;
            for (int j = i + 1; j < n; j++) {
                forward += augmented(route[j - 1], route[j]);
                reversed += augmented(route[j], route[j - 1]);
                int last = route[j];
                int next = route[(j + 1) % n];
                long delta = augmented(prev, last) + augmented(first, next) + reversed
                        - augmented(prev, first) - augmented(last, next) - forward;
                if (delta < 0) {
                    reverse(route, i, j);
                    return true;
                }
            }
        }
        return false;
    }

    private boolean orOpt(int[] route) {
        int maxLength = Math.min(MAX_SEGMENT_LENGTH, n - 2);
        for (int length = 1; length <= maxLength; length++) {
            for (int i = 1; i + length <= n; i++) {
                if (TourCosts.deadlinePassed(deadlineNanos)) {
                    deadlineReached = true;
                    return false;
                }
                int segmentEnd = i + length - 1;
                int prev = route[i - 1];
                int segFirst = route[i];
                int segLast = route[segmentEnd];
                int next = route[(segmentEnd + 1) % n];
                long removalGain = augmented(prev, segFirst) + augmented(segLast, next) - augmented(prev, next);
                for (int p = 0; p < n; p++) {
                    if (p >= i - 1 && p <= segmentEnd) continue;
                    int a = route[p];
                    int b = route[(p + 1) % n];
                    long delta = augmented(a, segFirst) + augmented(segLast, b) - augmented(a, b) - removalGain;
                    if (delta < 0) {
                        relocate(route, i, length, p);
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private void penalizeMaxUtilityEdges(int[] route) {
        double maxUtility = -1;
        for (int k = 0; k < n; k++) {
            int from = route[k];
            int to = route[(k + 1) % n];
            maxUtility = Math.max(maxUtility, utility(from, to));
        }
        for (int k = 0; k < n; k++) {
            int from = route[k];
            int to = route[(k + 1) % n];
            if (utility(from, to) == maxUtility) {
                penalties[from][to]++;
            }
        }
    }

    private double utility(int from, int to) {
        return cost[from][to] / (1.0 + penalties[from][to]);
    }

    static void reverse(int[] route, int i, int j) {
        while (i < j) {
            int tmp = route[i];
            route[i] = route[j];
            route[j] = tmp;
            i++;
            j--;
        }
    }

    // route[i .. i+length-1] 구간을 떼어내 route[p] 바로 뒤에 끼웁니다. p 는 구간 밖이어야 합니다.
    static void relocate(int[] route, int i, int length, int p) {
        int[] moved = new int[route.length];
        int k = 0;
        for (int q = 0; q < route.length; q++) {
            if (q >= i && q < i + length) continue;
            moved[k++] = route[q];
            if (q == p) {
                for (int s = 0; s < length; s++) {
                    moved[k++] = route[i + s];
                }
            }
        }
        System.arraycopy(moved, 0, route, 0, route.length);
    }
}
