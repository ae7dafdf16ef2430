package com.riansoft.weather_tsp.solver;

import com.riansoft.weather_tsp.exception.NoFeasibleTourException;

/**
 * 탐색 내부에서 쓰는 정수 비용 도우미. 분 단위 값에 100을 곱해 반올림합니다.
 */
final class TourCosts {

    static final double SCALE = 100.0;

    private TourCosts() {
    }

    // 경로 합과 벌점 가산이 long 범위 안에 머물도록 간선 하나의 비용 상한을 둡니다.
    static long maxEdgeCost(int n) {
        return Long.MAX_VALUE / (4L * (n + 1));
    }

    static long[][] scale(double[][] minutes) {
        int n = minutes.length;
        long limit = maxEdgeCost(n);
        long[][] scaled = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double value = minutes[i][j] * SCALE;
                if (value > limit) {
                    throw new NoFeasibleTourException(String.format(
                            "정류장 %d -> %d 이동 시간(%s분)이 너무 커서 경로를 계산할 수 없습니다.", i, j, minutes[i][j]));
                }
                scaled[i][j] = Math.round(value);
            }
        }
        return scaled;
    }

    // route 는 출발 노드로 시작하며 마지막 노드에서 출발 노드로 닫힙니다.
    static long routeCost(long[][] cost, int[] route) {
        long total = 0;
        for (int i = 0; i < route.length; i++) {
            total += cost[route[i]][route[(i + 1) % route.length]];
        }
        return total;
    }

    static boolean deadlinePassed(long deadlineNanos) {
        return System.nanoTime() - deadlineNanos >= 0;
    }
}
