package com.riansoft.weather_tsp.solver;

/**
 * 작은 인스턴스용 깊이 우선 전수 탐색. 부분 경로 비용이 현재 최선 이상이면 가지를 잘라냅니다.
 * 시간 제한에 걸리면 그때까지의 최선해를 남깁니다.
 */
final class ExhaustiveTourSearch {

    private static final int DEADLINE_CHECK_INTERVAL = 4096;

    private final long[][] cost;
    private final int n;
    private final int start;
    private final long deadlineNanos;

    private final int[] path;
    private final boolean[] visited;
    private int[] bestRoute;
    private long bestCost;
    private long expansions;
    private boolean deadlineReached;

    ExhaustiveTourSearch(long[][] cost, int start, long deadlineNanos) {
        this.cost = cost;
        this.n = cost.length;
        this.start = start;
        this.deadlineNanos = deadlineNanos;
        this.path = new int[n];
        this.visited = new boolean[n];
    }

    int[] search(int[] incumbent) {
        bestRoute = incumbent.clone();
        bestCost = TourCosts.routeCost(cost, incumbent);
        path[0] = start;
        visited[start] = true;
        extend(1, 0L);
        return bestRoute;
    }

    boolean isDeadlineReached() {
        return deadlineReached;
    }

    private void extend(int depth, long partialCost) {
        if (deadlineReached) return;
        if (++expansions % DEADLINE_CHECK_INTERVAL == 0 && TourCosts.deadlinePassed(deadlineNanos)) {
            deadlineReached = true;
            return;
        }
        int last = path[depth - 1];
        if (depth == n) {
            long total = partialCost + cost[last][start];
            if (total < bestCost) {
                bestCost = total;
                bestRoute = path.clone();
            }
            return;
        }
        for (int candidate = 0; candidate < n; candidate++) {
            if (visited[candidate]) continue;
            long nextCost = partialCost + cost[last][candidate];
            if (nextCost >= bestCost) continue;
            visited[candidate] = true;
            path[depth] = candidate;
            extend(depth + 1, nextCost);
            visited[candidate] = false;
        }
    }
}
