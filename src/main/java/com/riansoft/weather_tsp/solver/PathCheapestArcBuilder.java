package com.riansoft.weather_tsp.solver;

/**
 * 출발 노드에서 시작해 현재 경로 끝에서 가장 싼 간선으로 이어지는 미방문 노드를 하나씩 붙여
 * 초기 경로를 만듭니다. 동률이면 인덱스가 작은 노드를 고릅니다.
 */
final class PathCheapestArcBuilder {

    private PathCheapestArcBuilder() {
    }

    static int[] build(long[][] cost, int start) {
        int n = cost.length;
        int[] route = new int[n];
        boolean[] visited = new boolean[n];
        route[0] = start;
        visited[start] = true;
        int last = start;
        for (int position = 1; position < n; position++) {
            int next = -1;
            for (int candidate = 0; candidate < n; candidate++) {
                if (visited[candidate]) continue;
                if (next < 0 || cost[last][candidate] < cost[last][next]) {
                    next = candidate;
                }
            }
            route[position] = next;
            visited[next] = true;
            last = next;
        }
        return route;
    }
}
