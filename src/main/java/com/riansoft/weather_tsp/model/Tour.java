package com.riansoft.weather_tsp.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 출발 정류장에서 시작해 모든 정류장을 한 번씩 방문하고 다시 출발 정류장으로 돌아오는 순서.
 * totalMinutes 는 날씨 보정 행렬의 원래(스케일하지 않은) 값을 합산한 값입니다.
 */
public class Tour {
    private final List<Integer> order;
    private final double totalMinutes;

    public Tour(List<Integer> order, double totalMinutes) {
        if (order.size() < 2 || !order.get(0).equals(order.get(order.size() - 1))) {
            throw new IllegalArgumentException("순회 경로는 같은 정류장에서 시작하고 끝나야 합니다: " + order);
        }
        this.order = Collections.unmodifiableList(new ArrayList<>(order));
        this.totalMinutes = totalMinutes;
    }

    public static Tour of(int[] route, TimeMatrix matrix) {
        List<Integer> order = new ArrayList<>(route.length + 1);
        double total = 0;
        for (int i = 0; i < route.length; i++) {
            order.add(route[i]);
            total += matrix.get(route[i], route[(i + 1) % route.length]);
        }
        order.add(route[0]);
        return new Tour(order, total);
    }

    public List<Integer> getOrder() {
        return order;
    }

    public int getStartIndex() {
        return order.get(0);
    }

    public double getTotalMinutes() {
        return totalMinutes;
    }

    @Override
    public String toString() {
        return order + String.format(" (%.1f분)", totalMinutes);
    }
}
