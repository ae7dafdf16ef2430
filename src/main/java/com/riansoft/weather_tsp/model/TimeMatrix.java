package com.riansoft.weather_tsp.model;

import java.util.Arrays;

/**
 * 정류장 간 이동 시간(분) 정사각 행렬. 생성 후에는 읽기 전용입니다.
 * <p>
 * 대각선은 0, 나머지 값은 0 이상이어야 합니다. 도로망 기반 제공자가 연결이 없는 구간을
 * 표시할 때만 {@link Double#POSITIVE_INFINITY} 를 허용하며, 이런 행렬은 솔버가 거부합니다.
 */
public class TimeMatrix {

    private final double[][] minutes;

    public TimeMatrix(double[][] minutes) {
        int n = minutes.length;
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (minutes[i] == null || minutes[i].length != n) {
                throw new IllegalArgumentException("시간 행렬은 정사각 행렬이어야 합니다. (행 " + i + ")");
            }
            for (int j = 0; j < n; j++) {
                double value = minutes[i][j];
                if (Double.isNaN(value) || value < 0) {
                    throw new IllegalArgumentException(
                            String.format("시간 행렬 값은 0 이상이어야 합니다: [%d][%d] = %s", i, j, value));
                }
                if (i == j && value != 0.0) {
                    throw new IllegalArgumentException("시간 행렬의 대각선은 0이어야 합니다. (인덱스 " + i + ")");
                }
            }
            copy[i] = Arrays.copyOf(minutes[i], n);
        }
        this.minutes = copy;
    }

    public int size() {
        return minutes.length;
    }

    public double get(int from, int to) {
        return minutes[from][to];
    }

    public boolean isSymmetric() {
        for (int i = 0; i < minutes.length; i++) {
            for (int j = i + 1; j < minutes.length; j++) {
                if (Double.compare(minutes[i][j], minutes[j][i]) != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    public double[][] toArray() {
        double[][] copy = new double[minutes.length][];
        for (int i = 0; i < minutes.length; i++) {
            copy[i] = Arrays.copyOf(minutes[i], minutes.length);
        }
        return copy;
    }
}
