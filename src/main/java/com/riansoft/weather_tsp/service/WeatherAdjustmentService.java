package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.model.TimeMatrix;
import com.riansoft.weather_tsp.model.WeatherLookup;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 기본 시간 행렬에 정류장별 날씨 계수를 적용합니다.
 * time(i -> j) = base(i -> j) * max(factor(i), factor(j)). 구간 도중의 날씨는 반영하지 않습니다.
 */
@Service
public class WeatherAdjustmentService {

    public TimeMatrix adjust(TimeMatrix base, List<Double> factors) {
        int n = base.size();
        if (factors.size() != n) {
            throw new IllegalArgumentException(
                    String.format("계수 개수(%d)가 행렬 크기(%d)와 다릅니다.", factors.size(), n));
        }
        for (int i = 0; i < n; i++) {
            Double factor = factors.get(i);
            if (factor == null || !(factor >= WeatherLookup.NEUTRAL_FACTOR) || factor.isInfinite()) {
                throw new IllegalArgumentException("날씨 계수는 1.0 이상의 유한한 값이어야 합니다: [" + i + "] = " + factor);
            }
        }

        double[][] adjusted = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j) continue;
                adjusted[i][j] = base.get(i, j) * Math.max(factors.get(i), factors.get(j));
            }
        }
        return new TimeMatrix(adjusted);
    }

    public TimeMatrix adjustWithLookups(TimeMatrix base, List<WeatherLookup> lookups) {
        return adjust(base, lookups.stream().map(lookup -> lookup.factor).toList());
    }
}
