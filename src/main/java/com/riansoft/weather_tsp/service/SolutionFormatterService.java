package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.dto.RouteSolutionDto;
import com.riansoft.weather_tsp.dto.StopDto;
import com.riansoft.weather_tsp.dto.StopFactorDto;
import com.riansoft.weather_tsp.model.DataModel;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.model.Tour;
import com.riansoft.weather_tsp.model.WeatherLookup;
import com.riansoft.weather_tsp.solver.SolverResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
public class SolutionFormatterService {

    /**
     * 솔버 결과를 방문 순서, 출발 기준 누적 이동 시간, 정류장별 날씨 계수를 담은 DTO 로 변환합니다.
     */
    public RouteSolutionDto formatSolutionToDto(DataModel data, SolverResult result) {
        Tour tour = result.getTour();
        List<Integer> order = tour.getOrder();

        List<StopDto> route = new ArrayList<>(order.size());
        double accumulatedMinutes = 0;
        for (int k = 0; k < order.size(); k++) {
            int nodeIndex = order.get(k);
            if (k > 0) {
                accumulatedMinutes += data.adjustedMatrix.get(order.get(k - 1), nodeIndex);
            }
            Stop stop = data.stops.get(nodeIndex);
            StopDto stopDto = new StopDto(stop.id, stop.name, stop.lat, stop.lon,
                    stop.arrivalTime != null ? stop.arrivalTime.toString() : null);
            stopDto.setIndex(nodeIndex);
            stopDto.setMinutesFromStart(accumulatedMinutes);
            stopDto.setWeatherFactor(data.weatherLookups.get(nodeIndex).factor);
            route.add(stopDto);
        }

        List<StopFactorDto> factors = new ArrayList<>(data.stops.size());
        List<String> estimated = new ArrayList<>();
        for (int i = 0; i < data.stops.size(); i++) {
            WeatherLookup lookup = data.weatherLookups.get(i);
            String name = data.stops.get(i).name;
            factors.add(new StopFactorDto(i, name, lookup.factor, lookup.status.name(),
                    lookup.requestedHourUtc != null ? lookup.requestedHourUtc.toString() : null, lookup.detail));
            if (lookup.isDegraded()) {
                estimated.add(name);
            }
        }

        return new RouteSolutionDto(order, route, tour.getTotalMinutes(), result.getInitialMinutes(),
                factors, estimated, result.getStrategy().name(), result.getElapsedMillis(),
                result.isTimeBudgetExhausted());
    }

    /**
     * 결과를 사람이 읽는 텍스트로 출력합니다.
     */
    public String renderReport(RouteSolutionDto solution) {
        StringBuilder report = new StringBuilder("Visit order:\n");
        for (StopDto stop : solution.getRoute()) {
            report.append(stop.getIndex()).append(' ').append(stop.getName()).append('\n');
        }
        report.append(String.format(Locale.ROOT, "Total travel time (weather-adjusted): %.1f min\n",
                solution.getTotalMinutes()));
        String factors = solution.getWeatherFactors().stream()
                .map(f -> String.valueOf(Math.round(f.getFactor() * 100) / 100.0))
                .collect(Collectors.joining(", ", "[", "]"));
        report.append("Node weather factors: ").append(factors);
        if (!solution.getEstimatedFactorStops().isEmpty()) {
            report.append('\n').append("Estimated (neutral) factors: ")
                    .append(String.join(", ", solution.getEstimatedFactorStops()));
        }
        return report.toString();
    }
}
