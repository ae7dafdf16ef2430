package com.riansoft.weather_tsp.controller;

import com.riansoft.weather_tsp.config.PlannerProperties;
import com.riansoft.weather_tsp.dto.RouteSolutionDto;
import com.riansoft.weather_tsp.dto.StopDto;
import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.exception.NoFeasibleTourException;
import com.riansoft.weather_tsp.model.PlanOptions;
import com.riansoft.weather_tsp.model.Stop;
import com.riansoft.weather_tsp.service.RouteOptimizationService;
import com.riansoft.weather_tsp.service.StopDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RouteController.class)
class RouteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RouteOptimizationService routeService;

    @MockBean
    private StopDataService stopDataService;

    @MockBean
    private PlannerProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.toPlanOptions()).thenReturn(PlanOptions.defaults());
        when(properties.getStopFile()).thenReturn("stops.csv");
    }

    @Test
    @DisplayName("GET /api/optimize-route 는 쿼리 값으로 설정을 덮어쓴다")
    void optimizeWithOverrides() throws Exception {
        when(routeService.findOptimalRoutes(any())).thenReturn(solution(List.of(0, 2, 1, 0), 42.5));

        mockMvc.perform(get("/api/optimize-route")
                        .param("speed", "50")
                        .param("timeLimit", "3")
                        .param("start", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.visitOrder[1]").value(2))
                .andExpect(jsonPath("$.totalMinutes").value(42.5))
                .andExpect(jsonPath("$.strategy").value("EXHAUSTIVE"));

        ArgumentCaptor<PlanOptions> captor = ArgumentCaptor.forClass(PlanOptions.class);
        verify(routeService).findOptimalRoutes(captor.capture());
        assertEquals(50.0, captor.getValue().averageSpeedKph);
        assertEquals(Duration.ofSeconds(3), captor.getValue().getTimeLimit());
        assertEquals(1, captor.getValue().startIndex);
    }

    @Test
    @DisplayName("시간 제한 0초는 400 INVALID_TIME_LIMIT")
    void rejectsZeroTimeLimit() throws Exception {
        mockMvc.perform(get("/api/optimize-route").param("timeLimit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_TIME_LIMIT"));

        verify(routeService, never()).findOptimalRoutes(any());
    }

    @Test
    @DisplayName("상한을 넘는 시간 제한은 400 INVALID_TIME_LIMIT")
    void rejectsTimeLimitAboveCap() throws Exception {
        mockMvc.perform(get("/api/optimize-route").param("timeLimit", "10000000000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_TIME_LIMIT"));

        verify(routeService, never()).findOptimalRoutes(any());
    }

    @Test
    @DisplayName("POST /api/optimize-route 는 본문의 정류장 목록으로 계산한다")
    void optimizePostedStops() throws Exception {
        List<Stop> stops = List.of(
                new Stop("ST_0", "Depot", 41.1176, -85.0689, null),
                new Stop("ST_1", "Stop A", 41.1802, -84.9960, null));
        when(stopDataService.toStops(anyList())).thenReturn(stops);
        when(routeService.optimize(any(), any())).thenReturn(solution(List.of(0, 1, 0), 31.7));

        String body = "{\"stops\":["
                + "{\"name\":\"Depot\",\"lat\":41.1176,\"lon\":-85.0689},"
                + "{\"name\":\"Stop A\",\"lat\":41.1802,\"lon\":-84.9960}],"
                + "\"averageSpeedKph\":40}";
        mockMvc.perform(post("/api/optimize-route").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.visitOrder.length()").value(3))
                .andExpect(jsonPath("$.totalMinutes").value(31.7));

        ArgumentCaptor<PlanOptions> captor = ArgumentCaptor.forClass(PlanOptions.class);
        verify(routeService).optimize(any(), captor.capture());
        assertEquals(40.0, captor.getValue().averageSpeedKph);
    }

    @Test
    @DisplayName("잘못된 입력은 400 과 사유 코드로 응답한다")
    void mapsInvalidInputToBadRequest() throws Exception {
        when(routeService.findOptimalRoutes(any())).thenThrow(new InvalidInputException(
                InvalidInputException.Reason.INVALID_COORDINATE, "위도 범위 오류"));

        mockMvc.perform(get("/api/optimize-route"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_COORDINATE"))
                .andExpect(jsonPath("$.message").value("위도 범위 오류"));
    }

    @Test
    @DisplayName("순회 경로가 없으면 422 NO_FEASIBLE_TOUR")
    void mapsNoFeasibleTourToUnprocessable() throws Exception {
        when(routeService.findOptimalRoutes(any())).thenThrow(new NoFeasibleTourException("연결되지 않은 구간"));

        mockMvc.perform(get("/api/optimize-route"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("NO_FEASIBLE_TOUR"));
    }

    @Test
    @DisplayName("GET /api/all-stops 는 설정된 정류장 파일을 돌려준다")
    void listsAllStops() throws Exception {
        when(stopDataService.getAllStopsAsDto("stops.csv")).thenReturn(List.of(
                new StopDto("ST_0", "Depot", 41.1176, -85.0689, "2025-11-10T08:00-05:00")));

        mockMvc.perform(get("/api/all-stops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Depot"))
                .andExpect(jsonPath("$[0].expectedArrival").value("2025-11-10T08:00-05:00"))
                .andExpect(jsonPath("$[0].index").doesNotExist());
    }

    private static RouteSolutionDto solution(List<Integer> order, double totalMinutes) {
        RouteSolutionDto dto = new RouteSolutionDto();
        dto.setVisitOrder(order);
        dto.setTotalMinutes(totalMinutes);
        dto.setStrategy("EXHAUSTIVE");
        return dto;
    }
}
