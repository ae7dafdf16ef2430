package com.riansoft.weather_tsp.controller;

import com.riansoft.weather_tsp.dto.ErrorResponseDto;
import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.exception.NoFeasibleTourException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RouteExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RouteExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidInput(InvalidInputException e) {
        log.warn("[ERROR] 잘못된 입력 ({}): {}", e.getReason(), e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponseDto(e.getReason().name(), e.getMessage()));
    }

    @ExceptionHandler(NoFeasibleTourException.class)
    public ResponseEntity<ErrorResponseDto> handleNoFeasibleTour(NoFeasibleTourException e) {
        log.error("[ERROR] 순회 경로 계산 실패: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponseDto("NO_FEASIBLE_TOUR", e.getMessage()));
    }
}
