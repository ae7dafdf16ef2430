package com.riansoft.weather_tsp.exception;

/**
 * 계산 시작 전에 거부되는 잘못된 입력 (좌표, 속도, 빈 정류장 목록 등).
 */
public class InvalidInputException extends RoutePlanningException {

    public enum Reason {
        INVALID_COORDINATE,
        INVALID_SPEED,
        INVALID_TIME_LIMIT,
        EMPTY_STOP_LIST,
        INVALID_START_INDEX,
        INVALID_TIMESTAMP,
        MALFORMED_STOP_RECORD,
        STOP_FILE_UNREADABLE
    }

    private final Reason reason;

    public InvalidInputException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidInputException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
