package com.riansoft.weather_tsp.service;

import com.riansoft.weather_tsp.dto.StopDto;
import com.riansoft.weather_tsp.exception.InvalidInputException;
import com.riansoft.weather_tsp.model.Stop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class StopDataService {

    private static final Logger log = LoggerFactory.getLogger(StopDataService.class);

    /**
     * resources 폴더의 CSV 파일(이름,위도,경도[,예상 도착 시각])을 읽어 정류장 목록을 만듭니다.
     * 첫 줄이 기본 출발 정류장입니다. 빈 줄과 '#' 주석 줄은 건너뜁니다.
     */
    public List<Stop> loadStops(String fileName) {
        List<Stop> stops = new ArrayList<>();
        try (InputStream inputStream = new ClassPathResource(fileName).getInputStream();
             BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                stops.add(parseCsvLine(trimmed, lineNumber, "ST_" + stops.size()));
            }
        } catch (IOException e) {
            throw new InvalidInputException(InvalidInputException.Reason.STOP_FILE_UNREADABLE,
                    fileName + " 파일 읽기 중 오류 발생", e);
        }
        log.info("[DATA LOG] {} 파일로부터 총 {}개의 정류장을 로드했습니다.", fileName, stops.size());
        return stops;
    }

    private Stop parseCsvLine(String line, int lineNumber, String id) {
        String[] parts = line.split(",");
        if (parts.length < 3 || parts.length > 4) {
            throw new InvalidInputException(InvalidInputException.Reason.MALFORMED_STOP_RECORD,
                    String.format("%d번째 줄 형식 오류 (이름,위도,경도[,도착 시각]): %s", lineNumber, line));
        }
        String name = parts[0].trim();
        double lat;
        double lon;
        try {
            lat = Double.parseDouble(parts[1].trim());
            lon = Double.parseDouble(parts[2].trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(InvalidInputException.Reason.MALFORMED_STOP_RECORD,
                    String.format("%d번째 줄 숫자 변환 오류: %s", lineNumber, line), e);
        }
        OffsetDateTime arrival = parts.length == 4 ? parseArrival(parts[3], name) : null;
        return new Stop(id, name, lat, lon, arrival);
    }

    /**
     * 요청으로 들어온 정류장 DTO 를 도메인 정류장으로 변환합니다. id 가 없으면 순번으로 부여합니다.
     */
    public List<Stop> toStops(List<StopDto> stopDtos) {
        if (stopDtos == null) {
            return List.of();
        }
        List<Stop> stops = new ArrayList<>(stopDtos.size());
        for (int i = 0; i < stopDtos.size(); i++) {
            StopDto dto = stopDtos.get(i);
            if (dto == null) {
                throw new InvalidInputException(InvalidInputException.Reason.MALFORMED_STOP_RECORD,
                        i + "번째 정류장 정보가 비어 있습니다.");
            }
            String id = dto.getId() != null && !dto.getId().isBlank() ? dto.getId() : "ST_" + i;
            String name = dto.getName() != null ? dto.getName() : id;
            if (dto.getLat() == null || dto.getLon() == null) {
                throw new InvalidInputException(InvalidInputException.Reason.MALFORMED_STOP_RECORD,
                        String.format("정류장 '%s'의 위도/경도가 없습니다.", name));
            }
            stops.add(new Stop(id, name, dto.getLat(), dto.getLon(), parseArrival(dto.getExpectedArrival(), name)));
        }
        return stops;
    }

    /**
     * 모든 정류장 목록을 DTO 리스트로 변환하여 반환합니다.
     */
    public List<StopDto> getAllStopsAsDto(String fileName) {
        return loadStops(fileName).stream()
                .map(stop -> new StopDto(stop.id, stop.name, stop.lat, stop.lon,
                        stop.arrivalTime != null ? stop.arrivalTime.toString() : null))
                .collect(Collectors.toList());
    }

    private OffsetDateTime parseArrival(String raw, String stopName) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_TIMESTAMP,
                    String.format("정류장 '%s'의 도착 시각 형식 오류 (ISO-8601, UTC 오프셋 필요): %s", stopName, raw), e);
        }
    }
}
