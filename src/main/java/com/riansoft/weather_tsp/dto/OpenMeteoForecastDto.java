package com.riansoft.weather_tsp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

// Open-Meteo /v1/forecast 응답 중 hourly 블록만 사용합니다.
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenMeteoForecastDto {
    private Hourly hourly;

    public Hourly getHourly() { return hourly; }
    public void setHourly(Hourly hourly) { this.hourly = hourly; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hourly {
        private List<String> time;
        private List<Double> precipitation;
        private List<Double> snowfall;
        @JsonProperty("wind_speed_10m")
        private List<Double> windSpeed10m;
        @JsonProperty("wind_gusts_10m")
        private List<Double> windGusts10m;

        // --- Getters and Setters ---
        public List<String> getTime() { return time; }
        public void setTime(List<String> time) { this.time = time; }
        public List<Double> getPrecipitation() { return precipitation; }
        public void setPrecipitation(List<Double> precipitation) { this.precipitation = precipitation; }
        public List<Double> getSnowfall() { return snowfall; }
        public void setSnowfall(List<Double> snowfall) { this.snowfall = snowfall; }
        public List<Double> getWindSpeed10m() { return windSpeed10m; }
        public void setWindSpeed10m(List<Double> windSpeed10m) { this.windSpeed10m = windSpeed10m; }
        public List<Double> getWindGusts10m() { return windGusts10m; }
        public void setWindGusts10m(List<Double> windGusts10m) { this.windGusts10m = windGusts10m; }
    }
}
