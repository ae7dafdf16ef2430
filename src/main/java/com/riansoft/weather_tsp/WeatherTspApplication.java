package com.riansoft.weather_tsp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WeatherTspApplication {

    public static void main(String[] args) {
        SpringApplication.run(WeatherTspApplication.class, args);
    }
}
