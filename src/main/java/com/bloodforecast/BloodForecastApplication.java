package com.bloodforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BloodForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(BloodForecastApplication.class, args);
    }
}
