package com.bloodforecast.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ForecastingConfig {

    /** Wall clock for forecast horizons and training timestamps; tests substitute a fixed one. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
