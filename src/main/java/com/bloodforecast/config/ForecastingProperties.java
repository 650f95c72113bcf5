package com.bloodforecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Forecasting settings shared by more than one component.
 */
@Data
@Component
@ConfigurationProperties(prefix = "forecasting")
public class ForecastingProperties {

    /** Regions forecast by default and covered by synthetic training data. */
    private List<String> regions = new ArrayList<>(List.of(
        "South Delhi", "North Delhi", "East Delhi", "West Delhi",
        "Central Delhi", "Noida", "Gurgaon", "Dwarka"));
}
