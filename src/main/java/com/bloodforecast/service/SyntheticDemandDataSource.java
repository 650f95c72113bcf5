package com.bloodforecast.service;

import com.bloodforecast.config.ForecastingProperties;
import com.bloodforecast.ml.BloodTypes;
import com.bloodforecast.ml.DemandObservation;
import com.bloodforecast.ml.Season;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates demand with realistic seasonal, regional and weekly patterns, used
 * when no recorded history is available.
 */
@Slf4j
@Component
public class SyntheticDemandDataSource implements TrainingDataSource {

    private static final double BASE_UNITS = 100.0;
    private static final double OUTBREAK_PROBABILITY = 0.1;
    private static final double OUTBREAK_MULTIPLIER = 1.5;
    private static final double WEEKEND_FACTOR = 0.9;

    private final Clock clock;

    @Value("${forecasting.training.seed:42}")
    private long seed;

    private final ForecastingProperties properties;

    public SyntheticDemandDataSource(ForecastingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<DemandObservation> load(int daysBack) {
        Random random = new Random(seed);
        List<String> regions = properties.getRegions();
        LocalDate start = LocalDate.now(clock).minusDays(daysBack);
        List<DemandObservation> rows = new ArrayList<>(daysBack * regions.size() * BloodTypes.ALL.size());

        for (int day = 0; day < daysBack; day++) {
            LocalDate date = start.plusDays(day);
            Season season = Season.of(date);
            boolean weekend = date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;

            for (String region : regions) {
                double regionFactor = uniform(random, 0.8, 1.2);

                for (Map.Entry<String, Double> bloodType : BloodTypes.DEMAND_WEIGHTS.entrySet()) {
                    double demand = bloodType.getValue() * BASE_UNITS
                        * season.demandMultiplier()
                        * regionFactor
                        * uniform(random, 0.8, 1.2);

                    boolean outbreak = false;
                    if (season.isRainAdjacent() && random.nextDouble() < OUTBREAK_PROBABILITY) {
                        outbreak = true;
                        demand *= OUTBREAK_MULTIPLIER;
                    }
                    if (weekend) {
                        demand *= WEEKEND_FACTOR;
                    }
                    rows.add(new DemandObservation(bloodType.getKey(), region, date, (int) demand, season, outbreak));
                }
            }
        }
        log.info("Synthetic training data generated | days={} | regions={} | rows={}", daysBack, regions.size(), rows.size());
        return rows;
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
