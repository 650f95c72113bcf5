package com.bloodforecast.service;

import com.bloodforecast.entity.DemandHistoryRecord;
import com.bloodforecast.ml.DemandObservation;
import com.bloodforecast.ml.Season;
import com.bloodforecast.repository.DemandHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Reads recorded demand history; falls back to synthesized data when the window
 * holds no records so that training always completes.
 */
@Slf4j
@Primary
@Component
public class HistoricalDemandDataSource implements TrainingDataSource {

    private final DemandHistoryRepository repository;
    private final SyntheticDemandDataSource fallback;
    private final Clock clock;

    public HistoricalDemandDataSource(DemandHistoryRepository repository,
                                      SyntheticDemandDataSource fallback,
                                      Clock clock) {
        this.repository = repository;
        this.fallback = fallback;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DemandObservation> load(int daysBack) {
        LocalDate to = LocalDate.now(clock);
        LocalDate from = to.minusDays(daysBack);
        List<DemandHistoryRecord> records = repository.findByDateBetweenOrderByDateAsc(from, to);
        if (records.isEmpty()) {
            log.info("No demand history between {} and {}, using synthetic training data", from, to);
            return fallback.load(daysBack);
        }
        log.info("Demand history loaded | from={} | to={} | rows={}", from, to, records.size());
        return records.stream().map(this::toObservation).toList();
    }

    private DemandObservation toObservation(DemandHistoryRecord r) {
        Season season = Season.fromLabel(r.getSeason()).orElseGet(() -> Season.of(r.getDate()));
        return new DemandObservation(
            r.getBloodType(), r.getRegion(), r.getDate(),
            Math.max(0, r.getUnitsConsumed()), season, r.isDiseaseOutbreak());
    }
}
