package com.bloodforecast.service;

import com.bloodforecast.ml.DemandObservation;

import java.util.List;

/**
 * Supplies the demand observations a training run fits on.
 */
public interface TrainingDataSource {

    /**
     * @param daysBack length of the window ending today
     * @return one observation per recorded (day, region, blood type); never null
     */
    List<DemandObservation> load(int daysBack);
}
