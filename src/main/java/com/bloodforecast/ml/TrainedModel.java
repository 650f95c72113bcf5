package com.bloodforecast.ml;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The encoder/regressor pair produced by one training run. Encodings from two
 * different fits are not interchangeable, so the pair is published, persisted and
 * reloaded only as a whole.
 */
public final class TrainedModel implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /** Probability of an outbreak day within a rain-adjacent season. */
    public static final double OUTBREAK_RATE = 0.1;

    private final CategoryEncoder bloodTypeEncoder;
    private final CategoryEncoder regionEncoder;
    private final CategoryEncoder seasonEncoder;
    private final DemandModel regressor;
    private final Instant trainedAt;
    private final int sampleCount;
    private final boolean trained;

    public TrainedModel(CategoryEncoder bloodTypeEncoder, CategoryEncoder regionEncoder,
                        CategoryEncoder seasonEncoder, DemandModel regressor,
                        Instant trainedAt, int sampleCount) {
        this.bloodTypeEncoder = Objects.requireNonNull(bloodTypeEncoder, "bloodTypeEncoder");
        this.regionEncoder = Objects.requireNonNull(regionEncoder, "regionEncoder");
        this.seasonEncoder = Objects.requireNonNull(seasonEncoder, "seasonEncoder");
        this.regressor = Objects.requireNonNull(regressor, "regressor");
        this.trainedAt = trainedAt;
        this.sampleCount = sampleCount;
        this.trained = true;
    }

    public static double[] featureRow(int bloodTypeCode, int regionCode, int seasonCode,
                                      LocalDate date, double outbreak, boolean rainSeason) {
        return new double[] {
            bloodTypeCode,
            regionCode,
            seasonCode,
            date.getDayOfWeek().getValue() - 1,
            date.getMonthValue(),
            outbreak,
            rainSeason ? 1.0 : 0.0
        };
    }

    /**
     * Encodes a prediction request. The outbreak feature is the expected outbreak
     * rate of the season rather than a coin flip, which keeps predictions repeatable.
     */
    public double[] features(String bloodType, String region, LocalDate date, UnknownCategoryListener listener) {
        Season season = Season.of(date);
        return featureRow(
            bloodTypeEncoder.encode(bloodType, listener),
            regionEncoder.encode(region, listener),
            seasonEncoder.encode(season.label(), listener),
            date,
            season.isRainAdjacent() ? OUTBREAK_RATE : 0.0,
            season.isRainAdjacent());
    }

    public CategoryEncoder bloodTypeEncoder() {
        return bloodTypeEncoder;
    }

    public CategoryEncoder regionEncoder() {
        return regionEncoder;
    }

    public CategoryEncoder seasonEncoder() {
        return seasonEncoder;
    }

    public DemandModel regressor() {
        return regressor;
    }

    public Instant trainedAt() {
        return trainedAt;
    }

    public int sampleCount() {
        return sampleCount;
    }

    public boolean isTrained() {
        return trained;
    }
}
