package com.bloodforecast.service;

import com.bloodforecast.config.ForecastingProperties;
import com.bloodforecast.dto.DemandForecast;
import com.bloodforecast.dto.ForecasterState;
import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.dto.TrainingResult;
import com.bloodforecast.dto.TrainingStatusResponse;
import com.bloodforecast.exception.BloodForecastException;
import com.bloodforecast.exception.InvalidForecastRequestException;
import com.bloodforecast.exception.ModelArtifactException;
import com.bloodforecast.exception.ModelNotReadyException;
import com.bloodforecast.exception.ModelTrainingException;
import com.bloodforecast.ml.BloodTypes;
import com.bloodforecast.ml.CategoryEncoder;
import com.bloodforecast.ml.DemandModel;
import com.bloodforecast.ml.DemandObservation;
import com.bloodforecast.ml.DemandPrediction;
import com.bloodforecast.ml.ModelArtifactStore;
import com.bloodforecast.ml.TrainedModel;
import com.bloodforecast.repository.InventoryLevelRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the current {@link TrainedModel} and turns it into per-cell demand forecasts.
 * <p>
 * The model is published through a single reference: a retrain builds a complete
 * encoder/regressor pair before swapping it in, so concurrent predictions see either
 * the previous pair or the new one. A failed retrain leaves the previous model in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DemandForecastService {

    private static final double MIN_CONFIDENCE = 0.5;
    private static final double MAX_CONFIDENCE = 0.95;
    private static final double ZERO_PREDICTION_CONFIDENCE = 0.7;
    private static final double ZERO_DEMAND_COVERAGE = 10.0;

    private final TrainingDataSource   trainingDataSource;
    private final ModelArtifactStore   artifactStore;
    private final InventoryLevelRepository inventoryRepository;
    private final ForecastingProperties properties;
    private final Clock                clock;

    @Value("${forecasting.training.days-back:365}")
    private int daysBack;

    @Value("${forecasting.training.on-startup:false}")
    private boolean trainOnStartup;

    @Value("${forecasting.model.trees:100}")
    private int trees;

    @Value("${forecasting.model.max-depth:10}")
    private int maxDepth;

    @Value("${forecasting.model.node-size:5}")
    private int nodeSize;

    @Value("${forecasting.model.features-per-split:7}")
    private int featuresPerSplit;

    @Value("${forecasting.default-inventory-units:50}")
    private int defaultInventoryUnits;

    @Value("${forecasting.max-horizon-hours:168}")
    private int maxHorizonHours;

    private final AtomicReference<TrainedModel> current = new AtomicReference<>();
    private final AtomicReference<ForecasterState> state = new AtomicReference<>(ForecasterState.UNTRAINED);
    private final ReentrantLock trainingLock = new ReentrantLock();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final ConcurrentHashMap<String, LongAdder> unknownCategories = new ConcurrentHashMap<>();

    private ExecutorService trainingExecutor;

    @PostConstruct
    void init() {
        trainingExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "demand-model-training");
            t.setDaemon(true);
            return t;
        });
        if (artifactStore.exists()) {
            try {
                TrainedModel model = artifactStore.load();
                publish(model);
                log.info("Demand model restored at startup | path={} | samples={}", artifactStore.path(), model.sampleCount());
                return;
            } catch (ModelArtifactException ex) {
                log.warn("Could not restore demand model at startup | path={} | reason={}", artifactStore.path(), ex.getMessage());
            }
        }
        if (trainOnStartup) {
            trainAsync(false).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Startup training failed: {}", ex.getMessage(), ex);
                }
            });
        }
    }

    @PreDestroy
    void shutdown() {
        if (trainingExecutor != null) {
            trainingExecutor.shutdown();
        }
    }

    public TrainingResult train(boolean forceRetrain) {
        trainingLock.lock();
        try {
            if (!forceRetrain && artifactStore.exists()) {
                try {
                    TrainedModel loaded = artifactStore.load();
                    publish(loaded);
                    log.info("Loaded existing demand model | path={} | samples={}", artifactStore.path(), loaded.sampleCount());
                    return toResult(TrainingResult.Source.LOADED, loaded);
                } catch (ModelArtifactException ex) {
                    log.warn("Could not load existing model, retraining | reason={}", ex.getMessage());
                }
            }

            state.set(ForecasterState.TRAINING);
            log.info("Training demand model | daysBack={} | trees={} | featuresPerSplit={} | maxDepth={}",
                     daysBack, trees, featuresPerSplit, maxDepth);
            TrainedModel model = fit(trainingDataSource.load(daysBack));
            artifactStore.save(model);
            publish(model);
            log.info("Demand model trained | samples={} | score={}",
                     model.sampleCount(), String.format("%.3f", model.regressor().trainingScore()));
            return toResult(TrainingResult.Source.TRAINED, model);
        } catch (BloodForecastException ex) {
            restoreState();
            throw ex;
        } catch (RuntimeException ex) {
            restoreState();
            throw new ModelTrainingException("Demand model training failed: " + ex.getMessage(), ex);
        } finally {
            trainingLock.unlock();
        }
    }

    public CompletableFuture<TrainingResult> trainAsync(boolean forceRetrain) {
        return CompletableFuture.supplyAsync(() -> train(forceRetrain), trainingExecutor);
    }

    /** Completes once a model has been published; never completes exceptionally. */
    public CompletableFuture<Void> readiness() {
        return ready.thenApply(v -> v);
    }

    public boolean awaitReady(Duration timeout) throws InterruptedException {
        try {
            ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException ex) {
            return false;
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Readiness signal failed", ex.getCause());
        }
    }

    public boolean isReady() {
        return current.get() != null;
    }

    public ForecasterState state() {
        return state.get();
    }

    public TrainingStatusResponse trainingStatus() {
        TrainedModel model = current.get();
        Map<String, Long> unknown = new TreeMap<>();
        unknownCategories.forEach((k, v) -> unknown.put(k, v.sum()));
        return TrainingStatusResponse.builder()
            .state(state.get())
            .trained(model != null)
            .modelExists(artifactStore.exists())
            .lastTrained(model != null ? model.trainedAt() : null)
            .sampleCount(model != null ? model.sampleCount() : 0)
            .unknownCategories(unknown)
            .build();
    }

    public DemandPrediction predictDemand(String bloodType, String region, LocalDateTime forecastDate) {
        TrainedModel model = requireModel();
        double[] features = model.features(bloodType, region, forecastDate.toLocalDate(), this::onUnknownCategory);
        double[] perTree = model.regressor().predictPerTree(features);

        double mean = 0.0;
        for (double p : perTree) {
            mean += p;
        }
        mean /= perTree.length;
        double variance = 0.0;
        for (double p : perTree) {
            variance += (p - mean) * (p - mean);
        }
        double stdDev = Math.sqrt(variance / perTree.length);

        double prediction = Math.max(0.0, mean);
        double confidence = prediction > 0.0 ? 1.0 - (stdDev / prediction) : ZERO_PREDICTION_CONFIDENCE;
        return new DemandPrediction(prediction, clamp(confidence, MIN_CONFIDENCE, MAX_CONFIDENCE));
    }

    public RiskLevel assessShortageRisk(double predictedDemand, double currentInventory) {
        if (currentInventory <= 0) {
            return RiskLevel.CRITICAL;
        }
        double coverageRatio = predictedDemand > 0 ? currentInventory / predictedDemand : ZERO_DEMAND_COVERAGE;
        if (coverageRatio >= 3.0) {
            return RiskLevel.LOW;
        }
        if (coverageRatio >= 2.0) {
            return RiskLevel.MEDIUM;
        }
        if (coverageRatio >= 1.0) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.CRITICAL;
    }

    public List<DemandForecast> generateForecasts(int hoursAhead, List<String> requestedRegions) {
        if (hoursAhead < 1 || hoursAhead > maxHorizonHours) {
            throw new InvalidForecastRequestException(
                "hoursAhead must be between 1 and " + maxHorizonHours + ", got " + hoursAhead);
        }
        requireModel();

        List<String> targetRegions = requestedRegions == null || requestedRegions.isEmpty()
            ? properties.getRegions() : requestedRegions;
        LocalDateTime forecastDate = LocalDateTime.now(clock).plusHours(hoursAhead);
        List<DemandForecast> forecasts = new ArrayList<>(targetRegions.size() * BloodTypes.ALL.size());

        for (String region : targetRegions) {
            for (String bloodType : BloodTypes.ALL) {
                try {
                    int inventory = currentInventory(region, bloodType);
                    DemandPrediction prediction = predictDemand(bloodType, region, forecastDate);
                    forecasts.add(DemandForecast.builder()
                        .bloodType(bloodType)
                        .region(region)
                        .forecastDate(forecastDate)
                        .predictedDemand(prediction.units())
                        .confidence(prediction.confidence())
                        .shortageRisk(assessShortageRisk(prediction.units(), inventory))
                        .currentInventory(inventory)
                        .alertSent(false)
                        .build());
                } catch (RuntimeException ex) {
                    log.warn("Forecast skipped | bloodType={} | region={} | reason={}", bloodType, region, ex.getMessage());
                }
            }
        }
        log.info("Forecasts generated | hoursAhead={} | regions={} | count={}", hoursAhead, targetRegions.size(), forecasts.size());
        return forecasts;
    }

    private TrainedModel fit(List<DemandObservation> rows) {
        if (rows.isEmpty()) {
            throw new ModelTrainingException("No training rows available");
        }
        CategoryEncoder bloodTypeEncoder = CategoryEncoder.fit("blood_type",
            rows.stream().map(DemandObservation::bloodType).toList());
        CategoryEncoder regionEncoder = CategoryEncoder.fit("region",
            rows.stream().map(DemandObservation::region).toList());
        CategoryEncoder seasonEncoder = CategoryEncoder.fit("season",
            rows.stream().map(o -> o.season().label()).toList());

        double[][] x = new double[rows.size()][];
        double[] y = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            DemandObservation o = rows.get(i);
            x[i] = TrainedModel.featureRow(
                bloodTypeEncoder.encode(o.bloodType()),
                regionEncoder.encode(o.region()),
                seasonEncoder.encode(o.season().label()),
                o.date(),
                o.outbreak() ? 1.0 : 0.0,
                o.season().isRainAdjacent());
            y[i] = o.units();
        }
        DemandModel regressor = DemandModel.fit(x, y, trees, featuresPerSplit, maxDepth, nodeSize);
        return new TrainedModel(bloodTypeEncoder, regionEncoder, seasonEncoder, regressor,
                                Instant.now(clock), rows.size());
    }

    private int currentInventory(String region, String bloodType) {
        Long units = inventoryRepository.sumCurrentUnits(region, bloodType);
        return units != null ? units.intValue() : defaultInventoryUnits;
    }

    private TrainedModel requireModel() {
        TrainedModel model = current.get();
        if (model == null) {
            throw new ModelNotReadyException(state.get());
        }
        return model;
    }

    private void publish(TrainedModel model) {
        current.set(model);
        state.set(ForecasterState.TRAINED);
        ready.complete(null);
    }

    private void restoreState() {
        state.set(current.get() != null ? ForecasterState.TRAINED : ForecasterState.UNTRAINED);
    }

    private void onUnknownCategory(String column, String value) {
        unknownCategories.computeIfAbsent(column, k -> new LongAdder()).increment();
        log.warn("Unknown category at prediction time, using fallback code | column={} | value={}", column, value);
    }

    private TrainingResult toResult(TrainingResult.Source source, TrainedModel model) {
        return TrainingResult.builder()
            .source(source)
            .sampleCount(model.sampleCount())
            .trainingScore(model.regressor().trainingScore())
            .trainedAt(model.trainedAt())
            .modelPath(artifactStore.path().toString())
            .build();
    }

    private double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
