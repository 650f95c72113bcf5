package com.bloodforecast.ml;

import com.bloodforecast.exception.ModelArtifactException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelArtifactStoreTest {

    private static final List<String> REGIONS = List.of("South Delhi", "Noida");

    private static TrainedModel model;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void trainSmallModel() {
        Random random = new Random(7);
        CategoryEncoder bloodTypes = CategoryEncoder.fit("blood_type", BloodTypes.ALL);
        CategoryEncoder regions = CategoryEncoder.fit("region", REGIONS);
        CategoryEncoder seasons = CategoryEncoder.fit("season",
            List.of("Winter", "Summer", "Monsoon", "Post-Monsoon"));

        List<double[]> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        LocalDate start = LocalDate.of(2025, 1, 1);
        for (int day = 0; day < 120; day += 3) {
            LocalDate date = start.plusDays(day);
            Season season = Season.of(date);
            for (String region : REGIONS) {
                for (String bloodType : BloodTypes.ALL) {
                    x.add(TrainedModel.featureRow(bloodTypes.encode(bloodType), regions.encode(region),
                        seasons.encode(season.label()), date, 0.0, season.isRainAdjacent()));
                    y.add(BloodTypes.DEMAND_WEIGHTS.get(bloodType) * 100 * season.demandMultiplier()
                        * (0.8 + 0.4 * random.nextDouble()));
                }
            }
        }
        DemandModel regressor = DemandModel.fit(
            x.toArray(new double[0][]), y.stream().mapToDouble(Double::doubleValue).toArray(), 10, 7, 6, 5);
        model = new TrainedModel(bloodTypes, regions, seasons, regressor, Instant.parse("2025-05-01T00:00:00Z"), y.size());
    }

    @Test
    void saveThenLoad_reproducesPredictions() {
        ModelArtifactStore store = new ModelArtifactStore(tempDir.resolve("nested/model.bin"));
        store.save(model);

        assertThat(store.exists()).isTrue();
        TrainedModel reloaded = store.load();

        assertThat(reloaded.isTrained()).isTrue();
        assertThat(reloaded.sampleCount()).isEqualTo(model.sampleCount());
        assertThat(reloaded.trainedAt()).isEqualTo(model.trainedAt());
        for (String bloodType : List.of("O+", "AB-")) {
            double[] features = model.features(bloodType, "Noida", LocalDate.of(2025, 10, 4), UnknownCategoryListener.NONE);
            double[] reloadedFeatures = reloaded.features(bloodType, "Noida", LocalDate.of(2025, 10, 4), UnknownCategoryListener.NONE);
            assertThat(reloadedFeatures).containsExactly(features);
            assertThat(reloaded.regressor().predictPerTree(reloadedFeatures))
                .containsExactly(model.regressor().predictPerTree(features));
        }
    }

    @Test
    void save_leavesNoTemporaryFileBehind() throws IOException {
        Path path = tempDir.resolve("model.bin");
        new ModelArtifactStore(path).save(model);

        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("model.bin");
        }
    }

    @Test
    void load_corruptFile_throwsArtifactException() throws IOException {
        Path path = tempDir.resolve("model.bin");
        Files.writeString(path, "not a model");

        ModelArtifactStore store = new ModelArtifactStore(path);

        assertThatThrownBy(store::load)
            .isInstanceOf(ModelArtifactException.class)
            .hasMessageContaining(path.toString());
    }

    @Test
    void exists_falseForMissingFile() {
        assertThat(new ModelArtifactStore(tempDir.resolve("missing.bin")).exists()).isFalse();
    }

    @Test
    void regressor_fitsTrainingData() {
        assertThat(model.regressor().size()).isEqualTo(10);
        assertThat(model.regressor().trainingScore()).isGreaterThan(0.3);
    }
}
