package com.bloodforecast.ml;

import com.bloodforecast.exception.ModelArtifactException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists the current {@link TrainedModel} to a single well-known file.
 */
@Slf4j
@Component
public class ModelArtifactStore {

    private final Path path;

    @Autowired
    public ModelArtifactStore(@Value("${forecasting.model.path:${java.io.tmpdir}/blood_demand_model.bin}") String path) {
        this(Path.of(path));
    }

    public ModelArtifactStore(Path path) {
        this.path = path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    public Path path() {
        return path;
    }

    public void save(TrainedModel model) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (ObjectOutputStream out = new ObjectOutputStream(
                    new BufferedOutputStream(Files.newOutputStream(tmp)))) {
                out.writeObject(model);
            }
            move(tmp, path);
        } catch (IOException ex) {
            throw new ModelArtifactException("Could not write model artifact to " + path, ex);
        }
        log.info("Model artifact saved | path={} | samples={}", path, model.sampleCount());
    }

    public TrainedModel load() {
        try (ObjectInputStream in = new ObjectInputStream(
                new BufferedInputStream(Files.newInputStream(path)))) {
            Object artifact = in.readObject();
            if (!(artifact instanceof TrainedModel model) || !model.isTrained()) {
                throw new ModelArtifactException("Model artifact at " + path + " does not hold a trained model");
            }
            return model;
        } catch (IOException | ClassNotFoundException ex) {
            throw new ModelArtifactException("Could not read model artifact from " + path, ex);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
