package solcore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solcore.config.RunConfig;
import solcore.config.RunConfigLoader;
import solcore.io.InputDataLoader;
import solcore.io.MetricsExcelWriter;
import solcore.io.ParameterArtifactStore;
import solcore.io.PlantArtifact;
import solcore.io.ResultsCsvWriter;
import solcore.pipeline.InferenceManager;
import solcore.pipeline.PlantInferenceResult;
import solcore.pipeline.PlantTrainResult;
import solcore.pipeline.TrainManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command line entry: {@code java solcore.Main <config.json>}.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final String METRICS_FILE = "metrics.xlsx";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length != 1) {
            log.error("Usage: java solcore.Main <config.json>");
            return 1;
        }
        Path configPath = Paths.get(args[0]);

        try {
            if (!Files.exists(configPath)) {
                throw new IOException("Configuration file not found: " + configPath);
            }
            // 1) config
            RunConfig config = RunConfigLoader.load(configPath);
            InputDataLoader loader = new InputDataLoader(config.getInputDir());
            ParameterArtifactStore store = new ParameterArtifactStore(config.getArtifactDir());

            // 2) run
            switch (config.getMode()) {
                case TRAIN:
                    runTraining(config, loader, store);
                    break;
                case INFERENCE:
                    runInference(config, loader, store);
                    break;
            }
            return 0;

        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    static void runTraining(RunConfig config, InputDataLoader loader, ParameterArtifactStore store) throws IOException {
        log.info("Starting training mode");
        Map<String, PlantTrainResult> results = new TrainManager(config, loader).train();
        log.info("Training completed for {} plant(s)", results.size());

        List<PlantArtifact> artifacts = new ArrayList<>(results.size());
        for (PlantTrainResult r : results.values()) {
            PlantArtifact artifact = r.toArtifact();
            store.save(artifact);
            artifacts.add(artifact);
        }

        if (config.isWriteErrors()) {
            Path xlsx = MetricsExcelWriter.writeXlsx(config.getArtifactDir().resolve(METRICS_FILE), artifacts);
            log.info("Saved: {}", xlsx);
        }
    }

    static void runInference(RunConfig config, InputDataLoader loader, ParameterArtifactStore store) throws IOException {
        log.info("Starting inference mode");

        // configured plants, or all stored artifacts
        List<String> ids = config.getPlantIds().isEmpty() ? store.listPlantIds() : config.getPlantIds();
        List<PlantArtifact> artifacts = new ArrayList<>(ids.size());
        for (String id : ids) {
            artifacts.add(store.load(id));
        }

        Map<String, PlantInferenceResult> results = new InferenceManager(config, loader).predict(artifacts);
        for (PlantInferenceResult r : results.values()) {
            Path csv = ResultsCsvWriter.writeResults(config.getOutputDir(), r.plantId(), r.irradiance());
            log.info("Saved: {}", csv);
        }
        log.info("Inference completed for {} plant(s)", results.size());
    }
}
