package solcore.config;

import solcore.model.RadiationType;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration of one pipeline run.
 */
public class RunConfig {

    private final RunMode mode;

    /** Directory with plants.csv and one sub-directory per plant. */
    private final Path inputDir;

    /** Irradiance CSVs of the inference run go here. */
    private final Path outputDir;

    /** Parameter JSONs and metrics.xlsx. */
    private final Path artifactDir;

    /** Plants to process; empty means every plant in plants.csv. */
    private final List<String> plantIds;

    /** Stream the calibration fits and the metrics score. */
    private final RadiationType targetRadiationType;

    private final TimeWindow trainingWindow;
    private final TimeWindow validationWindow;
    private final TimeWindow testWindow;
    private final TimeWindow inferenceWindow;

    /** Write metrics.xlsx after training. */
    private final boolean writeErrors;

    public RunConfig(RunMode mode,
                     Path inputDir,
                     Path outputDir,
                     Path artifactDir,
                     List<String> plantIds,
                     RadiationType targetRadiationType,
                     TimeWindow trainingWindow,
                     TimeWindow validationWindow,
                     TimeWindow testWindow,
                     TimeWindow inferenceWindow,
                     boolean writeErrors) {
        this.mode = mode;
        this.inputDir = inputDir;
        this.outputDir = outputDir;
        this.artifactDir = artifactDir;
        this.plantIds = List.copyOf(plantIds);
        this.targetRadiationType = targetRadiationType;
        this.trainingWindow = trainingWindow;
        this.validationWindow = validationWindow;
        this.testWindow = testWindow;
        this.inferenceWindow = inferenceWindow;
        this.writeErrors = writeErrors;
    }

    public RunMode getMode() {
        return mode;
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getArtifactDir() {
        return artifactDir;
    }

    public List<String> getPlantIds() {
        return plantIds;
    }

    public RadiationType getTargetRadiationType() {
        return targetRadiationType;
    }

    public TimeWindow getTrainingWindow() {
        return trainingWindow;
    }

    /** May be null. */
    public TimeWindow getValidationWindow() {
        return validationWindow;
    }

    /** May be null. */
    public TimeWindow getTestWindow() {
        return testWindow;
    }

    public TimeWindow getInferenceWindow() {
        return inferenceWindow;
    }

    public boolean isWriteErrors() {
        return writeErrors;
    }
}
