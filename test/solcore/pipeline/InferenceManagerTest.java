package solcore.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solcore.config.RunConfig;
import solcore.config.TimeWindow;
import solcore.io.InputDataLoader;
import solcore.io.PlantArtifact;
import solcore.model.CalibratedParameters;
import solcore.model.RadiationType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static solcore.pipeline.PipelineFixtures.*;

class InferenceManagerTest {

    private static PlantArtifact artifact(String plantId, CalibratedParameters p) {
        return new PlantArtifact(plantId, p, null, null, null, RadiationType.GHI);
    }

    @Test
    void predictsWindowWithStoredParameters(@TempDir Path root) throws IOException {
        writeInputs(root.resolve("input"));
        RunConfig config = inferenceConfig(root, THIRD_DAY);
        InputDataLoader loader = new InputDataLoader(config.getInputDir());

        Map<String, PlantInferenceResult> results = new InferenceManager(config, loader)
                .predict(List.of(artifact("P1", TRUTH), artifact("P2", CalibratedParameters.DEFAULT)));

        assertEquals(List.of("P1", "P2"), List.copyOf(results.keySet()));
        PlantInferenceResult p1 = results.get("P1");
        assertEquals(11, p1.irradiance().size());
        assertEquals(TRUTH, p1.parameters());

        // measured data of P1 was generated with the same parameters
        double[] measured = loader.loadMeasured("P1").slice(THIRD_DAY.start(), THIRD_DAY.end()).getValues();
        assertArrayEquals(measured, p1.chosenRadiation().getValues(), 1e-9);
    }

    @Test
    void clearSkyIsIndependentOfParameters(@TempDir Path root) throws IOException {
        writeInputs(root.resolve("input"));
        RunConfig config = inferenceConfig(root, TimeWindow.parse("2024-01-15T00:00/2024-01-17T23:00"));

        Map<String, PlantInferenceResult> results = new InferenceManager(config, new InputDataLoader(config.getInputDir()))
                .predict(List.of(artifact("P1", TRUTH), artifact("P2", CalibratedParameters.DEFAULT)));

        assertArrayEquals(results.get("P1").irradiance().getGhiCs().getValues(),
                results.get("P2").irradiance().getGhiCs().getValues(), 0.0);
        assertNotEquals(results.get("P1").irradiance().getGhi().valueAt(0),
                results.get("P2").irradiance().getGhi().valueAt(0));
    }

    @Test
    void emptyWindowGivesNoResult(@TempDir Path root) throws IOException {
        writeInputs(root.resolve("input"));
        RunConfig config = inferenceConfig(root, NEXT_YEAR);

        assertTrue(new InferenceManager(config, new InputDataLoader(config.getInputDir()))
                .predict(List.of(artifact("P1", TRUTH))).isEmpty());
    }

    @Test
    void artifactForUnlistedPlantIsAnError(@TempDir Path root) throws IOException {
        writeInputs(root.resolve("input"));
        RunConfig config = inferenceConfig(root, THIRD_DAY);

        assertThrows(IOException.class, () -> new InferenceManager(config, new InputDataLoader(config.getInputDir()))
                .predict(List.of(artifact("P9", TRUTH))));
    }
}
