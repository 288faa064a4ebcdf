package solcore.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solcore.config.RunConfig;
import solcore.config.TimeWindow;
import solcore.engine.Rest2Model;
import solcore.io.InputDataLoader;
import solcore.io.PlantArtifact;
import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.LocationAtmosphericState;
import solcore.model.Plant;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes irradiance over the inference window with stored per-plant parameters.
 */
public class InferenceManager {

    private static final Logger log = LoggerFactory.getLogger(InferenceManager.class);

    private final RunConfig config;
    private final InputDataLoader loader;

    public InferenceManager(RunConfig config, InputDataLoader loader) {
        this.config = config;
        this.loader = loader;
    }

    public Map<String, PlantInferenceResult> predict(List<PlantArtifact> artifacts) throws IOException {
        List<Plant> plants = loader.loadPlants();
        Map<String, PlantInferenceResult> results = new LinkedHashMap<>();

        for (PlantArtifact artifact : artifacts) {
            Plant plant = find(plants, artifact.getPlantId());
            PlantInferenceResult r = predictForPlant(plant, artifact);
            if (r != null) {
                results.put(plant.id(), r);
            }
        }
        return results;
    }

    PlantInferenceResult predictForPlant(Plant plant, PlantArtifact artifact) throws IOException {
        log.info("Predicting plant {}", plant.id());
        TimeWindow window = config.getInferenceWindow();
        LocationAtmosphericState atmosphere = loader.loadAtmosphere(plant).slice(window.start(), window.end());
        if (atmosphere.size() == 0) {
            log.warn("Plant {} has no data in inference window {}; skipped", plant.id(), window);
            return null;
        }

        CalibratedParameters params = artifact.getParameters();
        IrradianceResult radiation = new Rest2Model(atmosphere).convertRadiation(params);
        return new PlantInferenceResult(plant.id(), params, radiation, config.getTargetRadiationType());
    }

    private static Plant find(List<Plant> plants, String id) throws IOException {
        for (Plant p : plants) {
            if (p.id().equals(id)) return p;
        }
        throw new IOException("Plant " + id + " has an artifact but is not listed in " + InputDataLoader.PLANTS_FILE);
    }
}
