package solcore.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solcore.config.RunConfig;
import solcore.config.TimeWindow;
import solcore.engine.Rest2Model;
import solcore.engine.calibration.CalibrationOutcome;
import solcore.engine.metrics.MetricsEvaluator;
import solcore.io.InputData;
import solcore.io.InputDataLoader;
import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.LocationAtmosphericState;
import solcore.model.Plant;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fits (mu0, g) per plant on the training window, then scores the fitted
 * parameters on the validation and test windows when they are configured.
 */
public class TrainManager {

    private static final Logger log = LoggerFactory.getLogger(TrainManager.class);

    private final RunConfig config;
    private final InputDataLoader loader;

    public TrainManager(RunConfig config, InputDataLoader loader) {
        this.config = config;
        this.loader = loader;
    }

    /**
     * @return results keyed by plant id, in processing order; plants without usable data are left out
     */
    public Map<String, PlantTrainResult> train() throws IOException {
        Map<String, PlantTrainResult> results = new LinkedHashMap<>();
        for (Plant plant : selectPlants(config, loader)) {
            PlantTrainResult r = trainForPlant(plant);
            if (r != null) {
                results.put(plant.id(), r);
            }
        }
        return results;
    }

    PlantTrainResult trainForPlant(Plant plant) throws IOException {
        log.info("Training plant {}", plant.id());
        InputData data = loader.load(plant);
        if (!data.hasMeasured()) {
            log.warn("Plant {} has no measured data; skipped", plant.id());
            return null;
        }

        RadiationType target = config.getTargetRadiationType();
        TimeWindow window = config.getTrainingWindow();

        LocationAtmosphericState atmosphere = data.getAtmosphere().slice(window.start(), window.end());
        TimeSeries measured = data.getMeasured().slice(window.start(), window.end());
        if (atmosphere.size() == 0 || measured.isEmpty()) {
            log.warn("Plant {} has no data in training window {}; skipped", plant.id(), window);
            return null;
        }

        Rest2Model model = new Rest2Model(atmosphere);
        CalibrationOutcome outcome = model.train(measured, target);
        CalibratedParameters params = outcome.parameters();

        IrradianceResult insample = model.convertRadiation(params);
        Map<String, Double> metrics = model.evaluate(insample, measured, target);
        log.info("Plant {}: mu0={}, g={}, train RMSE={} ({} iterations, converged={})",
                plant.id(), params.mu0(), params.g(), metrics.get(MetricsEvaluator.RMSE),
                outcome.iterations(), outcome.converged());

        EvaluationResult train = new EvaluationResult(params, insample, metrics, target);
        EvaluationResult validation = evaluateWindow(data, config.getValidationWindow(), params, "validation");
        EvaluationResult testing = evaluateWindow(data, config.getTestWindow(), params, "testing");

        return new PlantTrainResult(plant.id(), outcome, train, validation, testing);
    }

    private EvaluationResult evaluateWindow(InputData data,
                                            TimeWindow window,
                                            CalibratedParameters params,
                                            String split) {
        if (window == null) return null;

        String plantId = data.getPlant().id();
        LocationAtmosphericState atmosphere = data.getAtmosphere().slice(window.start(), window.end());
        TimeSeries measured = data.getMeasured().slice(window.start(), window.end());
        if (atmosphere.size() == 0) {
            log.warn("Plant {} has no data in {} window {}; {} skipped", plantId, split, window, split);
            return null;
        }

        RadiationType target = config.getTargetRadiationType();
        Rest2Model model = new Rest2Model(atmosphere);
        IrradianceResult radiation = model.convertRadiation(params);
        Map<String, Double> metrics = model.evaluate(radiation, measured, target);
        log.info("Plant {}: {} RMSE={}", plantId, split, metrics.get(MetricsEvaluator.RMSE));
        return new EvaluationResult(params, radiation, metrics, target);
    }

    /** Configured plants, or every plant of plants.csv when none are configured. */
    static List<Plant> selectPlants(RunConfig config, InputDataLoader loader) throws IOException {
        List<Plant> all = loader.loadPlants();
        if (config.getPlantIds().isEmpty()) {
            return all;
        }
        List<Plant> selected = new ArrayList<>();
        for (String id : config.getPlantIds()) {
            Plant found = null;
            for (Plant p : all) {
                if (p.id().equals(id)) {
                    found = p;
                    break;
                }
            }
            if (found == null) {
                throw new IOException("Plant " + id + " is not listed in " + InputDataLoader.PLANTS_FILE);
            }
            selected.add(found);
        }
        return selected;
    }
}
