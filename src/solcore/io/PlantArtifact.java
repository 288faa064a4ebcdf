package solcore.io;

import solcore.model.CalibratedParameters;
import solcore.model.RadiationType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted outcome of training one plant.
 * Field names map to snake_case JSON keys.
 */
public final class PlantArtifact {

    public static final String TRAIN = "train";
    public static final String VALIDATION = "validation";
    public static final String TESTING = "testing";

    private String plantId;
    private Map<String, Double> parameters;
    private Map<String, Map<String, Double>> metrics;
    private String radiationType;

    // Gson
    private PlantArtifact() {}

    public PlantArtifact(String plantId,
                         CalibratedParameters parameters,
                         Map<String, Double> trainMetrics,
                         Map<String, Double> validationMetrics,
                         Map<String, Double> testingMetrics,
                         RadiationType radiationType) {
        this.plantId = plantId;
        this.parameters = parameters.asMap();
        this.metrics = new LinkedHashMap<>();
        this.metrics.put(TRAIN, trainMetrics);
        this.metrics.put(VALIDATION, validationMetrics);
        this.metrics.put(TESTING, testingMetrics);
        this.radiationType = radiationType.key();
    }

    public String getPlantId() {
        return plantId;
    }

    void setPlantId(String plantId) {
        this.plantId = plantId;
    }

    public CalibratedParameters getParameters() {
        return CalibratedParameters.fromMap(parameters);
    }

    /** Metrics of one split, null when the split was not evaluated. */
    public Map<String, Double> getMetrics(String split) {
        return metrics == null ? null : metrics.get(split);
    }

    public RadiationType getRadiationType() {
        return RadiationType.fromKey(radiationType);
    }
}
