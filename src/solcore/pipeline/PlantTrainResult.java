package solcore.pipeline;

import solcore.engine.calibration.CalibrationOutcome;
import solcore.io.PlantArtifact;

/**
 * Training outcome of one plant. Validation and testing are null when their window is not configured.
 */
public final class PlantTrainResult {

    private final String plantId;
    private final CalibrationOutcome calibration;
    private final EvaluationResult train;
    private final EvaluationResult validation;
    private final EvaluationResult testing;

    public PlantTrainResult(String plantId,
                            CalibrationOutcome calibration,
                            EvaluationResult train,
                            EvaluationResult validation,
                            EvaluationResult testing) {
        this.plantId = plantId;
        this.calibration = calibration;
        this.train = train;
        this.validation = validation;
        this.testing = testing;
    }

    public String getPlantId()                { return plantId; }
    public CalibrationOutcome getCalibration() { return calibration; }
    public EvaluationResult getTrain()        { return train; }
    public EvaluationResult getValidation()   { return validation; }
    public EvaluationResult getTesting()      { return testing; }

    public PlantArtifact toArtifact() {
        return new PlantArtifact(
                plantId,
                calibration.parameters(),
                train.metrics(),
                validation == null ? null : validation.metrics(),
                testing == null ? null : testing.metrics(),
                train.radiationType());
    }
}
