package solcore.pipeline;

import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.util.Map;

/**
 * Model output for one time window with the parameters used and the metrics of the target stream.
 */
public record EvaluationResult(CalibratedParameters parameters,
                               IrradianceResult irradiance,
                               Map<String, Double> metrics,
                               RadiationType radiationType) {

    public TimeSeries chosenRadiation() {
        return irradiance.get(radiationType);
    }
}
