package solcore.pipeline;

import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

/**
 * Irradiance predicted for one plant over the inference window.
 */
public record PlantInferenceResult(String plantId,
                                   CalibratedParameters parameters,
                                   IrradianceResult irradiance,
                                   RadiationType radiationType) {

    public TimeSeries chosenRadiation() {
        return irradiance.get(radiationType);
    }
}
