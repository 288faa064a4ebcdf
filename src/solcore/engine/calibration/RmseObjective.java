package solcore.engine.calibration;

import org.apache.commons.math3.analysis.MultivariateFunction;
import solcore.engine.metrics.ErrorMetrics;
import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.time.Instant;
import java.util.function.Function;

/**
 * RMSE of one irradiance stream against measurements, as a function of (mu0, g).
 * The measured series is joined onto the model time index once, up front.
 */
public final class RmseObjective implements MultivariateFunction {

    private final Function<CalibratedParameters, IrradianceResult> forwardModel;
    private final RadiationType radiationType;
    private final double[] measured;

    public RmseObjective(Function<CalibratedParameters, IrradianceResult> forwardModel,
                         Instant[] modelTimes,
                         TimeSeries measured,
                         RadiationType radiationType) {
        this.forwardModel = forwardModel;
        this.radiationType = radiationType;
        this.measured = measured.alignTo(modelTimes);
    }

    @Override
    public double value(double[] point) {
        IrradianceResult result = forwardModel.apply(CalibratedParameters.fromVector(point));
        double[] predicted = result.get(radiationType).getValues();
        return ErrorMetrics.rmse(predicted, measured);
    }

    /** Number of model timesteps with a measurement. */
    public int matchedPoints() {
        int count = 0;
        for (double v : measured) {
            if (!Double.isNaN(v)) count++;
        }
        return count;
    }
}
