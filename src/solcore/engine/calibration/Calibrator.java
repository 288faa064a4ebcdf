package solcore.engine.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fits (mu0, g) for one location by minimizing the RMSE of the chosen
 * irradiance stream against measurements. Starts from {@link CalibratedParameters#DEFAULT};
 * no bounds are imposed on either parameter.
 */
public final class Calibrator {

    private static final Logger log = LoggerFactory.getLogger(Calibrator.class);

    private final Function<CalibratedParameters, IrradianceResult> forwardModel;
    private final Instant[] modelTimes;

    public Calibrator(Function<CalibratedParameters, IrradianceResult> forwardModel, Instant[] modelTimes) {
        this.forwardModel = Objects.requireNonNull(forwardModel, "forwardModel");
        this.modelTimes = Objects.requireNonNull(modelTimes, "modelTimes").clone();
    }

    public CalibrationOutcome train(TimeSeries measured, RadiationType radiationType) {
        Objects.requireNonNull(measured, "measured");
        Objects.requireNonNull(radiationType, "radiationType");

        RmseObjective objective = new RmseObjective(forwardModel, modelTimes, measured, radiationType);
        if (objective.matchedPoints() == 0) {
            log.warn("No measurement matches the model time index; keeping default parameters");
        }

        double[] start = CalibratedParameters.DEFAULT.toVector();
        OptimizationResult opt = new BfgsMinimizer().minimize(objective, start);

        CalibratedParameters fitted = CalibratedParameters.fromVector(opt.getPoint());
        if (!opt.isConverged()) {
            log.warn("Calibration on {} did not converge after {} iterations ({}); using best iterate mu0={}, g={}, RMSE={}",
                    radiationType.key(), opt.getIterations(), opt.getMessage(),
                    fitted.mu0(), fitted.g(), opt.getValue());
        } else {
            log.debug("Calibration on {} converged in {} iterations", radiationType.key(), opt.getIterations());
        }

        return new CalibrationOutcome(fitted, opt.getIterations(), opt.getEvaluations(),
                opt.getValue(), opt.isConverged());
    }
}
