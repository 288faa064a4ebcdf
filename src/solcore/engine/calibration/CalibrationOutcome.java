package solcore.engine.calibration;

import solcore.model.CalibratedParameters;

/**
 * Fitted parameters plus optimizer diagnostics.
 *
 * @param parameters  best (mu0, g) found
 * @param iterations  BFGS iterations performed
 * @param evaluations objective evaluations, gradient ones included
 * @param finalRmse   objective value at {@code parameters}
 * @param converged   whether the gradient tolerance was reached
 */
public record CalibrationOutcome(CalibratedParameters parameters,
                                 int iterations,
                                 int evaluations,
                                 double finalRmse,
                                 boolean converged) {
}
