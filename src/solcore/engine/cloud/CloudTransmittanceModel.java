package solcore.engine.cloud;

import solcore.model.CalibratedParameters;

/**
 * Grey-body two-stream cloud transmittance (Petty, 2006, p. 412).
 * <p>
 * Tdir = exp(-COD / (0.5 + mu0)),
 * Tdif = 1 / (1 + (1 - g) COD) - Tdir.
 * <p>
 * At COD = 0 the diffuse term is 0, so a clear timestep gets no diffuse light
 * in the cloud-sky stream. Callers that need clear-sky diffuse use the clear-sky stream.
 */
public final class CloudTransmittanceModel {

    public CloudTransmittance evaluate(double[] cod, CalibratedParameters parameters) {
        return evaluate(cod, parameters.mu0(), parameters.g());
    }

    public CloudTransmittance evaluate(double[] cod, double mu0, double g) {
        final int n = cod.length;
        double[] direct = new double[n];
        double[] diffuse = new double[n];
        for (int i = 0; i < n; i++) {
            direct[i] = direct(cod[i], mu0);
            diffuse[i] = diffuse(cod[i], mu0, g);
        }
        return new CloudTransmittance(direct, diffuse);
    }

    public static double direct(double cod, double mu0) {
        return Math.exp(-cod / (0.5 + mu0));
    }

    public static double diffuse(double cod, double mu0, double g) {
        return 1.0 / (1.0 + (1.0 - g) * cod) - direct(cod, mu0);
    }
}
