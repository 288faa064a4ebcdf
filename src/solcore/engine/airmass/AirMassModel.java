package solcore.engine.airmass;

import solcore.config.RadiationConstants;
import solcore.engine.ComplexPowers;

/**
 * Optical air masses of the REST2 model (Gueymard, 2008) and Angstrom turbidity.
 */
public final class AirMassModel {

    // |cos z + A Z^B / (C - Z)^D|^-1, Z in degrees
    private static final double[] AEROSOL = {0.16851, 0.18198, 95.318, 1.9542};
    private static final double[] WATER_VAPOUR = {0.10648, 0.11423, 93.781, 1.9203};
    private static final double[] OZONE = {1.0651, 0.6379, 101.8, 2.2694};
    private static final double[] RAYLEIGH = {0.48353, 0.095846, 96.741, 1.754};

    private static final double TURBIDITY_WAVELENGTH_UM = 0.55;

    public AirMassSet evaluate(double[] zenithRad,
                               double[] angstromExponent,
                               double[] pressureHpa,
                               double[] opticalDepth550nm) {
        if (angstromExponent == null) {
            throw new IllegalArgumentException("angstrom_exponent must not be null");
        }
        final int n = zenithRad.length;
        requireLength("angstrom_exponent", angstromExponent, n);
        requireLength("pressure", pressureHpa, n);
        requireLength("od550", opticalDepth550nm, n);

        double[] ama = new double[n];
        double[] amw = new double[n];
        double[] amo = new double[n];
        double[] amR = new double[n];
        double[] amRe = new double[n];
        double[] beta = new double[n];

        for (int i = 0; i < n; i++) {
            double z = zenithRad[i];
            ama[i] = airMass(z, AEROSOL, 1.0);
            amw[i] = airMass(z, WATER_VAPOUR, 1.0);
            amo[i] = airMass(z, OZONE, 1.0);
            amR[i] = airMass(z, RAYLEIGH, 1.0);
            amRe[i] = airMass(z, RAYLEIGH, pressureHpa[i] / RadiationConstants.STANDARD_PRESSURE_HPA);

            beta[i] = angstromTurbidity(opticalDepth550nm[i], angstromExponent[i]);
        }

        return new AirMassSet(amR, amRe, amo, amw, ama, beta);
    }

    /**
     * beta = tau550 / 0.55^(-alpha), clipped to [0, 1.1]; NaN stays NaN.
     */
    public static double angstromTurbidity(double opticalDepth550nm, double angstromExponent) {
        double b = opticalDepth550nm / Math.pow(TURBIDITY_WAVELENGTH_UM, -angstromExponent);
        if (b > RadiationConstants.MAX_ANGSTROM_TURBIDITY) b = RadiationConstants.MAX_ANGSTROM_TURBIDITY;
        if (b < 0) b = 0;
        return b;
    }

    private static double airMass(double zenithRad, double[] k, double scale) {
        return ComplexPowers.airMass(zenithRad, k[0], k[1], k[2], k[3], scale);
    }

    private static void requireLength(String name, double[] arr, int n) {
        if (arr == null) throw new IllegalArgumentException(name + " must not be null");
        if (arr.length != n) {
            throw new IllegalArgumentException(
                    "Shape mismatch: " + name + " has " + arr.length + " points, zenith has " + n);
        }
    }
}
