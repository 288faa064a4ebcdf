package solcore.engine.airmass;

/**
 * Angstrom exponent from aerosol optical depths at 550 and 670 nm.
 * Used when the input provider delivers only the two optical depths.
 */
public final class AngstromExponent {

    /** Depths are floored here before the logarithm. */
    public static final double MIN_OPTICAL_DEPTH = 1e-10;

    private static final double LOG_WAVELENGTH_RATIO = Math.log(550.0 / 670.0);

    private AngstromExponent() {}

    public static double fromOpticalDepths(double od550, double od670) {
        double a = Math.max(od550, MIN_OPTICAL_DEPTH);
        double b = Math.max(od670, MIN_OPTICAL_DEPTH);
        return -Math.log(a / b) / LOG_WAVELENGTH_RATIO;
    }

    public static double[] fromOpticalDepths(double[] od550, double[] od670) {
        if (od550.length != od670.length) {
            throw new IllegalArgumentException(
                    "od550/od670 length mismatch: " + od550.length + " != " + od670.length);
        }
        double[] out = new double[od550.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = fromOpticalDepths(od550[i], od670[i]);
        }
        return out;
    }
}
